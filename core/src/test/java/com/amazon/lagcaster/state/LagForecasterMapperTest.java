/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.lagcaster.state;

import static com.amazon.lagcaster.TestUtils.cycle;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.exceptions.NotFittedException;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.testutils.PoissonCountTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class LagForecasterMapperTest {

    private static void assertSameForecast(StochasticForecast expected, StochasticForecast actual) {
        assertEquals(expected.getStartTime(), actual.getStartTime());
        assertEquals(expected.getLength(), actual.getLength());
        for (int t = 0; t < expected.getLength(); t++) {
            for (int c = 0; c < expected.getNumberOfComponents(); c++) {
                assertArrayEquals(expected.getSamples(t, c), actual.getSamples(t, c));
            }
        }
    }

    private static LagForecaster poissonForecaster() {
        TimeSeries series = new TimeSeries(new PoissonCountTestData().generateTestData(200, 17));
        LagForecaster forecaster = LagForecaster.builder().lags(LagSpecification.builder().targetLags(12).build())
                .outputChunkLength(3).likelihood(Likelihood.poisson()).randomSeed(42).build();
        forecaster.fit(series);
        return forecaster;
    }

    @Test
    public void testRoundTripSamples() {
        LagForecasterMapper mapper = new LagForecasterMapper();
        LagForecaster forecaster = poissonForecaster();
        LagForecaster restored = mapper.toModel(mapper.toState(forecaster));

        assertTrue(restored.isFit());
        assertEquals(forecaster.getLikelihood(), restored.getLikelihood());
        assertArrayEquals(forecaster.getLags().getTargetLags(), restored.getLags().getTargetLags());
        assertEquals(forecaster.getSignature().getComponentNames(), restored.getSignature().getComponentNames());
        // the seed is part of the state, so sampling resumes identically
        assertSameForecast(forecaster.predict(6, 25), restored.predict(6, 25));
    }

    @Test
    public void testRoundTripQuantiles() {
        TimeSeries series = cycle(60, 2, 4, 3, 7, 1);
        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().explicitTargetLags(-5, -2, -1).build()).outputChunkLength(2)
                .multiModels(false).likelihood(Likelihood.quantile(0.2, 0.5, 0.8)).build();
        forecaster.fit(series);

        LagForecasterMapper mapper = new LagForecasterMapper();
        LagForecasterState state = mapper.toState(forecaster);
        assertEquals(Version.V1_0, state.getVersion());
        assertArrayEquals(new double[] { 0.2, 0.5, 0.8 }, state.getModelKeys());
        assertEquals(3, state.getModels().length);

        LagForecaster restored = mapper.toModel(state, 0L);
        assertFalse(restored.isMultiModels());
        assertSameForecast(forecaster.predict(5, series, null, null, 1), restored.predict(5, series, null, null, 1));
    }

    @Test
    public void testTrainingSeriesIsOptional() {
        LagForecasterMapper mapper = new LagForecasterMapper();
        mapper.setSaveTrainingSeriesEnabled(false);
        LagForecaster forecaster = poissonForecaster();
        LagForecasterState state = mapper.toState(forecaster);
        assertNull(state.getTrainingSeries());

        LagForecaster restored = mapper.toModel(state);
        assertThrows(IllegalArgumentException.class, () -> restored.predict(3));
        TimeSeries series = forecaster.getTrainingSeries().get();
        assertSameForecast(forecaster.predict(3, series, null, null, 1), restored.predict(3, series, null, null, 1));
    }

    @Test
    public void testNotFitted() {
        LagForecaster forecaster = LagForecaster.builder().lags(LagSpecification.builder().targetLags(2).build())
                .build();
        assertThrows(NotFittedException.class, () -> new LagForecasterMapper().toState(forecaster));
    }

    @Test
    public void testUnknownVersion() {
        LagForecasterMapper mapper = new LagForecasterMapper();
        LagForecasterState state = mapper.toState(poissonForecaster());
        state.setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testJacksonRoundTrip() throws Exception {
        LagForecasterMapper mapper = new LagForecasterMapper();
        LagForecaster forecaster = poissonForecaster();
        LagForecasterState state = mapper.toState(forecaster);

        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(state);
        LagForecasterState copy = jsonMapper.readValue(json, LagForecasterState.class);

        assertEquals(state.getTrainingSeries(), copy.getTrainingSeries());
        assertTrue(Arrays.equals(state.getSamplesPerSeries(), copy.getSamplesPerSeries()));
        assertSameForecast(forecaster.predict(4, 10), mapper.toModel(copy).predict(4, 10));
    }
}
