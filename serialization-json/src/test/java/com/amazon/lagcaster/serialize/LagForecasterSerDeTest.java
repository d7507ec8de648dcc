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

package com.amazon.lagcaster.serialize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.exceptions.NotFittedException;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.testutils.SeasonalTestData;

public class LagForecasterSerDeTest {

    @TempDir
    Path directory;

    private static LagForecaster fitted(Likelihood likelihood) {
        TimeSeries series = new TimeSeries(new SeasonalTestData().generateTestData(150, 2, 11));
        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().targetLags(24).build()).outputChunkLength(4)
                .likelihood(likelihood).randomSeed(3).build();
        forecaster.fit(series);
        return forecaster;
    }

    private static void assertSameForecast(StochasticForecast expected, StochasticForecast actual) {
        assertEquals(expected.getStartTime(), actual.getStartTime());
        for (int t = 0; t < expected.getLength(); t++) {
            for (int c = 0; c < expected.getNumberOfComponents(); c++) {
                assertArrayEquals(expected.getSamples(t, c), actual.getSamples(t, c));
            }
        }
    }

    @Test
    public void testJsonRoundTrip() {
        LagForecasterSerDe serDe = new LagForecasterSerDe();
        LagForecaster forecaster = fitted(Likelihood.gaussian());
        String json = serDe.toJson(forecaster);
        assertThat(json, containsString("\"likelihood\":\"GAUSSIAN\""));

        LagForecaster restored = serDe.fromJson(json);
        assertTrue(restored.isFit());
        assertEquals(2, restored.getSignature().getTargetComponents());
        assertSameForecast(forecaster.predict(6, 20), restored.predict(6, 20));
    }

    @Test
    public void testQuantileRoundTrip() {
        LagForecasterSerDe serDe = new LagForecasterSerDe();
        LagForecaster forecaster = fitted(Likelihood.quantile(0.1, 0.5, 0.9));
        LagForecaster restored = serDe.fromJson(serDe.toJson(forecaster), 99L);
        assertEquals(forecaster.getLikelihood(), restored.getLikelihood());
        assertSameForecast(forecaster.predict(8), restored.predict(8));
    }

    @Test
    public void testExportAndRead() throws IOException {
        LagForecasterSerDe serDe = new LagForecasterSerDe();
        LagForecaster forecaster = fitted(Likelihood.gaussian());
        Path path = directory.resolve("forecaster.json");
        serDe.export(forecaster, path);
        assertTrue(Files.size(path) > 0);

        LagForecaster restored = serDe.read(path);
        assertSameForecast(forecaster.predict(4, 10), restored.predict(4, 10));
    }

    @Test
    public void testExportBeforeFit() {
        LagForecasterSerDe serDe = new LagForecasterSerDe();
        LagForecaster forecaster = LagForecaster.builder().lags(LagSpecification.builder().targetLags(3).build())
                .build();
        Path path = directory.resolve("unfit.json");
        assertThrows(NotFittedException.class, () -> serDe.export(forecaster, path));
        assertFalse(Files.exists(path));
    }

    @Test
    public void testReadMissingFile() {
        assertThrows(IOException.class, () -> new LagForecasterSerDe().read(directory.resolve("missing.json")));
    }
}
