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

package com.amazon.lagcaster.examples.serialization;

import java.nio.file.Files;
import java.nio.file.Path;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.examples.Example;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.serialize.LagForecasterSerDe;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.state.LagForecasterMapper;
import com.amazon.lagcaster.state.LagForecasterState;
import com.amazon.lagcaster.testutils.SeasonalTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Exports a fitted forecaster to a JSON file and reads it back, then writes
 * the same state with <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 * The restored forecasters have to predict what the original predicts.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "export a fitted forecaster as JSON and restore it";
    }

    @Override
    public void run() throws Exception {
        double[][] data = new SeasonalTestData().generateTestData(24 * 10, 2, 11);
        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().targetLags(24).build()).outputChunkLength(3)
                .likelihood(Likelihood.quantile()).randomSeed(11).build();
        forecaster.fit(new TimeSeries(data));

        LagForecasterSerDe serDe = new LagForecasterSerDe();
        Path path = Files.createTempFile("forecaster", ".json");
        try {
            serDe.export(forecaster, path);
            System.out.printf("JSON size = %d bytes%n", Files.size(path));
            LagForecaster restored = serDe.read(path);
            compare(forecaster.predict(12), restored.predict(12));
        } finally {
            Files.deleteIfExists(path);
        }

        LagForecasterMapper mapper = new LagForecasterMapper();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(forecaster));
        LagForecaster restored = mapper.toModel(jsonMapper.readValue(json, LagForecasterState.class));
        compare(forecaster.predict(12), restored.predict(12));

        System.out.println("Looks good!");
    }

    void compare(StochasticForecast expected, StochasticForecast actual) {
        for (int t = 0; t < expected.getLength(); t++) {
            for (int c = 0; c < expected.getNumberOfComponents(); c++) {
                if (Math.abs(expected.getValue(t, c, 0) - actual.getValue(t, c, 0)) > 1e-9) {
                    throw new IllegalStateException("restored forecaster does not agree with the original");
                }
            }
        }
    }
}
