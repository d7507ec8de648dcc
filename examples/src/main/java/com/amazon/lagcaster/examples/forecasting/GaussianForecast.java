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

package com.amazon.lagcaster.examples.forecasting;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.examples.Example;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.scorer.GaussianNllScorer;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.testutils.SeasonalTestData;

/**
 * A Gaussian forecaster driven by a known future covariate (the hour of the
 * day), with a single model for the last step of each chunk, scored with the Gaussian NLL.
 */
public class GaussianForecast implements Example {

    public static void main(String[] args) throws Exception {
        new GaussianForecast().run();
    }

    @Override
    public String command() {
        return "gaussian";
    }

    @Override
    public String description() {
        return "single-model Gaussian forecast with a future covariate";
    }

    @Override
    public void run() throws Exception {
        int period = 24;
        int trainingLength = period * 10;
        int horizon = period;
        double[][] data = new SeasonalTestData(20.0, 4.0, period, 1.0).generateTestData(trainingLength + horizon, 1,
                3);
        SeasonalTestData clock = new SeasonalTestData(0.0, 1.0, period, 0.0);
        double[] wave = clock.generateWave(trainingLength + horizon);
        double[][] covariate = new double[wave.length][];
        for (int i = 0; i < wave.length; i++) {
            covariate[i] = new double[] { wave[i] };
        }

        TimeSeries all = new TimeSeries(data);
        TimeSeries training = all.head(trainingLength);
        TimeSeries future = new TimeSeries(covariate);

        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().targetLags(2).futureCovariateLags(0, 1).build())
                .outputChunkLength(4).multiModels(false).likelihood(Likelihood.gaussian()).randomSeed(3).build();
        forecaster.fit(training, null, future);

        StochasticForecast forecast = forecaster.predict(horizon, training, null, future, 300);
        TimeSeries actual = all.slice(trainingLength, trainingLength + horizon);
        TimeSeries scores = new GaussianNllScorer(1).score(forecast, actual);

        double total = 0;
        for (int i = 0; i < scores.getLength(); i++) {
            total += scores.getValue(i, 0);
        }
        System.out.printf("mean Gaussian NLL over %d steps: %.3f%n", scores.getLength(), total / scores.getLength());
    }
}
