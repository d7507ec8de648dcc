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
import com.amazon.lagcaster.scorer.PoissonNllScorer;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.testutils.DataWithKey;
import com.amazon.lagcaster.testutils.PoissonCountTestData;

/**
 * Fits a Poisson forecaster on hourly counts, samples the next two days and
 * scores the observed counts, where a burst was injected, by their negative log
 * likelihood.
 */
public class PoissonAnomalyScore implements Example {

    public static void main(String[] args) throws Exception {
        new PoissonAnomalyScore().run();
    }

    @Override
    public String command() {
        return "poisson";
    }

    @Override
    public String description() {
        return "forecast counts with a Poisson likelihood and score them with a window NLL";
    }

    @Override
    public void run() throws Exception {
        int trainingLength = 24 * 14;
        int horizon = 48;
        int numSamples = 200;
        int window = 3;

        PoissonCountTestData generator = new PoissonCountTestData(6.0, 3.0, 24, 40.0, 0.0);
        DataWithKey dataWithKey = generator.generateTestDataWithKey(trainingLength + horizon, 17);
        double[][] data = dataWithKey.data;
        int burst = trainingLength + horizon / 2;
        data[burst][0] += 30;

        double[][] training = new double[trainingLength][];
        System.arraycopy(data, 0, training, 0, trainingLength);
        double[][] observed = new double[horizon][];
        System.arraycopy(data, trainingLength, observed, 0, horizon);

        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().explicitTargetLags(-24, -2, -1).build()).outputChunkLength(12)
                .likelihood(Likelihood.poisson()).randomSeed(42).build();
        forecaster.fit(new TimeSeries(training));

        StochasticForecast forecast = forecaster.predict(horizon, numSamples);
        TimeSeries actual = new TimeSeries(trainingLength, 1, observed);
        TimeSeries scores = new PoissonNllScorer(window).score(forecast, actual);

        int worst = 0;
        for (int i = 0; i < scores.getLength(); i++) {
            if (scores.getValue(i, 0) > scores.getValue(worst, 0)) {
                worst = i;
            }
        }
        System.out.printf("forecast of %d steps with %d samples, %d window scores%n", forecast.getLength(),
                forecast.getNumberOfSamples(), scores.getLength());
        System.out.printf("burst injected at time %d with count %.0f%n", burst, data[burst][0]);
        System.out.printf("highest score %.2f at time %d%n", scores.getValue(worst, 0), scores.timeAt(worst));

        if (scores.timeAt(worst) != burst) {
            throw new IllegalStateException("the burst did not receive the highest score");
        }
        System.out.println("Looks good!");
    }
}
