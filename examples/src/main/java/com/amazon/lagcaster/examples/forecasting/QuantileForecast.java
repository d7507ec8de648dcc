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

import java.util.List;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.examples.Example;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.testutils.SeasonalTestData;

/**
 * Fits one model per quantile on a noisy seasonal series and prints the median
 * forecast with an 80% band, along with the raw quantile predictions of the
 * first step.
 */
public class QuantileForecast implements Example {

    public static void main(String[] args) throws Exception {
        new QuantileForecast().run();
    }

    @Override
    public String command() {
        return "quantile";
    }

    @Override
    public String description() {
        return "forecast a seasonal series with a quantile ensemble";
    }

    @Override
    public void run() throws Exception {
        int period = 24;
        double[][] data = new SeasonalTestData(10.0, 5.0, period, 0.5).generateTestData(period * 20, 1, 7);
        TimeSeries series = new TimeSeries(data);

        LagForecaster forecaster = LagForecaster.builder()
                .lags(LagSpecification.builder().explicitTargetLags(-period, -1).build()).outputChunkLength(6)
                .likelihood(Likelihood.quantile(0.1, 0.5, 0.9)).randomSeed(7).build();
        forecaster.fit(series);
        System.out.printf("trained %d quantile models%n", forecaster.getModels().size());

        StochasticForecast forecast = forecaster.predict(period, 500);
        TimeSeries lower = forecast.quantile(0.1);
        TimeSeries median = forecast.quantile(0.5);
        TimeSeries upper = forecast.quantile(0.9);
        for (int i = 0; i < forecast.getLength(); i++) {
            System.out.printf("t = %4d  median %6.2f  [%6.2f, %6.2f]%n", forecast.timeAt(i), median.getValue(i, 0),
                    lower.getValue(i, 0), upper.getValue(i, 0));
        }

        TimeSeries parameters = forecaster.predictLikelihoodParameters(1, series, null, null);
        List<String> names = parameters.getComponentNames();
        for (int c = 0; c < names.size(); c++) {
            System.out.printf("%s = %.3f%n", names.get(c), parameters.getValue(0, c));
        }
    }
}
