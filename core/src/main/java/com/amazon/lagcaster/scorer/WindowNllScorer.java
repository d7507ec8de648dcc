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

package com.amazon.lagcaster.scorer;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.lagcaster.exceptions.DistributionSupportException;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.series.TimeSeries;

/**
 * Scores a series against a stochastic forecast with a sliding window. For
 * every window position and component, a distribution is fitted from all the
 * forecast samples inside the window and the negative log likelihood of the
 * most recent true value of the window is reported. A series of length L gives
 * L - window + 1 scores per component, aligned with the window ends.
 *
 * Values outside the support of the fitted distribution score
 * {@code Double.POSITIVE_INFINITY}, unless the scorer was built to fail on them.
 */
@Slf4j
@Getter
public abstract class WindowNllScorer {

    public static final int DEFAULT_WINDOW = 1;

    public static final boolean DEFAULT_FAIL_ON_UNSUPPORTED_VALUES = false;

    private final int window;

    private final boolean failOnUnsupportedValues;

    protected WindowNllScorer(int window, boolean failOnUnsupportedValues) {
        checkArgument(window > 0, "window has to be positive");
        this.window = window;
        this.failOnUnsupportedValues = failOnUnsupportedValues;
    }

    /**
     * fits the distribution parameters from the forecast samples of one window
     *
     * @param samples samples of one component, indexed by [time][sample]
     * @return the fitted parameters
     */
    protected abstract double[] fit(double[][] samples);

    /**
     * @param parameters the fitted parameters
     * @param value      the observed value
     * @return the negative log likelihood, positive infinity outside the support
     */
    protected abstract double negativeLogLikelihood(double[] parameters, double value);

    /**
     * scores aligned arrays
     *
     * @param forecast samples indexed by [time][component][sample]
     * @param actual   true values indexed by [time][component]
     * @return scores indexed by [window end - window + 1][component]
     * @throws DistributionSupportException if configured to fail and a value is
     *                                      outside the support
     */
    public double[][] score(double[][][] forecast, double[][] actual) {
        checkNotNull(forecast, "forecast cannot be null");
        checkNotNull(actual, "actual values cannot be null");
        checkArgument(forecast.length == actual.length, "forecast and actual values need the same length");
        checkArgument(actual.length >= window,
                "series of length " + actual.length + " is shorter than the window " + window);
        int components = actual[0].length;
        for (int t = 0; t < actual.length; t++) {
            checkArgument(actual[t].length == components && forecast[t].length == components,
                    "forecast and actual values need the same components");
        }

        double[][] answer = new double[actual.length - window + 1][components];
        for (int end = window - 1; end < actual.length; end++) {
            for (int c = 0; c < components; c++) {
                double[][] samples = new double[window][];
                for (int i = 0; i < window; i++) {
                    samples[i] = forecast[end - window + 1 + i][c];
                }
                double score = negativeLogLikelihood(fit(samples), actual[end][c]);
                if (score == Double.POSITIVE_INFINITY && failOnUnsupportedValues) {
                    throw new DistributionSupportException(end, c, actual[end][c]);
                }
                answer[end - window + 1][c] = score;
            }
        }
        return answer;
    }

    /**
     * scores the overlap of a forecast and a series; the result starts at the
     * end of the first full window of the overlap
     *
     * @param forecast the stochastic forecast
     * @param actual   the observed series
     * @return one score column per component
     */
    public TimeSeries score(StochasticForecast forecast, TimeSeries actual) {
        checkNotNull(forecast, "forecast cannot be null");
        checkNotNull(actual, "actual series cannot be null");
        checkArgument(forecast.getStep() == actual.getStep(), "forecast and series need the same step");
        checkArgument(forecast.getNumberOfComponents() == actual.getNumberOfComponents(),
                "forecast and series need the same components");
        long from = max(forecast.getStartTime(), actual.getStartTime());
        long to = min(forecast.getEndTime(), actual.getEndTime());
        checkArgument(from <= to, "forecast and series do not overlap");
        TimeSeries observed = actual.sliceByTime(from, to);
        int offset = (int) ((from - forecast.getStartTime()) / forecast.getStep());
        StochasticForecast predicted = forecast.slice(offset, offset + observed.getLength());

        double[][] scores = score(predicted.getValues(), observed.getValues());
        log.debug("scored {} windows of length {} over {} components", scores.length, window,
                observed.getNumberOfComponents());
        return new TimeSeries(observed.timeAt(window - 1), observed.getStep(), scores,
                observed.getComponentNames(), null);
    }
}
