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

import java.util.Arrays;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Fits a normal distribution to the samples of the window: their mean and
 * population standard deviation. A deviation of 0 is a point mass at the mean.
 */
public class GaussianNllScorer extends WindowNllScorer {

    public GaussianNllScorer() {
        this(DEFAULT_WINDOW);
    }

    public GaussianNllScorer(int window) {
        this(window, DEFAULT_FAIL_ON_UNSUPPORTED_VALUES);
    }

    public GaussianNllScorer(int window, boolean failOnUnsupportedValues) {
        super(window, failOnUnsupportedValues);
    }

    @Override
    protected double[] fit(double[][] samples) {
        double[] pooled = Arrays.stream(samples).flatMapToDouble(Arrays::stream).toArray();
        double mean = Arrays.stream(pooled).average().orElse(Double.NaN);
        double deviation = new StandardDeviation(false).evaluate(pooled);
        return new double[] { mean, deviation };
    }

    @Override
    protected double negativeLogLikelihood(double[] parameters, double value) {
        double mean = parameters[0];
        double deviation = parameters[1];
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.POSITIVE_INFINITY;
        }
        if (deviation == 0) {
            return (value == mean) ? 0 : Double.POSITIVE_INFINITY;
        }
        return -new NormalDistribution(null, mean, deviation).logDensity(value);
    }
}
