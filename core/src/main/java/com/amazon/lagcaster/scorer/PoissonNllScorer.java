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

import static java.lang.Math.log;
import static java.lang.Math.max;

import org.apache.commons.math3.special.Gamma;

import com.amazon.lagcaster.CommonUtils;

/**
 * The Poisson rate is the mean of all the samples of the window. A rate of 0
 * scores 0 for an observed 0; negative or fractional observations are outside
 * the support.
 */
public class PoissonNllScorer extends WindowNllScorer {

    public PoissonNllScorer() {
        this(DEFAULT_WINDOW);
    }

    public PoissonNllScorer(int window) {
        this(window, DEFAULT_FAIL_ON_UNSUPPORTED_VALUES);
    }

    public PoissonNllScorer(int window, boolean failOnUnsupportedValues) {
        super(window, failOnUnsupportedValues);
    }

    @Override
    protected double[] fit(double[][] samples) {
        return new double[] { max(0, CommonUtils.mean(samples)) };
    }

    @Override
    protected double negativeLogLikelihood(double[] parameters, double value) {
        double rate = parameters[0];
        if (Double.isNaN(value) || value < 0 || value != Math.rint(value) || Double.isInfinite(value)) {
            return Double.POSITIVE_INFINITY;
        }
        if (rate == 0) {
            return (value == 0) ? 0 : Double.POSITIVE_INFINITY;
        }
        // counts beyond the int range are still in the support
        return rate - value * log(rate) + Gamma.logGamma(value + 1);
    }
}
