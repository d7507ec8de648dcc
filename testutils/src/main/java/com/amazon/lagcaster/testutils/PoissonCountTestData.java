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

package com.amazon.lagcaster.testutils;

import static java.lang.Math.PI;
import static java.lang.Math.max;
import static java.lang.Math.sin;

import java.util.Arrays;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Counts drawn from a Poisson distribution whose rate follows a daily cycle.
 * With a small probability a count is drawn from a much larger anomaly rate
 * instead.
 */
public class PoissonCountTestData {

    private final double baseRate;
    private final double amplitude;
    private final int period;
    private final double anomalyRate;
    private final double anomalyProbability;

    public PoissonCountTestData(double baseRate, double amplitude, int period, double anomalyRate,
            double anomalyProbability) {
        this.baseRate = baseRate;
        this.amplitude = amplitude;
        this.period = period;
        this.anomalyRate = anomalyRate;
        this.anomalyProbability = anomalyProbability;
    }

    public PoissonCountTestData() {
        this(6.0, 3.0, 24, 40.0, 0.01);
    }

    public double rateAt(int index) {
        return max(0, baseRate + amplitude * sin(2 * PI * index / period));
    }

    public double[][] generateTestData(int numberOfRows, int seed) {
        return generateTestDataWithKey(numberOfRows, seed).data;
    }

    /**
     * @param numberOfRows length of the series
     * @param seed         0 for an unseeded generator
     * @return a univariate count series and the positions of the injected
     *         anomalies
     */
    public DataWithKey generateTestDataWithKey(int numberOfRows, int seed) {
        RandomGenerator random = (seed != 0) ? new Well19937c(seed) : new Well19937c();
        double[][] result = new double[numberOfRows][1];
        int[] anomalies = new int[numberOfRows];
        int numberOfAnomalies = 0;
        for (int i = 0; i < numberOfRows; i++) {
            double rate = rateAt(i);
            if (random.nextDouble() < anomalyProbability) {
                rate = anomalyRate;
                anomalies[numberOfAnomalies++] = i;
            }
            result[i][0] = (rate == 0) ? 0
                    : new PoissonDistribution(random, rate, PoissonDistribution.DEFAULT_EPSILON,
                            PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
        }
        return new DataWithKey(result, Arrays.copyOf(anomalies, numberOfAnomalies));
    }
}
