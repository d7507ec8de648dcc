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
import static java.lang.Math.sin;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Sine waves with Gaussian noise. Component {@code j} is shifted in phase by
 * {@code j} steps so that the components are not identical.
 */
public class SeasonalTestData {

    private final double level;
    private final double amplitude;
    private final int period;
    private final double noise;

    public SeasonalTestData(double level, double amplitude, int period, double noise) {
        this.level = level;
        this.amplitude = amplitude;
        this.period = period;
        this.noise = noise;
    }

    public SeasonalTestData() {
        this(10.0, 5.0, 24, 0.5);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns) {
        return generateTestData(numberOfRows, numberOfColumns, 0);
    }

    /**
     * @param numberOfRows    length of the series
     * @param numberOfColumns number of components
     * @param seed            0 for an unseeded generator
     * @return values indexed by [time][component]
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, int seed) {
        RandomGenerator random = (seed != 0) ? new Well19937c(seed) : new Well19937c();
        double[][] result = new double[numberOfRows][numberOfColumns];
        for (int i = 0; i < numberOfRows; i++) {
            for (int j = 0; j < numberOfColumns; j++) {
                result[i][j] = level + amplitude * sin(2 * PI * (i + j) / period) + noise * random.nextGaussian();
            }
        }
        return result;
    }

    /**
     * a noiseless univariate wave
     *
     * @param numberOfRows length of the series
     * @return the values
     */
    public double[] generateWave(int numberOfRows) {
        double[] result = new double[numberOfRows];
        for (int i = 0; i < numberOfRows; i++) {
            result[i] = level + amplitude * sin(2 * PI * i / period);
        }
        return result;
    }
}
