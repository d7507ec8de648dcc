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

package com.amazon.lagcaster.sampler;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.sqrt;

import java.util.Arrays;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import com.amazon.lagcaster.config.Likelihood;

/**
 * Draws samples from raw model outputs under a likelihood. The outputs for one
 * time step and component are
 * <ul>
 * <li>quantile: one value per declared level, read as a piecewise linear
 * inverse CDF (constant beyond the outermost levels)</li>
 * <li>Poisson: the rate; a rate of 0 always yields 0</li>
 * <li>Gaussian: the mean and the variance; a non-positive variance is clamped to
 * {@link #MIN_VARIANCE}</li>
 * <li>none: the point value, returned as is</li>
 * </ul>
 * All randomness comes from the generator that is passed in, which the caller
 * owns; calls that share a generator are ordered and must not run concurrently.
 */
public class LikelihoodSampler {

    public static final double MIN_VARIANCE = 1e-9;

    private final Likelihood likelihood;

    private final double[] levels;

    public LikelihoodSampler(Likelihood likelihood) {
        this.likelihood = checkNotNull(likelihood, "likelihood cannot be null");
        this.levels = likelihood.getQuantiles();
    }

    public Likelihood getLikelihood() {
        return likelihood;
    }

    /**
     * draws independent samples for every time step and component
     *
     * @param parameters raw outputs indexed by [time][component][parameter]
     * @param numSamples number of samples per time step and component
     * @param random     the generator
     * @return samples indexed by [time][component][sample]
     */
    public double[][][] sample(double[][][] parameters, int numSamples, RandomGenerator random) {
        checkNotNull(parameters, "parameters cannot be null");
        checkArgument(numSamples > 0, "number of samples has to be positive");
        checkNotNull(random, "random generator cannot be null");
        double[][][] answer = new double[parameters.length][][];
        for (int t = 0; t < parameters.length; t++) {
            answer[t] = new double[parameters[t].length][numSamples];
            for (int c = 0; c < parameters[t].length; c++) {
                for (int s = 0; s < numSamples; s++) {
                    answer[t][c][s] = drawOne(parameters[t][c], random);
                }
            }
        }
        return answer;
    }

    /**
     * a single draw
     *
     * @param parameters the raw outputs for one time step and component
     * @param random     the generator
     * @return the sample
     */
    public double drawOne(double[] parameters, RandomGenerator random) {
        checkArgument(parameters.length == likelihood.getNumberOfParameters(), "incorrect number of parameters");
        switch (likelihood.getType()) {
        case QUANTILE:
            return inverseCdf(levels, parameters, random.nextDouble());
        case POISSON:
            return samplePoisson(parameters[0], random);
        case GAUSSIAN:
            return parameters[0] + sqrt(clampVariance(parameters[1])) * random.nextGaussian();
        default:
            return parameters[0];
        }
    }

    /**
     * the deterministic value of a distribution: the median level for quantiles,
     * the rate for Poisson, the mean for Gaussian
     *
     * @param parameters the raw outputs for one time step and component
     * @return the point value
     */
    public double pointValue(double[] parameters) {
        switch (likelihood.getType()) {
        case QUANTILE:
            return parameters[likelihood.getMedianIndex()];
        case POISSON:
            return max(0, parameters[0]);
        default:
            return parameters[0];
        }
    }

    /**
     * raw outputs converted to the reported likelihood parameters: rates are
     * clamped at 0 and Gaussian variances become standard deviations
     *
     * @param parameters the raw outputs for one time step and component
     * @return the reported parameters
     */
    public double[] reportedParameters(double[] parameters) {
        switch (likelihood.getType()) {
        case POISSON:
            return new double[] { max(0, parameters[0]) };
        case GAUSSIAN:
            return new double[] { parameters[0], sqrt(clampVariance(parameters[1])) };
        default:
            return Arrays.copyOf(parameters, parameters.length);
        }
    }

    public static double clampVariance(double variance) {
        checkArgument(!Double.isNaN(variance), "variance is NaN");
        return max(variance, MIN_VARIANCE);
    }

    static double samplePoisson(double rate, RandomGenerator random) {
        checkArgument(!Double.isNaN(rate), "Poisson rate is NaN");
        if (rate <= 0) {
            return 0;
        }
        return new PoissonDistribution(random, rate, PoissonDistribution.DEFAULT_EPSILON,
                PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
    }

    /**
     * evaluates the piecewise linear inverse CDF through (levels[i], values[i]);
     * values are sorted first so that crossing quantile predictions still give a
     * monotone function
     *
     * @param levels      increasing quantile levels
     * @param values      predicted value per level
     * @param probability a probability in [0,1]
     * @return the interpolated value
     */
    public static double inverseCdf(double[] levels, double[] values, double probability) {
        checkArgument(levels.length == values.length, "levels and values have to align");
        if (values.length == 1) {
            return values[0];
        }
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        if (probability <= levels[0]) {
            return sorted[0];
        }
        int last = levels.length - 1;
        if (probability >= levels[last]) {
            return sorted[last];
        }
        int upper = 1;
        while (levels[upper] < probability) {
            ++upper;
        }
        double fraction = (probability - levels[upper - 1]) / (levels[upper] - levels[upper - 1]);
        return sorted[upper - 1] + fraction * (sorted[upper] - sorted[upper - 1]);
    }
}
