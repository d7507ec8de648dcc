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

package com.amazon.lagcaster.config;

import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static java.lang.Math.abs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.amazon.lagcaster.exceptions.InvalidLikelihoodException;

/**
 * A likelihood fixed at construction of a forecaster. The type decides how raw
 * regressor outputs are read (point value, distribution parameters or quantile
 * function) and how samples are drawn; the quantile levels are only present for
 * {@link LikelihoodType#QUANTILE}.
 */
public final class Likelihood {

    private static final double[] DEFAULT_QUANTILES = new double[] { 0.01, 0.05, 0.1, 0.25, 0.5, 0.75, 0.9, 0.95,
            0.99 };

    public static final String QUANTILE_NAME = "quantile";
    public static final String POISSON_NAME = "poisson";
    public static final String GAUSSIAN_NAME = "gaussian";
    // the catboost loss name is accepted as an alias of gaussian
    public static final String GAUSSIAN_ALIAS = "RMSEWithUncertainty";

    private static final Likelihood NONE = new Likelihood(LikelihoodType.NONE, null);
    private static final Likelihood POISSON = new Likelihood(LikelihoodType.POISSON, null);
    private static final Likelihood GAUSSIAN = new Likelihood(LikelihoodType.GAUSSIAN, null);

    private final LikelihoodType type;

    private final double[] quantiles;

    private final int medianIndex;

    private Likelihood(LikelihoodType type, double[] quantiles) {
        this.type = type;
        this.quantiles = quantiles;
        this.medianIndex = (quantiles == null) ? -1 : nearestToMedian(quantiles);
    }

    public static Likelihood none() {
        return NONE;
    }

    public static Likelihood poisson() {
        return POISSON;
    }

    public static Likelihood gaussian() {
        return GAUSSIAN;
    }

    public static Likelihood quantile() {
        return quantile(DEFAULT_QUANTILES);
    }

    /**
     * @return a copy of the levels used by {@link #quantile()}
     */
    public static double[] getDefaultQuantiles() {
        return Arrays.copyOf(DEFAULT_QUANTILES, DEFAULT_QUANTILES.length);
    }

    /**
     * a quantile likelihood over the given levels
     *
     * @param levels strictly increasing levels in (0,1)
     * @return the likelihood
     * @throws InvalidLikelihoodException if the levels are malformed
     */
    public static Likelihood quantile(double... levels) {
        if (levels == null || levels.length == 0) {
            throw new InvalidLikelihoodException("at least one quantile level is required");
        }
        for (int i = 0; i < levels.length; i++) {
            if (!(levels[i] > 0 && levels[i] < 1)) {
                throw new InvalidLikelihoodException("quantile levels must lie in (0,1), found " + levels[i]);
            }
            if (i > 0 && levels[i - 1] >= levels[i]) {
                throw new InvalidLikelihoodException(
                        "quantile levels must be strictly increasing, found " + Arrays.toString(levels));
            }
        }
        return new Likelihood(LikelihoodType.QUANTILE, Arrays.copyOf(levels, levels.length));
    }

    /**
     * resolves a likelihood from its name; a null name is a point forecast
     *
     * @param name      one of quantile, poisson, gaussian (or
     *                  RMSEWithUncertainty), or null
     * @param quantiles levels for the quantile likelihood, null for the default
     *                  levels; ignored otherwise
     * @return the likelihood
     * @throws InvalidLikelihoodException for unknown names
     */
    public static Likelihood of(String name, double[] quantiles) {
        if (name == null) {
            return none();
        }
        if (GAUSSIAN_ALIAS.equals(name)) {
            return gaussian();
        }
        switch (name.toLowerCase(Locale.ROOT)) {
        case QUANTILE_NAME:
            return (quantiles == null) ? quantile() : quantile(quantiles);
        case POISSON_NAME:
            return poisson();
        case GAUSSIAN_NAME:
            return gaussian();
        default:
            throw new InvalidLikelihoodException("unknown likelihood " + name + ", available likelihoods are "
                    + Arrays.asList(QUANTILE_NAME, POISSON_NAME, GAUSSIAN_NAME, GAUSSIAN_ALIAS));
        }
    }

    static int nearestToMedian(double[] levels) {
        int index = 0;
        for (int i = 1; i < levels.length; i++) {
            // ties resolve to the lower level
            if (abs(levels[i] - 0.5) < abs(levels[index] - 0.5)) {
                index = i;
            }
        }
        return index;
    }

    public LikelihoodType getType() {
        return type;
    }

    public boolean isProbabilistic() {
        return type != LikelihoodType.NONE;
    }

    public double[] getQuantiles() {
        return (quantiles == null) ? null : Arrays.copyOf(quantiles, quantiles.length);
    }

    public int getMedianIndex() {
        return medianIndex;
    }

    public double getMedianQuantile() {
        return (quantiles == null) ? 0.5 : quantiles[medianIndex];
    }

    /**
     * @return the number of values the model produces per time step and
     *         component
     */
    public int getNumberOfParameters() {
        switch (type) {
        case QUANTILE:
            return quantiles.length;
        case GAUSSIAN:
            return 2;
        default:
            return 1;
        }
    }

    /**
     * the per-parameter suffixes, without the component prefix
     *
     * @return empty for point forecasts
     */
    public Optional<List<String>> getParameterSuffixes() {
        switch (type) {
        case QUANTILE:
            List<String> names = new ArrayList<>();
            for (double level : quantiles) {
                names.add(String.format(Locale.ROOT, "q%.2f", level));
            }
            return Optional.of(names);
        case POISSON:
            return Optional.of(List.of("lambda"));
        case GAUSSIAN:
            return Optional.of(List.of("mu", "sigma"));
        default:
            return Optional.empty();
        }
    }

    /**
     * names of the likelihood parameter columns, component major
     *
     * @param componentNames names of the target components
     * @return names such as {@code y_q0.50}, {@code y_lambda}, {@code y_mu}; empty
     *         for point forecasts
     */
    public Optional<List<String>> getParameterNames(List<String> componentNames) {
        checkNotNull(componentNames, "component names cannot be null");
        return getParameterSuffixes().map(suffixes -> {
            List<String> names = new ArrayList<>();
            for (String component : componentNames) {
                for (String suffix : suffixes) {
                    names.add(component + "_" + suffix);
                }
            }
            return names;
        });
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Likelihood)) {
            return false;
        }
        Likelihood that = (Likelihood) other;
        return type == that.type && Arrays.equals(quantiles, that.quantiles);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(quantiles);
    }

    @Override
    public String toString() {
        return (type == LikelihoodType.QUANTILE) ? type + Arrays.toString(quantiles) : type.toString();
    }
}
