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

package com.amazon.lagcaster.regressor;

import static com.amazon.lagcaster.CommonUtils.checkArgument;

import java.util.OptionalDouble;

import com.amazon.lagcaster.config.Likelihood;

/**
 * Objective (loss function) names understood by regressors. The names follow
 * the gradient boosting conventions so that a configuration can be passed on
 * to such libraries unchanged.
 */
public class Objectives {

    public static final String RMSE = "RMSE";

    public static final String POISSON = "Poisson";

    public static final String RMSE_WITH_UNCERTAINTY = "RMSEWithUncertainty";

    public static final String QUANTILE_PREFIX = "Quantile:alpha=";

    private Objectives() {
    }

    public static String quantile(double alpha) {
        checkArgument(alpha > 0 && alpha < 1, "quantile level has to be in (0,1)");
        return QUANTILE_PREFIX + alpha;
    }

    /**
     * @param objective an objective name
     * @return the level of a quantile objective, empty for other objectives
     */
    public static OptionalDouble parseQuantile(String objective) {
        if (objective == null || !objective.startsWith(QUANTILE_PREFIX)) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(objective.substring(QUANTILE_PREFIX.length())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed quantile objective " + objective, e);
        }
    }

    /**
     * the objective used for a parametric likelihood; quantile likelihoods use
     * one objective per level and point forecasts keep the configured objective
     *
     * @param likelihood the likelihood
     * @param configured the objective of the configuration
     * @return the objective to train with
     */
    public static String forLikelihood(Likelihood likelihood, String configured) {
        switch (likelihood.getType()) {
        case POISSON:
            return POISSON;
        case GAUSSIAN:
            return RMSE_WITH_UNCERTAINTY;
        case QUANTILE:
            throw new IllegalArgumentException("quantile likelihoods train one objective per level");
        default:
            return (configured == null) ? RMSE : configured;
        }
    }
}
