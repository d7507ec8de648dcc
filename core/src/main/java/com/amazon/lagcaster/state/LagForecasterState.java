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

package com.amazon.lagcaster.state;

import static com.amazon.lagcaster.state.Version.V1_0;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Data;

import com.amazon.lagcaster.state.regressor.HorizonRegressorState;
import com.amazon.lagcaster.state.series.TimeSeriesState;

/**
 * A class that holds everything needed to restore a fitted
 * {@link com.amazon.lagcaster.LagForecaster}.
 */
@Data
public class LagForecasterState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private int[] targetLags;

    private int[] pastCovariateLags;

    private int[] futureCovariateLags;

    private int outputChunkLength;

    private boolean multiModels;

    private boolean useStaticCovariates;

    /**
     * name of a {@link com.amazon.lagcaster.config.LikelihoodType}
     */
    private String likelihood;

    /**
     * quantile levels, null unless the likelihood is a quantile likelihood
     */
    private double[] quantiles;

    private String objective;

    private Long regressorRandomSeed;

    private boolean verbose;

    private Map<String, Object> regressorOptions;

    /**
     * the sampling seed, null if sampling was not seeded
     */
    private Long randomSeed;

    /**
     * the keys of the models; quantile levels or a single 0
     */
    private double[] modelKeys;

    private HorizonRegressorState[] models;

    private List<String> componentNames;

    private int pastCovariateComponents;

    private int futureCovariateComponents;

    private int staticCovariateLength;

    private int[] samplesPerSeries;

    /**
     * present only if the forecaster was fit on a single series
     */
    private TimeSeriesState trainingSeries;

    private TimeSeriesState trainingPastCovariates;

    private TimeSeriesState trainingFutureCovariates;
}
