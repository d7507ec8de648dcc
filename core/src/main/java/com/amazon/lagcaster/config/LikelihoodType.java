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

/**
 * The family of distributions that the regressor outputs are interpreted in.
 */
public enum LikelihoodType {

    /**
     * point forecasts, the regressor output is the forecast itself
     */
    NONE,
    /**
     * one regressor per quantile level; the collection of outputs is read as a
     * piecewise linear inverse CDF
     */
    QUANTILE,
    /**
     * the regressor output is a non-negative rate of a Poisson distribution
     */
    POISSON,
    /**
     * the regressor outputs a mean and a variance of a normal distribution
     */
    GAUSSIAN;

}
