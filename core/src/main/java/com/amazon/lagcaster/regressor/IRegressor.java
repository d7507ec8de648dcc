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

/**
 * The capability a wrapped regression model has to offer. Training and
 * inference are opaque synchronous calls; an implementation need not be thread
 * safe.
 */
public interface IRegressor {

    /**
     * trains the model
     *
     * @param features rows of features
     * @param targets  one target per row
     * @param evalSet  optional evaluation data for monitoring, may be null
     * @return this regressor
     */
    IRegressor fit(double[][] features, double[] targets, EvalSet evalSet);

    /**
     * @param features rows of features
     * @return one row of {@link #getNumberOfOutputs()} values per feature row
     */
    double[][] predict(double[][] features);

    /**
     * @return the number of values predicted per row, for example 2 for a mean
     *         and a variance
     */
    int getNumberOfOutputs();

}
