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

package com.amazon.lagcaster.ensemble;

import java.util.List;

import com.amazon.lagcaster.regressor.HorizonRegressor;

/**
 * Trained models addressed by a key. A quantile ensemble keys its models by
 * quantile level; a single model container ignores keys. Either way the
 * container presents the prediction contract of one probabilistic model.
 */
public interface IModelContainer {

    /**
     * discards every model, must precede retraining
     */
    void clear();

    void set(double key, HorizonRegressor model);

    HorizonRegressor get(double key);

    /**
     * @return the model used when a deterministic forecast is needed
     */
    HorizonRegressor getMedian();

    default double[][][][] predict(double key, double[][] features) {
        return get(key).predict(features);
    }

    default double[][][][] predictMedian(double[][] features) {
        return getMedian().predict(features);
    }

    /**
     * raw distribution parameters for every feature row
     *
     * @param features rows of features
     * @return values indexed by [row][step][component][parameter]
     */
    double[][][][] predictParameters(double[][] features);

    /**
     * @return true when every expected model is present
     */
    boolean isComplete();

    int size();

    List<Double> getKeys();

}
