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

import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static com.amazon.lagcaster.CommonUtils.checkState;

import java.util.Collections;
import java.util.List;

import com.amazon.lagcaster.regressor.HorizonRegressor;

/**
 * Holds exactly one model; every key resolves to it. Used for point forecasts
 * and parametric likelihoods, where the model outputs the distribution
 * parameters directly.
 */
public class SingleModelContainer implements IModelContainer {

    private HorizonRegressor model;

    @Override
    public void clear() {
        model = null;
    }

    @Override
    public void set(double key, HorizonRegressor model) {
        this.model = checkNotNull(model, "model cannot be null");
    }

    @Override
    public HorizonRegressor get(double key) {
        checkState(model != null, "no model has been trained");
        return model;
    }

    @Override
    public HorizonRegressor getMedian() {
        return get(0);
    }

    @Override
    public double[][][][] predictParameters(double[][] features) {
        return get(0).predict(features);
    }

    @Override
    public boolean isComplete() {
        return model != null;
    }

    @Override
    public int size() {
        return (model == null) ? 0 : 1;
    }

    /**
     * @return the single key 0 once a model is present
     */
    @Override
    public List<Double> getKeys() {
        return (model == null) ? Collections.emptyList() : Collections.singletonList(0.0);
    }
}
