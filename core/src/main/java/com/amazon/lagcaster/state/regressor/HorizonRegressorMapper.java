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

package com.amazon.lagcaster.state.regressor;

import static com.amazon.lagcaster.CommonUtils.checkArgument;

import com.amazon.lagcaster.regressor.HorizonRegressor;
import com.amazon.lagcaster.regressor.IRegressor;
import com.amazon.lagcaster.regressor.LinearRegressor;
import com.amazon.lagcaster.state.IStateMapper;

/**
 * Saves the regressors of every step and component. Only
 * {@link LinearRegressor} instances can be saved; other regressors have to be
 * exported by their own means.
 */
public class HorizonRegressorMapper implements IStateMapper<HorizonRegressor, HorizonRegressorState> {

    private final LinearRegressorMapper regressorMapper = new LinearRegressorMapper();

    @Override
    public HorizonRegressorState toState(HorizonRegressor model) {
        HorizonRegressorState state = new HorizonRegressorState();
        state.setSteps(model.getSteps());
        state.setComponents(model.getComponents());
        LinearRegressorState[] regressors = new LinearRegressorState[model.getSteps() * model.getComponents()];
        for (int step = 0; step < model.getSteps(); step++) {
            for (int component = 0; component < model.getComponents(); component++) {
                IRegressor regressor = model.getRegressor(step, component);
                checkArgument(regressor instanceof LinearRegressor,
                        "cannot save regressors of type " + regressor.getClass().getName());
                regressors[step * model.getComponents() + component] = regressorMapper
                        .toState((LinearRegressor) regressor);
            }
        }
        state.setRegressors(regressors);
        return state;
    }

    @Override
    public HorizonRegressor toModel(HorizonRegressorState state, long seed) {
        LinearRegressorState[] saved = state.getRegressors();
        IRegressor[] regressors = new IRegressor[saved.length];
        for (int i = 0; i < saved.length; i++) {
            regressors[i] = regressorMapper.toModel(saved[i]);
        }
        return new HorizonRegressor(state.getSteps(), state.getComponents(), regressors);
    }
}
