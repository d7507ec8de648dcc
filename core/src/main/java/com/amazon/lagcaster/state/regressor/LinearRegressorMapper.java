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

import com.amazon.lagcaster.regressor.LinearRegressor;
import com.amazon.lagcaster.state.IStateMapper;

public class LinearRegressorMapper implements IStateMapper<LinearRegressor, LinearRegressorState> {

    @Override
    public LinearRegressorState toState(LinearRegressor model) {
        checkArgument(model.isFit(), "only trained regressors can be saved");
        LinearRegressorState state = new LinearRegressorState();
        state.setObjective(model.getObjective());
        state.setCoefficients(model.getCoefficients());
        return state;
    }

    @Override
    public LinearRegressor toModel(LinearRegressorState state, long seed) {
        return new LinearRegressor(state.getObjective(), state.getCoefficients());
    }
}
