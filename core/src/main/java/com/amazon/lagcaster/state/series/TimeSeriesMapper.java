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

package com.amazon.lagcaster.state.series;

import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.state.IStateMapper;

public class TimeSeriesMapper implements IStateMapper<TimeSeries, TimeSeriesState> {

    @Override
    public TimeSeriesState toState(TimeSeries model) {
        TimeSeriesState state = new TimeSeriesState();
        state.setStartTime(model.getStartTime());
        state.setStep(model.getStep());
        state.setValues(model.getValues());
        state.setComponentNames(model.getComponentNames());
        state.setStaticCovariates(model.getStaticCovariates());
        return state;
    }

    @Override
    public TimeSeries toModel(TimeSeriesState state, long seed) {
        return new TimeSeries(state.getStartTime(), state.getStep(), state.getValues(), state.getComponentNames(),
                state.getStaticCovariates());
    }
}
