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
import static com.amazon.lagcaster.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * Evaluation data forwarded to a regressor for early stopping or monitoring.
 * The forecaster builds it from validation series and does not interpret the
 * metric.
 */
@Getter
public class EvalSet {

    private final double[][] features;

    private final double[] targets;

    public EvalSet(double[][] features, double[] targets) {
        checkNotNull(features, "features cannot be null");
        checkNotNull(targets, "targets cannot be null");
        checkArgument(features.length == targets.length, "features and targets have to align");
        this.features = features;
        this.targets = targets;
    }

    public int size() {
        return targets.length;
    }
}
