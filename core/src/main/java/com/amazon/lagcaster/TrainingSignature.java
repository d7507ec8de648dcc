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

package com.amazon.lagcaster;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * What a forecaster was trained on: the shape of the target, covariates and
 * static covariates that predictions have to match, and the number of samples
 * each training series contributed.
 */
@Getter
public class TrainingSignature {

    private final List<String> componentNames;

    private final int pastCovariateComponents;

    private final int futureCovariateComponents;

    private final int staticCovariateLength;

    private final int[] samplesPerSeries;

    public TrainingSignature(List<String> componentNames, int pastCovariateComponents, int futureCovariateComponents,
            int staticCovariateLength, int[] samplesPerSeries) {
        checkNotNull(componentNames, "component names cannot be null");
        checkArgument(!componentNames.isEmpty(), "at least one component is required");
        checkArgument(pastCovariateComponents >= 0 && futureCovariateComponents >= 0 && staticCovariateLength >= 0,
                "dimensions cannot be negative");
        this.componentNames = Collections.unmodifiableList(new ArrayList<>(componentNames));
        this.pastCovariateComponents = pastCovariateComponents;
        this.futureCovariateComponents = futureCovariateComponents;
        this.staticCovariateLength = staticCovariateLength;
        this.samplesPerSeries = (samplesPerSeries == null) ? new int[0]
                : Arrays.copyOf(samplesPerSeries, samplesPerSeries.length);
    }

    public int getTargetComponents() {
        return componentNames.size();
    }

    public int[] getSamplesPerSeries() {
        return Arrays.copyOf(samplesPerSeries, samplesPerSeries.length);
    }
}
