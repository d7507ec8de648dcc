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

package com.amazon.lagcaster.lags;

import static com.amazon.lagcaster.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * A supervised data set extracted from one or more series: one feature row and
 * one target row per anchor. Rows of different series are concatenated in the
 * order of the input series; {@code samplesPerSeries} records how many rows each
 * series contributed. A target row holds the {@code outputChunkLength} steps
 * following the anchor, component minor.
 */
@Getter
public class LaggedDataset {

    private final double[][] features;

    private final double[][] targets;

    private final int[] samplesPerSeries;

    public LaggedDataset(double[][] features, double[][] targets, int[] samplesPerSeries) {
        checkArgument(features.length == targets.length, "features and targets have to align");
        int total = 0;
        for (int count : samplesPerSeries) {
            total += count;
        }
        checkArgument(total == features.length, "sample counts do not add up");
        this.features = features;
        this.targets = targets;
        this.samplesPerSeries = samplesPerSeries;
    }

    public int size() {
        return features.length;
    }

    public int getNumberOfFeatures() {
        return (features.length == 0) ? 0 : features[0].length;
    }

    /**
     * a single column of the targets, used to train one regressor per horizon
     * step and component
     *
     * @param column index into a target row
     * @return the column
     */
    public double[] getTargetColumn(int column) {
        double[] answer = new double[targets.length];
        for (int i = 0; i < targets.length; i++) {
            answer[i] = targets[i][column];
        }
        return answer;
    }
}
