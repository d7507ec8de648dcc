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

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static com.amazon.lagcaster.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.config.LikelihoodType;
import com.amazon.lagcaster.regressor.HorizonRegressor;

/**
 * One model per declared quantile level, kept in increasing order of level.
 * The median is the model at the level closest to 0.5.
 */
public class QuantileModelContainer implements IModelContainer {

    private final double[] levels;

    private final double medianLevel;

    private final TreeMap<Double, HorizonRegressor> models = new TreeMap<>();

    public QuantileModelContainer(Likelihood likelihood) {
        checkNotNull(likelihood, "likelihood cannot be null");
        checkArgument(likelihood.getType() == LikelihoodType.QUANTILE, "quantile likelihood required");
        this.levels = likelihood.getQuantiles();
        this.medianLevel = likelihood.getMedianQuantile();
    }

    @Override
    public void clear() {
        models.clear();
    }

    @Override
    public void set(double level, HorizonRegressor model) {
        checkArgument(Arrays.binarySearch(levels, level) >= 0, "level " + level + " is not a declared quantile");
        models.put(level, checkNotNull(model, "model cannot be null"));
    }

    @Override
    public HorizonRegressor get(double level) {
        HorizonRegressor model = models.get(level);
        checkState(model != null, "no model has been trained for quantile " + level);
        return model;
    }

    @Override
    public HorizonRegressor getMedian() {
        return get(medianLevel);
    }

    public double getMedianLevel() {
        return medianLevel;
    }

    /**
     * the first output of every quantile model, in increasing order of level
     */
    @Override
    public double[][][][] predictParameters(double[][] features) {
        checkState(isComplete(), "the quantile ensemble is incomplete");
        if (features.length == 0) {
            return new double[0][][][];
        }
        double[][][][] answer = null;
        int index = 0;
        for (Map.Entry<Double, HorizonRegressor> entry : models.entrySet()) {
            double[][][][] predictions = entry.getValue().predict(features);
            if (answer == null) {
                answer = new double[features.length][predictions[0].length][predictions[0][0].length][levels.length];
            }
            for (int row = 0; row < features.length; row++) {
                for (int step = 0; step < predictions[row].length; step++) {
                    for (int component = 0; component < predictions[row][step].length; component++) {
                        answer[row][step][component][index] = predictions[row][step][component][0];
                    }
                }
            }
            ++index;
        }
        return answer;
    }

    @Override
    public boolean isComplete() {
        return models.size() == levels.length;
    }

    @Override
    public int size() {
        return models.size();
    }

    @Override
    public List<Double> getKeys() {
        return new ArrayList<>(models.keySet());
    }
}
