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

import java.util.Arrays;

import com.amazon.lagcaster.lags.LaggedDataset;

/**
 * One regressor per (horizon step, target component). With several steps this
 * is the multi-model arrangement, every step has its own regressor and all of
 * them read the same feature row. With a single step the regressors are
 * trained on one chosen step of the output chunk, and the forecaster shifts
 * the anchor to produce the other steps.
 */
public class HorizonRegressor {

    private final int steps;

    private final int components;

    private final IRegressor[] regressors;

    /**
     * @param steps      number of horizon steps predicted per call
     * @param components number of target components
     * @param regressors regressors indexed by {@code step * components + component}
     */
    public HorizonRegressor(int steps, int components, IRegressor[] regressors) {
        checkArgument(steps > 0 && components > 0, "steps and components have to be positive");
        checkNotNull(regressors, "regressors cannot be null");
        checkArgument(regressors.length == steps * components, "one regressor per step and component");
        int outputs = regressors[0].getNumberOfOutputs();
        for (IRegressor regressor : regressors) {
            checkNotNull(regressor, "regressor cannot be null");
            checkArgument(regressor.getNumberOfOutputs() == outputs, "regressors disagree on their outputs");
        }
        this.steps = steps;
        this.components = components;
        this.regressors = Arrays.copyOf(regressors, regressors.length);
    }

    /**
     * trains a fresh regressor for every step and component, starting at the
     * first step of the output chunk
     *
     * @param factory    creates the regressors
     * @param config     configuration handed to the factory
     * @param data       training data
     * @param evaluation evaluation data or null
     * @param steps      number of steps to train
     * @param components number of target components
     * @return the trained regressors
     */
    public static HorizonRegressor train(IRegressorFactory factory, RegressorConfig config, LaggedDataset data,
            LaggedDataset evaluation, int steps, int components) {
        return train(factory, config, data, evaluation, 0, steps, components);
    }

    /**
     * trains a fresh regressor for every step and component; the regressor for
     * {@code (step, component)} learns the target column
     * {@code (firstStep + step) * components + component}
     *
     * @param factory    creates the regressors
     * @param config     configuration handed to the factory
     * @param data       training data
     * @param evaluation evaluation data or null
     * @param firstStep  the step of the output chunk learnt by the first
     *                   regressors
     * @param steps      number of steps to train
     * @param components number of target components
     * @return the trained regressors
     */
    public static HorizonRegressor train(IRegressorFactory factory, RegressorConfig config, LaggedDataset data,
            LaggedDataset evaluation, int firstStep, int steps, int components) {
        checkArgument(firstStep >= 0, "first step cannot be negative");
        IRegressor[] regressors = new IRegressor[steps * components];
        int offset = firstStep * components;
        for (int index = 0; index < regressors.length; index++) {
            int column = offset + index;
            EvalSet evalSet = (evaluation == null) ? null
                    : new EvalSet(evaluation.getFeatures(), evaluation.getTargetColumn(column));
            IRegressor regressor = checkNotNull(factory.create(config), "factory returned null");
            regressors[index] = regressor;
            regressor.fit(data.getFeatures(), data.getTargetColumn(column), evalSet);
        }
        return new HorizonRegressor(steps, components, regressors);
    }

    /**
     * @param features rows of features
     * @return predictions indexed by [row][step][component][output]
     */
    public double[][][][] predict(double[][] features) {
        double[][][][] answer = new double[features.length][steps][components][];
        for (int step = 0; step < steps; step++) {
            for (int component = 0; component < components; component++) {
                double[][] predictions = regressors[step * components + component].predict(features);
                checkArgument(predictions.length == features.length, "regressor returned an incorrect number of rows");
                for (int row = 0; row < features.length; row++) {
                    answer[row][step][component] = predictions[row];
                }
            }
        }
        return answer;
    }

    public int getSteps() {
        return steps;
    }

    public int getComponents() {
        return components;
    }

    public int getNumberOfOutputs() {
        return regressors[0].getNumberOfOutputs();
    }

    public IRegressor getRegressor(int step, int component) {
        checkArgument(step >= 0 && step < steps && component >= 0 && component < components, "incorrect index");
        return regressors[step * components + component];
    }
}
