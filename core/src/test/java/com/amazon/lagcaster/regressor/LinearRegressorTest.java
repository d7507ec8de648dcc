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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

public class LinearRegressorTest {

    private static LinearRegressor create(String objective) {
        return new LinearRegressor(RegressorConfig.builder().objective(objective).build());
    }

    @Test
    public void testLeastSquaresRecoversPlane() {
        RandomGenerator random = new Well19937c(0);
        double[][] features = new double[50][2];
        double[] targets = new double[50];
        for (int i = 0; i < 50; i++) {
            features[i][0] = random.nextDouble();
            features[i][1] = random.nextDouble();
            targets[i] = 1 + 2 * features[i][0] - 3 * features[i][1];
        }
        LinearRegressor regressor = create(Objectives.RMSE).fit(features, targets, null);
        assertTrue(regressor.isFit());
        assertArrayEquals(new double[] { 1, 2, -3 }, regressor.getCoefficients()[0], 1e-3);
        assertEquals(1, regressor.getNumberOfOutputs());
        assertEquals(1 + 2 * 0.5 - 3 * 0.25, regressor.predict(new double[][] { { 0.5, 0.25 } })[0][0], 1e-3);
    }

    @Test
    public void testConstantFeaturesAreSolvable() {
        double[][] features = { { 1 }, { 1 }, { 1 } };
        double[] targets = { 2, 3, 4 };
        LinearRegressor regressor = create(Objectives.RMSE).fit(features, targets, null);
        assertEquals(3.0, regressor.predict(new double[][] { { 1 } })[0][0], 1e-3);
    }

    @Test
    public void testQuantileCoverage() {
        RandomGenerator random = new Well19937c(1);
        int n = 2000;
        double[][] features = new double[n][1];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            features[i][0] = random.nextDouble() * 10;
            targets[i] = features[i][0] + random.nextGaussian();
        }
        LinearRegressor regressor = create(Objectives.quantile(0.9)).fit(features, targets, null);
        double[][] predictions = regressor.predict(features);
        int below = 0;
        for (int i = 0; i < n; i++) {
            if (targets[i] <= predictions[i][0]) {
                ++below;
            }
        }
        assertEquals(0.9, below / (double) n, 0.05);
    }

    @Test
    public void testPoissonRegression() {
        RandomGenerator random = new Well19937c(2);
        int n = 3000;
        double[][] features = new double[n][1];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            features[i][0] = random.nextDouble() * 3;
            double rate = Math.exp(0.5 + 0.3 * features[i][0]);
            targets[i] = new PoissonDistribution(random, rate, PoissonDistribution.DEFAULT_EPSILON,
                    PoissonDistribution.DEFAULT_MAX_ITERATIONS).sample();
        }
        LinearRegressor regressor = create(Objectives.POISSON).fit(features, targets, null);
        double[] beta = regressor.getCoefficients()[0];
        assertEquals(0.5, beta[0], 0.1);
        assertEquals(0.3, beta[1], 0.1);
        // predictions are rates
        assertTrue(regressor.predict(new double[][] { { -100 } })[0][0] >= 0);

        assertThrows(IllegalArgumentException.class,
                () -> create(Objectives.POISSON).fit(new double[][] { { 1 } }, new double[] { -1 }, null));
    }

    @Test
    public void testMeanAndVariance() {
        RandomGenerator random = new Well19937c(3);
        int n = 4000;
        double[][] features = new double[n][1];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            features[i][0] = random.nextDouble();
            targets[i] = 5 * features[i][0] + 2 * random.nextGaussian();
        }
        LinearRegressor regressor = create(Objectives.RMSE_WITH_UNCERTAINTY).fit(features, targets, null);
        assertEquals(2, regressor.getNumberOfOutputs());
        double[] prediction = regressor.predict(new double[][] { { 0.5 } })[0];
        assertEquals(2.5, prediction[0], 0.2);
        assertEquals(4.0, prediction[1], 0.6);
    }

    @Test
    public void testEvaluationLoss() {
        double[][] features = { { 0 }, { 1 }, { 2 }, { 3 } };
        double[] targets = { 0, 1, 2, 3 };
        LinearRegressor regressor = create(Objectives.RMSE);
        assertTrue(Double.isNaN(regressor.getLastEvaluationLoss()));
        regressor.fit(features, targets, new EvalSet(new double[][] { { 4 } }, new double[] { 6 }));
        assertEquals(2.0, regressor.getLastEvaluationLoss(), 1e-3);
        assertEquals(0.0, regressor.evaluate(new EvalSet(features, targets)), 1e-3);
    }

    @Test
    public void testInvalidUse() {
        assertThrows(IllegalArgumentException.class, () -> create("MAE"));
        assertThrows(IllegalArgumentException.class, () -> create("Quantile:alpha=1.5"));
        assertThrows(IllegalArgumentException.class, () -> create("Quantile:alpha=x"));
        LinearRegressor regressor = create(Objectives.RMSE);
        assertFalse(regressor.isFit());
        assertThrows(IllegalStateException.class, () -> regressor.predict(new double[][] { { 1 } }));
        assertThrows(IllegalArgumentException.class,
                () -> regressor.fit(new double[][] { { 1 } }, new double[] { 1, 2 }, null));
        assertThrows(IllegalArgumentException.class,
                () -> new LinearRegressor(Objectives.RMSE_WITH_UNCERTAINTY, new double[][] { { 0, 1 } }));
    }

    @Test
    public void testRestore() {
        LinearRegressor regressor = new LinearRegressor(Objectives.RMSE, new double[][] { { 1, 2 } });
        assertTrue(regressor.isFit());
        assertEquals(7.0, regressor.predict(new double[][] { { 3 } })[0][0]);
        assertThrows(IllegalArgumentException.class, () -> regressor.predict(new double[][] { { 3, 4 } }));
    }

    @Test
    public void testOptions() {
        RegressorConfig config = RegressorConfig.builder().objective(Objectives.RMSE)
                .option(LinearRegressor.L2_REGULARIZATION, -1.0).build();
        assertThrows(IllegalArgumentException.class, () -> new LinearRegressor(config));
        RegressorConfig iterations = RegressorConfig.builder().option(LinearRegressor.MAX_ITERATIONS, 0).build();
        assertThrows(IllegalArgumentException.class, () -> new LinearRegressor(iterations));
    }
}
