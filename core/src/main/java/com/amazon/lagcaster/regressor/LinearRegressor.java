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
import static com.amazon.lagcaster.CommonUtils.checkState;
import static java.lang.Math.abs;
import static java.lang.Math.exp;
import static java.lang.Math.log;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.Arrays;
import java.util.OptionalDouble;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A linear model with an intercept that supports the objectives the forecaster
 * asks for:
 * <ul>
 * <li>{@code RMSE}: ridge least squares</li>
 * <li>{@code Quantile:alpha=q}: quantile regression through iteratively
 * reweighted least squares on the pinball loss</li>
 * <li>{@code Poisson}: log link Poisson regression (IRLS); predicts the
 * rate</li>
 * <li>{@code RMSEWithUncertainty}: least squares mean plus a linear model of the
 * squared residuals; predicts a mean and a variance. The variance model is not
 * constrained and can go non-positive far from the training data.</li>
 * </ul>
 * Options read from the configuration: {@code l2Regularization},
 * {@code maxIterations}, {@code tolerance}.
 */
@Slf4j
public class LinearRegressor implements IRegressor {

    public static final double DEFAULT_L2_REGULARIZATION = 1e-6;

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    public static final double DEFAULT_TOLERANCE = 1e-8;

    public static final String L2_REGULARIZATION = "l2Regularization";

    public static final String MAX_ITERATIONS = "maxIterations";

    public static final String TOLERANCE = "tolerance";

    // keeps exp() of the linear predictor finite
    static final double MAX_LINK = 30;

    static final double MIN_RESIDUAL = 1e-6;

    private final String objective;

    private final double l2Regularization;

    private final int maxIterations;

    private final double tolerance;

    private final boolean verbose;

    // one row of (intercept, weights...) per output
    private double[][] coefficients;

    private double lastEvaluationLoss = Double.NaN;

    public LinearRegressor(RegressorConfig config) {
        checkNotNull(config, "configuration cannot be null");
        this.objective = checkNotNull(config.getObjective(), "objective cannot be null");
        validateObjective(objective);
        this.l2Regularization = config.getDoubleOption(L2_REGULARIZATION, DEFAULT_L2_REGULARIZATION);
        this.maxIterations = config.getIntOption(MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS);
        this.tolerance = config.getDoubleOption(TOLERANCE, DEFAULT_TOLERANCE);
        this.verbose = config.isVerbose();
        checkArgument(l2Regularization >= 0, "regularization cannot be negative");
        checkArgument(maxIterations > 0, "need at least one iteration");
    }

    /**
     * a trained model, used when restoring from state
     *
     * @param objective    objective the model was trained with
     * @param coefficients intercept followed by weights, one row per output
     */
    public LinearRegressor(String objective, double[][] coefficients) {
        this(RegressorConfig.builder().objective(objective).build());
        checkNotNull(coefficients, "coefficients cannot be null");
        checkArgument(coefficients.length == outputsFor(objective), "incorrect number of outputs");
        this.coefficients = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            this.coefficients[i] = Arrays.copyOf(coefficients[i], coefficients[i].length);
        }
    }

    static void validateObjective(String objective) {
        OptionalDouble level = Objectives.parseQuantile(objective);
        if (level.isPresent()) {
            checkArgument(level.getAsDouble() > 0 && level.getAsDouble() < 1, "quantile level has to be in (0,1)");
            return;
        }
        checkArgument(Objectives.RMSE.equals(objective) || Objectives.POISSON.equals(objective)
                || Objectives.RMSE_WITH_UNCERTAINTY.equals(objective), "unsupported objective " + objective);
    }

    static int outputsFor(String objective) {
        return Objectives.RMSE_WITH_UNCERTAINTY.equals(objective) ? 2 : 1;
    }

    @Override
    public LinearRegressor fit(double[][] features, double[] targets, EvalSet evalSet) {
        checkNotNull(features, "features cannot be null");
        checkNotNull(targets, "targets cannot be null");
        checkArgument(features.length == targets.length, "features and targets have to align");
        checkArgument(features.length > 0, "cannot fit without samples");

        OptionalDouble level = Objectives.parseQuantile(objective);
        if (level.isPresent()) {
            coefficients = new double[][] { fitQuantile(features, targets, level.getAsDouble()) };
        } else if (Objectives.POISSON.equals(objective)) {
            coefficients = new double[][] { fitPoisson(features, targets) };
        } else if (Objectives.RMSE_WITH_UNCERTAINTY.equals(objective)) {
            double[] mean = solve(features, targets, null);
            double[] squaredResiduals = new double[targets.length];
            for (int i = 0; i < targets.length; i++) {
                double residual = targets[i] - linear(mean, features[i]);
                squaredResiduals[i] = residual * residual;
            }
            coefficients = new double[][] { mean, solve(features, squaredResiduals, null) };
        } else {
            coefficients = new double[][] { solve(features, targets, null) };
        }

        if (evalSet != null && evalSet.size() > 0) {
            lastEvaluationLoss = evaluate(evalSet);
            if (verbose) {
                log.info("objective {} evaluation loss {} over {} samples", objective, lastEvaluationLoss,
                        evalSet.size());
            } else {
                log.debug("objective {} evaluation loss {} over {} samples", objective, lastEvaluationLoss,
                        evalSet.size());
            }
        }
        return this;
    }

    @Override
    public double[][] predict(double[][] features) {
        checkState(coefficients != null, "regressor has not been fit");
        double[][] answer = new double[features.length][];
        boolean poisson = Objectives.POISSON.equals(objective);
        for (int i = 0; i < features.length; i++) {
            checkArgument(features[i].length == coefficients[0].length - 1, "incorrect number of features");
            answer[i] = new double[coefficients.length];
            for (int j = 0; j < coefficients.length; j++) {
                double value = linear(coefficients[j], features[i]);
                answer[i][j] = poisson ? exp(clipLink(value)) : value;
            }
        }
        return answer;
    }

    @Override
    public int getNumberOfOutputs() {
        return outputsFor(objective);
    }

    /**
     * the loss of the objective on evaluation data; pinball loss for quantiles,
     * negative log likelihood (up to constants) for Poisson and Gaussian, root
     * mean squared error otherwise
     *
     * @param evalSet evaluation data
     * @return the average loss
     */
    public double evaluate(EvalSet evalSet) {
        double[][] predictions = predict(evalSet.getFeatures());
        double[] targets = evalSet.getTargets();
        OptionalDouble level = Objectives.parseQuantile(objective);
        double sum = 0;
        for (int i = 0; i < targets.length; i++) {
            double residual = targets[i] - predictions[i][0];
            if (level.isPresent()) {
                double alpha = level.getAsDouble();
                sum += (residual >= 0) ? alpha * residual : (alpha - 1) * residual;
            } else if (Objectives.POISSON.equals(objective)) {
                double rate = max(predictions[i][0], MIN_RESIDUAL);
                sum += rate - targets[i] * log(rate);
            } else if (Objectives.RMSE_WITH_UNCERTAINTY.equals(objective)) {
                double variance = max(predictions[i][1], MIN_RESIDUAL);
                sum += 0.5 * (log(variance) + residual * residual / variance);
            } else {
                sum += residual * residual;
            }
        }
        double average = sum / targets.length;
        return (level.isPresent() || !Objectives.RMSE.equals(objective)) ? average : Math.sqrt(average);
    }

    double[] fitQuantile(double[][] features, double[] targets, double alpha) {
        double[] beta = solve(features, targets, null);
        double[] weights = new double[targets.length];
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            for (int i = 0; i < targets.length; i++) {
                double residual = targets[i] - linear(beta, features[i]);
                weights[i] = ((residual >= 0) ? alpha : 1 - alpha) / max(abs(residual), MIN_RESIDUAL);
            }
            double[] next = solve(features, targets, weights);
            double change = maxDifference(beta, next);
            beta = next;
            if (change < tolerance) {
                return beta;
            }
        }
        log.debug("quantile regression at level {} stopped after {} iterations", alpha, maxIterations);
        return beta;
    }

    double[] fitPoisson(double[][] features, double[] targets) {
        double mean = 0;
        for (double target : targets) {
            checkArgument(target >= 0, "Poisson objective requires non-negative targets");
            mean += target;
        }
        mean /= targets.length;
        double[] beta = new double[features[0].length + 1];
        beta[0] = log(mean + MIN_RESIDUAL);
        double[] weights = new double[targets.length];
        double[] working = new double[targets.length];
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            for (int i = 0; i < targets.length; i++) {
                double eta = clipLink(linear(beta, features[i]));
                double rate = max(exp(eta), MIN_RESIDUAL);
                weights[i] = rate;
                working[i] = eta + (targets[i] - rate) / rate;
            }
            double[] next = solve(features, working, weights);
            double change = maxDifference(beta, next);
            beta = next;
            if (change < tolerance) {
                return beta;
            }
        }
        log.warn("Poisson regression did not converge in {} iterations", maxIterations);
        return beta;
    }

    /**
     * weighted ridge regression with an unpenalized intercept
     *
     * @param features rows of features
     * @param targets  targets
     * @param weights  sample weights, null for uniform weights
     * @return intercept followed by weights
     */
    double[] solve(double[][] features, double[] targets, double[] weights) {
        int dimension = features[0].length + 1;
        double[][] normal = new double[dimension][dimension];
        double[] moment = new double[dimension];
        double[] row = new double[dimension];
        row[0] = 1;
        for (int i = 0; i < features.length; i++) {
            System.arraycopy(features[i], 0, row, 1, dimension - 1);
            double weight = (weights == null) ? 1 : weights[i];
            for (int j = 0; j < dimension; j++) {
                double scaled = weight * row[j];
                moment[j] += scaled * targets[i];
                for (int k = j; k < dimension; k++) {
                    normal[j][k] += scaled * row[k];
                }
            }
        }
        for (int j = 0; j < dimension; j++) {
            for (int k = 0; k < j; k++) {
                normal[j][k] = normal[k][j];
            }
        }
        // a small ridge keeps constant or collinear lags solvable
        double scale = 0;
        for (int j = 1; j < dimension; j++) {
            scale = max(scale, normal[j][j]);
        }
        double ridge = l2Regularization * max(1.0, scale);
        for (int j = 1; j < dimension; j++) {
            normal[j][j] += ridge;
        }
        if (normal[0][0] == 0) {
            normal[0][0] = ridge;
        }
        RealMatrix matrix = new Array2DRowRealMatrix(normal, false);
        RealVector solution = new LUDecomposition(matrix).getSolver().solve(new ArrayRealVector(moment, false));
        return solution.toArray();
    }

    static double linear(double[] beta, double[] features) {
        double value = beta[0];
        for (int j = 0; j < features.length; j++) {
            value += beta[j + 1] * features[j];
        }
        return value;
    }

    static double clipLink(double value) {
        return max(-MAX_LINK, min(MAX_LINK, value));
    }

    static double maxDifference(double[] a, double[] b) {
        double answer = 0;
        for (int i = 0; i < a.length; i++) {
            answer = max(answer, abs(a[i] - b[i]));
        }
        return answer;
    }

    public String getObjective() {
        return objective;
    }

    public boolean isFit() {
        return coefficients != null;
    }

    /**
     * @return a copy of the coefficients, intercept first, one row per output
     */
    public double[][] getCoefficients() {
        checkState(coefficients != null, "regressor has not been fit");
        double[][] answer = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            answer[i] = Arrays.copyOf(coefficients[i], coefficients[i].length);
        }
        return answer;
    }

    public double getLastEvaluationLoss() {
        return lastEvaluationLoss;
    }
}
