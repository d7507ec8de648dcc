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
import static com.amazon.lagcaster.CommonUtils.checkState;
import static java.lang.Math.max;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import com.amazon.lagcaster.config.ForecasterStage;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.config.LikelihoodType;
import com.amazon.lagcaster.ensemble.IModelContainer;
import com.amazon.lagcaster.ensemble.QuantileModelContainer;
import com.amazon.lagcaster.ensemble.SingleModelContainer;
import com.amazon.lagcaster.exceptions.InsufficientHistoryException;
import com.amazon.lagcaster.exceptions.NotFittedException;
import com.amazon.lagcaster.lags.LagFeatureBuilder;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.lags.LaggedDataset;
import com.amazon.lagcaster.regressor.HorizonRegressor;
import com.amazon.lagcaster.regressor.IRegressorFactory;
import com.amazon.lagcaster.regressor.LinearRegressor;
import com.amazon.lagcaster.regressor.Objectives;
import com.amazon.lagcaster.regressor.RegressorConfig;
import com.amazon.lagcaster.returntypes.StochasticForecast;
import com.amazon.lagcaster.sampler.LikelihoodSampler;
import com.amazon.lagcaster.series.TimeSeries;

/**
 * A probabilistic forecaster over lag features. The forecaster extracts fixed
 * width lag windows from the target and covariate series, trains regressors on
 * them and turns the regressor outputs into sample paths under a likelihood.
 *
 * With multiModels (the default) one regressor is trained per step of the
 * output chunk and all steps are predicted from the same feature row. Without
 * it a single regressor learns the last step of the output chunk; step i of a
 * chunk is predicted from a feature row anchored outputChunkLength - 1 - i
 * steps earlier, so earlier predicted points come back as lagged target.
 * Horizons longer than the output
 * chunk are produced by an autoregressive rollout that appends every predicted
 * chunk to the history and moves the anchor forward; every sample path is
 * rolled out on its own history.
 *
 * The likelihood and the lags are fixed at construction. A quantile likelihood
 * clears and retrains its ensemble on each call to fit so that one instance can
 * be reused across backtests. The random generator belongs to the instance:
 * predictions are reproducible for a fixed seed, but at most one fit or predict
 * call may be in flight per instance.
 */
@Slf4j
public class LagForecaster {

    public static final int DEFAULT_OUTPUT_CHUNK_LENGTH = 1;

    public static final boolean DEFAULT_MULTI_MODELS = true;

    public static final boolean DEFAULT_USE_STATIC_COVARIATES = true;

    /**
     * a regressor needs at least two samples, so a series needs at least three
     * points
     */
    public static final int MIN_SERIES_LENGTH = 3;

    private final LagSpecification lags;

    private final int outputChunkLength;

    private final boolean multiModels;

    private final boolean useStaticCovariates;

    private final Likelihood likelihood;

    private final RegressorConfig regressorConfig;

    private final IRegressorFactory regressorFactory;

    private final Optional<Long> randomSeed;

    private final RandomGenerator random;

    private final LagFeatureBuilder featureBuilder;

    private final LikelihoodSampler sampler;

    private final IModelContainer models;

    private ForecasterStage stage = ForecasterStage.UNFIT;

    private TrainingSignature signature;

    // kept when fit on a single series so that predict(n) can continue it
    private TimeSeries trainingSeries;
    private TimeSeries trainingPastCovariates;
    private TimeSeries trainingFutureCovariates;

    public LagForecaster(Builder<?> builder) {
        this.lags = builder.lags;
        this.outputChunkLength = builder.outputChunkLength;
        this.multiModels = builder.multiModels;
        this.useStaticCovariates = builder.useStaticCovariates;
        this.likelihood = builder.likelihood;
        this.randomSeed = builder.randomSeed;
        RegressorConfig config = builder.regressorConfig;
        if (randomSeed.isPresent() && !config.getRandomSeed().isPresent()) {
            config = config.toBuilder().randomSeed(randomSeed.get()).build();
        }
        this.regressorConfig = config;
        this.regressorFactory = builder.regressorFactory;
        this.random = builder.getRandom();
        this.featureBuilder = new LagFeatureBuilder(lags, outputChunkLength, useStaticCovariates);
        this.sampler = new LikelihoodSampler(likelihood);
        this.models = (likelihood.getType() == LikelihoodType.QUANTILE) ? new QuantileModelContainer(likelihood)
                : new SingleModelContainer();
    }

    /**
     * a fitted forecaster, used when restoring from state
     *
     * @param builder       configuration
     * @param trainedModels the complete models
     * @param signature     shapes seen in fit
     * @param training      the series fit on, with its past and future
     *                      covariates (either may be null); null when fit on
     *                      several series
     */
    public LagForecaster(Builder<?> builder, IModelContainer trainedModels, TrainingSignature signature,
            TimeSeries[] training) {
        this.lags = builder.lags;
        this.outputChunkLength = builder.outputChunkLength;
        this.multiModels = builder.multiModels;
        this.useStaticCovariates = builder.useStaticCovariates;
        this.likelihood = builder.likelihood;
        this.randomSeed = builder.randomSeed;
        this.regressorConfig = builder.regressorConfig;
        this.regressorFactory = builder.regressorFactory;
        this.random = builder.getRandom();
        this.featureBuilder = new LagFeatureBuilder(lags, outputChunkLength, useStaticCovariates);
        this.sampler = new LikelihoodSampler(likelihood);
        checkNotNull(trainedModels, "models cannot be null");
        checkArgument(trainedModels.isComplete(), "models are incomplete");
        checkArgument((likelihood.getType() == LikelihoodType.QUANTILE) == (trainedModels instanceof QuantileModelContainer),
                "model container does not match the likelihood");
        this.models = trainedModels;
        this.signature = checkNotNull(signature, "signature cannot be null");
        if (training != null) {
            checkArgument(training.length == 3, "training series, past and future covariates expected");
            this.trainingSeries = training[0];
            this.trainingPastCovariates = training[1];
            this.trainingFutureCovariates = training[2];
        }
        this.stage = ForecasterStage.FIT;
    }

    /**
     * the shortest series that can be used for training: the longest target lag
     * plus one output chunk plus one, and never fewer than
     * {@link #MIN_SERIES_LENGTH}
     *
     * @return the minimum training series length
     */
    public int getMinTrainSeriesLength() {
        if (lags.hasTargetLags()) {
            return max(MIN_SERIES_LENGTH, lags.getTargetLookback() + outputChunkLength + 1);
        }
        return max(MIN_SERIES_LENGTH, outputChunkLength);
    }

    public LagForecaster fit(TimeSeries series) {
        return fit(series, null, null);
    }

    public LagForecaster fit(TimeSeries series, TimeSeries pastCovariates, TimeSeries futureCovariates) {
        return fit(LagFeatureBuilder.listOf(series), LagFeatureBuilder.listOf(pastCovariates),
                LagFeatureBuilder.listOf(futureCovariates), null, null, null, LagFeatureBuilder.UNLIMITED_SAMPLES);
    }

    public LagForecaster fit(List<TimeSeries> series, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates) {
        return fit(series, pastCovariates, futureCovariates, null, null, null, LagFeatureBuilder.UNLIMITED_SAMPLES);
    }

    /**
     * trains the models; any earlier models are discarded first
     *
     * @param series                    target series
     * @param pastCovariates            past covariates, one per series, or null
     * @param futureCovariates          future covariates, one per series, or null
     * @param validationSeries          validation targets or null
     * @param validationPastCovariates  validation past covariates or null
     * @param validationFutureCovariates validation future covariates or null
     * @param maxSamplesPerSeries       if positive, the number of most recent
     *                                  samples kept per series
     * @return this forecaster
     * @throws InsufficientHistoryException if a series is shorter than
     *                                      {@link #getMinTrainSeriesLength()}
     */
    public LagForecaster fit(List<TimeSeries> series, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates, List<TimeSeries> validationSeries,
            List<TimeSeries> validationPastCovariates, List<TimeSeries> validationFutureCovariates,
            int maxSamplesPerSeries) {
        checkNotNull(series, "series cannot be null");
        int minimum = getMinTrainSeriesLength();
        for (TimeSeries target : series) {
            checkNotNull(target, "series cannot be null");
            if (target.getLength() < minimum) {
                throw new InsufficientHistoryException("training series of length " + target.getLength()
                        + " is shorter than the minimum length " + minimum);
            }
        }
        LaggedDataset data = featureBuilder.build(series, pastCovariates, futureCovariates, maxSamplesPerSeries);
        LaggedDataset evaluation = null;
        if (validationSeries != null) {
            checkArgument(!validationSeries.isEmpty(), "validation series cannot be empty");
            checkArgument(validationSeries.get(0).getNumberOfComponents() == series.get(0).getNumberOfComponents(),
                    "validation series need the components of the training series");
            evaluation = featureBuilder.build(validationSeries, validationPastCovariates, validationFutureCovariates,
                    maxSamplesPerSeries);
            checkArgument(evaluation.getNumberOfFeatures() == data.getNumberOfFeatures(),
                    "validation data does not have the features of the training data");
        }

        // nothing of an earlier fit survives, even if this one fails
        models.clear();
        stage = ForecasterStage.UNFIT;
        signature = null;
        trainingSeries = null;
        trainingPastCovariates = null;
        trainingFutureCovariates = null;

        int steps = multiModels ? outputChunkLength : 1;
        int firstStep = getAnchorShift();
        int components = series.get(0).getNumberOfComponents();
        if (likelihood.getType() == LikelihoodType.QUANTILE) {
            for (double level : likelihood.getQuantiles()) {
                RegressorConfig config = regressorConfig.withObjective(Objectives.quantile(level));
                log.debug("training quantile {} with objective {}", level, config.getObjective());
                HorizonRegressor model = HorizonRegressor.train(regressorFactory, config, data, evaluation,
                        firstStep, steps, components);
                checkState(model.getNumberOfOutputs() == 1, "quantile regressors have to predict a single value");
                models.set(level, model);
            }
        } else {
            RegressorConfig config = regressorConfig
                    .withObjective(Objectives.forLikelihood(likelihood, regressorConfig.getObjective()));
            HorizonRegressor model = HorizonRegressor.train(regressorFactory, config, data, evaluation,
                    firstStep, steps, components);
            checkState(model.getNumberOfOutputs() == likelihood.getNumberOfParameters(),
                    "objective " + config.getObjective() + " has to produce " + likelihood.getNumberOfParameters()
                            + " outputs for likelihood " + likelihood);
            models.set(0, model);
        }

        TimeSeries first = series.get(0);
        double[] statics = featureBuilder.staticCovariatesOf(first);
        signature = new TrainingSignature(first.getComponentNames(),
                (pastCovariates == null) ? 0 : pastCovariates.get(0).getNumberOfComponents(),
                (futureCovariates == null) ? 0 : futureCovariates.get(0).getNumberOfComponents(),
                (statics == null) ? 0 : statics.length, data.getSamplesPerSeries());
        if (series.size() == 1) {
            trainingSeries = first;
            trainingPastCovariates = (pastCovariates == null) ? null : pastCovariates.get(0);
            trainingFutureCovariates = (futureCovariates == null) ? null : futureCovariates.get(0);
        }
        stage = ForecasterStage.FIT;
        log.info("fit {} model(s) for likelihood {} on {} samples from {} series", max(1, models.size()), likelihood,
                data.size(), series.size());
        return this;
    }

    /**
     * continues the series the forecaster was fit on
     *
     * @param n number of steps
     * @return a deterministic forecast
     */
    public StochasticForecast predict(int n) {
        return predict(n, 1);
    }

    public StochasticForecast predict(int n, int numSamples) {
        checkFitted();
        checkArgument(trainingSeries != null,
                "the forecaster was not fit on a single series, the series to continue has to be given");
        return predict(n, trainingSeries, trainingPastCovariates, trainingFutureCovariates, numSamples);
    }

    public StochasticForecast predict(int n, TimeSeries series, TimeSeries pastCovariates,
            TimeSeries futureCovariates, int numSamples) {
        return predict(n, LagFeatureBuilder.listOf(series), LagFeatureBuilder.listOf(pastCovariates),
                LagFeatureBuilder.listOf(futureCovariates), numSamples).get(0);
    }

    /**
     * forecasts {@code n} steps past the end of every series. A single sample on
     * a probabilistic forecaster gives the deterministic (median, rate or mean)
     * forecast. Either every series is forecast or the call fails before any
     * sampling.
     *
     * @param n                number of steps
     * @param series           series to continue
     * @param pastCovariates   past covariates, one per series, or null
     * @param futureCovariates future covariates, one per series, or null
     * @param numSamples       number of sample paths
     * @return one forecast per series
     */
    public List<StochasticForecast> predict(int n, List<TimeSeries> series, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates, int numSamples) {
        checkFitted();
        checkArgument(numSamples > 0, "number of samples has to be positive");
        checkArgument(numSamples == 1 || likelihood.isProbabilistic(),
                "more than one sample requires a probabilistic likelihood");
        validatePrediction(n, series, pastCovariates, futureCovariates);

        stage = ForecasterStage.PREDICTING;
        try {
            List<StochasticForecast> answer = new ArrayList<>();
            for (int i = 0; i < series.size(); i++) {
                TimeSeries target = series.get(i);
                double[][][] values = rollout(n, target, get(pastCovariates, i), get(futureCovariates, i),
                        numSamples, false);
                answer.add(new StochasticForecast(target.timeAt(target.getLength()), target.getStep(), values,
                        signature.getComponentNames()));
            }
            return answer;
        } finally {
            stage = ForecasterStage.FIT;
        }
    }

    public TimeSeries predictLikelihoodParameters(int n, TimeSeries series, TimeSeries pastCovariates,
            TimeSeries futureCovariates) {
        return predictLikelihoodParameters(n, LagFeatureBuilder.listOf(series),
                LagFeatureBuilder.listOf(pastCovariates), LagFeatureBuilder.listOf(futureCovariates)).get(0);
    }

    /**
     * the distribution parameters instead of samples; one column per component
     * and parameter, named as in {@link Likelihood#getParameterNames(List)}
     *
     * @param n                number of steps, at most the output chunk length
     * @param series           series to continue
     * @param pastCovariates   past covariates, one per series, or null
     * @param futureCovariates future covariates, one per series, or null
     * @return one parameter series per input series
     */
    public List<TimeSeries> predictLikelihoodParameters(int n, List<TimeSeries> series,
            List<TimeSeries> pastCovariates, List<TimeSeries> futureCovariates) {
        checkFitted();
        checkArgument(likelihood.isProbabilistic(), "point forecasts have no likelihood parameters");
        checkArgument(n <= outputChunkLength, "likelihood parameters are only available up to the output chunk length");
        validatePrediction(n, series, pastCovariates, futureCovariates);
        List<String> names = likelihood.getParameterNames(signature.getComponentNames()).get();

        stage = ForecasterStage.PREDICTING;
        try {
            List<TimeSeries> answer = new ArrayList<>();
            for (int i = 0; i < series.size(); i++) {
                TimeSeries target = series.get(i);
                double[][][] values = rollout(n, target, get(pastCovariates, i), get(futureCovariates, i), 1, true);
                double[][] rows = new double[n][];
                for (int t = 0; t < n; t++) {
                    rows[t] = new double[names.size()];
                    int position = 0;
                    for (double[] parameters : values[t]) {
                        System.arraycopy(parameters, 0, rows[t], position, parameters.length);
                        position += parameters.length;
                    }
                }
                answer.add(new TimeSeries(target.timeAt(target.getLength()), target.getStep(), rows, names, null));
            }
            return answer;
        } finally {
            stage = ForecasterStage.FIT;
        }
    }

    /**
     * checks every input before anything is predicted
     */
    void validatePrediction(int n, List<TimeSeries> series, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates) {
        checkArgument(n > 0, "number of steps has to be positive");
        featureBuilder.validateInputs(series, pastCovariates, futureCovariates);
        int shift = getAnchorShift();
        int lastOffset = ((n - 1) / outputChunkLength) * outputChunkLength;
        for (int i = 0; i < series.size(); i++) {
            TimeSeries target = series.get(i);
            checkArgument(target.getNumberOfComponents() == signature.getTargetComponents(),
                    "series has " + target.getNumberOfComponents() + " components, the forecaster was fit on "
                            + signature.getTargetComponents());
            double[] statics = featureBuilder.staticCovariatesOf(target);
            checkArgument(((statics == null) ? 0 : statics.length) == signature.getStaticCovariateLength(),
                    "static covariates do not match those seen in fit");
            if (lags.hasTargetLags() && target.getLength() < lags.getTargetLookback() + shift) {
                throw new InsufficientHistoryException("series of length " + target.getLength()
                        + " is shorter than the target lags " + Arrays.toString(lags.getTargetLags())
                        + ((shift > 0) ? " shifted back by " + shift + " steps" : ""));
            }
            long firstAnchor = target.timeAt(target.getLength() - shift);
            long lastAnchor = target.timeAt(target.getLength() + lastOffset);
            TimeSeries past = get(pastCovariates, i);
            if (past != null) {
                checkArgument(past.getNumberOfComponents() == signature.getPastCovariateComponents(),
                        "past covariates do not match those seen in fit");
                featureBuilder.checkCoverage(past, lags.getPastCovariateLags(), firstAnchor, lastAnchor,
                        target.getStep(), "past");
            }
            TimeSeries future = get(futureCovariates, i);
            if (future != null) {
                checkArgument(future.getNumberOfComponents() == signature.getFutureCovariateComponents(),
                        "future covariates do not match those seen in fit");
                featureBuilder.checkCoverage(future, lags.getFutureCovariateLags(), firstAnchor, lastAnchor,
                        target.getStep(), "future");
            }
        }
    }

    /**
     * rolls out {@code n} steps for every sample path. Each path keeps its own
     * history: the last rows of the series followed by everything predicted for
     * that path so far. Every iteration predicts one output chunk. Multiple
     * models read one feature row at the chunk start; a single model, trained
     * on the last step of a chunk, reads one row per step with the anchor
     * shifted back by {@link #getAnchorShift()}. Either way the features only
     * use history from before the chunk, which is appended afterwards.
     *
     * @param parameters when true, the reported likelihood parameters are
     *                   returned instead of samples and the point value is fed
     *                   back
     * @return values indexed by [time][component][sample], or
     *         [time][component][parameter]
     */
    double[][][] rollout(int n, TimeSeries series, TimeSeries past, TimeSeries future, int numSamples,
            boolean parameters) {
        int paths = parameters ? 1 : numSamples;
        boolean deterministic = parameters || numSamples == 1;
        boolean medianModel = deterministic && !parameters && likelihood.getType() == LikelihoodType.QUANTILE;
        int shift = getAnchorShift();
        int lookback = lags.getTargetLookback();
        int components = series.getNumberOfComponents();
        int length = series.getLength();
        int produced = 0;
        int base = lookback + shift;
        int capacity = base + ((n + outputChunkLength - 1) / outputChunkLength) * outputChunkLength;

        // rows before the start of the series are never read
        double[][][] history = new double[paths][capacity][];
        for (int index = 0; index < base; index++) {
            int seriesIndex = length - base + index;
            double[] row = (seriesIndex >= 0) ? series.getRow(seriesIndex) : null;
            for (int path = 0; path < paths; path++) {
                history[path][index] = row;
            }
        }
        double[] statics = featureBuilder.staticCovariatesOf(series);
        double[][][] answer = new double[n][components][];

        while (produced < n) {
            double[][][][] raw = predictChunk(history, paths, lookback + produced, length + produced - shift, series,
                    past, future, statics, medianModel);
            for (int path = 0; path < paths; path++) {
                for (int step = 0; step < outputChunkLength; step++) {
                    double[] row = new double[components];
                    int time = produced + step;
                    for (int c = 0; c < components; c++) {
                        double[] output = raw[path][step][c];
                        if (medianModel) {
                            row[c] = output[0];
                        } else if (deterministic) {
                            row[c] = sampler.pointValue(output);
                        } else {
                            row[c] = sampler.drawOne(output, random);
                        }
                        if (time < n) {
                            if (parameters) {
                                answer[time][c] = sampler.reportedParameters(output);
                            } else {
                                if (answer[time][c] == null) {
                                    answer[time][c] = new double[paths];
                                }
                                answer[time][c][path] = row[c];
                            }
                        }
                    }
                    history[path][base + time] = row;
                }
            }
            produced += outputChunkLength;
        }
        return answer;
    }

    /**
     * predicts one output chunk for every path
     *
     * @param anchor      history index of the first anchor
     * @param seriesIndex series index of the first anchor, used for its time
     * @return outputs indexed by [path][step][component][output]
     */
    double[][][][] predictChunk(double[][][] history, int paths, int anchor, int seriesIndex, TimeSeries series,
            TimeSeries past, TimeSeries future, double[] statics, boolean medianModel) {
        int rowsPerPath = multiModels ? 1 : outputChunkLength;
        double[][] features = new double[paths * rowsPerPath][];
        for (int offset = 0; offset < rowsPerPath; offset++) {
            long anchorTime = series.timeAt(seriesIndex + offset);
            for (int path = 0; path < paths; path++) {
                features[offset * paths + path] = featureBuilder.featureRow(history[path], anchor + offset,
                        anchorTime, series.getStep(), past, future, statics);
            }
        }
        double[][][][] raw = medianModel ? models.predictMedian(features) : models.predictParameters(features);
        if (multiModels) {
            return raw;
        }
        double[][][][] answer = new double[paths][outputChunkLength][][];
        for (int offset = 0; offset < outputChunkLength; offset++) {
            for (int path = 0; path < paths; path++) {
                answer[path][offset] = raw[offset * paths + path][0];
            }
        }
        return answer;
    }

    /**
     * the number of steps a single model looks back from the step it predicts
     * to the anchor it was trained with; zero for multiple models
     *
     * @return the anchor shift
     */
    public int getAnchorShift() {
        return multiModels ? 0 : outputChunkLength - 1;
    }

    void checkFitted() {
        if (stage == ForecasterStage.UNFIT) {
            throw new NotFittedException("the forecaster has to be fit before it can predict");
        }
    }

    static TimeSeries get(List<TimeSeries> list, int index) {
        return (list == null) ? null : list.get(index);
    }

    public boolean isFit() {
        return stage != ForecasterStage.UNFIT;
    }

    public ForecasterStage getStage() {
        return stage;
    }

    public LagSpecification getLags() {
        return lags;
    }

    public int getOutputChunkLength() {
        return outputChunkLength;
    }

    public boolean isMultiModels() {
        return multiModels;
    }

    public boolean isUseStaticCovariates() {
        return useStaticCovariates;
    }

    public Likelihood getLikelihood() {
        return likelihood;
    }

    public boolean isProbabilistic() {
        return likelihood.isProbabilistic();
    }

    public RegressorConfig getRegressorConfig() {
        return regressorConfig;
    }

    public IRegressorFactory getRegressorFactory() {
        return regressorFactory;
    }

    public Optional<Long> getRandomSeed() {
        return randomSeed;
    }

    public IModelContainer getModels() {
        return models;
    }

    /**
     * @return the signature of the last successful fit
     * @throws NotFittedException before a successful fit
     */
    public TrainingSignature getSignature() {
        checkFitted();
        return signature;
    }

    public Optional<TimeSeries> getTrainingSeries() {
        return Optional.ofNullable(trainingSeries);
    }

    public Optional<TimeSeries> getTrainingPastCovariates() {
        return Optional.ofNullable(trainingPastCovariates);
    }

    public Optional<TimeSeries> getTrainingFutureCovariates() {
        return Optional.ofNullable(trainingFutureCovariates);
    }

    /**
     * names of the likelihood parameter columns of
     * {@link #predictLikelihoodParameters}, empty for point forecasts
     *
     * @return the names
     */
    public Optional<List<String>> getLikelihoodParameterNames() {
        checkFitted();
        return likelihood.getParameterNames(signature.getComponentNames());
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        protected LagSpecification lags;
        protected int outputChunkLength = DEFAULT_OUTPUT_CHUNK_LENGTH;
        protected boolean multiModels = DEFAULT_MULTI_MODELS;
        protected boolean useStaticCovariates = DEFAULT_USE_STATIC_COVARIATES;
        protected Likelihood likelihood = Likelihood.none();
        protected RegressorConfig regressorConfig = RegressorConfig.defaults();
        protected IRegressorFactory regressorFactory = LinearRegressor::new;
        protected Optional<Long> randomSeed = Optional.empty();
        protected RandomGenerator randomGenerator = null;

        void validate() {
            checkNotNull(lags, "lags have to be specified");
            checkArgument(outputChunkLength > 0, "output chunk length has to be positive");
            lags.validateFor(outputChunkLength);
            checkNotNull(likelihood, "likelihood cannot be null");
            checkNotNull(regressorConfig, "regressor configuration cannot be null");
            checkNotNull(regressorFactory, "regressor factory cannot be null");
        }

        public LagForecaster build() {
            validate();
            return new LagForecaster(this);
        }

        public T lags(LagSpecification lags) {
            this.lags = lags;
            return (T) this;
        }

        public T outputChunkLength(int outputChunkLength) {
            this.outputChunkLength = outputChunkLength;
            return (T) this;
        }

        public T multiModels(boolean multiModels) {
            this.multiModels = multiModels;
            return (T) this;
        }

        public T useStaticCovariates(boolean useStaticCovariates) {
            this.useStaticCovariates = useStaticCovariates;
            return (T) this;
        }

        public T likelihood(Likelihood likelihood) {
            this.likelihood = likelihood;
            return (T) this;
        }

        /**
         * @param name      quantile, poisson or gaussian
         * @param quantiles levels for a quantile likelihood, none for the default
         *                  levels
         * @return this builder
         */
        public T likelihood(String name, double... quantiles) {
            this.likelihood = Likelihood.of(name, (quantiles == null || quantiles.length == 0) ? null : quantiles);
            return (T) this;
        }

        public T regressorConfig(RegressorConfig regressorConfig) {
            this.regressorConfig = regressorConfig;
            return (T) this;
        }

        public T regressorFactory(IRegressorFactory regressorFactory) {
            this.regressorFactory = regressorFactory;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        /**
         * replaces the seeded generator used for sampling; the generator then
         * belongs to the forecaster
         *
         * @param randomGenerator the generator
         * @return this builder
         */
        public T randomGenerator(RandomGenerator randomGenerator) {
            this.randomGenerator = randomGenerator;
            return (T) this;
        }

        public RandomGenerator getRandom() {
            if (randomGenerator != null) {
                return randomGenerator;
            }
            return randomSeed.map(Well19937c::new).orElseGet(Well19937c::new);
        }
    }
}
