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

package com.amazon.lagcaster.state;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.lagcaster.LagForecaster;
import com.amazon.lagcaster.TrainingSignature;
import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.config.LikelihoodType;
import com.amazon.lagcaster.ensemble.IModelContainer;
import com.amazon.lagcaster.ensemble.QuantileModelContainer;
import com.amazon.lagcaster.ensemble.SingleModelContainer;
import com.amazon.lagcaster.exceptions.NotFittedException;
import com.amazon.lagcaster.lags.LagSpecification;
import com.amazon.lagcaster.regressor.RegressorConfig;
import com.amazon.lagcaster.series.TimeSeries;
import com.amazon.lagcaster.state.regressor.HorizonRegressorMapper;
import com.amazon.lagcaster.state.regressor.HorizonRegressorState;
import com.amazon.lagcaster.state.series.TimeSeriesMapper;
import com.amazon.lagcaster.state.series.TimeSeriesState;

/**
 * A utility class for creating a {@link LagForecasterState} from a fitted
 * {@link LagForecaster} and vice versa. Only forecasters whose regressors are
 * {@link com.amazon.lagcaster.regressor.LinearRegressor} instances can be
 * saved. A restored forecaster uses the default regressor factory for any later
 * fit.
 */
@Slf4j
@Getter
@Setter
public class LagForecasterMapper implements IStateMapper<LagForecaster, LagForecasterState> {

    /**
     * if true, the series a forecaster was fit on is saved so that the restored
     * forecaster can continue it
     */
    private boolean saveTrainingSeriesEnabled = true;

    private final HorizonRegressorMapper regressorMapper = new HorizonRegressorMapper();

    private final TimeSeriesMapper seriesMapper = new TimeSeriesMapper();

    /**
     * @param model a fitted forecaster
     * @return its state
     * @throws NotFittedException if the forecaster has not been fit
     */
    @Override
    public LagForecasterState toState(LagForecaster model) {
        if (!model.isFit()) {
            throw new NotFittedException("only a fitted forecaster can be saved");
        }
        LagForecasterState state = new LagForecasterState();
        LagSpecification lags = model.getLags();
        state.setTargetLags(lags.getTargetLags());
        state.setPastCovariateLags(lags.getPastCovariateLags());
        state.setFutureCovariateLags(lags.getFutureCovariateLags());
        state.setOutputChunkLength(model.getOutputChunkLength());
        state.setMultiModels(model.isMultiModels());
        state.setUseStaticCovariates(model.isUseStaticCovariates());

        Likelihood likelihood = model.getLikelihood();
        state.setLikelihood(likelihood.getType().name());
        if (likelihood.getType() == LikelihoodType.QUANTILE) {
            state.setQuantiles(likelihood.getQuantiles());
        }

        RegressorConfig config = model.getRegressorConfig();
        state.setObjective(config.getObjective());
        state.setRegressorRandomSeed(config.getRandomSeed().orElse(null));
        state.setVerbose(config.isVerbose());
        state.setRegressorOptions(new HashMap<>(config.getOptions()));
        state.setRandomSeed(model.getRandomSeed().orElse(null));

        IModelContainer models = model.getModels();
        List<Double> keys = models.getKeys();
        double[] modelKeys = new double[keys.size()];
        HorizonRegressorState[] regressors = new HorizonRegressorState[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            modelKeys[i] = keys.get(i);
            regressors[i] = regressorMapper.toState(models.get(keys.get(i)));
        }
        state.setModelKeys(modelKeys);
        state.setModels(regressors);

        TrainingSignature signature = model.getSignature();
        state.setComponentNames(signature.getComponentNames());
        state.setPastCovariateComponents(signature.getPastCovariateComponents());
        state.setFutureCovariateComponents(signature.getFutureCovariateComponents());
        state.setStaticCovariateLength(signature.getStaticCovariateLength());
        state.setSamplesPerSeries(signature.getSamplesPerSeries());

        if (saveTrainingSeriesEnabled && model.getTrainingSeries().isPresent()) {
            state.setTrainingSeries(seriesMapper.toState(model.getTrainingSeries().get()));
            model.getTrainingPastCovariates().ifPresent(s -> state.setTrainingPastCovariates(seriesMapper.toState(s)));
            model.getTrainingFutureCovariates()
                    .ifPresent(s -> state.setTrainingFutureCovariates(seriesMapper.toState(s)));
        }
        log.debug("saved forecaster with {} model(s)", keys.size());
        return state;
    }

    /**
     * restores a forecaster; the seed is used for sampling only when the state
     * carries no seed of its own
     *
     * @param state a forecaster state
     * @param seed  a fallback random seed
     * @return the fitted forecaster
     */
    @Override
    public LagForecaster toModel(LagForecasterState state, long seed) {
        checkNotNull(state, "state cannot be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());

        LagSpecification.Builder lags = LagSpecification.builder();
        if (state.getTargetLags() != null && state.getTargetLags().length > 0) {
            lags.explicitTargetLags(state.getTargetLags());
        }
        if (state.getPastCovariateLags() != null && state.getPastCovariateLags().length > 0) {
            lags.explicitPastCovariateLags(state.getPastCovariateLags());
        }
        if (state.getFutureCovariateLags() != null && state.getFutureCovariateLags().length > 0) {
            lags.explicitFutureCovariateLags(state.getFutureCovariateLags());
        }

        Likelihood likelihood = toLikelihood(LikelihoodType.valueOf(state.getLikelihood()), state.getQuantiles());

        RegressorConfig.Builder config = RegressorConfig.builder().objective(state.getObjective())
                .verbose(state.isVerbose());
        if (state.getRegressorRandomSeed() != null) {
            config.randomSeed(state.getRegressorRandomSeed());
        }
        Map<String, Object> options = state.getRegressorOptions();
        if (options != null) {
            options.forEach(config::option);
        }

        LagForecaster.Builder<?> builder = LagForecaster.builder().lags(lags.build())
                .outputChunkLength(state.getOutputChunkLength()).multiModels(state.isMultiModels())
                .useStaticCovariates(state.isUseStaticCovariates()).likelihood(likelihood)
                .regressorConfig(config.build())
                .randomSeed((state.getRandomSeed() != null) ? state.getRandomSeed() : seed);

        IModelContainer models = (likelihood.getType() == LikelihoodType.QUANTILE)
                ? new QuantileModelContainer(likelihood)
                : new SingleModelContainer();
        checkArgument(state.getModelKeys().length == state.getModels().length, "models and keys do not align");
        for (int i = 0; i < state.getModels().length; i++) {
            models.set(state.getModelKeys()[i], regressorMapper.toModel(state.getModels()[i]));
        }

        TrainingSignature signature = new TrainingSignature(state.getComponentNames(),
                state.getPastCovariateComponents(), state.getFutureCovariateComponents(),
                state.getStaticCovariateLength(), state.getSamplesPerSeries());
        TimeSeries[] training = null;
        if (state.getTrainingSeries() != null) {
            training = new TimeSeries[] { toSeries(state.getTrainingSeries()),
                    toSeries(state.getTrainingPastCovariates()), toSeries(state.getTrainingFutureCovariates()) };
        }
        return new LagForecaster(builder, models, signature, training);
    }

    TimeSeries toSeries(TimeSeriesState state) {
        return (state == null) ? null : seriesMapper.toModel(state);
    }

    static Likelihood toLikelihood(LikelihoodType type, double[] quantiles) {
        switch (type) {
        case QUANTILE:
            return Likelihood.quantile(quantiles);
        case POISSON:
            return Likelihood.poisson();
        case GAUSSIAN:
            return Likelihood.gaussian();
        default:
            return Likelihood.none();
        }
    }
}
