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
import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.lagcaster.exceptions.InsufficientCovariateException;
import com.amazon.lagcaster.exceptions.InsufficientHistoryException;
import com.amazon.lagcaster.series.TimeSeries;

/**
 * Turns target series and optional covariate series into fixed width feature
 * rows. An anchor is the index of the first step to be predicted; the feature
 * row of an anchor reads the target at {@code anchor + lag} for every target lag
 * and the covariates at {@code time(anchor) + lag * step} for every covariate
 * lag, followed by the static covariates (if used). Each feature row only reads
 * the history of its own series.
 */
@Slf4j
@Getter
public class LagFeatureBuilder {

    public static final int UNLIMITED_SAMPLES = 0;

    private final LagSpecification lags;

    private final int outputChunkLength;

    private final boolean useStaticCovariates;

    public LagFeatureBuilder(LagSpecification lags, int outputChunkLength, boolean useStaticCovariates) {
        checkNotNull(lags, "lags cannot be null");
        lags.validateFor(outputChunkLength);
        this.lags = lags;
        this.outputChunkLength = outputChunkLength;
        this.useStaticCovariates = useStaticCovariates;
    }

    /**
     * builds the training set over all the series; either every series yields at
     * least one sample or the call fails
     *
     * @param targets             the target series
     * @param pastCovariates      past covariates, one per target, or null
     * @param futureCovariates    future covariates, one per target, or null
     * @param maxSamplesPerSeries if positive, only the most recent anchors of
     *                            each series are kept
     * @return the data set
     * @throws InsufficientHistoryException   if a target is too short
     * @throws InsufficientCovariateException if covariates do not overlap the
     *                                        target enough
     */
    public LaggedDataset build(List<TimeSeries> targets, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates, int maxSamplesPerSeries) {
        checkArgument(maxSamplesPerSeries >= 0, "maximum number of samples cannot be negative");
        validateInputs(targets, pastCovariates, futureCovariates);

        // all ranges are computed before any row is produced
        int[][] ranges = new int[targets.size()][];
        int[] counts = new int[targets.size()];
        int total = 0;
        for (int i = 0; i < targets.size(); i++) {
            ranges[i] = trainingAnchors(targets.get(i), get(pastCovariates, i), get(futureCovariates, i));
            if (maxSamplesPerSeries != UNLIMITED_SAMPLES) {
                ranges[i][0] = max(ranges[i][0], ranges[i][1] - maxSamplesPerSeries + 1);
            }
            counts[i] = ranges[i][1] - ranges[i][0] + 1;
            total += counts[i];
        }

        int components = targets.get(0).getNumberOfComponents();
        double[][] features = new double[total][];
        double[][] targetRows = new double[total][];
        int row = 0;
        for (int i = 0; i < targets.size(); i++) {
            TimeSeries target = targets.get(i);
            double[][] history = target.getValues();
            double[] statics = staticCovariatesOf(target);
            for (int anchor = ranges[i][0]; anchor <= ranges[i][1]; anchor++) {
                features[row] = featureRow(history, anchor, target.timeAt(anchor), target.getStep(),
                        get(pastCovariates, i), get(futureCovariates, i), statics);
                double[] y = new double[outputChunkLength * components];
                for (int step = 0; step < outputChunkLength; step++) {
                    System.arraycopy(history[anchor + step], 0, y, step * components, components);
                }
                targetRows[row++] = y;
            }
        }
        log.debug("built {} samples with {} features from {} series", total,
                (total == 0) ? 0 : features[0].length, targets.size());
        return new LaggedDataset(features, targetRows, counts);
    }

    /**
     * the inclusive range of anchors of a series that have all lags and a full
     * output chunk available
     *
     * @param target the target series
     * @param past   past covariates or null
     * @param future future covariates or null
     * @return {first anchor, last anchor}
     */
    public int[] trainingAnchors(TimeSeries target, TimeSeries past, TimeSeries future) {
        int first = lags.getTargetLookback();
        int last = target.getLength() - outputChunkLength;
        if (first > last) {
            throw new InsufficientHistoryException("series of length " + target.getLength()
                    + " is too short for target lags " + lags + " and output chunk length " + outputChunkLength);
        }
        if (lags.hasPastCovariateLags()) {
            int[] bounds = covariateBounds(target, past, lags.getPastCovariateLags());
            first = max(first, bounds[0]);
            last = min(last, bounds[1]);
        }
        if (lags.hasFutureCovariateLags()) {
            int[] bounds = covariateBounds(target, future, lags.getFutureCovariateLags());
            first = max(first, bounds[0]);
            last = min(last, bounds[1]);
        }
        if (first > last) {
            throw new InsufficientCovariateException(
                    "covariates do not overlap the target " + target + " enough to build a single sample");
        }
        return new int[] { first, last };
    }

    /**
     * the anchors (as indices of the target) whose covariate lags fall inside the
     * covariate series
     */
    int[] covariateBounds(TimeSeries target, TimeSeries covariate, int[] covariateLags) {
        checkArgument(covariate.getStep() == target.getStep(), "covariates have to share the step of the target");
        int offset = covariate.indexOf(target.getStartTime());
        int first = -offset - covariateLags[0];
        int last = covariate.getLength() - 1 - offset - covariateLags[covariateLags.length - 1];
        return new int[] { first, last };
    }

    /**
     * checks that a covariate series covers every lag of anchors in
     * {@code [firstAnchorTime, lastAnchorTime]}
     *
     * @param covariate       the covariate series
     * @param covariateLags   its lags
     * @param firstAnchorTime time of the first anchor
     * @param lastAnchorTime  time of the last anchor
     * @param step            step of the target
     * @param name            used in the error message
     * @throws InsufficientCovariateException if a lag falls outside the
     *                                        covariates
     */
    public void checkCoverage(TimeSeries covariate, int[] covariateLags, long firstAnchorTime, long lastAnchorTime,
            long step, String name) {
        checkArgument(covariate.getStep() == step, "covariates have to share the step of the target");
        long needFrom = firstAnchorTime + covariateLags[0] * step;
        long needTo = lastAnchorTime + covariateLags[covariateLags.length - 1] * step;
        if (!covariate.contains(needFrom) || !covariate.contains(needTo)) {
            throw new InsufficientCovariateException(name + " covariates span [" + covariate.getStartTime() + ", "
                    + covariate.getEndTime() + "] but [" + needFrom + ", " + needTo + "] is required");
        }
    }

    /**
     * a single feature row
     *
     * @param history          target rows; lags are read relative to anchor
     * @param anchor           index in history of the first predicted step
     * @param anchorTime       time of the anchor
     * @param step             time step of the target
     * @param past             past covariates, null if not used
     * @param future           future covariates, null if not used
     * @param staticCovariates static covariates, null if not used
     * @return the feature row
     */
    public double[] featureRow(double[][] history, int anchor, long anchorTime, long step, TimeSeries past,
            TimeSeries future, double[] staticCovariates) {
        int[] targetLags = lags.getTargetLags();
        int components = (targetLags.length == 0) ? 0 : history[anchor + targetLags[0]].length;
        int[] pastLags = lags.getPastCovariateLags();
        int[] futureLags = lags.getFutureCovariateLags();
        int pastComponents = (past == null) ? 0 : past.getNumberOfComponents();
        int futureComponents = (future == null) ? 0 : future.getNumberOfComponents();
        int staticLength = (staticCovariates == null) ? 0 : staticCovariates.length;

        double[] row = new double[lags.getNumberOfFeatures(components, pastComponents, futureComponents,
                staticLength)];
        int position = 0;
        for (int lag : targetLags) {
            System.arraycopy(history[anchor + lag], 0, row, position, components);
            position += components;
        }
        position = copyCovariates(row, position, past, pastLags, anchorTime, step);
        position = copyCovariates(row, position, future, futureLags, anchorTime, step);
        if (staticLength > 0) {
            System.arraycopy(staticCovariates, 0, row, position, staticLength);
        }
        return row;
    }

    int copyCovariates(double[] row, int position, TimeSeries covariate, int[] covariateLags, long anchorTime,
            long step) {
        if (covariateLags.length == 0) {
            return position;
        }
        int base = covariate.indexOf(anchorTime);
        int components = covariate.getNumberOfComponents();
        for (int lag : covariateLags) {
            int index = base + lag;
            for (int c = 0; c < components; c++) {
                row[position++] = covariate.getValue(index, c);
            }
        }
        return position;
    }

    /**
     * the static covariates that go into the feature rows of a series
     *
     * @param series a target series
     * @return null when static covariates are not used
     */
    public double[] staticCovariatesOf(TimeSeries series) {
        return (useStaticCovariates && series.hasStaticCovariates()) ? series.getStaticCovariates() : null;
    }

    /**
     * checks that the inputs are mutually consistent: covariates are present
     * exactly when lags ask for them, one per target, with a uniform number of
     * components across series
     *
     * @param targets          target series
     * @param pastCovariates   past covariates or null
     * @param futureCovariates future covariates or null
     */
    public void validateInputs(List<TimeSeries> targets, List<TimeSeries> pastCovariates,
            List<TimeSeries> futureCovariates) {
        checkNotNull(targets, "target series cannot be null");
        checkArgument(!targets.isEmpty(), "at least one target series is required");
        validateCovariates(targets, pastCovariates, lags.hasPastCovariateLags(), "past");
        validateCovariates(targets, futureCovariates, lags.hasFutureCovariateLags(), "future");
        int components = targets.get(0).getNumberOfComponents();
        int staticLength = staticLength(targets.get(0));
        for (TimeSeries target : targets) {
            checkNotNull(target, "target series cannot be null");
            checkArgument(target.getNumberOfComponents() == components,
                    "all target series need the same number of components");
            checkArgument(staticLength(target) == staticLength,
                    "all target series need the same number of static covariates");
        }
    }

    int staticLength(TimeSeries series) {
        double[] statics = staticCovariatesOf(series);
        return (statics == null) ? 0 : statics.length;
    }

    void validateCovariates(List<TimeSeries> targets, List<TimeSeries> covariates, boolean used, String name) {
        if (!used) {
            checkArgument(covariates == null, name + " covariates were given, but no " + name + " covariate lags");
            return;
        }
        checkArgument(covariates != null, name + " covariate lags require " + name + " covariates");
        checkArgument(covariates.size() == targets.size(), "one set of " + name + " covariates per target series");
        int components = covariates.get(0).getNumberOfComponents();
        for (TimeSeries covariate : covariates) {
            checkNotNull(covariate, name + " covariates cannot be null");
            checkArgument(covariate.getNumberOfComponents() == components,
                    "all " + name + " covariates need the same number of components");
        }
    }

    static TimeSeries get(List<TimeSeries> list, int index) {
        return (list == null) ? null : list.get(index);
    }

    /**
     * wraps a single, possibly null, series as a list
     *
     * @param series a series or null
     * @return null or a singleton list
     */
    public static List<TimeSeries> listOf(TimeSeries series) {
        if (series == null) {
            return null;
        }
        List<TimeSeries> answer = new ArrayList<>();
        answer.add(series);
        return answer;
    }
}
