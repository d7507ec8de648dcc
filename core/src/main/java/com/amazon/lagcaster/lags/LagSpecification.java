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
import static com.amazon.lagcaster.CommonUtils.checkStrictlyIncreasing;

import java.util.Arrays;

/**
 * The lags (offsets in time steps from the forecast anchor, which is the first
 * forecasted step) read from each class of input. Target and past covariate
 * lags are strictly negative; future covariate lags can be non-negative since
 * future covariates are known over the forecast horizon. Lags are stored in
 * increasing order and an unused class has no lags.
 */
public class LagSpecification {

    private static final int[] NO_LAGS = new int[0];

    private final int[] targetLags;

    private final int[] pastCovariateLags;

    private final int[] futureCovariateLags;

    protected LagSpecification(Builder builder) {
        this.targetLags = builder.targetLags;
        this.pastCovariateLags = builder.pastCovariateLags;
        this.futureCovariateLags = builder.futureCovariateLags;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int[] getTargetLags() {
        return Arrays.copyOf(targetLags, targetLags.length);
    }

    public int[] getPastCovariateLags() {
        return Arrays.copyOf(pastCovariateLags, pastCovariateLags.length);
    }

    public int[] getFutureCovariateLags() {
        return Arrays.copyOf(futureCovariateLags, futureCovariateLags.length);
    }

    public boolean hasTargetLags() {
        return targetLags.length > 0;
    }

    public boolean hasPastCovariateLags() {
        return pastCovariateLags.length > 0;
    }

    public boolean hasFutureCovariateLags() {
        return futureCovariateLags.length > 0;
    }

    /**
     * @return the most negative target lag, 0 if no target lags are used
     */
    public int getMinTargetLag() {
        return hasTargetLags() ? targetLags[0] : 0;
    }

    /**
     * number of past target rows that a feature row reads
     *
     * @return the look back of the target
     */
    public int getTargetLookback() {
        return -getMinTargetLag();
    }

    public int getMaxFutureCovariateLag() {
        return hasFutureCovariateLags() ? futureCovariateLags[futureCovariateLags.length - 1] : 0;
    }

    /**
     * width of a feature row
     *
     * @param targetComponents  components of the target
     * @param pastComponents    components of the past covariates
     * @param futureComponents  components of the future covariates
     * @param staticCovariates  length of the static covariates
     * @return the number of features
     */
    public int getNumberOfFeatures(int targetComponents, int pastComponents, int futureComponents,
            int staticCovariates) {
        return targetLags.length * targetComponents + pastCovariateLags.length * pastComponents
                + futureCovariateLags.length * futureComponents + staticCovariates;
    }

    /**
     * future covariate lags have to fall before the end of an output chunk
     *
     * @param outputChunkLength number of steps predicted per regressor call
     */
    public void validateFor(int outputChunkLength) {
        checkArgument(outputChunkLength > 0, "output chunk length has to be positive");
        checkArgument(getMaxFutureCovariateLag() <= outputChunkLength - 1,
                "future covariate lags cannot exceed output chunk length - 1");
    }

    @Override
    public String toString() {
        return "LagSpecification(target=" + Arrays.toString(targetLags) + ", past="
                + Arrays.toString(pastCovariateLags) + ", future=" + Arrays.toString(futureCovariateLags) + ")";
    }

    static int[] range(int from, int to) {
        int[] answer = new int[Math.max(0, to - from)];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = from + i;
        }
        return answer;
    }

    static int[] sorted(int[] lags, String name) {
        checkNotNull(lags, name + " lags cannot be null");
        checkArgument(lags.length > 0, "explicit " + name + " lags cannot be empty");
        int[] answer = Arrays.copyOf(lags, lags.length);
        Arrays.sort(answer);
        checkStrictlyIncreasing(answer, name + " lags cannot repeat");
        return answer;
    }

    public static class Builder {

        protected int[] targetLags = NO_LAGS;
        protected int[] pastCovariateLags = NO_LAGS;
        protected int[] futureCovariateLags = NO_LAGS;

        /**
         * uses lags -width, ..., -1 of the target
         *
         * @param width positive number of lags
         * @return this builder
         */
        public Builder targetLags(int width) {
            checkArgument(width > 0, "target lag width has to be positive");
            this.targetLags = range(-width, 0);
            return this;
        }

        public Builder explicitTargetLags(int... lags) {
            this.targetLags = sorted(lags, "target");
            return this;
        }

        public Builder pastCovariateLags(int width) {
            checkArgument(width > 0, "past covariate lag width has to be positive");
            this.pastCovariateLags = range(-width, 0);
            return this;
        }

        public Builder explicitPastCovariateLags(int... lags) {
            this.pastCovariateLags = sorted(lags, "past covariate");
            return this;
        }

        /**
         * uses lags -past, ..., -1 and 0, ..., future - 1 of the future covariates
         *
         * @param past   number of lags before the anchor
         * @param future number of lags starting at the anchor
         * @return this builder
         */
        public Builder futureCovariateLags(int past, int future) {
            checkArgument(past >= 0 && future >= 0, "future covariate lag widths cannot be negative");
            checkArgument(past + future > 0, "future covariate lags cannot be empty");
            this.futureCovariateLags = range(-past, future);
            return this;
        }

        public Builder explicitFutureCovariateLags(int... lags) {
            this.futureCovariateLags = sorted(lags, "future covariate");
            return this;
        }

        public LagSpecification build() {
            checkArgument(targetLags.length + pastCovariateLags.length + futureCovariateLags.length > 0,
                    "at least one of target, past covariate or future covariate lags is required");
            for (int lag : targetLags) {
                checkArgument(lag < 0, "target lags have to be negative");
            }
            for (int lag : pastCovariateLags) {
                checkArgument(lag < 0, "past covariate lags have to be negative");
            }
            return new LagSpecification(this);
        }
    }
}
