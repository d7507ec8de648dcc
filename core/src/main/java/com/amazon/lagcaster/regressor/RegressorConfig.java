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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An opaque configuration bag for regressors: an objective, an optional random
 * seed and free form options passed through to the regressor. The forecaster
 * only ever overwrites the objective.
 */
public class RegressorConfig {

    private final String objective;

    private final Optional<Long> randomSeed;

    private final boolean verbose;

    private final Map<String, Object> options;

    protected RegressorConfig(Builder builder) {
        this.objective = builder.objective;
        this.randomSeed = builder.randomSeed;
        this.verbose = builder.verbose;
        this.options = Collections.unmodifiableMap(new HashMap<>(builder.options));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RegressorConfig defaults() {
        return builder().build();
    }

    public String getObjective() {
        return objective;
    }

    public Optional<Long> getRandomSeed() {
        return randomSeed;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public double getDoubleOption(String name, double defaultValue) {
        Object value = options.get(name);
        return (value instanceof Number) ? ((Number) value).doubleValue() : defaultValue;
    }

    public int getIntOption(String name, int defaultValue) {
        Object value = options.get(name);
        return (value instanceof Number) ? ((Number) value).intValue() : defaultValue;
    }

    /**
     * @param newObjective the objective to use
     * @return a copy of this configuration with the objective replaced
     */
    public RegressorConfig withObjective(String newObjective) {
        return toBuilder().objective(newObjective).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder().objective(objective).verbose(verbose);
        randomSeed.ifPresent(builder::randomSeed);
        builder.options.putAll(options);
        return builder;
    }

    @Override
    public String toString() {
        return "RegressorConfig(objective=" + objective + ", randomSeed=" + randomSeed + ", options=" + options + ")";
    }

    public static class Builder {

        private String objective = Objectives.RMSE;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean verbose = false;
        private final Map<String, Object> options = new HashMap<>();

        public Builder objective(String objective) {
            this.objective = objective;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder option(String name, Object value) {
            this.options.put(name, value);
            return this;
        }

        public RegressorConfig build() {
            return new RegressorConfig(this);
        }
    }
}
