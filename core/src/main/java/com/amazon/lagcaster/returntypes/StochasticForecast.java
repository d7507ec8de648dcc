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

package com.amazon.lagcaster.returntypes;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import com.amazon.lagcaster.series.TimeSeries;

/**
 * A forecast made of sample paths, indexed by [time][component][sample]. A
 * deterministic forecast has exactly one sample. Each call to predict produces
 * a fresh instance that belongs to the caller.
 */
public class StochasticForecast {

    private final long startTime;

    private final long step;

    private final double[][][] values;

    private final List<String> componentNames;

    public StochasticForecast(long startTime, long step, double[][][] values, List<String> componentNames) {
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length > 0, "a forecast needs at least one time step");
        checkArgument(step > 0, "step has to be positive");
        int components = values[0].length;
        checkArgument(components > 0, "a forecast needs at least one component");
        int samples = values[0][0].length;
        checkArgument(samples > 0, "a forecast needs at least one sample");
        for (double[][] slice : values) {
            checkArgument(slice.length == components, "nonuniform number of components");
            for (double[] draws : slice) {
                checkArgument(draws.length == samples, "nonuniform number of samples");
            }
        }
        checkNotNull(componentNames, "component names cannot be null");
        checkArgument(componentNames.size() == components, "incorrect number of component names");
        this.startTime = startTime;
        this.step = step;
        this.values = values;
        this.componentNames = Collections.unmodifiableList(new ArrayList<>(componentNames));
    }

    public long getStartTime() {
        return startTime;
    }

    public long getStep() {
        return step;
    }

    public long getEndTime() {
        return timeAt(values.length - 1);
    }

    public long timeAt(int index) {
        return startTime + index * step;
    }

    public int getLength() {
        return values.length;
    }

    public int getNumberOfComponents() {
        return values[0].length;
    }

    public int getNumberOfSamples() {
        return values[0][0].length;
    }

    public boolean isDeterministic() {
        return getNumberOfSamples() == 1;
    }

    public List<String> getComponentNames() {
        return componentNames;
    }

    public double getValue(int time, int component, int sample) {
        return values[time][component][sample];
    }

    public double[] getSamples(int time, int component) {
        return Arrays.copyOf(values[time][component], values[time][component].length);
    }

    /**
     * @return a copy of all the samples, indexed by [time][component][sample]
     */
    public double[][][] getValues() {
        double[][][] answer = new double[values.length][][];
        for (int t = 0; t < values.length; t++) {
            answer[t] = new double[values[t].length][];
            for (int c = 0; c < values[t].length; c++) {
                answer[t][c] = Arrays.copyOf(values[t][c], values[t][c].length);
            }
        }
        return answer;
    }

    /**
     * @param sample index of a sample path
     * @return the path as a series
     */
    public TimeSeries getPath(int sample) {
        checkArgument(sample >= 0 && sample < getNumberOfSamples(), "incorrect sample index");
        double[][] rows = new double[values.length][getNumberOfComponents()];
        for (int t = 0; t < values.length; t++) {
            for (int c = 0; c < rows[t].length; c++) {
                rows[t][c] = values[t][c][sample];
            }
        }
        return new TimeSeries(startTime, step, rows, componentNames, null);
    }

    /**
     * @return the sample mean at every time step and component
     */
    public TimeSeries mean() {
        double[][] rows = new double[values.length][getNumberOfComponents()];
        for (int t = 0; t < values.length; t++) {
            for (int c = 0; c < rows[t].length; c++) {
                rows[t][c] = StatUtils.mean(values[t][c]);
            }
        }
        return new TimeSeries(startTime, step, rows, componentNames, null);
    }

    /**
     * the empirical quantile (linear interpolation between order statistics) at
     * every time step and component
     *
     * @param level a level in [0,1]
     * @return the quantile series
     */
    public TimeSeries quantile(double level) {
        checkArgument(level >= 0 && level <= 1, "level has to be in [0,1]");
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double[][] rows = new double[values.length][getNumberOfComponents()];
        for (int t = 0; t < values.length; t++) {
            for (int c = 0; c < rows[t].length; c++) {
                rows[t][c] = (level == 0) ? StatUtils.min(values[t][c])
                        : percentile.evaluate(values[t][c], 100 * level);
            }
        }
        return new TimeSeries(startTime, step, rows, componentNames, null);
    }

    /**
     * the steps in {@code [from, to)}
     *
     * @param from first index, inclusive
     * @param to   last index, exclusive
     * @return a new forecast
     */
    public StochasticForecast slice(int from, int to) {
        checkArgument(0 <= from && from < to && to <= values.length, "incorrect slice");
        return new StochasticForecast(timeAt(from), step, Arrays.copyOfRange(values, from, to), componentNames);
    }

    @Override
    public String toString() {
        return "StochasticForecast(start=" + startTime + ", step=" + step + ", length=" + values.length
                + ", components=" + componentNames + ", samples=" + getNumberOfSamples() + ")";
    }
}
