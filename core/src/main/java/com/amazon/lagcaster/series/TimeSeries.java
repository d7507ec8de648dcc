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

package com.amazon.lagcaster.series;

import static com.amazon.lagcaster.CommonUtils.checkArgument;
import static com.amazon.lagcaster.CommonUtils.checkNotNull;
import static com.amazon.lagcaster.CommonUtils.deepCopy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, regularly spaced multivariate series. Row {@code i} of the
 * values is observed at {@code startTime + i * step}. A series can carry a
 * fixed length vector of static covariates that does not vary over time.
 */
public class TimeSeries {

    private final long startTime;

    private final long step;

    private final double[][] values;

    private final List<String> componentNames;

    private final double[] staticCovariates;

    public TimeSeries(double[][] values) {
        this(0L, 1L, values);
    }

    public TimeSeries(long startTime, long step, double[][] values) {
        this(startTime, step, values, null, null);
    }

    /**
     * @param startTime        time of the first row
     * @param step             positive spacing between rows
     * @param values           rows of equal, positive width
     * @param componentNames   one name per column; null names the columns
     *                         "0","1",...
     * @param staticCovariates optional static covariates, may be null
     */
    public TimeSeries(long startTime, long step, double[][] values, List<String> componentNames,
            double[] staticCovariates) {
        checkNotNull(values, "values cannot be null");
        checkArgument(values.length > 0, "a series needs at least one entry");
        checkArgument(step > 0, "step has to be positive");
        int width = values[0].length;
        checkArgument(width > 0, "a series needs at least one component");
        for (double[] row : values) {
            checkArgument(row != null && row.length == width, "nonuniform number of components");
        }
        this.startTime = startTime;
        this.step = step;
        this.values = deepCopy(values);
        if (componentNames == null) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < width; i++) {
                names.add(String.valueOf(i));
            }
            this.componentNames = Collections.unmodifiableList(names);
        } else {
            checkArgument(componentNames.size() == width, "incorrect number of component names");
            this.componentNames = Collections.unmodifiableList(new ArrayList<>(componentNames));
        }
        this.staticCovariates = (staticCovariates == null) ? null
                : Arrays.copyOf(staticCovariates, staticCovariates.length);
    }

    public static TimeSeries univariate(long startTime, long step, double[] values) {
        checkNotNull(values, "values cannot be null");
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[] { values[i] };
        }
        return new TimeSeries(startTime, step, rows);
    }

    public static TimeSeries univariate(double[] values) {
        return univariate(0L, 1L, values);
    }

    public TimeSeries withStaticCovariates(double[] staticCovariates) {
        return new TimeSeries(startTime, step, values, componentNames, staticCovariates);
    }

    public TimeSeries withComponentNames(List<String> names) {
        return new TimeSeries(startTime, step, values, names, staticCovariates);
    }

    public int getLength() {
        return values.length;
    }

    public int getNumberOfComponents() {
        return values[0].length;
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

    /**
     * the row index corresponding to a time; the index can be outside the range
     * of this series (negative or beyond the end)
     *
     * @param time a time on the grid of this series
     * @return the (possibly out of range) index
     */
    public int indexOf(long time) {
        long offset = time - startTime;
        checkArgument(Math.floorMod(offset, step) == 0, "time " + time + " is not aligned with the series");
        return Math.toIntExact(Math.floorDiv(offset, step));
    }

    public boolean contains(long time) {
        int index = indexOf(time);
        return index >= 0 && index < values.length;
    }

    public double getValue(int index, int component) {
        return values[index][component];
    }

    public double[] getRow(int index) {
        return Arrays.copyOf(values[index], values[index].length);
    }

    public double[][] getValues() {
        return deepCopy(values);
    }

    public double[] getComponent(int component) {
        checkArgument(component >= 0 && component < getNumberOfComponents(), "incorrect component");
        double[] answer = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            answer[i] = values[i][component];
        }
        return answer;
    }

    public List<String> getComponentNames() {
        return componentNames;
    }

    public boolean hasStaticCovariates() {
        return staticCovariates != null;
    }

    public double[] getStaticCovariates() {
        return (staticCovariates == null) ? null : Arrays.copyOf(staticCovariates, staticCovariates.length);
    }

    /**
     * the rows in {@code [from, to)}
     *
     * @param from first index, inclusive
     * @param to   last index, exclusive
     * @return a new series
     */
    public TimeSeries slice(int from, int to) {
        checkArgument(0 <= from && from < to && to <= values.length, "incorrect slice");
        return new TimeSeries(timeAt(from), step, Arrays.copyOfRange(values, from, to), componentNames,
                staticCovariates);
    }

    /**
     * the rows whose times lie in {@code [fromTime, toTime]}
     *
     * @param fromTime start time, inclusive
     * @param toTime   end time, inclusive
     * @return a new series
     */
    public TimeSeries sliceByTime(long fromTime, long toTime) {
        int from = Math.max(0, indexOf(fromTime));
        int to = Math.min(values.length, indexOf(toTime) + 1);
        checkArgument(from < to, "no overlap between the series and [" + fromTime + ", " + toTime + "]");
        return slice(from, to);
    }

    /**
     * the first {@code length} rows
     *
     * @param length number of rows
     * @return a new series
     */
    public TimeSeries head(int length) {
        return slice(0, length);
    }

    /**
     * appends rows that continue this series on the same time grid
     *
     * @param rows the rows to append
     * @return a new, longer series
     */
    public TimeSeries append(double[][] rows) {
        checkNotNull(rows, "rows cannot be null");
        double[][] combined = Arrays.copyOf(values, values.length + rows.length);
        System.arraycopy(rows, 0, combined, values.length, rows.length);
        return new TimeSeries(startTime, step, combined, componentNames, staticCovariates);
    }

    @Override
    public String toString() {
        return "TimeSeries(start=" + startTime + ", step=" + step + ", length=" + values.length + ", components="
                + componentNames + ")";
    }
}
