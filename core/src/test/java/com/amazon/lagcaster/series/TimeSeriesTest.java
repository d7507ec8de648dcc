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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class TimeSeriesTest {

    private final TimeSeries series = TimeSeries.univariate(100, 10, new double[] { 1, 2, 3, 4, 5 });

    @Test
    public void testConstruction() {
        assertThrows(NullPointerException.class, () -> new TimeSeries(null));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(0, 0, new double[][] { { 1 } }));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(new double[][] { { 1 }, { 1, 2 } }));
        assertThrows(IllegalArgumentException.class,
                () -> new TimeSeries(0, 1, new double[][] { { 1, 2 } }, Arrays.asList("a"), null));

        TimeSeries wide = new TimeSeries(new double[][] { { 1, 2 }, { 3, 4 } });
        assertThat(wide.getComponentNames(), contains("0", "1"));
        assertArrayEquals(new double[] { 2, 4 }, wide.getComponent(1));
        assertFalse(wide.hasStaticCovariates());
        assertNull(wide.getStaticCovariates());
    }

    @Test
    public void testTimeGrid() {
        assertEquals(5, series.getLength());
        assertEquals(140, series.getEndTime());
        assertEquals(150, series.timeAt(5));
        assertEquals(2, series.indexOf(120));
        assertEquals(-1, series.indexOf(90));
        assertTrue(series.contains(140));
        assertFalse(series.contains(150));
        assertThrows(IllegalArgumentException.class, () -> series.indexOf(105));
    }

    @Test
    public void testSlicing() {
        TimeSeries middle = series.slice(1, 3);
        assertEquals(110, middle.getStartTime());
        assertArrayEquals(new double[] { 2, 3 }, middle.getComponent(0));

        TimeSeries byTime = series.sliceByTime(80, 120);
        assertEquals(100, byTime.getStartTime());
        assertEquals(3, byTime.getLength());
        assertThrows(IllegalArgumentException.class, () -> series.sliceByTime(200, 300));
        assertEquals(2, series.head(2).getLength());
    }

    @Test
    public void testAppendKeepsMetadata() {
        TimeSeries tagged = series.withStaticCovariates(new double[] { 7 }).withComponentNames(Arrays.asList("y"));
        TimeSeries longer = tagged.append(new double[][] { { 6 }, { 7 } });
        assertEquals(7, longer.getLength());
        assertEquals(160, longer.getEndTime());
        assertArrayEquals(new double[] { 7 }, longer.getStaticCovariates());
        assertThat(longer.getComponentNames(), contains("y"));
        assertEquals(5, series.getLength());
    }

    @Test
    public void testDefensiveCopies() {
        double[][] values = new double[][] { { 1 }, { 2 } };
        TimeSeries copy = new TimeSeries(values);
        values[0][0] = 100;
        assertEquals(1, copy.getValue(0, 0));
        copy.getValues()[1][0] = 100;
        copy.getRow(1)[0] = 100;
        assertEquals(2, copy.getValue(1, 0));
    }
}
