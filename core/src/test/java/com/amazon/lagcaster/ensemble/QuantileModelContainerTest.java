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

package com.amazon.lagcaster.ensemble;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.lagcaster.config.Likelihood;
import com.amazon.lagcaster.regressor.HorizonRegressor;

public class QuantileModelContainerTest {

    private QuantileModelContainer container;

    private HorizonRegressor low;
    private HorizonRegressor middle;
    private HorizonRegressor high;

    @BeforeEach
    public void setUp() {
        container = new QuantileModelContainer(Likelihood.quantile(0.1, 0.5, 0.9));
        low = mock(HorizonRegressor.class);
        middle = mock(HorizonRegressor.class);
        high = mock(HorizonRegressor.class);
    }

    @Test
    public void testOneModelPerLevel() {
        // insertion order does not matter
        container.set(0.9, high);
        assertFalse(container.isComplete());
        container.set(0.1, low);
        container.set(0.5, middle);
        assertTrue(container.isComplete());
        assertEquals(3, container.size());
        assertThat(container.getKeys(), contains(0.1, 0.5, 0.9));
        assertSame(middle, container.getMedian());
        assertSame(low, container.get(0.1));
        assertEquals(0.5, container.getMedianLevel());

        assertThrows(IllegalArgumentException.class, () -> container.set(0.3, low));
        assertThrows(IllegalArgumentException.class,
                () -> new QuantileModelContainer(Likelihood.poisson()));
    }

    @Test
    public void testClear() {
        container.set(0.1, low);
        container.set(0.5, middle);
        container.set(0.9, high);
        container.clear();
        assertEquals(0, container.size());
        assertThat(container.getKeys(), empty());
        assertThrows(IllegalStateException.class, () -> container.getMedian());
        assertThrows(IllegalStateException.class, () -> container.predictParameters(new double[][] { { 1 } }));
    }

    @Test
    public void testParametersInLevelOrder() {
        double[][] features = { { 0 }, { 1 } };
        when(low.predict(features)).thenReturn(new double[][][][] { { { { 1 } } }, { { { 10 } } } });
        when(middle.predict(features)).thenReturn(new double[][][][] { { { { 2 } } }, { { { 20 } } } });
        when(high.predict(features)).thenReturn(new double[][][][] { { { { 3 } } }, { { { 30 } } } });
        container.set(0.5, middle);
        container.set(0.9, high);
        container.set(0.1, low);

        double[][][][] parameters = container.predictParameters(features);
        assertArrayEquals(new double[] { 1, 2, 3 }, parameters[0][0][0]);
        assertArrayEquals(new double[] { 10, 20, 30 }, parameters[1][0][0]);
        assertArrayEquals(new double[] { 20 }, container.predictMedian(features)[1][0][0]);
        assertArrayEquals(new double[] { 30 }, container.predict(0.9, features)[1][0][0]);
        assertEquals(0, container.predictParameters(new double[0][]).length);
    }

    @Test
    public void testSingleModelContainer() {
        SingleModelContainer single = new SingleModelContainer();
        assertFalse(single.isComplete());
        assertThrows(IllegalStateException.class, () -> single.get(0));
        single.set(0, middle);
        assertSame(middle, single.get(0.25));
        assertSame(middle, single.getMedian());
        assertThat(single.getKeys(), contains(0.0));
        single.set(0, high);
        assertEquals(1, single.size());
        assertSame(high, single.get(0));
        single.clear();
        assertFalse(single.isComplete());
    }
}
