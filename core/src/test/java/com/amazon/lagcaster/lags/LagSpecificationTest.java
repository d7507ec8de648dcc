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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class LagSpecificationTest {

    @Test
    public void testWidths() {
        LagSpecification lags = LagSpecification.builder().targetLags(3).pastCovariateLags(2)
                .futureCovariateLags(1, 2).build();
        assertArrayEquals(new int[] { -3, -2, -1 }, lags.getTargetLags());
        assertArrayEquals(new int[] { -2, -1 }, lags.getPastCovariateLags());
        assertArrayEquals(new int[] { -1, 0, 1 }, lags.getFutureCovariateLags());
        assertEquals(-3, lags.getMinTargetLag());
        assertEquals(3, lags.getTargetLookback());
        assertEquals(1, lags.getMaxFutureCovariateLag());
        // 3 target lags x 2 components, 2 past lags x 1, 3 future lags x 2, 4 statics
        assertEquals(6 + 2 + 6 + 4, lags.getNumberOfFeatures(2, 1, 2, 4));
    }

    @Test
    public void testExplicitLagsAreSorted() {
        LagSpecification lags = LagSpecification.builder().explicitTargetLags(-1, -24, -7).build();
        assertArrayEquals(new int[] { -24, -7, -1 }, lags.getTargetLags());
        assertEquals(24, lags.getTargetLookback());
        assertTrue(lags.hasTargetLags());
        assertFalse(lags.hasPastCovariateLags());
        assertFalse(lags.hasFutureCovariateLags());
    }

    @Test
    public void testInvalidLags() {
        assertThrows(IllegalArgumentException.class, () -> LagSpecification.builder().build());
        assertThrows(IllegalArgumentException.class, () -> LagSpecification.builder().targetLags(0));
        assertThrows(IllegalArgumentException.class,
                () -> LagSpecification.builder().explicitTargetLags(-2, 0).build());
        assertThrows(IllegalArgumentException.class,
                () -> LagSpecification.builder().explicitPastCovariateLags(1).build());
        assertThrows(IllegalArgumentException.class,
                () -> LagSpecification.builder().explicitTargetLags(-2, -2).build());
    }

    @Test
    public void testFutureLagsBoundedByOutputChunk() {
        LagSpecification lags = LagSpecification.builder().futureCovariateLags(0, 3).build();
        assertDoesNotThrow(() -> lags.validateFor(3));
        assertThrows(IllegalArgumentException.class, () -> lags.validateFor(2));
    }
}
