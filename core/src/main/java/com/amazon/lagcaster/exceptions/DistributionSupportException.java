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

package com.amazon.lagcaster.exceptions;

import lombok.Getter;

/**
 * Thrown by a scorer that is configured to reject observations lying outside
 * the support of the fitted distribution. By default such observations are
 * scored as positive infinity instead.
 */
@Getter
public class DistributionSupportException extends ArithmeticException {

    private static final long serialVersionUID = 1L;

    private final int timeIndex;
    private final int component;
    private final double value;

    public DistributionSupportException(int timeIndex, int component, double value) {
        super("value " + value + " at position " + timeIndex + " of component " + component
                + " is outside the support of the fitted distribution");
        this.timeIndex = timeIndex;
        this.component = component;
        this.value = value;
    }
}
