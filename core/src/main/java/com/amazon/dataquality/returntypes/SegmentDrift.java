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

package com.amazon.dataquality.returntypes;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A segment value whose weekly share follows a significant linear trend.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class SegmentDrift {

    private final String segmentValue;

    /**
     * change of the share (a proportion) per week
     */
    private final double slope;

    private final double pValue;

    /**
     * absolute difference between the share of the last and the first week
     */
    private final double totalChange;

    public String getDirection() {
        return slope > 0 ? "increasing" : "decreasing";
    }
}
