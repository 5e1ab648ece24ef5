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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Record counts of one segment column over a window.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SegmentSummary {

    private final String segment;

    private final int uniqueValues;

    /**
     * the most frequent values with their record counts, most frequent first
     */
    private final Map<String, Long> topValues;

    private final long totalRecords;

    public SegmentSummary(String segment, int uniqueValues, Map<String, Long> topValues, long totalRecords) {
        this.segment = segment;
        this.uniqueValues = uniqueValues;
        this.topValues = Collections.unmodifiableMap(new LinkedHashMap<>(topValues));
        this.totalRecords = totalRecords;
    }
}
