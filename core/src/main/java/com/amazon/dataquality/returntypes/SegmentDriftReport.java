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
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Drifting values per segment column. A report built from too few weeks is
 * flagged as insufficient and lists nothing.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SegmentDriftReport {

    private final Map<String, List<SegmentDrift>> driftingValues;

    private final boolean insufficientData;

    private SegmentDriftReport(Map<String, List<SegmentDrift>> driftingValues, boolean insufficientData) {
        this.driftingValues = Collections.unmodifiableMap(new LinkedHashMap<>(driftingValues));
        this.insufficientData = insufficientData;
    }

    public static SegmentDriftReport of(Map<String, List<SegmentDrift>> driftingValues) {
        return new SegmentDriftReport(driftingValues, false);
    }

    public static SegmentDriftReport insufficient() {
        return new SegmentDriftReport(Collections.emptyMap(), true);
    }

    public boolean isDriftDetected(String segment) {
        List<SegmentDrift> values = driftingValues.get(segment);
        return values != null && !values.isEmpty();
    }

    public boolean isDriftDetected() {
        return driftingValues.values().stream().anyMatch(values -> !values.isEmpty());
    }
}
