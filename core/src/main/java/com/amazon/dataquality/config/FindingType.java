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

package com.amazon.dataquality.config;

import java.util.Locale;

/**
 * The closed set of finding types. Each analyzer emits only the types that
 * belong to it.
 */
public enum FindingType {

    /**
     * a variable pair whose correlation disagrees with the expected value, or is
     * implausibly strong without an expectation
     */
    CORRELATION_DEVIATION,
    /**
     * a variable pair whose correlation over the recent days differs
     * significantly from the full window
     */
    TEMPORAL_CORRELATION_SHIFT,
    /**
     * a row flagged by enough ensemble members to pass the consensus threshold
     */
    CONSENSUS_OUTLIER,
    /**
     * a segment value whose share of the total moved between windows
     */
    SEGMENT_SHARE_SHIFT,
    /**
     * a segment value whose average metric changed between windows
     */
    SEGMENT_BEHAVIOR_ANOMALY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
