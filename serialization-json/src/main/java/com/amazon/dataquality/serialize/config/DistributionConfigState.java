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


package com.amazon.dataquality.serialize.config;

import java.util.List;

import lombok.Data;

import com.fasterxml.jackson.annotation.JsonProperty;

@Data
public class DistributionConfigState {

    @JsonProperty("segments")
    private List<String> segments;

    @JsonProperty("metrics")
    private List<String> metrics;

    @JsonProperty("reference_period")
    private Integer referencePeriod;

    @JsonProperty("comparison_period")
    private Integer comparisonPeriod;

    @JsonProperty("date_column")
    private String dateColumn;

    @JsonProperty("share_shift_threshold")
    private Double shareShiftThreshold;

    @JsonProperty("share_shift_high_threshold")
    private Double shareShiftHighThreshold;

    @JsonProperty("behavior_change_threshold")
    private Double behaviorChangeThreshold;

    @JsonProperty("behavior_change_critical_threshold")
    private Double behaviorChangeCriticalThreshold;
}
