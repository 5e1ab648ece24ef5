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

/**
 * JSON shape of a correlation configuration. Absent keys stay null and the
 * builder default applies.
 */
@Data
public class CorrelationConfigState {

    @JsonProperty("variables")
    private List<String> variables;

    @JsonProperty("expected_correlation")
    private Double expectedCorrelation;

    @JsonProperty("threshold")
    private Double threshold;

    @JsonProperty("correlation_type")
    private String correlationType;

    @JsonProperty("date_column")
    private String dateColumn;

    @JsonProperty("window_days")
    private Integer windowDays;

    @JsonProperty("recent_window_days")
    private Integer recentWindowDays;

    @JsonProperty("significance_level")
    private Double significanceLevel;
}
