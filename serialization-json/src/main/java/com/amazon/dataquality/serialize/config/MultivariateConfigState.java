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
public class MultivariateConfigState {

    @JsonProperty("features")
    private List<String> features;

    @JsonProperty("algorithms")
    private List<String> algorithms;

    @JsonProperty("contamination")
    private Double contamination;

    @JsonProperty("date_column")
    private String dateColumn;

    @JsonProperty("window_days")
    private Integer windowDays;

    @JsonProperty("min_samples")
    private Integer minSamples;

    @JsonProperty("random_seed")
    private Long randomSeed;

    @JsonProperty("number_of_trees")
    private Integer numberOfTrees;

    @JsonProperty("sample_size")
    private Integer sampleSize;

    @JsonProperty("variance_retained")
    private Double varianceRetained;

    @JsonProperty("clip_factor")
    private Double clipFactor;
}
