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

package com.amazon.dataquality.state;

import static com.amazon.dataquality.state.Version.V1_0;

import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * A plain representation of an
 * {@link com.amazon.dataquality.returntypes.AnalysisResult} for serialization.
 */
@Data
public class AnalysisResultState {

    private String version = V1_0;

    private boolean passed;

    private int anomaliesCount;

    private String message;

    private Map<String, Object> details;

    private List<AnomalyFindingState> findings;
}
