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

package com.amazon.dataquality.detector;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * What a detector found: the flagged row indices in ascending order, one score
 * per row, and algorithm specific diagnostics (thresholds, radius, number of
 * components).
 */
@ToString
@EqualsAndHashCode
public class DetectionOutput {

    private final int[] indices;

    private final double[] scores;

    private final Map<String, Object> diagnostics;

    public DetectionOutput(int[] indices, double[] scores, Map<String, Object> diagnostics) {
        for (int i = 0; i < indices.length; i++) {
            checkArgument(indices[i] >= 0 && indices[i] < scores.length, "index out of range");
            checkArgument(i == 0 || indices[i - 1] < indices[i], "indices must be strictly increasing");
        }
        this.indices = Arrays.copyOf(indices, indices.length);
        this.scores = Arrays.copyOf(scores, scores.length);
        this.diagnostics = diagnostics == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public int[] getIndices() {
        return Arrays.copyOf(indices, indices.length);
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public int getAnomaliesCount() {
        return indices.length;
    }

    public Map<String, Object> getDiagnostics() {
        return diagnostics;
    }
}
