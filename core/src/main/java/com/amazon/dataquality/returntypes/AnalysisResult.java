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

import static com.amazon.dataquality.CommonUtils.checkArgument;
import static com.amazon.dataquality.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of one analyzer call. A result passes exactly when it reports no
 * anomaly; when findings are enumerated their number is the anomaly count.
 * Errors are reported as failed results with a count of one and no findings,
 * so that a caller can render a status for every analysis of a batch.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AnalysisResult {

    public static final String ERROR = "error";

    public static final String ERROR_TYPE = "errorType";

    public static final String INSUFFICIENT_DATA = "insufficientData";

    public static final String SKIPPED = "skipped";

    private final boolean passed;

    private final int anomaliesCount;

    private final String message;

    private final Map<String, Object> details;

    private final List<AnomalyFinding> findings;

    public AnalysisResult(boolean passed, int anomaliesCount, String message, Map<String, Object> details,
            List<AnomalyFinding> findings) {
        checkArgument(anomaliesCount >= 0, "anomaliesCount must be non-negative");
        checkArgument(passed == (anomaliesCount == 0), "a result passes exactly when there are no anomalies");
        checkNotNull(findings, "findings must not be null");
        checkArgument(findings.isEmpty() || findings.size() == anomaliesCount,
                "anomaliesCount must match the enumerated findings");
        this.passed = passed;
        this.anomaliesCount = anomaliesCount;
        this.message = checkNotNull(message, "message must not be null");
        this.details = details == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.findings = Collections.unmodifiableList(new ArrayList<>(findings));
    }

    /**
     * A result whose verdict is given by the findings.
     */
    public static AnalysisResult of(List<AnomalyFinding> findings, String message, Map<String, Object> details) {
        return new AnalysisResult(findings.isEmpty(), findings.size(), message, details, findings);
    }

    /**
     * A passing result that carries no verdict because the data was too thin.
     */
    public static AnalysisResult insufficientData(String message, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (details != null) {
            merged.putAll(details);
        }
        merged.put(INSUFFICIENT_DATA, true);
        return new AnalysisResult(true, 0, message, merged, Collections.emptyList());
    }

    /**
     * A passing result for an analysis that was deliberately not evaluated.
     */
    public static AnalysisResult skipped(String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(SKIPPED, true);
        return new AnalysisResult(true, 0, message, details, Collections.emptyList());
    }

    /**
     * A failed result capturing an error.
     */
    public static AnalysisResult failure(String message, Throwable error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(ERROR, String.valueOf(error.getMessage()));
        details.put(ERROR_TYPE, error.getClass().getSimpleName());
        return new AnalysisResult(false, 1, message, details, Collections.emptyList());
    }

    public boolean isSkipped() {
        return Boolean.TRUE.equals(details.get(SKIPPED));
    }

    public boolean isInsufficientData() {
        return Boolean.TRUE.equals(details.get(INSUFFICIENT_DATA));
    }

    public boolean isError() {
        return details.containsKey(ERROR);
    }
}
