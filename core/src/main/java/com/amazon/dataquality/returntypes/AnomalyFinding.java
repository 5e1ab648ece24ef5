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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;

/**
 * A single anomaly reported by an analyzer. The {@code subject} names what is
 * anomalous (a variable pair, a row, a segment value) and the
 * {@code statistic} is the number the verdict was based on.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AnomalyFinding {

    private final FindingType type;

    private final String subject;

    private final double statistic;

    private final Double pValue;

    private final Severity severity;

    private final Double confidence;

    private final String description;

    private final Map<String, Object> evidence;

    @Builder
    public AnomalyFinding(FindingType type, String subject, double statistic, Double pValue, Severity severity,
            Double confidence, String description, Map<String, Object> evidence) {
        this.type = checkNotNull(type, "type must not be null");
        this.subject = checkNotNull(subject, "subject must not be null");
        this.severity = checkNotNull(severity, "severity must not be null");
        checkArgument(confidence == null || (confidence > 0 && confidence <= 1), "confidence must be in (0, 1]");
        this.statistic = statistic;
        this.pValue = pValue;
        this.confidence = confidence;
        this.description = description == null ? "" : description;
        this.evidence = evidence == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public Optional<Double> getPValue() {
        return Optional.ofNullable(pValue);
    }

    public Optional<Double> getConfidence() {
        return Optional.ofNullable(confidence);
    }
}
