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

import static com.amazon.dataquality.CommonUtils.checkConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.dataquality.exception.ConfigException;

/**
 * Configuration of the segment distribution analysis. Thresholds are expressed
 * in percentage points for shares and in percent for average changes.
 */
@Getter
public class DistributionConfig extends AnalysisConfig {

    public static final String COUNT_METRIC = "count";

    public static final int DEFAULT_REFERENCE_PERIOD = 30;

    public static final int DEFAULT_COMPARISON_PERIOD = 7;

    public static final double DEFAULT_SHARE_SHIFT_THRESHOLD = 10.0;

    public static final double DEFAULT_SHARE_SHIFT_HIGH_THRESHOLD = 20.0;

    public static final double DEFAULT_BEHAVIOR_CHANGE_THRESHOLD = 25.0;

    public static final double DEFAULT_BEHAVIOR_CHANGE_CRITICAL_THRESHOLD = 50.0;

    private final List<String> segments;

    private final List<String> metrics;

    private final int referencePeriod;

    private final int comparisonPeriod;

    // without a date column the analysis is skipped
    private final String dateColumn;

    private final double shareShiftThreshold;

    private final double shareShiftHighThreshold;

    private final double behaviorChangeThreshold;

    private final double behaviorChangeCriticalThreshold;

    protected DistributionConfig(Builder<?> builder) {
        this.segments = builder.segments == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.segments));
        this.metrics = builder.metrics == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.metrics));
        this.referencePeriod = builder.referencePeriod;
        this.comparisonPeriod = builder.comparisonPeriod;
        this.dateColumn = builder.dateColumn.orElse(null);
        this.shareShiftThreshold = builder.shareShiftThreshold;
        this.shareShiftHighThreshold = builder.shareShiftHighThreshold;
        this.behaviorChangeThreshold = builder.behaviorChangeThreshold;
        this.behaviorChangeCriticalThreshold = builder.behaviorChangeCriticalThreshold;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public boolean isDateColumnConfigured() {
        return dateColumn != null && !dateColumn.isEmpty();
    }

    @Override
    public void validate() {
        if (segments == null) {
            throw ConfigException.missingField("segments");
        }
        checkConfig(!segments.isEmpty(), "At least one segment required for distribution analysis");
        checkConfig(new HashSet<>(segments).size() == segments.size(), "segments must be distinct");
        if (metrics == null) {
            throw ConfigException.missingField("metrics");
        }
        checkConfig(!metrics.isEmpty(), "at least one metric is required");
        checkConfig(new HashSet<>(metrics).size() == metrics.size(), "metrics must be distinct");
        checkConfig(referencePeriod > 0, "reference_period must be positive");
        checkConfig(comparisonPeriod > 0, "comparison_period must be positive");
        checkConfig(shareShiftThreshold > 0 && shareShiftHighThreshold >= shareShiftThreshold,
                "share shift thresholds must be positive and ordered");
        checkConfig(behaviorChangeThreshold > 0 && behaviorChangeCriticalThreshold >= behaviorChangeThreshold,
                "behavior change thresholds must be positive and ordered");
    }

    public static class Builder<T extends Builder<T>> {

        protected List<String> segments;
        protected List<String> metrics = List.of(COUNT_METRIC);
        protected int referencePeriod = DEFAULT_REFERENCE_PERIOD;
        protected int comparisonPeriod = DEFAULT_COMPARISON_PERIOD;
        protected Optional<String> dateColumn = Optional.empty();
        protected double shareShiftThreshold = DEFAULT_SHARE_SHIFT_THRESHOLD;
        protected double shareShiftHighThreshold = DEFAULT_SHARE_SHIFT_HIGH_THRESHOLD;
        protected double behaviorChangeThreshold = DEFAULT_BEHAVIOR_CHANGE_THRESHOLD;
        protected double behaviorChangeCriticalThreshold = DEFAULT_BEHAVIOR_CHANGE_CRITICAL_THRESHOLD;

        public DistributionConfig build() {
            return new DistributionConfig(this);
        }

        public T segments(List<String> segments) {
            this.segments = segments;
            return (T) this;
        }

        public T segments(String... segments) {
            this.segments = List.of(segments);
            return (T) this;
        }

        public T metrics(List<String> metrics) {
            this.metrics = metrics;
            return (T) this;
        }

        public T metrics(String... metrics) {
            this.metrics = List.of(metrics);
            return (T) this;
        }

        public T referencePeriod(int referencePeriod) {
            this.referencePeriod = referencePeriod;
            return (T) this;
        }

        public T comparisonPeriod(int comparisonPeriod) {
            this.comparisonPeriod = comparisonPeriod;
            return (T) this;
        }

        public T dateColumn(String dateColumn) {
            this.dateColumn = Optional.ofNullable(dateColumn);
            return (T) this;
        }

        public T shareShiftThreshold(double shareShiftThreshold) {
            this.shareShiftThreshold = shareShiftThreshold;
            return (T) this;
        }

        public T shareShiftHighThreshold(double shareShiftHighThreshold) {
            this.shareShiftHighThreshold = shareShiftHighThreshold;
            return (T) this;
        }

        public T behaviorChangeThreshold(double behaviorChangeThreshold) {
            this.behaviorChangeThreshold = behaviorChangeThreshold;
            return (T) this;
        }

        public T behaviorChangeCriticalThreshold(double behaviorChangeCriticalThreshold) {
            this.behaviorChangeCriticalThreshold = behaviorChangeCriticalThreshold;
            return (T) this;
        }
    }
}
