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
 * Configuration of the correlation analysis.
 */
@Getter
public class CorrelationConfig extends AnalysisConfig {

    public static final double DEFAULT_THRESHOLD = 0.2;

    public static final int DEFAULT_WINDOW_DAYS = 30;

    public static final int DEFAULT_RECENT_WINDOW_DAYS = 7;

    public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05;

    private final List<String> variables;

    // null when no baseline is known
    private final Double expectedCorrelation;

    private final double threshold;

    private final CorrelationMethod correlationMethod;

    private final String dateColumn;

    private final int windowDays;

    private final int recentWindowDays;

    private final double significanceLevel;

    protected CorrelationConfig(Builder<?> builder) {
        this.variables = builder.variables == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.variables));
        this.expectedCorrelation = builder.expectedCorrelation.orElse(null);
        this.threshold = builder.threshold;
        this.correlationMethod = builder.correlationMethod;
        this.dateColumn = builder.dateColumn;
        this.windowDays = builder.windowDays;
        this.recentWindowDays = builder.recentWindowDays;
        this.significanceLevel = builder.significanceLevel;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public Optional<Double> getExpectedCorrelation() {
        return Optional.ofNullable(expectedCorrelation);
    }

    @Override
    public void validate() {
        if (variables == null) {
            throw ConfigException.missingField("variables");
        }
        checkConfig(variables.size() >= 2, "At least 2 variables required for correlation analysis");
        checkConfig(new HashSet<>(variables).size() == variables.size(), "variables must be distinct");
        checkConfig(threshold > 0, "threshold must be positive");
        checkConfig(correlationMethod != null, "missing required field: correlation_type");
        checkConfig(dateColumn != null && !dateColumn.isEmpty(), "missing required field: date_column");
        checkConfig(windowDays > 0, "window_days must be positive");
        checkConfig(recentWindowDays > 0 && recentWindowDays < windowDays,
                "recent_window_days must be positive and smaller than window_days");
        checkConfig(significanceLevel > 0 && significanceLevel < 1, "significance_level must be in (0, 1)");
        if (expectedCorrelation != null) {
            checkConfig(expectedCorrelation >= -1 && expectedCorrelation <= 1,
                    "expected_correlation must be in [-1, 1]");
        }
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        protected List<String> variables;
        protected Optional<Double> expectedCorrelation = Optional.empty();
        protected double threshold = DEFAULT_THRESHOLD;
        protected CorrelationMethod correlationMethod = CorrelationMethod.PEARSON;
        protected String dateColumn = DEFAULT_DATE_COLUMN;
        protected int windowDays = DEFAULT_WINDOW_DAYS;
        protected int recentWindowDays = DEFAULT_RECENT_WINDOW_DAYS;
        protected double significanceLevel = DEFAULT_SIGNIFICANCE_LEVEL;

        public CorrelationConfig build() {
            return new CorrelationConfig(this);
        }

        public T variables(List<String> variables) {
            this.variables = variables;
            return (T) this;
        }

        public T variables(String... variables) {
            this.variables = List.of(variables);
            return (T) this;
        }

        public T expectedCorrelation(double expectedCorrelation) {
            this.expectedCorrelation = Optional.of(expectedCorrelation);
            return (T) this;
        }

        public T threshold(double threshold) {
            this.threshold = threshold;
            return (T) this;
        }

        public T correlationMethod(CorrelationMethod correlationMethod) {
            this.correlationMethod = correlationMethod;
            return (T) this;
        }

        public T dateColumn(String dateColumn) {
            this.dateColumn = dateColumn;
            return (T) this;
        }

        public T windowDays(int windowDays) {
            this.windowDays = windowDays;
            return (T) this;
        }

        public T recentWindowDays(int recentWindowDays) {
            this.recentWindowDays = recentWindowDays;
            return (T) this;
        }

        public T significanceLevel(double significanceLevel) {
            this.significanceLevel = significanceLevel;
            return (T) this;
        }
    }
}
