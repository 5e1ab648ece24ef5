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
import static com.amazon.dataquality.CommonUtils.checkRequired;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import lombok.Getter;

import com.amazon.dataquality.exception.ConfigException;

/**
 * Configuration of the multivariate ensemble analysis. The random seed has no
 * default: consensus results depend on it, so it must be chosen explicitly.
 */
@Getter
public class MultivariateConfig extends AnalysisConfig {

    public static final double DEFAULT_CONTAMINATION = 0.1;

    public static final double MAX_CONTAMINATION = 0.5;

    public static final int DEFAULT_WINDOW_DAYS = 30;

    public static final int DEFAULT_MIN_SAMPLES = 100;

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    public static final double DEFAULT_VARIANCE_RETAINED = 0.9;

    public static final double DEFAULT_CLIP_FACTOR = 100.0;

    public static final List<DetectorType> DEFAULT_ALGORITHMS = List.of(DetectorType.ISOLATION_FOREST,
            DetectorType.LOCAL_OUTLIER_FACTOR);

    private final List<String> features;

    private final List<DetectorType> algorithms;

    private final double contamination;

    private final String dateColumn;

    private final int windowDays;

    private final int minSamples;

    private final Long randomSeed;

    private final int numberOfTrees;

    private final int sampleSize;

    private final double varianceRetained;

    private final double clipFactor;

    protected MultivariateConfig(Builder<?> builder) {
        this.features = builder.features == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.features));
        this.algorithms = builder.algorithms == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.algorithms));
        this.contamination = builder.contamination;
        this.dateColumn = builder.dateColumn;
        this.windowDays = builder.windowDays;
        this.minSamples = builder.minSamples;
        this.randomSeed = builder.randomSeed.orElse(null);
        this.numberOfTrees = builder.numberOfTrees;
        this.sampleSize = builder.sampleSize;
        this.varianceRetained = builder.varianceRetained;
        this.clipFactor = builder.clipFactor;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return the configured seed
     * @throws ConfigException if no seed was configured
     */
    public long getRandomSeed() {
        return checkRequired(randomSeed, "random_seed");
    }

    @Override
    public void validate() {
        if (features == null) {
            throw ConfigException.missingField("features");
        }
        checkConfig(features.size() >= 2, "At least 2 features required for multivariate analysis");
        checkConfig(new HashSet<>(features).size() == features.size(), "features must be distinct");
        if (algorithms == null) {
            throw ConfigException.missingField("algorithms");
        }
        checkConfig(!algorithms.isEmpty(), "at least one algorithm is required");
        checkConfig(!algorithms.contains(null), "algorithms must not contain null");
        checkConfig(new HashSet<>(algorithms).size() == algorithms.size(), "algorithms must be distinct");
        checkConfig(contamination > 0 && contamination <= MAX_CONTAMINATION, "contamination must be in (0, 0.5]");
        checkConfig(dateColumn != null && !dateColumn.isEmpty(), "missing required field: date_column");
        checkConfig(windowDays > 0, "window_days must be positive");
        checkConfig(minSamples > 0, "min_samples must be positive");
        checkRequired(randomSeed, "random_seed");
        checkConfig(numberOfTrees > 0, "number_of_trees must be positive");
        checkConfig(sampleSize > 1, "sample_size must be at least 2");
        checkConfig(varianceRetained > 0 && varianceRetained <= 1, "variance_retained must be in (0, 1]");
        checkConfig(clipFactor > 0, "clip_factor must be positive");
    }

    public Builder<?> toBuilder() {
        Builder<?> builder = new Builder<>().features(features).algorithms(algorithms).contamination(contamination)
                .dateColumn(dateColumn).windowDays(windowDays).minSamples(minSamples).numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).varianceRetained(varianceRetained).clipFactor(clipFactor);
        if (randomSeed != null) {
            builder.randomSeed(randomSeed);
        }
        return builder;
    }

    public static class Builder<T extends Builder<T>> {

        protected List<String> features;
        protected List<DetectorType> algorithms = DEFAULT_ALGORITHMS;
        protected double contamination = DEFAULT_CONTAMINATION;
        protected String dateColumn = DEFAULT_DATE_COLUMN;
        protected int windowDays = DEFAULT_WINDOW_DAYS;
        protected int minSamples = DEFAULT_MIN_SAMPLES;
        protected Optional<Long> randomSeed = Optional.empty();
        protected int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        protected int sampleSize = DEFAULT_SAMPLE_SIZE;
        protected double varianceRetained = DEFAULT_VARIANCE_RETAINED;
        protected double clipFactor = DEFAULT_CLIP_FACTOR;

        public MultivariateConfig build() {
            return new MultivariateConfig(this);
        }

        public T features(List<String> features) {
            this.features = features;
            return (T) this;
        }

        public T features(String... features) {
            this.features = List.of(features);
            return (T) this;
        }

        public T algorithms(List<DetectorType> algorithms) {
            this.algorithms = algorithms;
            return (T) this;
        }

        public T algorithms(DetectorType... algorithms) {
            this.algorithms = List.of(algorithms);
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
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

        public T minSamples(int minSamples) {
            this.minSamples = minSamples;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T varianceRetained(double varianceRetained) {
            this.varianceRetained = varianceRetained;
            return (T) this;
        }

        public T clipFactor(double clipFactor) {
            this.clipFactor = clipFactor;
            return (T) this;
        }
    }
}
