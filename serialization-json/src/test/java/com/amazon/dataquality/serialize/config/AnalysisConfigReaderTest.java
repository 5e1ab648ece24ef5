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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.dataquality.config.AnalysisConfig;
import com.amazon.dataquality.config.CorrelationConfig;
import com.amazon.dataquality.config.CorrelationMethod;
import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.DistributionConfig;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.exception.ConfigException;

public class AnalysisConfigReaderTest {

    private AnalysisConfigReader reader;

    @BeforeEach
    public void setUp() {
        reader = new AnalysisConfigReader();
    }

    @Test
    public void testReadCorrelationConfig() {
        CorrelationConfig config = reader.readCorrelationConfig("{\"variables\": [\"price\", \"quantity\"],"
                + " \"expected_correlation\": 0.8, \"threshold\": 0.1, \"correlation_type\": \"spearman\","
                + " \"date_column\": \"order_date\", \"window_days\": 60, \"recent_window_days\": 14}");

        assertThat(config.getVariables(), contains("price", "quantity"));
        assertEquals(0.8, config.getExpectedCorrelation().get());
        assertEquals(0.1, config.getThreshold());
        assertEquals(CorrelationMethod.SPEARMAN, config.getCorrelationMethod());
        assertEquals("order_date", config.getDateColumn());
        assertEquals(60, config.getWindowDays());
        assertEquals(14, config.getRecentWindowDays());
        assertEquals(CorrelationConfig.DEFAULT_SIGNIFICANCE_LEVEL, config.getSignificanceLevel());
    }

    @Test
    public void testCorrelationDefaults() {
        CorrelationConfig config = reader.readCorrelationConfig("{\"variables\": [\"a\", \"b\", \"c\"]}");

        assertFalse(config.getExpectedCorrelation().isPresent());
        assertEquals(CorrelationConfig.DEFAULT_THRESHOLD, config.getThreshold());
        assertEquals(CorrelationMethod.PEARSON, config.getCorrelationMethod());
        assertEquals(AnalysisConfig.DEFAULT_DATE_COLUMN, config.getDateColumn());
        assertEquals(CorrelationConfig.DEFAULT_WINDOW_DAYS, config.getWindowDays());
    }

    @Test
    public void testUnknownCorrelationTypeFallsBackToCovariance() {
        CorrelationConfig config = reader
                .readCorrelationConfig("{\"variables\": [\"a\", \"b\"], \"correlation_type\": \"kendall\"}");
        assertEquals(CorrelationMethod.COVARIANCE, config.getCorrelationMethod());
    }

    @Test
    public void testReadMultivariateConfig() {
        MultivariateConfig config = reader.readMultivariateConfig("{\"features\": [\"amount\", \"latency\"],"
                + " \"algorithms\": [\"iforest\", \"LOF\", \"pca_reconstruction\"], \"contamination\": 0.05,"
                + " \"min_samples\": 50, \"random_seed\": 42, \"number_of_trees\": 50}");

        assertThat(config.getFeatures(), contains("amount", "latency"));
        assertThat(config.getAlgorithms(), contains(DetectorType.ISOLATION_FOREST, DetectorType.LOCAL_OUTLIER_FACTOR,
                DetectorType.PCA_RECONSTRUCTION));
        assertEquals(0.05, config.getContamination());
        assertEquals(50, config.getMinSamples());
        assertEquals(42L, config.getRandomSeed());
        assertEquals(50, config.getNumberOfTrees());
        assertEquals(MultivariateConfig.DEFAULT_SAMPLE_SIZE, config.getSampleSize());
    }

    @Test
    public void testMultivariateDefaults() {
        MultivariateConfig config = reader
                .readMultivariateConfig("{\"features\": [\"amount\", \"latency\"], \"random_seed\": 7}");
        assertEquals(MultivariateConfig.DEFAULT_ALGORITHMS, config.getAlgorithms());
        assertEquals(MultivariateConfig.DEFAULT_CONTAMINATION, config.getContamination());
        assertEquals(MultivariateConfig.DEFAULT_MIN_SAMPLES, config.getMinSamples());
    }

    @Test
    public void testUnknownAlgorithm() {
        ConfigException e = assertThrows(ConfigException.class, () -> reader.readMultivariateConfig(
                "{\"features\": [\"a\", \"b\"], \"algorithms\": [\"svm\"], \"random_seed\": 7}"));
        assertEquals("unknown algorithm: svm", e.getMessage());
    }

    @Test
    public void testReadDistributionConfig() {
        DistributionConfig config = reader.readDistributionConfig("{\"segments\": [\"region\"],"
                + " \"metrics\": [\"count\", \"amount\"], \"reference_period\": 28, \"comparison_period\": 7,"
                + " \"date_column\": \"created_at\", \"share_shift_threshold\": 5.0}");

        assertThat(config.getSegments(), contains("region"));
        assertThat(config.getMetrics(), contains("count", "amount"));
        assertEquals(28, config.getReferencePeriod());
        assertEquals(7, config.getComparisonPeriod());
        assertEquals("created_at", config.getDateColumn());
        assertEquals(5.0, config.getShareShiftThreshold());
        assertEquals(DistributionConfig.DEFAULT_SHARE_SHIFT_HIGH_THRESHOLD, config.getShareShiftHighThreshold());
    }

    @Test
    public void testDistributionWithoutDateColumn() {
        DistributionConfig config = reader.readDistributionConfig("{\"segments\": [\"region\"]}");
        assertNull(config.getDateColumn());
        assertFalse(config.isDateColumnConfigured());
        assertThat(config.getMetrics(), contains(DistributionConfig.COUNT_METRIC));
    }

    @ParameterizedTest
    @CsvSource({ "correlation, variables", "multivariate, features", "distribution, segments" })
    public void testMissingRequiredField(String analysis, String field) {
        ConfigException e = assertThrows(ConfigException.class, () -> read(analysis, "{}"));
        assertEquals("missing required field: " + field, e.getMessage());
    }

    @Test
    public void testMissingRandomSeed() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> reader.readMultivariateConfig("{\"features\": [\"amount\", \"latency\"]}"));
        assertEquals("missing required field: random_seed", e.getMessage());
    }

    @Test
    public void testUnknownField() {
        ConfigException e = assertThrows(ConfigException.class, () -> reader
                .readCorrelationConfig("{\"variables\": [\"a\", \"b\"], \"expected_corelation\": 0.5}"));
        assertEquals("unknown field: expected_corelation", e.getMessage());
    }

    @Test
    public void testCamelCaseKeysAreUnknown() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> reader.readDistributionConfig("{\"segments\": [\"region\"], \"referencePeriod\": 10}"));
        assertEquals("unknown field: referencePeriod", e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "null", "[1, 2]", "{\"variables\": ",
            "{\"variables\": [\"a\", \"b\"], \"window_days\": \"many\"}" })
    public void testMalformedDocument(String json) {
        assertThrows(ConfigException.class, () -> reader.readCorrelationConfig(json));
    }

    @Test
    public void testValuesAreValidated() {
        ConfigException e = assertThrows(ConfigException.class, () -> reader
                .readMultivariateConfig("{\"features\": [\"a\", \"b\"], \"contamination\": 0.7, \"random_seed\": 1}"));
        assertEquals("contamination must be in (0, 0.5]", e.getMessage());

        e = assertThrows(ConfigException.class,
                () -> reader.readCorrelationConfig("{\"variables\": [\"a\"], \"threshold\": 0.1}"));
        assertThat(e.getMessage(), startsWith("At least 2 variables"));
    }

    private AnalysisConfig read(String analysis, String json) {
        switch (analysis) {
        case "correlation":
            return reader.readCorrelationConfig(json);
        case "multivariate":
            return reader.readMultivariateConfig(json);
        default:
            return reader.readDistributionConfig(json);
        }
    }
}
