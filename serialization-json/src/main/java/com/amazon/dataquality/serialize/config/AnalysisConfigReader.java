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

import static com.amazon.dataquality.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.dataquality.config.AnalysisConfig;
import com.amazon.dataquality.config.CorrelationConfig;
import com.amazon.dataquality.config.CorrelationMethod;
import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.DistributionConfig;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.exception.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;

/**
 * Reads analyzer configurations from JSON documents with snake_case keys, for
 * example
 *
 * <pre>
 * {"variables": ["price", "quantity"], "expected_correlation": 0.8, "correlation_type": "spearman"}
 * </pre>
 *
 * Keys that are absent keep the builder defaults. Every configuration is
 * validated before it is returned, so unknown keys, missing required keys and
 * out of range values all surface here as {@link ConfigException}.
 */
public class AnalysisConfigReader {

    private final ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public CorrelationConfig readCorrelationConfig(String json) {
        CorrelationConfigState state = read(json, CorrelationConfigState.class);
        CorrelationConfig.Builder<?> builder = CorrelationConfig.builder().variables(state.getVariables());
        if (state.getExpectedCorrelation() != null) {
            builder.expectedCorrelation(state.getExpectedCorrelation());
        }
        if (state.getThreshold() != null) {
            builder.threshold(state.getThreshold());
        }
        if (state.getCorrelationType() != null) {
            builder.correlationMethod(CorrelationMethod.fromName(state.getCorrelationType()));
        }
        if (state.getDateColumn() != null) {
            builder.dateColumn(state.getDateColumn());
        }
        if (state.getWindowDays() != null) {
            builder.windowDays(state.getWindowDays());
        }
        if (state.getRecentWindowDays() != null) {
            builder.recentWindowDays(state.getRecentWindowDays());
        }
        if (state.getSignificanceLevel() != null) {
            builder.significanceLevel(state.getSignificanceLevel());
        }
        return validated(builder.build());
    }

    public MultivariateConfig readMultivariateConfig(String json) {
        MultivariateConfigState state = read(json, MultivariateConfigState.class);
        MultivariateConfig.Builder<?> builder = MultivariateConfig.builder().features(state.getFeatures());
        if (state.getAlgorithms() != null) {
            List<DetectorType> algorithms = new ArrayList<>(state.getAlgorithms().size());
            for (String name : state.getAlgorithms()) {
                algorithms.add(DetectorType.fromName(name));
            }
            builder.algorithms(algorithms);
        }
        if (state.getContamination() != null) {
            builder.contamination(state.getContamination());
        }
        if (state.getDateColumn() != null) {
            builder.dateColumn(state.getDateColumn());
        }
        if (state.getWindowDays() != null) {
            builder.windowDays(state.getWindowDays());
        }
        if (state.getMinSamples() != null) {
            builder.minSamples(state.getMinSamples());
        }
        if (state.getRandomSeed() != null) {
            builder.randomSeed(state.getRandomSeed());
        }
        if (state.getNumberOfTrees() != null) {
            builder.numberOfTrees(state.getNumberOfTrees());
        }
        if (state.getSampleSize() != null) {
            builder.sampleSize(state.getSampleSize());
        }
        if (state.getVarianceRetained() != null) {
            builder.varianceRetained(state.getVarianceRetained());
        }
        if (state.getClipFactor() != null) {
            builder.clipFactor(state.getClipFactor());
        }
        return validated(builder.build());
    }

    public DistributionConfig readDistributionConfig(String json) {
        DistributionConfigState state = read(json, DistributionConfigState.class);
        DistributionConfig.Builder<?> builder = DistributionConfig.builder().segments(state.getSegments())
                .dateColumn(state.getDateColumn());
        if (state.getMetrics() != null) {
            builder.metrics(state.getMetrics());
        }
        if (state.getReferencePeriod() != null) {
            builder.referencePeriod(state.getReferencePeriod());
        }
        if (state.getComparisonPeriod() != null) {
            builder.comparisonPeriod(state.getComparisonPeriod());
        }
        if (state.getShareShiftThreshold() != null) {
            builder.shareShiftThreshold(state.getShareShiftThreshold());
        }
        if (state.getShareShiftHighThreshold() != null) {
            builder.shareShiftHighThreshold(state.getShareShiftHighThreshold());
        }
        if (state.getBehaviorChangeThreshold() != null) {
            builder.behaviorChangeThreshold(state.getBehaviorChangeThreshold());
        }
        if (state.getBehaviorChangeCriticalThreshold() != null) {
            builder.behaviorChangeCriticalThreshold(state.getBehaviorChangeCriticalThreshold());
        }
        return validated(builder.build());
    }

    <S> S read(String json, Class<S> stateClass) {
        checkNotNull(json, "json must not be null");
        S state;
        try {
            state = mapper.readValue(json, stateClass);
        } catch (UnrecognizedPropertyException e) {
            throw new ConfigException("unknown field: " + e.getPropertyName(), e);
        } catch (JsonProcessingException e) {
            throw new ConfigException("invalid configuration: " + e.getOriginalMessage(), e);
        }
        if (state == null) {
            throw new ConfigException("configuration must be a JSON object");
        }
        return state;
    }

    private static <C extends AnalysisConfig> C validated(C config) {
        config.validate();
        return config;
    }
}
