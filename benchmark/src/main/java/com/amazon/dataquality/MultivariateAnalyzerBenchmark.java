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


package com.amazon.dataquality;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.dataquality.analysis.MultivariateAnalyzer;
import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.testutils.SyntheticData;

/**
 * End to end cost of a multivariate analysis over the in-memory provider,
 * including fetching, scaling, every detector and the consensus vote.
 */
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class MultivariateAnalyzerBenchmark {

    public static final String MODEL = "events";

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1000", "5000" })
        int rows;

        @Param({ "3" })
        int dimensions;

        @Param({ "false", "true" })
        boolean allAlgorithms;

        MultivariateAnalyzer analyzer;
        MultivariateConfig config;

        @Setup(Level.Trial)
        public void setUp() {
            Clock clock = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);
            List<String> features = new ArrayList<>();
            for (int i = 0; i < dimensions; i++) {
                features.add("feature_" + i);
            }
            double[][] outliers = new double[rows / 100][dimensions];
            for (double[] outlier : outliers) {
                outlier[0] = 10;
            }
            List<Map<String, Object>> data = SyntheticData.gaussianRows("created_at", LocalDate.of(2024, 6, 29), 30,
                    features, rows - outliers.length, outliers, 99);
            analyzer = new MultivariateAnalyzer(new InMemoryDataProvider(MODEL, data), clock);
            MultivariateConfig.Builder<?> builder = MultivariateConfig.builder().features(features).randomSeed(99)
                    .contamination(0.02);
            if (allAlgorithms) {
                builder.algorithms(DetectorType.values());
            }
            config = builder.build();
        }
    }

    @Benchmark
    public AnalysisResult analyze(BenchmarkState state) {
        return state.analyzer.analyze(MODEL, state.config);
    }

    @Benchmark
    public Map<String, Double> featureImportance(BenchmarkState state) {
        return state.analyzer.featureImportance(MODEL, state.config);
    }
}
