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
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.serialize.AnalysisResultSerDe;
import com.amazon.dataquality.testutils.SyntheticData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Benchmark)
public class SerDeBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "1000", "10000" })
        int rows;

        @Param({ "0.01", "0.1" })
        double contamination;

        AnalysisResultSerDe serDe;
        AnalysisResult result;
        String json;

        @Setup(Level.Trial)
        public void setUp() {
            Clock clock = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);
            List<String> features = List.of("amount", "latency");
            List<Map<String, Object>> data = SyntheticData.gaussianRows("created_at", LocalDate.of(2024, 6, 29), 30,
                    features, rows, new double[0][], 5);
            MultivariateConfig config = MultivariateConfig.builder().features(features).contamination(contamination)
                    .randomSeed(5).build();
            result = new MultivariateAnalyzer(new InMemoryDataProvider("events", data), clock).analyze("events",
                    config);
            serDe = new AnalysisResultSerDe();
            json = serDe.toJson(result);
        }
    }

    @Benchmark
    public String toJson(BenchmarkState state) {
        return state.serDe.toJson(state.result);
    }

    @Benchmark
    public AnalysisResult fromJson(BenchmarkState state) {
        return state.serDe.fromJson(state.json);
    }
}
