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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.detector.AnomalyDetector;
import com.amazon.dataquality.detector.DetectionOutput;
import com.amazon.dataquality.preprocessor.FeaturePreparer;
import com.amazon.dataquality.testutils.NormalSampler;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DetectorBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "ISOLATION_FOREST", "LOCAL_OUTLIER_FACTOR", "PCA_RECONSTRUCTION", "DBSCAN" })
        String detectorType;

        @Param({ "500", "2000" })
        int rows;

        @Param({ "4", "16" })
        int dimensions;

        @Param({ "0.05" })
        double contamination;

        double[][] points;
        AnomalyDetector detector;

        @Setup(Level.Trial)
        public void setUp() {
            double[][] raw = new NormalSampler(42).matrix(rows, dimensions, 0, 1);
            points = FeaturePreparer.fitTransform(raw, MultivariateConfig.DEFAULT_CLIP_FACTOR);
            MultivariateConfig config = MultivariateConfig.builder().features("unused_a", "unused_b").randomSeed(42)
                    .build();
            detector = DetectorType.valueOf(detectorType).newDetector(config);
        }
    }

    @Benchmark
    public DetectionOutput detect(BenchmarkState state) {
        return state.detector.detect(state.points, state.contamination);
    }
}
