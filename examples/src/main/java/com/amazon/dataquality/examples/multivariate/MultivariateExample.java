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


package com.amazon.dataquality.examples.multivariate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.analysis.MultivariateAnalyzer;
import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.MultivariateConfig;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.examples.Example;
import com.amazon.dataquality.examples.Results;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.testutils.SyntheticData;

/**
 * Payment rows drawn from a standard normal distribution with two planted
 * outliers. Three detectors vote and the rows most of them agree on are
 * reported first. The example also prints which feature drives the anomaly
 * scores.
 */
public class MultivariateExample implements Example {

    public static void main(String[] args) throws Exception {
        new MultivariateExample().run();
    }

    @Override
    public String command() {
        return "multivariate";
    }

    @Override
    public String description() {
        return "find multivariate outliers by consensus of several detectors";
    }

    @Override
    public void run() throws Exception {
        Clock clock = Clock.systemUTC();
        LocalDate today = LocalDate.now(clock);
        List<String> features = List.of("amount", "latency", "items");
        double[][] outliers = { { 9.0, 0.5, 0.0 }, { -8.0, 1.0, 7.5 } };
        List<Map<String, Object>> rows = SyntheticData.gaussianRows("created_at", today.minusDays(1), 25, features,
                398, outliers, 7);

        InMemoryDataProvider provider = new InMemoryDataProvider("payments", rows);
        MultivariateAnalyzer analyzer = new MultivariateAnalyzer(provider, clock);

        MultivariateConfig config = MultivariateConfig.builder().features(features)
                .algorithms(DetectorType.ISOLATION_FOREST, DetectorType.LOCAL_OUTLIER_FACTOR,
                        DetectorType.PCA_RECONSTRUCTION)
                .contamination(0.02).randomSeed(7).build();
        AnalysisResult result = analyzer.analyze("payments", config);
        Results.print(analyzer.getName(), result);

        System.out.println("feature importance:");
        for (Map.Entry<String, Double> entry : analyzer.featureImportance("payments", config).entrySet()) {
            System.out.printf("  %-8s %.3f%n", entry.getKey(), entry.getValue());
        }

        // rows come back newest first, so the planted rows are recognized by value
        boolean found = result.getFindings().stream()
                .anyMatch(finding -> Math.abs(((Number) finding.getEvidence().get("amount")).doubleValue()) > 7);
        if (!found) {
            throw new IllegalStateException("planted outliers were not reported");
        }

        System.out.println("Looks good!");
    }
}
