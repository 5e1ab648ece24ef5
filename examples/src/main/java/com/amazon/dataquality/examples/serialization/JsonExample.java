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


package com.amazon.dataquality.examples.serialization;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.analysis.DistributionAnalyzer;
import com.amazon.dataquality.config.DistributionConfig;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.examples.Example;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.serialize.AnalysisResultSerDe;
import com.amazon.dataquality.serialize.config.AnalysisConfigReader;
import com.amazon.dataquality.state.AnalysisResultMapper;
import com.amazon.dataquality.testutils.SyntheticData;
import com.google.gson.GsonBuilder;

/**
 * Read an analyzer configuration from JSON with
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>, run the analysis
 * and write the result as JSON with
 * <a href="https://github.com/google/gson">Gson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "configure an analysis from JSON and serialize its result";
    }

    @Override
    public void run() throws Exception {
        String configJson = "{\"segments\": [\"plan\"], \"metrics\": [\"count\", \"amount\"],"
                + " \"reference_period\": 30, \"comparison_period\": 7, \"date_column\": \"created_at\"}";
        DistributionConfig config = new AnalysisConfigReader().readDistributionConfig(configJson);

        Clock clock = Clock.systemUTC();
        LocalDate today = LocalDate.now(clock);
        Map<String, Integer> before = new LinkedHashMap<>();
        before.put("basic", 200);
        before.put("premium", 100);
        Map<String, Double> beforeAmount = new LinkedHashMap<>();
        beforeAmount.put("basic", 10.0);
        beforeAmount.put("premium", 40.0);
        Map<String, Integer> after = new LinkedHashMap<>();
        after.put("basic", 50);
        after.put("premium", 20);
        Map<String, Double> afterAmount = new LinkedHashMap<>();
        afterAmount.put("basic", 10.0);
        afterAmount.put("premium", 80.0);

        List<Map<String, Object>> rows = new ArrayList<>();
        rows.addAll(SyntheticData.segmentRows("created_at", "plan", today.minusDays(36), 30, before, "amount",
                beforeAmount));
        rows.addAll(
                SyntheticData.segmentRows("created_at", "plan", today.minusDays(6), 7, after, "amount", afterAmount));

        AnalysisResult result = new DistributionAnalyzer(new InMemoryDataProvider("subscriptions", rows), clock)
                .analyze("subscriptions", config);

        // Convert to JSON and print the number of bytes

        AnalysisResultSerDe serializer = new AnalysisResultSerDe(new AnalysisResultMapper(),
                new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create());
        String json = serializer.toJson(result);
        System.out.println(json);
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        // Restore from JSON and compare

        AnalysisResult restored = serializer.fromJson(json);
        if (restored.isPassed() != result.isPassed() || restored.getAnomaliesCount() != result.getAnomaliesCount()
                || !restored.getFindings().get(0).getDescription()
                        .equals(result.getFindings().get(0).getDescription())) {
            throw new IllegalStateException("restored result does not agree with the original result");
        }

        System.out.println("Looks good!");
    }
}
