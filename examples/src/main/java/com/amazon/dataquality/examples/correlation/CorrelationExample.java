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


package com.amazon.dataquality.examples.correlation;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.analysis.CorrelationAnalyzer;
import com.amazon.dataquality.config.CorrelationConfig;
import com.amazon.dataquality.config.CorrelationMethod;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.examples.Example;
import com.amazon.dataquality.examples.Results;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.testutils.SyntheticData;

/**
 * Revenue and order counts that are expected to move together but only
 * correlate moderately. The analyzer reports the deviation from the expected
 * coefficient.
 */
public class CorrelationExample implements Example {

    public static void main(String[] args) throws Exception {
        new CorrelationExample().run();
    }

    @Override
    public String command() {
        return "correlation";
    }

    @Override
    public String description() {
        return "detect a correlation that deviates from its expected value";
    }

    @Override
    public void run() throws Exception {
        Clock clock = Clock.systemUTC();
        LocalDate today = LocalDate.now(clock);
        List<Map<String, Object>> rows = SyntheticData.dailyCorrelatedRows("created_at", today.minusDays(1), 30,
                "revenue", "orders", 0.4, 2024);

        InMemoryDataProvider provider = new InMemoryDataProvider("daily_sales", rows);
        CorrelationAnalyzer analyzer = new CorrelationAnalyzer(provider, clock);

        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").expectedCorrelation(0.9)
                .threshold(0.2).correlationMethod(CorrelationMethod.PEARSON).build();
        AnalysisResult result = analyzer.analyze("daily_sales", config);
        Results.print(analyzer.getName(), result);

        boolean deviation = result.getFindings().stream()
                .anyMatch(finding -> finding.getType() == FindingType.CORRELATION_DEVIATION);
        if (!deviation) {
            throw new IllegalStateException("expected a correlation deviation");
        }

        System.out.println("Looks good!");
    }
}
