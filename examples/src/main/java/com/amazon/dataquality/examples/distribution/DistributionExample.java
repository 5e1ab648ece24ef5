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


package com.amazon.dataquality.examples.distribution;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.analysis.DistributionAnalyzer;
import com.amazon.dataquality.config.DistributionConfig;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.examples.Example;
import com.amazon.dataquality.examples.Results;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.SegmentSummary;
import com.amazon.dataquality.testutils.SyntheticData;

/**
 * Orders split by region. During the last week the "west" region takes a much
 * larger share of the orders than it did over the month before.
 */
public class DistributionExample implements Example {

    public static void main(String[] args) throws Exception {
        new DistributionExample().run();
    }

    @Override
    public String command() {
        return "distribution";
    }

    @Override
    public String description() {
        return "detect a segment whose share of the records shifted";
    }

    @Override
    public void run() throws Exception {
        Clock clock = Clock.systemUTC();
        LocalDate today = LocalDate.now(clock);

        Map<String, Integer> before = new LinkedHashMap<>();
        before.put("east", 300);
        before.put("west", 150);
        before.put("north", 150);
        Map<String, Integer> after = new LinkedHashMap<>();
        after.put("east", 70);
        after.put("west", 105);
        after.put("north", 35);

        List<Map<String, Object>> rows = new ArrayList<>();
        rows.addAll(SyntheticData.segmentRows("created_at", "region", today.minusDays(36), 30, before));
        rows.addAll(SyntheticData.segmentRows("created_at", "region", today.minusDays(6), 7, after));

        InMemoryDataProvider provider = new InMemoryDataProvider("orders", rows);
        DistributionAnalyzer analyzer = new DistributionAnalyzer(provider, clock);

        DistributionConfig config = DistributionConfig.builder().segments("region").dateColumn("created_at")
                .referencePeriod(30).comparisonPeriod(7).build();
        AnalysisResult result = analyzer.analyze("orders", config);
        Results.print(analyzer.getName(), result);

        System.out.println("segment summary:");
        for (SegmentSummary summary : analyzer.segmentSummary("orders", List.of("region"), "created_at", 45)
                .values()) {
            System.out.printf("  %s: %d values, %d records, top %s%n", summary.getSegment(),
                    summary.getUniqueValues(), summary.getTotalRecords(), summary.getTopValues());
        }

        boolean shifted = result.getFindings().stream().anyMatch(finding -> finding
                .getType() == FindingType.SEGMENT_SHARE_SHIFT && finding.getSubject().equals("region=west"));
        if (!shifted) {
            throw new IllegalStateException("expected a share shift for the west region");
        }

        System.out.println("Looks good!");
    }
}
