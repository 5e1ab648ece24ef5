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
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.analysis.DistributionAnalyzer;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.examples.Example;
import com.amazon.dataquality.returntypes.SegmentDrift;
import com.amazon.dataquality.returntypes.SegmentDriftReport;
import com.amazon.dataquality.testutils.SyntheticData;

/**
 * Signups by channel over eight weeks. The "mobile" channel grows steadily at
 * the expense of "web", which shows up as a gradual drift rather than a sudden
 * share shift.
 */
public class SegmentDriftExample implements Example {

    public static void main(String[] args) throws Exception {
        new SegmentDriftExample().run();
    }

    @Override
    public String command() {
        return "drift";
    }

    @Override
    public String description() {
        return "detect segment values whose weekly share trends up or down";
    }

    @Override
    public void run() throws Exception {
        Clock clock = Clock.systemUTC();
        LocalDate lastMonday = LocalDate.now(clock).minusWeeks(1)
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int k = 0; k < 8; k++) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put("mobile", 30 + 5 * k);
            counts.put("web", 70 - 5 * k);
            rows.addAll(
                    SyntheticData.segmentRows("signup_date", "channel", lastMonday.minusWeeks(7 - k), 1, counts));
        }

        DistributionAnalyzer analyzer = new DistributionAnalyzer(new InMemoryDataProvider("signups", rows), clock);
        SegmentDriftReport report = analyzer.detectSegmentDrift("signups", List.of("channel"), "signup_date");

        for (Map.Entry<String, List<SegmentDrift>> entry : report.getDriftingValues().entrySet()) {
            for (SegmentDrift drift : entry.getValue()) {
                System.out.printf("%s=%s is %s: slope %.3f per week, total change %.3f, p-value %.4f%n",
                        entry.getKey(), drift.getSegmentValue(), drift.getDirection(), drift.getSlope(),
                        drift.getTotalChange(), drift.getPValue());
            }
        }

        if (!report.isDriftDetected("channel")) {
            throw new IllegalStateException("expected the channel mix to drift");
        }

        System.out.println("Looks good!");
    }
}
