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


package com.amazon.dataquality.examples;

import java.util.Map;

import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;

public class Results {

    private Results() {
    }

    public static void print(String title, AnalysisResult result) {
        System.out.printf("%s: passed = %b, anomalies = %d%n", title, result.isPassed(), result.getAnomaliesCount());
        System.out.printf("  %s%n", result.getMessage());
        for (AnomalyFinding finding : result.getFindings()) {
            System.out.printf("  [%s] %s %s: %s%n", finding.getSeverity(), finding.getType().label(),
                    finding.getSubject(), finding.getDescription());
        }
        for (Map.Entry<String, Object> entry : result.getDetails().entrySet()) {
            System.out.printf("  %s = %s%n", entry.getKey(), entry.getValue());
        }
    }
}
