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

package com.amazon.dataquality.consensus;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.detector.DetectionOutput;
import com.amazon.dataquality.detector.DetectionResult;
import com.amazon.dataquality.returntypes.ConsensusVote;

/**
 * Combines the flagged rows of the detectors that completed. A row becomes a
 * consensus anomaly when at least {@code max(1, run / 2)} detectors flagged
 * it. Failed detectors neither vote nor count in the denominator.
 */
public class ConsensusAggregator {

    public static final Comparator<ConsensusVote> BY_CONFIDENCE = Comparator
            .comparingDouble(ConsensusVote::getConfidence).reversed().thenComparingInt(ConsensusVote::getIndex);

    private ConsensusAggregator() {
    }

    public static int threshold(int algorithmsRun) {
        return Math.max(1, algorithmsRun / 2);
    }

    /**
     * @param results the detector results, failures are ignored
     * @return the ordered consensus; empty if no detector completed
     */
    public static ConsensusOutcome aggregate(List<DetectionResult> results) {
        Map<Integer, EnumSet<DetectorType>> candidates = new TreeMap<>();
        int run = 0;
        for (DetectionResult result : results) {
            if (!result.isSuccess()) {
                continue;
            }
            ++run;
            DetectionOutput output = result.getOutput().get();
            for (int index : output.getIndices()) {
                candidates.computeIfAbsent(index, i -> EnumSet.noneOf(DetectorType.class)).add(result.getType());
            }
        }
        int threshold = threshold(run);
        List<ConsensusVote> votes = new ArrayList<>();
        for (Map.Entry<Integer, EnumSet<DetectorType>> entry : candidates.entrySet()) {
            if (entry.getValue().size() >= threshold) {
                votes.add(new ConsensusVote(entry.getKey(), entry.getValue(), run));
            }
        }
        votes.sort(BY_CONFIDENCE);
        return new ConsensusOutcome(votes, threshold, run, candidates.size());
    }

    /**
     * HIGH when every detector agreed, MEDIUM when at least half did, LOW
     * otherwise.
     */
    public static Severity severity(double confidence) {
        checkArgument(confidence > 0 && confidence <= 1, "confidence must be in (0, 1]");
        if (confidence >= 1) {
            return Severity.HIGH;
        }
        return confidence >= 0.5 ? Severity.MEDIUM : Severity.LOW;
    }
}
