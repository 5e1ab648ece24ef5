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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.detector.DetectionOutput;
import com.amazon.dataquality.detector.DetectionResult;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.returntypes.ConsensusVote;

public class ConsensusAggregatorTest {

    private static DetectionResult flagged(DetectorType type, int... indices) {
        return DetectionResult.success(type, new DetectionOutput(indices, new double[10], null));
    }

    private static DetectionResult failed(DetectorType type) {
        return DetectionResult.failure(type, new AlgorithmException(type, "failed"));
    }

    private static List<Integer> indices(ConsensusOutcome outcome) {
        return outcome.getVotes().stream().map(ConsensusVote::getIndex).collect(Collectors.toList());
    }

    @ParameterizedTest
    @CsvSource({ "0, 1", "1, 1", "2, 1", "3, 1", "4, 2", "5, 2" })
    public void testThreshold(int run, int expected) {
        assertEquals(expected, ConsensusAggregator.threshold(run));
    }

    @Test
    public void testFailedDetectorDoesNotCount() {
        ConsensusOutcome outcome = ConsensusAggregator.aggregate(Arrays.asList(
                flagged(DetectorType.ISOLATION_FOREST, 1, 2, 5), flagged(DetectorType.LOCAL_OUTLIER_FACTOR, 2, 5, 7),
                failed(DetectorType.PCA_RECONSTRUCTION)));
        assertEquals(2, outcome.getAlgorithmsRun());
        assertEquals(1, outcome.getThreshold());
        assertEquals(4, outcome.getTotalCandidates());
        assertThat(indices(outcome), contains(2, 5, 1, 7));

        ConsensusVote top = outcome.getVotes().get(0);
        assertEquals(2, top.getVotes());
        assertEquals(1.0, top.getConfidence());
        assertTrue(top.getAlgorithms().contains(DetectorType.LOCAL_OUTLIER_FACTOR));
        assertEquals(0.5, outcome.getVotes().get(3).getConfidence());
    }

    @Test
    public void testThresholdFiltersWeakVotes() {
        ConsensusOutcome outcome = ConsensusAggregator.aggregate(Arrays.asList(
                flagged(DetectorType.ISOLATION_FOREST, 0, 3), flagged(DetectorType.LOCAL_OUTLIER_FACTOR, 3, 4),
                flagged(DetectorType.PCA_RECONSTRUCTION, 3, 4, 8), flagged(DetectorType.DBSCAN, 9)));
        assertEquals(2, outcome.getThreshold());
        assertEquals(5, outcome.getTotalCandidates());
        assertThat(indices(outcome), contains(3, 4));
        assertEquals(0.75, outcome.getVotes().get(0).getConfidence());
    }

    @Test
    public void testNothingCompleted() {
        ConsensusOutcome outcome = ConsensusAggregator
                .aggregate(Arrays.asList(failed(DetectorType.DBSCAN), failed(DetectorType.ISOLATION_FOREST)));
        assertTrue(outcome.isEmpty());
        assertEquals(0, outcome.getAlgorithmsRun());
        assertEquals(0, outcome.getTotalCandidates());
    }

    @Test
    public void testSeverity() {
        assertThat(ConsensusAggregator.severity(1.0), is(Severity.HIGH));
        assertThat(ConsensusAggregator.severity(0.5), is(Severity.MEDIUM));
        assertThat(ConsensusAggregator.severity(2.0 / 3), is(Severity.MEDIUM));
        assertThat(ConsensusAggregator.severity(0.25), is(Severity.LOW));
        assertThrows(IllegalArgumentException.class, () -> ConsensusAggregator.severity(0));
    }

    @Test
    public void testVoteValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConsensusVote(0, List.of(DetectorType.DBSCAN, DetectorType.ISOLATION_FOREST), 1));
        assertThrows(IllegalArgumentException.class, () -> new ConsensusVote(0, List.of(), 1));
    }
}
