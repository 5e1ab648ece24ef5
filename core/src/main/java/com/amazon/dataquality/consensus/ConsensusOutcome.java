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

import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

import com.amazon.dataquality.returntypes.ConsensusVote;

/**
 * The votes that reached the consensus threshold, ordered by confidence
 * (descending) and then by row index.
 */
@Getter
@ToString
public class ConsensusOutcome {

    private final List<ConsensusVote> votes;

    private final int threshold;

    private final int algorithmsRun;

    private final int totalCandidates;

    public ConsensusOutcome(List<ConsensusVote> votes, int threshold, int algorithmsRun, int totalCandidates) {
        this.votes = Collections.unmodifiableList(votes);
        this.threshold = threshold;
        this.algorithmsRun = algorithmsRun;
        this.totalCandidates = totalCandidates;
    }

    public boolean isEmpty() {
        return votes.isEmpty();
    }
}
