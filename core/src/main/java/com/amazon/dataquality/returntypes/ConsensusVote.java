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

package com.amazon.dataquality.returntypes;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.dataquality.config.DetectorType;

/**
 * The votes collected by one candidate row across the ensemble.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConsensusVote {

    private final int index;

    private final int votes;

    private final Set<DetectorType> algorithms;

    private final double confidence;

    /**
     * @param index         row index in the analyzed dataset
     * @param algorithms    the detectors that flagged the row
     * @param algorithmsRun number of detectors that completed
     */
    public ConsensusVote(int index, Collection<DetectorType> algorithms, int algorithmsRun) {
        checkArgument(index >= 0, "index must be non-negative");
        checkArgument(!algorithms.isEmpty(), "a vote needs at least one algorithm");
        checkArgument(algorithms.size() <= algorithmsRun, "votes cannot exceed the algorithms run");
        this.index = index;
        this.algorithms = Collections.unmodifiableSet(EnumSet.copyOf(algorithms));
        this.votes = this.algorithms.size();
        this.confidence = (double) votes / algorithmsRun;
    }
}
