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

package com.amazon.dataquality.state;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;

/**
 * A utility class for creating an {@link AnalysisResultState} from an
 * {@link AnalysisResult} and vice versa. The reverse mapping checks the same
 * invariants as the result itself.
 */
public class AnalysisResultMapper implements IStateMapper<AnalysisResult, AnalysisResultState> {

    private final AnomalyFindingMapper findingMapper = new AnomalyFindingMapper();

    @Override
    public AnalysisResultState toState(AnalysisResult model) {
        AnalysisResultState state = new AnalysisResultState();
        state.setPassed(model.isPassed());
        state.setAnomaliesCount(model.getAnomaliesCount());
        state.setMessage(model.getMessage());
        state.setDetails(new LinkedHashMap<>(model.getDetails()));
        List<AnomalyFindingState> findings = new ArrayList<>(model.getFindings().size());
        for (AnomalyFinding finding : model.getFindings()) {
            findings.add(findingMapper.toState(finding));
        }
        state.setFindings(findings);
        return state;
    }

    @Override
    public AnalysisResult toModel(AnalysisResultState state) {
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        List<AnomalyFinding> findings = new ArrayList<>();
        if (state.getFindings() != null) {
            for (AnomalyFindingState finding : state.getFindings()) {
                findings.add(findingMapper.toModel(finding));
            }
        }
        return new AnalysisResult(state.isPassed(), state.getAnomaliesCount(), state.getMessage(),
                state.getDetails() == null ? Collections.emptyMap() : state.getDetails(), findings);
    }
}
