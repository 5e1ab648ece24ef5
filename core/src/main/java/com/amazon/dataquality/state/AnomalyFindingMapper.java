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

import static com.amazon.dataquality.CommonUtils.checkNotNull;

import java.util.LinkedHashMap;
import java.util.Locale;

import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.returntypes.AnomalyFinding;

public class AnomalyFindingMapper implements IStateMapper<AnomalyFinding, AnomalyFindingState> {

    @Override
    public AnomalyFindingState toState(AnomalyFinding model) {
        AnomalyFindingState state = new AnomalyFindingState();
        state.setType(model.getType().label());
        state.setSubject(model.getSubject());
        state.setStatistic(model.getStatistic());
        state.setPValue(model.getPValue().orElse(null));
        state.setSeverity(model.getSeverity().label());
        state.setConfidence(model.getConfidence().orElse(null));
        state.setDescription(model.getDescription());
        state.setEvidence(new LinkedHashMap<>(model.getEvidence()));
        return state;
    }

    @Override
    public AnomalyFinding toModel(AnomalyFindingState state) {
        checkNotNull(state.getType(), "type must not be null");
        checkNotNull(state.getSeverity(), "severity must not be null");
        return AnomalyFinding.builder().type(FindingType.valueOf(state.getType().toUpperCase(Locale.ROOT)))
                .subject(state.getSubject()).statistic(state.getStatistic()).pValue(state.getPValue())
                .severity(Severity.valueOf(state.getSeverity().toUpperCase(Locale.ROOT)))
                .confidence(state.getConfidence()).description(state.getDescription()).evidence(state.getEvidence())
                .build();
    }
}
