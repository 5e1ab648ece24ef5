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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;

public class AnalysisResultMapperTest {

    private AnalysisResultMapper mapper;

    private AnalysisResult result;

    @BeforeEach
    public void setUp() {
        mapper = new AnalysisResultMapper();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("votes", 2);
        AnomalyFinding finding = AnomalyFinding.builder().type(FindingType.CONSENSUS_OUTLIER).subject("row_3")
                .statistic(2).severity(Severity.HIGH).confidence(1.0).description("Row 3 flagged")
                .evidence(evidence).build();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("samples", 100);
        result = AnalysisResult.of(List.of(finding), "1 consensus anomalies detected", details);
    }

    @Test
    public void testToState() {
        AnalysisResultState state = mapper.toState(result);
        assertEquals(Version.V1_0, state.getVersion());
        assertEquals(1, state.getAnomaliesCount());
        AnomalyFindingState finding = state.getFindings().get(0);
        assertEquals("consensus_outlier", finding.getType());
        assertEquals("high", finding.getSeverity());
        assertNull(finding.getPValue());
        assertEquals(1.0, finding.getConfidence());
    }

    @Test
    public void testRoundTrip() {
        assertEquals(result, mapper.toModel(mapper.toState(result)));
    }

    @Test
    public void testVersionIsChecked() {
        AnalysisResultState state = mapper.toState(result);
        state.setVersion("0.9");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testInconsistentStateIsRejected() {
        AnalysisResultState state = mapper.toState(result);
        state.setPassed(true);
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testMissingCollections() {
        AnalysisResultState state = new AnalysisResultState();
        state.setPassed(true);
        state.setMessage("ok");
        AnalysisResult model = mapper.toModel(state);
        assertTrue(model.getFindings().isEmpty());
        assertTrue(model.getDetails().isEmpty());
    }
}
