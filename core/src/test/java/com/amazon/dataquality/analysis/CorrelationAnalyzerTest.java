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

package com.amazon.dataquality.analysis;

import static com.amazon.dataquality.TestUtils.CLOCK;
import static com.amazon.dataquality.TestUtils.DATE_COLUMN;
import static com.amazon.dataquality.TestUtils.EPSILON;
import static com.amazon.dataquality.TestUtils.TODAY;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.dataquality.config.CorrelationConfig;
import com.amazon.dataquality.config.CorrelationMethod;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.dataset.DataProvider;
import com.amazon.dataquality.dataset.Dataset;
import com.amazon.dataquality.dataset.InMemoryDataProvider;
import com.amazon.dataquality.dataset.QueryIntent;
import com.amazon.dataquality.exception.DataFetchException;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;
import com.amazon.dataquality.statistics.CorrelationEstimate;
import com.amazon.dataquality.testutils.SyntheticData;

@ExtendWith(MockitoExtension.class)
public class CorrelationAnalyzerTest {

    private static final String MODEL = "orders";

    private static final double[] PATTERN_X = { 1, 2, 3, 4 };

    private static final double[] PATTERN_Y = { 2, 1, 4, 3 };

    @Mock
    private DataProvider provider;

    private static CorrelationAnalyzer analyzer(List<Map<String, Object>> rows) {
        return new CorrelationAnalyzer(new InMemoryDataProvider(MODEL, rows), CLOCK);
    }

    /**
     * 28 daily rows repeating a 4-day pattern whose correlation is 0.6. From day
     * {@code flipFrom} on, the second variable mirrors the first instead.
     */
    private static List<Map<String, Object>> periodicRows(int flipFrom) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int k = 0; k < 28; k++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(DATE_COLUMN, TODAY.minusDays(27 - k));
            double x = PATTERN_X[k % 4];
            row.put("revenue", x);
            row.put("orders", k < flipFrom ? PATTERN_Y[k % 4] : 5 - x);
            rows.add(row);
        }
        return rows;
    }

    private static List<AnomalyFinding> ofType(AnalysisResult result, FindingType type) {
        return result.getFindings().stream().filter(f -> f.getType() == type).collect(Collectors.toList());
    }

    @Test
    public void testDeviationFromExpectedCorrelation() {
        List<Map<String, Object>> rows = SyntheticData.dailyCorrelatedRows(DATE_COLUMN, TODAY, 30, "revenue",
                "orders", 0.5, 42);
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").expectedCorrelation(0.8)
                .threshold(0.1).build();

        AnalysisResult result = analyzer(rows).analyze(MODEL, config);

        assertFalse(result.isPassed());
        List<AnomalyFinding> deviations = ofType(result, FindingType.CORRELATION_DEVIATION);
        assertEquals(1, deviations.size());
        AnomalyFinding finding = deviations.get(0);
        assertEquals("revenue_vs_orders", finding.getSubject());
        assertEquals(Severity.MEDIUM, finding.getSeverity());
        assertThat(finding.getStatistic(), closeTo(0.5, EPSILON));
        assertEquals("Correlation 0.500 deviates from expected 0.800 by 0.300", finding.getDescription());
        assertEquals(0.8, finding.getEvidence().get("expectedCorrelation"));
        assertEquals("pearson", finding.getEvidence().get("method"));
        assertEquals(1, result.getDetails().get("staticAnomalies"));
        assertEquals(30, result.getDetails().get("dataPoints"));
        assertEquals(result.getFindings().size(), result.getAnomaliesCount());
    }

    @Test
    public void testWeakCorrelationWhenStrongExpected() {
        List<Map<String, Object>> rows = SyntheticData.dailyCorrelatedRows(DATE_COLUMN, TODAY, 30, "revenue",
                "orders", 0.1, 7);
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").expectedCorrelation(0.9)
                .build();

        List<AnomalyFinding> deviations = ofType(analyzer(rows).analyze(MODEL, config),
                FindingType.CORRELATION_DEVIATION);
        assertEquals(1, deviations.size());
        assertEquals("Unexpectedly weak correlation 0.100 (expected 0.900)", deviations.get(0).getDescription());
    }

    @Test
    public void testStrongCorrelationWithoutExpectation() {
        List<Map<String, Object>> rows = SyntheticData.dailyCorrelatedRows(DATE_COLUMN, TODAY, 30, "revenue",
                "orders", 0.95, 3);
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();

        List<AnomalyFinding> deviations = ofType(analyzer(rows).analyze(MODEL, config),
                FindingType.CORRELATION_DEVIATION);
        assertEquals(1, deviations.size());
        assertEquals("Unexpectedly strong correlation 0.950", deviations.get(0).getDescription());
        assertFalse(deviations.get(0).getEvidence().containsKey("expectedCorrelation"));
    }

    @Test
    public void testStableCorrelationPasses() {
        // two full periods of the pattern in the recent window
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").expectedCorrelation(0.6)
                .recentWindowDays(8).build();

        AnalysisResult result = analyzer(periodicRows(28)).analyze(MODEL, config);

        assertTrue(result.isPassed());
        assertEquals(0, result.getAnomaliesCount());
        assertEquals("All correlations are within expected ranges", result.getMessage());
        Map<?, ?> temporal = (Map<?, ?>) result.getDetails().get("temporalCorrelation");
        Map<?, ?> pair = (Map<?, ?>) temporal.get("revenue_vs_orders");
        assertThat((Double) pair.get("recentCorrelation"), closeTo(0.6, EPSILON));
        assertEquals(8, pair.get("recentSampleSize"));
        assertThat((Double) pair.get("pValue"), closeTo(1.0, EPSILON));
    }

    @Test
    public void testRecentWindowEndsToday() {
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();

        AnalysisResult result = analyzer(periodicRows(28)).analyze(MODEL, config);

        Map<?, ?> temporal = (Map<?, ?>) result.getDetails().get("temporalCorrelation");
        Map<?, ?> pair = (Map<?, ?>) temporal.get("revenue_vs_orders");
        assertEquals(CorrelationConfig.DEFAULT_RECENT_WINDOW_DAYS, pair.get("recentSampleSize"));
    }

    @Test
    public void testTemporalShift() {
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();

        AnalysisResult result = analyzer(periodicRows(20)).analyze(MODEL, config);

        assertFalse(result.isPassed());
        assertTrue(ofType(result, FindingType.CORRELATION_DEVIATION).isEmpty());
        List<AnomalyFinding> shifts = ofType(result, FindingType.TEMPORAL_CORRELATION_SHIFT);
        assertEquals(1, shifts.size());
        AnomalyFinding shift = shifts.get(0);
        assertThat(shift.getStatistic(), closeTo(-1.0, EPSILON));
        assertThat(shift.getPValue().get(), lessThan(0.05));
        assertThat((Double) shift.getEvidence().get("baselineCorrelation"), closeTo(5.0 / 35, EPSILON));
        assertEquals("1 correlation anomalies detected (0 static, 1 temporal)", result.getMessage());
    }

    @Test
    public void testEveryPairIsChecked() {
        List<Map<String, Object>> rows = SyntheticData.dailyCorrelatedRows(DATE_COLUMN, TODAY, 30, "a", "b", 0.95,
                3);
        for (Map<String, Object> row : rows) {
            row.put("c", 1.0);
        }
        CorrelationConfig config = CorrelationConfig.builder().variables("a", "b", "c")
                .correlationMethod(CorrelationMethod.SPEARMAN).build();

        AnalysisResult result = analyzer(rows).analyze(MODEL, config);

        Map<?, ?> computed = (Map<?, ?>) result.getDetails().get("staticCorrelation");
        assertTrue(computed.containsKey("a_vs_b"));
        // a constant variable has no correlation and is skipped
        assertFalse(computed.containsKey("a_vs_c"));
        assertFalse(computed.containsKey("b_vs_c"));
    }

    @Test
    public void testNoData() {
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();
        AnalysisResult result = analyzer(new ArrayList<>()).analyze(MODEL, config);
        assertTrue(result.isPassed());
        assertTrue(result.isInsufficientData());
        assertEquals(CorrelationAnalyzer.NO_DATA_MESSAGE, result.getMessage());
    }

    @Test
    public void testInvalidConfigDoesNotFetch() {
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue").build();

        AnalysisResult result = new CorrelationAnalyzer(provider, CLOCK).analyze(MODEL, config);

        assertFalse(result.isPassed());
        assertEquals(1, result.getAnomaliesCount());
        assertEquals("Correlation analysis failed: At least 2 variables required for correlation analysis",
                result.getMessage());
        assertEquals("ConfigException", result.getDetails().get(AnalysisResult.ERROR_TYPE));
        verifyNoInteractions(provider);
    }

    @Test
    public void testMissingColumnIsAConfigError() throws DataFetchException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(QueryIntent.PERIOD_COLUMN, TODAY);
        row.put("revenue", 1.0);
        when(provider.fetch(any())).thenReturn(Dataset.of(List.of(row)));
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();

        AnalysisResult result = new CorrelationAnalyzer(provider, CLOCK).analyze(MODEL, config);

        assertTrue(result.isError());
        assertEquals("ConfigException", result.getDetails().get(AnalysisResult.ERROR_TYPE));
        assertEquals("dataset is missing required columns: orders", result.getDetails().get(AnalysisResult.ERROR));
    }

    @Test
    public void testProviderFailure() throws DataFetchException {
        when(provider.fetch(any())).thenThrow(new DataFetchException("warehouse unavailable"));
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();

        AnalysisResult result = new CorrelationAnalyzer(provider, CLOCK).analyze(MODEL, config);

        assertFalse(result.isPassed());
        assertEquals("Correlation analysis failed: warehouse unavailable", result.getMessage());
        assertEquals("DataFetchException", result.getDetails().get(AnalysisResult.ERROR_TYPE));
        assertTrue(result.getFindings().isEmpty());
    }

    @Test
    public void testMissingModel() {
        CorrelationConfig config = CorrelationConfig.builder().variables("revenue", "orders").build();
        AnalysisResult result = analyzer(new ArrayList<>()).analyze("", config);
        assertEquals("Correlation analysis failed: missing required field: model", result.getMessage());
    }

    @Test
    public void testStaticRules() {
        CorrelationAnalyzer analyzer = analyzer(new ArrayList<>());
        CorrelationConfig noExpectation = CorrelationConfig.builder().variables("a", "b").build();
        assertThat(analyzer.checkStatic("a_vs_b", new CorrelationEstimate(0.9, null, 10), noExpectation)
                .isPresent(), is(false));
        assertThat(analyzer.checkStatic("a_vs_b", new CorrelationEstimate(-0.95, null, 10), noExpectation)
                .isPresent(), is(true));

        CorrelationConfig expected = CorrelationConfig.builder().variables("a", "b").expectedCorrelation(0.4)
                .threshold(0.2).build();
        assertThat(analyzer.checkStatic("a_vs_b", new CorrelationEstimate(0.25, 0.1, 10), expected).isPresent(),
                is(false));
        Optional<AnomalyFinding> finding = analyzer.checkStatic("a_vs_b", new CorrelationEstimate(0.1, 0.3, 10),
                expected);
        assertThat(finding.get().getPValue().get(), is(0.3));
    }
}
