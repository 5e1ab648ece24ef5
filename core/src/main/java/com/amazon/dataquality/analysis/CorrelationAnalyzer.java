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

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import com.amazon.dataquality.config.CorrelationConfig;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.dataset.Aggregation;
import com.amazon.dataquality.dataset.DataProvider;
import com.amazon.dataquality.dataset.Dataset;
import com.amazon.dataquality.dataset.DateBucket;
import com.amazon.dataquality.dataset.DateRange;
import com.amazon.dataquality.dataset.QueryIntent;
import com.amazon.dataquality.exception.DataFetchException;
import com.amazon.dataquality.exception.InsufficientDataException;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;
import com.amazon.dataquality.statistics.CorrelationEstimate;
import com.amazon.dataquality.statistics.Correlations;

/**
 * Detects pairs of variables whose daily totals correlate differently from
 * what is expected, and pairs whose correlation in the most recent days
 * differs significantly from the whole window.
 */
@Slf4j
public class CorrelationAnalyzer extends AbstractAnalyzer<CorrelationConfig> {

    public static final String NO_DATA_MESSAGE = "No data available for correlation analysis";

    // a strong expected correlation makes an observed value below this suspicious
    public static final double WEAK_CORRELATION = 0.3;

    public static final double STRONG_EXPECTATION = 0.5;

    // without an expectation, a correlation above this has no baseline to justify it
    public static final double STRONG_CORRELATION = 0.9;

    public CorrelationAnalyzer(DataProvider dataProvider) {
        this(dataProvider, Clock.system(ZoneOffset.UTC));
    }

    public CorrelationAnalyzer(DataProvider dataProvider, Clock clock) {
        super(dataProvider, clock);
    }

    @Override
    public String getName() {
        return "Correlation";
    }

    @Override
    protected AnalysisResult doAnalyze(String model, CorrelationConfig config) throws DataFetchException {
        List<String> variables = config.getVariables();
        LocalDate today = today();

        QueryIntent.Builder intent = QueryIntent.builder(model).dateColumn(config.getDateColumn())
                .dateRange(DateRange.lastDays(today, config.getWindowDays())).dateBucket(DateBucket.DAY)
                .orderBy(QueryIntent.PERIOD_COLUMN);
        for (String variable : variables) {
            intent.aggregation(Aggregation.sum(variable, variable));
        }
        Dataset data = fetch(intent.build());
        if (data.isEmpty()) {
            throw new InsufficientDataException(NO_DATA_MESSAGE);
        }
        List<String> required = new ArrayList<>(variables);
        required.add(QueryIntent.PERIOD_COLUMN);
        data.requireColumns(required);

        LocalDate recentStart = today.minusDays(config.getRecentWindowDays() - 1);
        Dataset recent = data.filter(row -> {
            LocalDate period = Dataset.toLocalDate(row.get(QueryIntent.PERIOD_COLUMN));
            return period != null && !period.isBefore(recentStart);
        });

        List<AnomalyFinding> staticFindings = new ArrayList<>();
        List<AnomalyFinding> temporalFindings = new ArrayList<>();
        Map<String, Object> staticDetails = new LinkedHashMap<>();
        Map<String, Object> temporalDetails = new LinkedHashMap<>();

        for (int i = 0; i < variables.size(); i++) {
            for (int j = i + 1; j < variables.size(); j++) {
                String first = variables.get(i);
                String second = variables.get(j);
                String pair = first + "_vs_" + second;

                Optional<CorrelationEstimate> estimate = Correlations.estimate(data.getNumericColumn(first),
                        data.getNumericColumn(second), config.getCorrelationMethod());
                if (!estimate.isPresent()) {
                    log.warn("skipping {} in {}: correlation is undefined or there are fewer than {} observations",
                            pair, model, Correlations.MIN_OBSERVATIONS);
                    continue;
                }
                CorrelationEstimate full = estimate.get();
                staticDetails.put(pair, describe(full));
                checkStatic(pair, full, config).ifPresent(staticFindings::add);

                Optional<CorrelationEstimate> recentEstimate = Correlations.estimate(
                        recent.getNumericColumn(first), recent.getNumericColumn(second),
                        config.getCorrelationMethod());
                if (recentEstimate.isPresent()
                        && recentEstimate.get().getSampleSize() >= Correlations.MIN_SHIFT_OBSERVATIONS
                        && full.getSampleSize() >= Correlations.MIN_SHIFT_OBSERVATIONS) {
                    checkTemporal(pair, full, recentEstimate.get(), config, temporalDetails)
                            .ifPresent(temporalFindings::add);
                }
            }
        }

        List<AnomalyFinding> findings = new ArrayList<>(staticFindings);
        findings.addAll(temporalFindings);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("staticCorrelation", staticDetails);
        details.put("temporalCorrelation", temporalDetails);
        details.put("staticAnomalies", staticFindings.size());
        details.put("temporalAnomalies", temporalFindings.size());
        details.put("variablesAnalyzed", variables);
        details.put("dataPoints", data.size());

        String message = findings.isEmpty() ? "All correlations are within expected ranges"
                : String.format(Locale.ROOT, "%d correlation anomalies detected (%d static, %d temporal)",
                        findings.size(), staticFindings.size(), temporalFindings.size());
        return AnalysisResult.of(findings, message, details);
    }

    /**
     * Applies the flag rules in order; when several match, the last one names
     * the reason.
     */
    Optional<AnomalyFinding> checkStatic(String pair, CorrelationEstimate estimate, CorrelationConfig config) {
        double observed = estimate.getCoefficient();
        Optional<Double> expected = config.getExpectedCorrelation();
        String reason = null;

        if (expected.isPresent()) {
            double deviation = Math.abs(observed - expected.get());
            if (deviation > config.getThreshold()) {
                reason = String.format(Locale.ROOT, "Correlation %.3f deviates from expected %.3f by %.3f",
                        observed, expected.get(), deviation);
            }
            if (Math.abs(expected.get()) > STRONG_EXPECTATION && Math.abs(observed) < WEAK_CORRELATION) {
                reason = String.format(Locale.ROOT, "Unexpectedly weak correlation %.3f (expected %.3f)", observed,
                        expected.get());
            }
        } else if (Math.abs(observed) > STRONG_CORRELATION) {
            reason = String.format(Locale.ROOT, "Unexpectedly strong correlation %.3f", observed);
        }

        if (reason == null) {
            return Optional.empty();
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("correlation", observed);
        expected.ifPresent(value -> evidence.put("expectedCorrelation", value));
        evidence.put("sampleSize", estimate.getSampleSize());
        evidence.put("method", config.getCorrelationMethod().label());
        return Optional.of(AnomalyFinding.builder().type(FindingType.CORRELATION_DEVIATION).subject(pair)
                .statistic(observed).pValue(estimate.getPValue().orElse(null)).severity(Severity.MEDIUM)
                .description(reason).evidence(evidence).build());
    }

    private Optional<AnomalyFinding> checkTemporal(String pair, CorrelationEstimate full, CorrelationEstimate recent,
            CorrelationConfig config, Map<String, Object> temporalDetails) {
        double z = Correlations.fisherZ(full.getCoefficient(), full.getSampleSize(), recent.getCoefficient(),
                recent.getSampleSize());
        double pValue = Correlations.twoSidedNormalPValue(z);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("baselineCorrelation", full.getCoefficient());
        detail.put("recentCorrelation", recent.getCoefficient());
        detail.put("recentSampleSize", recent.getSampleSize());
        detail.put("zScore", z);
        detail.put("pValue", pValue);
        temporalDetails.put(pair, detail);

        if (!(pValue < config.getSignificanceLevel())) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT,
                "Correlation shifted from %.3f to %.3f in the last %d days (p=%.4f)", full.getCoefficient(),
                recent.getCoefficient(), config.getRecentWindowDays(), pValue);
        return Optional.of(AnomalyFinding.builder().type(FindingType.TEMPORAL_CORRELATION_SHIFT).subject(pair)
                .statistic(recent.getCoefficient()).pValue(pValue).severity(Severity.MEDIUM)
                .description(description).evidence(detail).build());
    }

    private static Map<String, Object> describe(CorrelationEstimate estimate) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("coefficient", estimate.getCoefficient());
        estimate.getPValue().ifPresent(p -> detail.put("pValue", p));
        detail.put("sampleSize", estimate.getSampleSize());
        return detail;
    }
}
