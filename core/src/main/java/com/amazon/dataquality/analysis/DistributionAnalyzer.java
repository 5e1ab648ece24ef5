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

import static com.amazon.dataquality.CommonUtils.checkConfig;
import static com.amazon.dataquality.CommonUtils.toDouble;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.dataquality.config.DistributionConfig;
import com.amazon.dataquality.config.FindingType;
import com.amazon.dataquality.config.Severity;
import com.amazon.dataquality.dataset.Aggregation;
import com.amazon.dataquality.dataset.DataProvider;
import com.amazon.dataquality.dataset.Dataset;
import com.amazon.dataquality.dataset.DateBucket;
import com.amazon.dataquality.dataset.DateRange;
import com.amazon.dataquality.dataset.Filter;
import com.amazon.dataquality.dataset.QueryIntent;
import com.amazon.dataquality.exception.ConfigException;
import com.amazon.dataquality.exception.DataFetchException;
import com.amazon.dataquality.returntypes.AnalysisResult;
import com.amazon.dataquality.returntypes.AnomalyFinding;
import com.amazon.dataquality.returntypes.SegmentDrift;
import com.amazon.dataquality.returntypes.SegmentDriftReport;
import com.amazon.dataquality.returntypes.SegmentSummary;

/**
 * Compares how records and metrics distribute over the values of segment
 * columns in a recent comparison window against the reference window right
 * before it. Two things are reported per segment value and metric: a shift of
 * its share of the total, and a change of its average metric value.
 *
 * <p>
 * A value seen in one window only is compared against zero on the other side.
 */
@Slf4j
public class DistributionAnalyzer extends AbstractAnalyzer<DistributionConfig> {

    public static final String SKIPPED_MESSAGE = "Distribution analysis skipped: no date column configured";

    public static final String NO_DATA_MESSAGE = "Insufficient data for distribution analysis";

    public static final int DEFAULT_SUMMARY_DAYS = 30;

    public static final int DEFAULT_DRIFT_LOOKBACK_DAYS = 90;

    public static final int TOP_VALUES = 10;

    // a drift needs a significant slope and at least this change of share
    public static final double DRIFT_SIGNIFICANCE = 0.05;

    public static final double DRIFT_MIN_CHANGE = 0.05;

    public static final int DRIFT_MIN_ROWS = 4;

    static final String COUNT_ALIAS = "count";

    private static final String SUM_SUFFIX = "__sum";

    private static final String AVG_SUFFIX = "__avg";

    public DistributionAnalyzer(DataProvider dataProvider) {
        this(dataProvider, Clock.system(ZoneOffset.UTC));
    }

    public DistributionAnalyzer(DataProvider dataProvider, Clock clock) {
        super(dataProvider, clock);
    }

    @Override
    public String getName() {
        return "Distribution";
    }

    @Override
    protected AnalysisResult doAnalyze(String model, DistributionConfig config) throws DataFetchException {
        if (!config.isDateColumnConfigured()) {
            log.debug("distribution analysis of {} skipped, no date column", model);
            return AnalysisResult.skipped(SKIPPED_MESSAGE);
        }
        LocalDate today = today();
        LocalDate comparisonStart = today.minusDays(config.getComparisonPeriod() - 1);
        DateRange comparisonWindow = new DateRange(comparisonStart, today.plusDays(1));
        DateRange referenceWindow = new DateRange(comparisonStart.minusDays(config.getReferencePeriod()),
                comparisonStart);

        Map<String, Dataset> reference = new LinkedHashMap<>();
        Map<String, Dataset> comparison = new LinkedHashMap<>();
        boolean anyData = false;
        for (String segment : config.getSegments()) {
            reference.put(segment, fetchWindow(model, config, segment, referenceWindow));
            comparison.put(segment, fetchWindow(model, config, segment, comparisonWindow));
            anyData |= !reference.get(segment).isEmpty() || !comparison.get(segment).isEmpty();
        }
        if (!anyData) {
            return AnalysisResult.insufficientData(NO_DATA_MESSAGE, null);
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        Map<String, Object> segmentDetails = new LinkedHashMap<>();
        int shareShifts = 0;
        int behaviorAnomalies = 0;
        for (String segment : config.getSegments()) {
            Map<String, Object> metricDetails = new LinkedHashMap<>();
            for (String metric : config.getMetrics()) {
                WindowStats before = new WindowStats(reference.get(segment), segment, metric,
                        config.getReferencePeriod());
                WindowStats after = new WindowStats(comparison.get(segment), segment, metric,
                        config.getComparisonPeriod());
                TreeSet<String> values = new TreeSet<>(before.totals.keySet());
                values.addAll(after.totals.keySet());

                Map<String, Double> referenceShares = new TreeMap<>();
                Map<String, Double> comparisonShares = new TreeMap<>();
                for (String value : values) {
                    double referenceShare = before.share(value);
                    double comparisonShare = after.share(value);
                    referenceShares.put(value, referenceShare);
                    comparisonShares.put(value, comparisonShare);

                    AnomalyFinding shift = checkShare(segment, value, metric, referenceShare, comparisonShare, config);
                    if (shift != null) {
                        findings.add(shift);
                        ++shareShifts;
                    }
                    AnomalyFinding behavior = checkBehavior(segment, value, metric, before.mean(value),
                            after.mean(value), config);
                    if (behavior != null) {
                        findings.add(behavior);
                        ++behaviorAnomalies;
                    }
                }
                Map<String, Object> shares = new LinkedHashMap<>();
                shares.put("reference", referenceShares);
                shares.put("comparison", comparisonShares);
                shares.put("referenceTotal", before.grandTotal);
                shares.put("comparisonTotal", after.grandTotal);
                metricDetails.put(metric, shares);
            }
            segmentDetails.put(segment, metricDetails);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("referenceWindow", referenceWindow.toString());
        details.put("comparisonWindow", comparisonWindow.toString());
        details.put("segments", segmentDetails);
        details.put("shareShifts", shareShifts);
        details.put("behaviorAnomalies", behaviorAnomalies);

        String message = findings.isEmpty() ? "All distribution patterns are normal"
                : String.format(Locale.ROOT, "%d distribution anomalies: %d share shifts, %d behavior anomalies",
                        findings.size(), shareShifts, behaviorAnomalies);
        return AnalysisResult.of(findings, message, details);
    }

    /**
     * Record counts per value of each segment column over the last days.
     *
     * @param model      the model to summarize
     * @param segments   segment columns
     * @param dateColumn the date column
     * @param days       number of days to look back
     * @return a summary per segment, in segment order; empty when there is no
     *         data
     * @throws DataFetchException if the provider fails
     */
    public Map<String, SegmentSummary> segmentSummary(String model, List<String> segments, String dateColumn,
            int days) throws DataFetchException {
        checkSegments(segments);
        checkConfig(dateColumn != null && !dateColumn.isEmpty(), "missing required field: date_column");
        checkConfig(days > 0, "days must be positive");
        Map<String, SegmentSummary> summary = new LinkedHashMap<>();
        DateRange window = DateRange.lastDays(today(), days);
        for (String segment : segments) {
            Dataset data = fetch(QueryIntent.builder(model).groupBy(segment).aggregation(Aggregation.count(COUNT_ALIAS))
                    .dateColumn(dateColumn).dateRange(window).build());
            if (data.isEmpty()) {
                log.debug("no data to summarize for {} in {}", segment, model);
                continue;
            }
            data.requireColumns(List.of(segment, COUNT_ALIAS));
            Map<String, Long> counts = new TreeMap<>();
            long total = 0;
            for (Map<String, Object> row : data.getRows()) {
                long count = (long) toDouble(row.get(COUNT_ALIAS));
                counts.merge(String.valueOf(row.get(segment)), count, Long::sum);
                total += count;
            }
            List<Map.Entry<String, Long>> ranked = new ArrayList<>(counts.entrySet());
            ranked.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.<String, Long>comparingByKey()));
            Map<String, Long> top = new LinkedHashMap<>();
            for (Map.Entry<String, Long> entry : ranked.subList(0, Math.min(TOP_VALUES, ranked.size()))) {
                top.put(entry.getKey(), entry.getValue());
            }
            summary.put(segment, new SegmentSummary(segment, counts.size(), top, total));
        }
        return summary;
    }

    public Map<String, SegmentSummary> segmentSummary(String model, List<String> segments, String dateColumn)
            throws DataFetchException {
        return segmentSummary(model, segments, dateColumn, DEFAULT_SUMMARY_DAYS);
    }

    /**
     * Looks for gradual drift: for every segment value, fits a least squares line
     * to its weekly share of records and reports the values with a significant
     * slope and a substantial change between the first and the last week.
     *
     * @param model        the model to analyze
     * @param segments     segment columns
     * @param dateColumn   the date column
     * @param lookbackDays number of days to look back
     * @return drifting values per segment, or an insufficient report when fewer
     *         than four weekly rows are available
     * @throws DataFetchException if the provider fails
     */
    public SegmentDriftReport detectSegmentDrift(String model, List<String> segments, String dateColumn,
            int lookbackDays) throws DataFetchException {
        checkSegments(segments);
        checkConfig(dateColumn != null && !dateColumn.isEmpty(), "missing required field: date_column");
        checkConfig(lookbackDays > 0, "lookback_days must be positive");
        QueryIntent.Builder intent = QueryIntent.builder(model).dateColumn(dateColumn)
                .dateRange(DateRange.lastDays(today(), lookbackDays)).dateBucket(DateBucket.WEEK)
                .aggregation(Aggregation.count(COUNT_ALIAS)).orderBy(QueryIntent.PERIOD_COLUMN);
        for (String segment : segments) {
            intent.groupBy(segment);
        }
        Dataset data = fetch(intent.build());
        if (data.size() < DRIFT_MIN_ROWS) {
            log.debug("not enough weekly rows for drift detection in {}: {}", model, data.size());
            return SegmentDriftReport.insufficient();
        }
        List<String> required = new ArrayList<>(segments);
        required.add(QueryIntent.PERIOD_COLUMN);
        required.add(COUNT_ALIAS);
        data.requireColumns(required);

        Map<String, List<SegmentDrift>> drifting = new LinkedHashMap<>();
        for (String segment : segments) {
            // week -> value -> records
            TreeMap<LocalDate, Map<String, Double>> weekly = new TreeMap<>();
            TreeSet<String> values = new TreeSet<>();
            for (Map<String, Object> row : data.getRows()) {
                LocalDate week = Dataset.toLocalDate(row.get(QueryIntent.PERIOD_COLUMN));
                String value = String.valueOf(row.get(segment));
                values.add(value);
                weekly.computeIfAbsent(week, w -> new LinkedHashMap<>()).merge(value,
                        toDouble(row.get(COUNT_ALIAS)), Double::sum);
            }

            List<SegmentDrift> segmentDrift = new ArrayList<>();
            for (String value : values) {
                double[] shares = new double[weekly.size()];
                int position = 0;
                for (Map<String, Double> week : weekly.values()) {
                    double total = week.values().stream().mapToDouble(Double::doubleValue).sum();
                    shares[position++] = total > 0 ? week.getOrDefault(value, 0.0) / total : 0;
                }
                SimpleRegression regression = new SimpleRegression();
                for (int i = 0; i < shares.length; i++) {
                    regression.addData(i, shares[i]);
                }
                double pValue = regression.getSignificance();
                double totalChange = Math.abs(shares[shares.length - 1] - shares[0]);
                if (pValue < DRIFT_SIGNIFICANCE && totalChange > DRIFT_MIN_CHANGE) {
                    segmentDrift.add(new SegmentDrift(value, regression.getSlope(), pValue, totalChange));
                }
            }
            drifting.put(segment, segmentDrift);
        }
        return SegmentDriftReport.of(drifting);
    }

    public SegmentDriftReport detectSegmentDrift(String model, List<String> segments, String dateColumn)
            throws DataFetchException {
        return detectSegmentDrift(model, segments, dateColumn, DEFAULT_DRIFT_LOOKBACK_DAYS);
    }

    private Dataset fetchWindow(String model, DistributionConfig config, String segment, DateRange window)
            throws DataFetchException {
        QueryIntent.Builder intent = QueryIntent.builder(model).groupBy(segment)
                .aggregation(Aggregation.count(COUNT_ALIAS)).dateColumn(config.getDateColumn())
                .dateRange(window).filter(Filter.notNull(segment)).orderBy(segment);
        for (String metric : config.getMetrics()) {
            if (!DistributionConfig.COUNT_METRIC.equals(metric)) {
                intent.aggregation(Aggregation.sum(metric, metric + SUM_SUFFIX));
                intent.aggregation(Aggregation.avg(metric, metric + AVG_SUFFIX));
            }
        }
        Dataset data = fetch(intent.build());
        List<String> required = new ArrayList<>();
        required.add(segment);
        required.add(COUNT_ALIAS);
        for (String metric : config.getMetrics()) {
            if (!DistributionConfig.COUNT_METRIC.equals(metric)) {
                required.add(metric + SUM_SUFFIX);
                required.add(metric + AVG_SUFFIX);
            }
        }
        data.requireColumns(required);
        return data;
    }

    private static AnomalyFinding checkShare(String segment, String value, String metric, double referenceShare,
            double comparisonShare, DistributionConfig config) {
        double change = comparisonShare - referenceShare;
        if (!(Math.abs(change) > config.getShareShiftThreshold())) {
            return null;
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("segment", segment);
        evidence.put("segmentValue", value);
        evidence.put("metric", metric);
        evidence.put("referenceShare", referenceShare);
        evidence.put("comparisonShare", comparisonShare);
        evidence.put("shareChange", change);
        return AnomalyFinding.builder().type(FindingType.SEGMENT_SHARE_SHIFT).subject(segment + "=" + value)
                .statistic(change)
                .severity(Math.abs(change) >= config.getShareShiftHighThreshold() ? Severity.HIGH : Severity.MEDIUM)
                .description(String.format(Locale.ROOT, "Share of %s=%s in %s moved from %.1f%% to %.1f%%", segment,
                        value, metric, referenceShare, comparisonShare))
                .evidence(evidence).build();
    }

    private static AnomalyFinding checkBehavior(String segment, String value, String metric, double referenceMean,
            double comparisonMean, DistributionConfig config) {
        if (!(referenceMean > 0)) {
            return null;
        }
        double percentChange = (comparisonMean - referenceMean) / referenceMean * 100;
        if (!(Math.abs(percentChange) > config.getBehaviorChangeThreshold())) {
            return null;
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("segment", segment);
        evidence.put("segmentValue", value);
        evidence.put("metric", metric);
        evidence.put("referenceMean", referenceMean);
        evidence.put("comparisonMean", comparisonMean);
        evidence.put("percentChange", percentChange);
        return AnomalyFinding.builder().type(FindingType.SEGMENT_BEHAVIOR_ANOMALY).subject(segment + "=" + value)
                .statistic(percentChange)
                .severity(Math.abs(percentChange) > config.getBehaviorChangeCriticalThreshold() ? Severity.CRITICAL
                        : Severity.HIGH)
                .description(String.format(Locale.ROOT, "Average %s of %s=%s changed by %+.1f%% (%.3f to %.3f)",
                        metric, segment, value, percentChange, referenceMean, comparisonMean))
                .evidence(evidence).build();
    }

    private static void checkSegments(List<String> segments) {
        if (segments == null) {
            throw ConfigException.missingField("segments");
        }
        checkConfig(!segments.isEmpty(), "At least one segment required for distribution analysis");
    }

    /**
     * Totals and averages per segment value of one window and one metric.
     */
    private static class WindowStats {

        private final Map<String, Double> totals = new TreeMap<>();

        private final Map<String, Double> means = new TreeMap<>();

        private final double grandTotal;

        WindowStats(Dataset data, String segment, String metric, int days) {
            boolean count = DistributionConfig.COUNT_METRIC.equals(metric);
            double sum = 0;
            for (Map<String, Object> row : data.getRows()) {
                String value = String.valueOf(row.get(segment));
                double records = toDouble(row.get(COUNT_ALIAS));
                double total = count ? records : toDouble(row.get(metric + SUM_SUFFIX));
                double mean = count ? records / days : toDouble(row.get(metric + AVG_SUFFIX));
                total = Double.isNaN(total) ? 0 : total;
                totals.merge(value, total, Double::sum);
                means.put(value, Double.isNaN(mean) ? 0 : mean);
                sum += total;
            }
            grandTotal = sum;
        }

        double share(String value) {
            // multiply first so that round shares stay exact
            return grandTotal > 0 ? totals.getOrDefault(value, 0.0) * 100 / grandTotal : 0;
        }

        double mean(String value) {
            return means.getOrDefault(value, 0.0);
        }
    }
}
