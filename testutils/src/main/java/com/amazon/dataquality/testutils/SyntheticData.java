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

package com.amazon.dataquality.testutils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generators of rows (column name to value) shaped like the tables the
 * analyzers read. Every generator is deterministic for a given seed.
 */
public class SyntheticData {

    private SyntheticData() {
    }

    /**
     * Two series whose sample Pearson correlation is exactly {@code rho}, up to
     * rounding. The second series is orthogonalized against the first before
     * mixing.
     *
     * @param n    length of the series, at least 3
     * @param rho  target correlation in [-1, 1]
     * @param seed random seed
     * @return an array {x, y} of standardized series
     */
    public static double[][] correlatedSeries(int n, double rho, long seed) {
        if (n < 3 || rho < -1 || rho > 1) {
            throw new IllegalArgumentException("n must be at least 3 and rho in [-1, 1]");
        }
        NormalSampler sampler = new NormalSampler(seed);
        double[] a = new double[n];
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            a[i] = sampler.nextDouble();
            b[i] = sampler.nextDouble();
        }
        standardize(a);
        standardize(b);
        double projection = dot(a, b) / dot(a, a);
        for (int i = 0; i < n; i++) {
            b[i] -= projection * a[i];
        }
        standardize(b);
        double[] y = new double[n];
        double mix = Math.sqrt(1 - rho * rho);
        for (int i = 0; i < n; i++) {
            y[i] = rho * a[i] + mix * b[i];
        }
        return new double[][] { a, y };
    }

    /**
     * One row per day ending on {@code lastDay}, with two correlated variables
     * shifted and scaled to positive values.
     */
    public static List<Map<String, Object>> dailyCorrelatedRows(String dateColumn, LocalDate lastDay, int days,
            String x, String y, double rho, long seed) {
        double[][] series = correlatedSeries(days, rho, seed);
        List<Map<String, Object>> rows = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(dateColumn, lastDay.minusDays(days - 1 - i));
            row.put(x, 100 + 10 * series[0][i]);
            row.put(y, 50 + 5 * series[1][i]);
            rows.add(row);
        }
        return rows;
    }

    /**
     * Gaussian feature rows spread over the days before {@code lastDay}, plus
     * the given outliers appended at the end.
     *
     * @param dateColumn name of the date column
     * @param lastDay    date of the most recent row
     * @param days       number of days the rows are spread over
     * @param features   feature columns
     * @param inliers    number of standard normal rows
     * @param outliers   outlier rows, one value per feature each
     * @param seed       random seed
     * @return the rows
     */
    public static List<Map<String, Object>> gaussianRows(String dateColumn, LocalDate lastDay, int days,
            List<String> features, int inliers, double[][] outliers, long seed) {
        double[][] values = new NormalSampler(seed).matrix(inliers, features.size(), 0, 1);
        List<Map<String, Object>> rows = new ArrayList<>(inliers + outliers.length);
        for (int i = 0; i < inliers; i++) {
            rows.add(featureRow(dateColumn, lastDay.minusDays(i % days), features, values[i]));
        }
        for (int i = 0; i < outliers.length; i++) {
            rows.add(featureRow(dateColumn, lastDay.minusDays(i % days), features, outliers[i]));
        }
        return rows;
    }

    /**
     * Rows of a single segment column. Each value gets the given number of
     * records, spread round-robin over the days {@code [firstDay, firstDay + days)}.
     *
     * @param dateColumn     name of the date column
     * @param segmentColumn  name of the segment column
     * @param firstDay       first day of the window
     * @param days           length of the window
     * @param recordsByValue number of records per segment value
     * @param metric         optional numeric column, null for none
     * @param metricByValue  value of the metric per segment value, ignored when
     *                       {@code metric} is null
     * @return the rows
     */
    public static List<Map<String, Object>> segmentRows(String dateColumn, String segmentColumn, LocalDate firstDay,
            int days, Map<String, Integer> recordsByValue, String metric, Map<String, Double> metricByValue) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int position = 0;
        for (Map.Entry<String, Integer> entry : recordsByValue.entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(dateColumn, firstDay.plusDays(position++ % days));
                row.put(segmentColumn, entry.getKey());
                if (metric != null) {
                    row.put(metric, metricByValue.get(entry.getKey()));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    public static List<Map<String, Object>> segmentRows(String dateColumn, String segmentColumn, LocalDate firstDay,
            int days, Map<String, Integer> recordsByValue) {
        return segmentRows(dateColumn, segmentColumn, firstDay, days, recordsByValue, null, null);
    }

    private static Map<String, Object> featureRow(String dateColumn, LocalDate date, List<String> features,
            double[] values) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(dateColumn, date);
        for (int j = 0; j < features.size(); j++) {
            row.put(features.get(j), values[j]);
        }
        return row;
    }

    private static void standardize(double[] values) {
        double mean = 0;
        for (double value : values) {
            mean += value / values.length;
        }
        double sumOfSquares = 0;
        for (int i = 0; i < values.length; i++) {
            values[i] -= mean;
            sumOfSquares += values[i] * values[i];
        }
        double norm = Math.sqrt(sumOfSquares / values.length);
        for (int i = 0; i < values.length; i++) {
            values[i] /= norm;
        }
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
