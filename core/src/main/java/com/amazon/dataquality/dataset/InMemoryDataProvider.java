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

package com.amazon.dataquality.dataset;

import static com.amazon.dataquality.CommonUtils.checkNotNull;
import static com.amazon.dataquality.CommonUtils.isFinite;
import static com.amazon.dataquality.CommonUtils.toDouble;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.dataquality.exception.DataFetchException;

/**
 * A {@link DataProvider} evaluating query intents over rows held in memory, one
 * list of rows per model. Useful when the data was already materialized by
 * another system, and for tests. Aggregates follow SQL semantics: nulls are
 * ignored, and SUM/AVG over no values yield null.
 */
@Slf4j
public class InMemoryDataProvider implements DataProvider {

    private final Map<String, Dataset> tables = new ConcurrentHashMap<>();

    public InMemoryDataProvider() {
    }

    public InMemoryDataProvider(String model, List<? extends Map<String, ?>> rows) {
        register(model, rows);
    }

    public InMemoryDataProvider register(String model, List<? extends Map<String, ?>> rows) {
        checkNotNull(model, "model must not be null");
        tables.put(model, Dataset.of(rows));
        return this;
    }

    @Override
    public Dataset fetch(QueryIntent intent) throws DataFetchException {
        checkNotNull(intent, "intent must not be null");
        Dataset table = tables.get(intent.getModel());
        if (table == null) {
            throw new DataFetchException("unknown model " + intent.getModel());
        }
        checkColumns(intent, table);

        List<Map<String, Object>> selected = new ArrayList<>();
        for (Map<String, Object> row : table.getRows()) {
            if (matches(intent, row)) {
                selected.add(row);
            }
        }

        List<Map<String, Object>> result = intent.isAggregated() ? aggregate(intent, selected)
                : project(intent, selected);
        sort(intent, result);
        log.debug("fetched {} rows from {} for {}", result.size(), intent.getModel(), intent);
        return Dataset.of(result);
    }

    /**
     * Rejects references to columns the model does not have, as a warehouse
     * would. An empty model has no known columns and accepts everything.
     */
    private static void checkColumns(QueryIntent intent, Dataset table) throws DataFetchException {
        if (table.isEmpty()) {
            return;
        }
        Set<String> referenced = new LinkedHashSet<>(intent.getColumns());
        referenced.addAll(intent.getGroupBy());
        for (Aggregation aggregation : intent.getAggregations()) {
            if (aggregation.getColumn() != null) {
                referenced.add(aggregation.getColumn());
            }
        }
        for (Filter filter : intent.getFilters()) {
            referenced.add(filter.getColumn());
        }
        if (intent.getDateColumn() != null) {
            referenced.add(intent.getDateColumn());
        }
        for (String column : referenced) {
            if (!table.hasColumn(column)) {
                throw new DataFetchException("column " + column + " does not exist in " + intent.getModel());
            }
        }
    }

    private static boolean matches(QueryIntent intent, Map<String, Object> row) {
        if (intent.getDateRange() != null
                && !intent.getDateRange().contains(Dataset.toLocalDate(row.get(intent.getDateColumn())))) {
            return false;
        }
        if (intent.getDateBucket() != null && Dataset.toLocalDate(row.get(intent.getDateColumn())) == null) {
            return false;
        }
        for (Filter filter : intent.getFilters()) {
            if (!filter.test(row.get(filter.getColumn()))) {
                return false;
            }
        }
        return true;
    }

    private static List<Map<String, Object>> project(QueryIntent intent, List<Map<String, Object>> rows) {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (intent.getColumns().isEmpty()) {
                result.add(row);
            } else {
                Map<String, Object> projected = new LinkedHashMap<>();
                for (String column : intent.getColumns()) {
                    projected.put(column, row.get(column));
                }
                result.add(projected);
            }
        }
        return result;
    }

    private static List<Map<String, Object>> aggregate(QueryIntent intent, List<Map<String, Object>> rows) {
        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>();
            if (intent.getDateBucket() != null) {
                key.add(intent.getDateBucket().truncate(Dataset.toLocalDate(row.get(intent.getDateColumn()))));
            }
            for (String column : intent.getGroupBy()) {
                key.add(row.get(column));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groups.isEmpty() && intent.getGroupBy().isEmpty() && intent.getDateBucket() == null) {
            // a global aggregate over no rows still yields one row
            groups.put(Collections.emptyList(), Collections.emptyList());
        }

        List<Map<String, Object>> result = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            Map<String, Object> out = new LinkedHashMap<>();
            int position = 0;
            if (intent.getDateBucket() != null) {
                out.put(QueryIntent.PERIOD_COLUMN, group.getKey().get(position++));
            }
            for (String column : intent.getGroupBy()) {
                out.put(column, group.getKey().get(position++));
            }
            for (Aggregation aggregation : intent.getAggregations()) {
                out.put(aggregation.getAlias(), evaluate(aggregation, group.getValue()));
            }
            result.add(out);
        }
        return result;
    }

    static Object evaluate(Aggregation aggregation, List<Map<String, Object>> rows) {
        if (aggregation.getFunction() == AggregateFunction.COUNT && aggregation.getColumn() == null) {
            return (long) rows.size();
        }
        double sum = 0;
        double sumOfSquares = 0;
        long count = 0;
        for (Map<String, Object> row : rows) {
            Object cell = row.get(aggregation.getColumn());
            if (cell == null) {
                continue;
            }
            if (aggregation.getFunction() == AggregateFunction.COUNT) {
                ++count;
                continue;
            }
            double value = toDouble(cell);
            if (isFinite(value)) {
                sum += value;
                sumOfSquares += value * value;
                ++count;
            }
        }
        switch (aggregation.getFunction()) {
        case COUNT:
            return count;
        case SUM:
            return count == 0 ? null : sum;
        case AVG:
            return count == 0 ? null : sum / count;
        case STDDEV:
            if (count < 2) {
                return null;
            }
            double mean = sum / count;
            return Math.sqrt(Math.max(0, (sumOfSquares - count * mean * mean) / (count - 1)));
        default:
            throw new IllegalStateException("unsupported aggregate " + aggregation.getFunction());
        }
    }

    private static void sort(QueryIntent intent, List<Map<String, Object>> rows) {
        if (intent.getOrderBy().isEmpty()) {
            return;
        }
        Comparator<Map<String, Object>> comparator = null;
        for (String column : intent.getOrderBy()) {
            Comparator<Map<String, Object>> next = (a, b) -> compareCells(a.get(column), b.get(column));
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        rows.sort(intent.isDescending() ? comparator.reversed() : comparator);
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    static int compareCells(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Comparable && a.getClass().equals(b.getClass())) {
            return ((Comparable) a).compareTo(b);
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        LocalDate dateA = Dataset.toLocalDate(a);
        LocalDate dateB = Dataset.toLocalDate(b);
        if (dateA != null && dateB != null) {
            return dateA.compareTo(dateB);
        }
        return a.toString().compareTo(b.toString());
    }
}
