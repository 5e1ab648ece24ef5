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

import static com.amazon.dataquality.CommonUtils.checkArgument;
import static com.amazon.dataquality.CommonUtils.checkNotNull;
import static com.amazon.dataquality.CommonUtils.toDouble;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import com.amazon.dataquality.exception.ConfigException;

/**
 * The immutable tabular result of a fetch: an ordered list of rows, each row a
 * mapping from column name to a scalar value (number, string, date or null).
 */
public class Dataset {

    private static final Dataset EMPTY = new Dataset(Collections.emptyList(), Collections.emptyList());

    private final List<String> columns;

    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Creates a dataset from rows. The column list is the union of the row keys in
     * order of first appearance; a row lacking a column reads as null.
     *
     * @param rows the rows, copied
     * @return a dataset
     */
    public static Dataset of(List<? extends Map<String, ?>> rows) {
        checkNotNull(rows, "rows must not be null");
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            checkNotNull(row, "rows must not contain null");
            columns.addAll(row.keySet());
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new Dataset(Collections.unmodifiableList(new ArrayList<>(columns)),
                Collections.unmodifiableList(copy));
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        checkArgument(index >= 0 && index < rows.size(), "row index out of range");
        return rows.get(index);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Schema check performed at analyzer entry. An empty dataset carries no
     * schema and always passes.
     *
     * @param required columns the analysis refers to
     * @throws ConfigException naming every missing column
     */
    public void requireColumns(Collection<String> required) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!columns.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw ConfigException.missingColumns(missing);
        }
    }

    /**
     * @param column a column name
     * @return the column as doubles, NaN wherever the cell is null or not numeric
     */
    public double[] getNumericColumn(String column) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = toDouble(rows.get(i).get(column));
        }
        return values;
    }

    /**
     * @param column a column name
     * @return the column as strings, null cells stay null
     */
    public List<String> getStringColumn(String column) {
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            values.add(value == null ? null : value.toString());
        }
        return values;
    }

    /**
     * @param column a column name
     * @return the column as dates, null where the cell cannot be read as a date
     */
    public List<LocalDate> getDateColumn(String column) {
        List<LocalDate> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(toLocalDate(row.get(column)));
        }
        return values;
    }

    public Dataset filter(Predicate<Map<String, Object>> predicate) {
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new Dataset(columns, Collections.unmodifiableList(kept));
    }

    /**
     * Reads a date out of a cell holding a {@link LocalDate}, a date-time or an
     * ISO-8601 string.
     *
     * @param value a cell
     * @return the date, or null if the cell is not a date
     */
    public static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDate();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "Dataset(" + rows.size() + " rows, columns=" + columns + ")";
    }
}
