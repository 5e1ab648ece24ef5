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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A dialect-neutral description of what an analyzer needs from the warehouse.
 * An intent either projects raw {@code columns} or computes
 * {@code aggregations} grouped by {@code groupBy} columns and, optionally, by a
 * date bucket.
 */
@Getter
@ToString
public class QueryIntent {

    /**
     * name of the output column holding the bucket start when a date bucket is
     * requested
     */
    public static final String PERIOD_COLUMN = "period";

    private final String model;

    private final List<String> columns;

    private final List<Aggregation> aggregations;

    private final List<String> groupBy;

    private final String dateColumn;

    private final DateRange dateRange;

    private final DateBucket dateBucket;

    private final List<Filter> filters;

    private final List<String> orderBy;

    private final boolean descending;

    protected QueryIntent(Builder builder) {
        this.model = builder.model;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.aggregations = Collections.unmodifiableList(new ArrayList<>(builder.aggregations));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.dateColumn = builder.dateColumn;
        this.dateRange = builder.dateRange;
        this.dateBucket = builder.dateBucket;
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.descending = builder.descending;
    }

    public static Builder builder(String model) {
        return new Builder(model);
    }

    public boolean isAggregated() {
        return !aggregations.isEmpty() || !groupBy.isEmpty() || dateBucket != null;
    }

    public static class Builder {

        private final String model;
        private final List<String> columns = new ArrayList<>();
        private final List<Aggregation> aggregations = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private String dateColumn;
        private DateRange dateRange;
        private DateBucket dateBucket;
        private final List<Filter> filters = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();
        private boolean descending = false;

        Builder(String model) {
            this.model = checkNotNull(model, "model must not be null");
        }

        public QueryIntent build() {
            checkArgument(dateRange == null || dateColumn != null, "a date range requires a date column");
            checkArgument(dateBucket == null || dateColumn != null, "a date bucket requires a date column");
            checkArgument(columns.isEmpty() || aggregations.isEmpty(),
                    "raw columns and aggregations cannot be mixed");
            return new QueryIntent(this);
        }

        public Builder columns(List<String> columns) {
            this.columns.addAll(columns);
            return this;
        }

        public Builder column(String column) {
            this.columns.add(column);
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregations.add(aggregation);
            return this;
        }

        public Builder groupBy(String column) {
            this.groupBy.add(column);
            return this;
        }

        public Builder dateColumn(String dateColumn) {
            this.dateColumn = dateColumn;
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder dateBucket(DateBucket dateBucket) {
            this.dateBucket = dateBucket;
            return this;
        }

        public Builder filter(Filter filter) {
            this.filters.add(filter);
            return this;
        }

        public Builder orderBy(String column) {
            this.orderBy.add(column);
            return this;
        }

        public Builder descending(boolean descending) {
            this.descending = descending;
            return this;
        }
    }
}
