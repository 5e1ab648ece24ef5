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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single aggregated output column of a query intent.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Aggregation {

    private final AggregateFunction function;

    // null only for COUNT, meaning all rows
    private final String column;

    private final String alias;

    public Aggregation(AggregateFunction function, String column, String alias) {
        checkNotNull(function, "function must not be null");
        checkNotNull(alias, "alias must not be null");
        checkArgument(column != null || function == AggregateFunction.COUNT, "only COUNT may omit the column");
        this.function = function;
        this.column = column;
        this.alias = alias;
    }

    public static Aggregation count(String alias) {
        return new Aggregation(AggregateFunction.COUNT, null, alias);
    }

    public static Aggregation sum(String column, String alias) {
        return new Aggregation(AggregateFunction.SUM, column, alias);
    }

    public static Aggregation avg(String column, String alias) {
        return new Aggregation(AggregateFunction.AVG, column, alias);
    }

    public static Aggregation stddev(String column, String alias) {
        return new Aggregation(AggregateFunction.STDDEV, column, alias);
    }
}
