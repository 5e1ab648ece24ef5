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

import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A row filter of a query intent.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Filter {

    public enum Operator {
        NOT_NULL, EQUALS
    }

    private final String column;

    private final Operator operator;

    private final Object value;

    private Filter(String column, Operator operator, Object value) {
        this.column = checkNotNull(column, "column must not be null");
        this.operator = operator;
        this.value = value;
    }

    public static Filter notNull(String column) {
        return new Filter(column, Operator.NOT_NULL, null);
    }

    public static Filter equalTo(String column, Object value) {
        return new Filter(column, Operator.EQUALS, checkNotNull(value, "value must not be null"));
    }

    public boolean test(Object cell) {
        switch (operator) {
        case NOT_NULL:
            return cell != null;
        case EQUALS:
            return cell != null && Objects.equals(cell.toString(), value.toString());
        default:
            throw new IllegalStateException("unsupported operator " + operator);
        }
    }
}
