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

package com.amazon.dataquality.exception;

/**
 * Raised when an analyzer configuration is invalid or insufficient, or when a
 * fetched dataset lacks a column the configuration refers to. It is always
 * raised before any computation starts.
 */
public class ConfigException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigException missingField(String field) {
        return new ConfigException("missing required field: " + field);
    }

    public static ConfigException unknownField(String field) {
        return new ConfigException("unknown field: " + field);
    }

    public static ConfigException missingColumns(Iterable<String> columns) {
        return new ConfigException("dataset is missing required columns: " + String.join(", ", columns));
    }
}
