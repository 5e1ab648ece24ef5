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

package com.amazon.dataquality.config;

/**
 * Parameters shared by all analyzers. Instances are immutable; they are
 * validated at the start of each analysis so that an invalid configuration
 * fails before any data is requested.
 */
public abstract class AnalysisConfig {

    public static final String DEFAULT_DATE_COLUMN = "created_at";

    /**
     * Checks every parameter and throws a
     * {@link com.amazon.dataquality.exception.ConfigException} naming the first
     * offending field.
     */
    public abstract void validate();

    /**
     * @return the column holding the event date, may be null where the analyzer
     *         allows it
     */
    public abstract String getDateColumn();
}
