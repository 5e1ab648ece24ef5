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

import java.util.Locale;

import com.amazon.dataquality.exception.ConfigException;

/**
 * Options for computing the pairwise correlation coefficient.
 */
public enum CorrelationMethod {

    /**
     * linear correlation, with a p-value from the t distribution
     */
    PEARSON,
    /**
     * rank correlation, with a p-value from the t approximation
     */
    SPEARMAN,
    /**
     * plain covariance ratio, without a significance value
     */
    COVARIANCE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CorrelationMethod fromName(String name) {
        if (name == null) {
            throw ConfigException.missingField("correlation_type");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            // anything else falls back to the basic ratio
            return COVARIANCE;
        }
    }
}
