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

/**
 * Ordered classification of findings used downstream to pick a notification
 * channel and urgency. Declaration order is from most to least severe.
 */
public enum Severity {

    CRITICAL,

    HIGH,

    MEDIUM,

    LOW;

    /**
     * @param other another severity
     * @return true if this severity ranks above the other one
     */
    public boolean isMoreSevereThan(Severity other) {
        return this.ordinal() < other.ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
