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

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar buckets used to group rows by their date column. Grouped rows carry
 * the start of their bucket in {@link QueryIntent#PERIOD_COLUMN}.
 */
public enum DateBucket {

    DAY {
        @Override
        public LocalDate truncate(LocalDate date) {
            return date;
        }
    },
    /**
     * weeks start on Monday
     */
    WEEK {
        @Override
        public LocalDate truncate(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }
    };

    public abstract LocalDate truncate(LocalDate date);
}
