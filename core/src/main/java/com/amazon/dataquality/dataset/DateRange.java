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

import java.time.LocalDate;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A half-open range of dates {@code [start, end)}. Either side may be open
 * (null).
 */
@Getter
@EqualsAndHashCode
public class DateRange {

    private final LocalDate start;

    private final LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        checkArgument(start == null || end == null || start.isBefore(end), "start must be before end");
        this.start = start;
        this.end = end;
    }

    /**
     * @param today the current date
     * @param days  number of days to look back
     * @return the range starting {@code days} before today, open to the future
     */
    public static DateRange lastDays(LocalDate today, int days) {
        checkArgument(days > 0, "days must be positive");
        return new DateRange(today.minusDays(days), null);
    }

    public boolean contains(LocalDate date) {
        if (date == null) {
            return false;
        }
        return (start == null || !date.isBefore(start)) && (end == null || date.isBefore(end));
    }

    @Override
    public String toString() {
        return "[" + (start == null ? "-inf" : start) + ", " + (end == null ? "+inf" : end) + ")";
    }
}
