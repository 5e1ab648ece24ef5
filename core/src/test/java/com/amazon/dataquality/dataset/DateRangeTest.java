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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

public class DateRangeTest {

    @Test
    public void testHalfOpen() {
        DateRange range = new DateRange(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 8));
        assertTrue(range.contains(LocalDate.of(2024, 1, 1)));
        assertTrue(range.contains(LocalDate.of(2024, 1, 7)));
        assertFalse(range.contains(LocalDate.of(2024, 1, 8)));
        assertFalse(range.contains(LocalDate.of(2023, 12, 31)));
        assertFalse(range.contains(null));
        assertEquals("[2024-01-01, 2024-01-08)", range.toString());
    }

    @Test
    public void testLastDays() {
        DateRange range = DateRange.lastDays(LocalDate.of(2024, 6, 30), 30);
        assertEquals(LocalDate.of(2024, 5, 31), range.getStart());
        assertTrue(range.contains(LocalDate.of(2024, 7, 1)));
        assertEquals("[2024-05-31, +inf)", range.toString());
        assertThrows(IllegalArgumentException.class, () -> DateRange.lastDays(LocalDate.of(2024, 6, 30), 0));
    }

    @Test
    public void testInvalidRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new DateRange(LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 8)));
    }

    @Test
    public void testWeekBucket() {
        // 2024-06-30 is a Sunday
        assertEquals(LocalDate.of(2024, 6, 24), DateBucket.WEEK.truncate(LocalDate.of(2024, 6, 30)));
        assertEquals(LocalDate.of(2024, 6, 24), DateBucket.WEEK.truncate(LocalDate.of(2024, 6, 24)));
        assertEquals(LocalDate.of(2024, 6, 30), DateBucket.DAY.truncate(LocalDate.of(2024, 6, 30)));
    }
}
