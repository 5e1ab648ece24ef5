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

package com.amazon.dataquality.statistics;

import static com.amazon.dataquality.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class PercentilesTest {

    private static final double[] VALUES = { 5, 1, 4, 2, 3 };

    @ParameterizedTest
    @CsvSource({ "0, 1.0", "25, 2.0", "50, 3.0", "90, 4.6", "100, 5.0" })
    public void testLinearInterpolation(double p, double expected) {
        assertThat(Percentiles.percentile(VALUES, p), closeTo(expected, EPSILON));
    }

    @Test
    public void testInputNotModified() {
        double[] values = VALUES.clone();
        Percentiles.median(values);
        assertArrayEquals(VALUES, values);
    }

    @Test
    public void testEmptyAndInvalid() {
        assertTrue(Double.isNaN(Percentiles.percentile(new double[0], 50)));
        assertThrows(IllegalArgumentException.class, () -> Percentiles.percentile(VALUES, 101));
        assertThrows(IllegalArgumentException.class, () -> Percentiles.percentile(VALUES, -1));
    }

    @Test
    public void testIndicesAbove() {
        double[] scores = { 1, 2, 100, 3, 4 };
        // 80th percentile is 4 + 0.2 * 96
        assertArrayEquals(new int[] { 2 }, Percentiles.indicesAbove(scores, 80));
        assertArrayEquals(new int[] { 1, 2, 3, 4 }, Percentiles.indicesAbove(scores, 0));
        assertThat(Percentiles.indicesAbove(scores, 100).length, is(0));
    }

    @Test
    public void testTiesAreNotFlagged() {
        double[] scores = { 1, 1, 1, 1 };
        assertEquals(0, Percentiles.indicesAbove(scores, 50).length);
    }
}
