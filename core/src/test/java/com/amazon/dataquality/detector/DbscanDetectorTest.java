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

package com.amazon.dataquality.detector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.dataquality.exception.AlgorithmException;

public class DbscanDetectorTest {

    private double[][] points;

    @BeforeEach
    public void setUp() {
        // two 5 x 2 grids far apart and one stray point
        points = new double[21][];
        int position = 0;
        for (int x = 0; x < 5; x++) {
            for (int y = 0; y < 2; y++) {
                points[position++] = new double[] { x, y };
                points[position++] = new double[] { 100 + x, 100 + y };
            }
        }
        points[20] = new double[] { 50, -50 };
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.01, 0.1, 0.5 })
    public void testStrayPointIsNoise(double contamination) {
        DetectionOutput output = new DbscanDetector().detect(points, contamination);
        assertArrayEquals(new int[] { 20 }, output.getIndices());
        assertEquals(2, output.getDiagnostics().get("clusters"));
        assertEquals(4, output.getDiagnostics().get("minPoints"));
        assertEquals(Math.sqrt(2), (Double) output.getDiagnostics().get("eps"), 1e-12);
    }

    @Test
    public void testTooFewRows() {
        double[][] few = { { 0, 0 }, { 1, 0 }, { 0, 1 }, { 1, 1 } };
        AlgorithmException e = assertThrows(AlgorithmException.class, () -> new DbscanDetector().detect(few, 0.1));
        assertEquals("density clustering needs more than 4 rows, got 4", e.getMessage());
    }

    @Test
    public void testOneDimensionalNeighborhood() {
        double[][] line = { { 0 }, { 1 }, { 2 }, { 3 }, { 4 }, { 40 } };
        DetectionOutput output = new DbscanDetector().detect(line, 0.1);
        assertEquals(2, output.getDiagnostics().get("minPoints"));
        assertArrayEquals(new int[] { 5 }, output.getIndices());
    }
}
