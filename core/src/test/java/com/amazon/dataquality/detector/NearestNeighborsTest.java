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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class NearestNeighborsTest {

    @Test
    public void testNeighborsSortedByDistance() {
        double[][] points = { { 0 }, { 1 }, { 3 }, { 6 } };
        NearestNeighbors neighbors = NearestNeighbors.compute(points, 2);
        assertEquals(2, neighbors.getK());
        assertEquals(1, neighbors.getNeighbor(0, 0));
        assertEquals(2, neighbors.getNeighbor(0, 1));
        assertEquals(3.0, neighbors.getKDistance(0));
        assertEquals(2, neighbors.getNeighbor(3, 0));
        assertEquals(3.0, neighbors.getDistance(3, 0));
        assertEquals(5.0, neighbors.getKDistance(3));
    }

    @Test
    public void testTiesPreferLowerIndex() {
        double[][] points = { { 0 }, { 1 }, { 2 } };
        NearestNeighbors neighbors = NearestNeighbors.compute(points, 2);
        assertEquals(0, neighbors.getNeighbor(1, 0));
        assertEquals(2, neighbors.getNeighbor(1, 1));
    }

    @Test
    public void testPointIsNotItsOwnNeighbor() {
        double[][] points = { { 1, 1 }, { 1, 1 }, { 5, 5 } };
        NearestNeighbors neighbors = NearestNeighbors.compute(points, 1);
        assertEquals(1, neighbors.getNeighbor(0, 0));
        assertEquals(0.0, neighbors.getKDistance(0));
        assertEquals(0, neighbors.getNeighbor(1, 0));
    }

    @Test
    public void testInvalidK() {
        double[][] points = { { 0 }, { 1 } };
        assertThrows(IllegalArgumentException.class, () -> NearestNeighbors.compute(points, 0));
        assertThrows(IllegalArgumentException.class, () -> NearestNeighbors.compute(points, 2));
    }
}
