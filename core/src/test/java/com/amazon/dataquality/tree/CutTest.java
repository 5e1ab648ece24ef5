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

package com.amazon.dataquality.tree;

import static com.amazon.dataquality.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CutTest {

    private BoundingBox box;

    @BeforeEach
    public void setUp() {
        double[][] points = { { 0, 0 }, { 2, 1 } };
        box = new BoundingBox(points, new int[] { 0, 1 }, 0, 2);
    }

    @Test
    public void testBoundingBox() {
        assertEquals(2, box.getDimensions());
        assertEquals(2.0, box.getMaxValue(0));
        assertEquals(0.0, box.getMinValue(1));
        assertEquals(3.0, box.getRangeSum());
    }

    @Test
    public void testCutDimensionProportionalToRange() {
        Cut first = Cut.randomCut(0.0, box);
        assertEquals(0, first.getDimension());
        assertEquals(0.0, first.getValue());

        Cut second = Cut.randomCut(0.9, box);
        assertEquals(1, second.getDimension());
        assertThat(second.getValue(), closeTo(0.7, EPSILON));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 0.3, 0.5, 0.66, 0.9, 0.9999999 })
    public void testCutSeparatesTheBox(double factor) {
        Cut cut = Cut.randomCut(factor, box);
        assertThat(cut.getValue(), lessThan(box.getMaxValue(cut.getDimension())));
        assertTrue(Cut.isLeftOf(new double[] { 0, 0 }, cut));
        assertFalse(Cut.isLeftOf(new double[] { 2, 1 }, cut));
    }

    @Test
    public void testSinglePointBox() {
        BoundingBox point = new BoundingBox(new double[][] { { 1, 1 } }, new int[] { 0 }, 0, 1);
        assertThrows(IllegalArgumentException.class, () -> Cut.randomCut(0.5, point));
    }
}
