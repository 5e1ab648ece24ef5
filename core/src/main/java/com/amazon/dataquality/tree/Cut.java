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

/**
 * A Cut represents a division of space into two half-spaces. Cuts define the
 * structure of an {@link IsolationTree} and determine the path a point takes
 * when it is scored.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * Create a new Cut with the given dimension and value.
     *
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * If the point's value in the cut dimension is less than or equal to the cut
     * value this method returns true, otherwise it returns false.
     *
     * @param point A point that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the point goes to the left child of the cut
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] <= cut.getValue();
    }

    /**
     * Chooses a cut for the given box. The dimension is chosen with probability
     * proportional to its side length and the value is uniform along that side,
     * in the half-open interval [min, max) so that both children are non-empty.
     *
     * @param factor a uniform random number in [0, 1)
     * @param box    the box of the points to be separated; must not be a single
     *               point
     * @return the cut
     */
    public static Cut randomCut(double factor, BoundingBox box) {
        double range = box.getRangeSum();
        if (!(range > 0)) {
            throw new IllegalArgumentException("the box is a single point " + box);
        }
        double breakPoint = factor * range;
        for (int i = 0; i < box.getDimensions(); i++) {
            double minValue = box.getMinValue(i);
            double maxValue = box.getMaxValue(i);
            double gap = maxValue - minValue;
            if (gap > 0 && breakPoint <= gap) {
                double cutValue = minValue + breakPoint;
                if (cutValue >= maxValue) {
                    cutValue = Math.nextAfter(maxValue, minValue);
                }
                return new Cut(i, cutValue);
            }
            breakPoint -= gap;
        }

        // floating point residue; cut the last dimension that has extent
        for (int i = box.getDimensions() - 1; i >= 0; i--) {
            if (box.getMaxValue(i) > box.getMinValue(i)) {
                return new Cut(i, Math.nextAfter(box.getMaxValue(i), box.getMinValue(i)));
            }
        }
        throw new IllegalStateException("the box has no extent " + box);
    }

    /**
     * @return the 0-based index of the dimension that this cut was made in.
     */
    public int getDimension() {
        return dimension;
    }

    /**
     * @return the value of the cut.
     */
    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}
