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

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * The smallest axis-aligned box containing a subset of the rows of a matrix.
 */
public class BoundingBox {

    private final double[] minValues;
    private final double[] maxValues;
    private final double rangeSum;

    public BoundingBox(double[][] points, int[] rows, int from, int to) {
        checkArgument(from < to, "a bounding box needs at least one point");
        int dimensions = points[rows[from]].length;
        minValues = Arrays.copyOf(points[rows[from]], dimensions);
        maxValues = Arrays.copyOf(points[rows[from]], dimensions);
        for (int i = from + 1; i < to; i++) {
            double[] point = points[rows[i]];
            for (int j = 0; j < dimensions; j++) {
                minValues[j] = Math.min(minValues[j], point[j]);
                maxValues[j] = Math.max(maxValues[j], point[j]);
            }
        }
        double sum = 0;
        for (int j = 0; j < dimensions; j++) {
            sum += maxValues[j] - minValues[j];
        }
        rangeSum = sum;
    }

    public int getDimensions() {
        return minValues.length;
    }

    public double getMinValue(int dimension) {
        return minValues[dimension];
    }

    public double getMaxValue(int dimension) {
        return maxValues[dimension];
    }

    public double getRangeSum() {
        return rangeSum;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", Arrays.toString(minValues), Arrays.toString(maxValues));
    }
}
