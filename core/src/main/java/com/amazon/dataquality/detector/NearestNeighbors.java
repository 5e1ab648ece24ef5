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

import static com.amazon.dataquality.CommonUtils.checkArgument;
import static com.amazon.dataquality.CommonUtils.distance;

import java.util.Arrays;

/**
 * Exact k nearest neighbors of every point of a small matrix, by brute force.
 * A point is never its own neighbor; ties are resolved in favor of the lower
 * index so that results are reproducible.
 */
public class NearestNeighbors {

    private final int k;

    private final int[][] indices;

    private final double[][] distances;

    private NearestNeighbors(int k, int[][] indices, double[][] distances) {
        this.k = k;
        this.indices = indices;
        this.distances = distances;
    }

    /**
     * @param points n x d matrix
     * @param k      number of neighbors, in [1, n - 1]
     * @return neighbors sorted by increasing distance
     */
    public static NearestNeighbors compute(double[][] points, int k) {
        checkArgument(k >= 1 && k < points.length, "k must be in [1, n - 1]");
        int n = points.length;
        int[][] indices = new int[n][k];
        double[][] distances = new double[n][k];
        for (int i = 0; i < n; i++) {
            Arrays.fill(distances[i], Double.POSITIVE_INFINITY);
            Arrays.fill(indices[i], -1);
            for (int j = 0; j < n; j++) {
                if (j == i) {
                    continue;
                }
                double d = distance(points[i], points[j]);
                if (d < distances[i][k - 1]) {
                    int position = k - 1;
                    while (position > 0 && distances[i][position - 1] > d) {
                        distances[i][position] = distances[i][position - 1];
                        indices[i][position] = indices[i][position - 1];
                        --position;
                    }
                    distances[i][position] = d;
                    indices[i][position] = j;
                }
            }
        }
        return new NearestNeighbors(k, indices, distances);
    }

    public int getK() {
        return k;
    }

    public int getNeighbor(int point, int rank) {
        return indices[point][rank];
    }

    public double getDistance(int point, int rank) {
        return distances[point][rank];
    }

    /**
     * @return distance from the point to its k-th neighbor
     */
    public double getKDistance(int point) {
        return distances[point][k - 1];
    }
}
