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

import static com.amazon.dataquality.CommonUtils.distance;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.statistics.Percentiles;

/**
 * Density clustering; the rows left as noise are the anomalies. The minimum
 * neighborhood is {@code k = min(5, 2d)} points including the point itself and
 * the radius is the 75th percentile of the distance to the k-th point. The
 * contamination level is ignored.
 */
public class DbscanDetector implements AnomalyDetector {

    public static final int MAX_MIN_POINTS = 5;

    public static final double RADIUS_PERCENTILE = 75;

    @Override
    public DetectorType getType() {
        return DetectorType.DBSCAN;
    }

    @Override
    public DetectionOutput detect(double[][] points, double contamination) {
        int n = points.length;
        int minPoints = Math.min(MAX_MIN_POINTS, 2 * points[0].length);
        if (n < minPoints + 1) {
            throw new AlgorithmException(getType(),
                    "density clustering needs more than " + minPoints + " rows, got " + n);
        }
        // the point itself is the first of its minPoints
        NearestNeighbors neighbors = NearestNeighbors.compute(points, minPoints - 1);
        double[] kDistances = new double[n];
        for (int i = 0; i < n; i++) {
            kDistances[i] = neighbors.getKDistance(i);
        }
        double eps = Percentiles.percentile(kDistances, RADIUS_PERCENTILE);

        List<int[]> regions = new ArrayList<>(n);
        boolean[] core = new boolean[n];
        for (int i = 0; i < n; i++) {
            int[] region = regionQuery(points, i, eps);
            regions.add(region);
            core[i] = region.length + 1 >= minPoints;
        }

        int[] labels = new int[n];
        int clusters = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < n; i++) {
            if (!core[i] || labels[i] != 0) {
                continue;
            }
            ++clusters;
            labels[i] = clusters;
            queue.add(i);
            while (!queue.isEmpty()) {
                int p = queue.poll();
                for (int q : regions.get(p)) {
                    if (labels[q] == 0) {
                        labels[q] = clusters;
                        if (core[q]) {
                            queue.add(q);
                        }
                    }
                }
            }
        }

        int noise = 0;
        for (int label : labels) {
            if (label == 0) {
                ++noise;
            }
        }
        int[] indices = new int[noise];
        int position = 0;
        for (int i = 0; i < n; i++) {
            if (labels[i] == 0) {
                indices[position++] = i;
            }
        }

        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("eps", eps);
        diagnostics.put("minPoints", minPoints);
        diagnostics.put("clusters", clusters);
        return new DetectionOutput(indices, kDistances, diagnostics);
    }

    private static int[] regionQuery(double[][] points, int index, double eps) {
        int count = 0;
        int[] buffer = new int[8];
        for (int j = 0; j < points.length; j++) {
            if (j != index && distance(points[index], points[j]) <= eps) {
                if (count == buffer.length) {
                    int[] grown = new int[2 * count];
                    System.arraycopy(buffer, 0, grown, 0, count);
                    buffer = grown;
                }
                buffer[count++] = j;
            }
        }
        int[] region = new int[count];
        System.arraycopy(buffer, 0, region, 0, count);
        return region;
    }
}
