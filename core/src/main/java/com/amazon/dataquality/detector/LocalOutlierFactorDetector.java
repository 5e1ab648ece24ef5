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

import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.statistics.Percentiles;

/**
 * Local outlier factor. The neighborhood size is
 * {@code k = max(1, min(20, n / 5))}; a factor well above 1 means the row sits
 * in a sparser region than its neighbors.
 */
public class LocalOutlierFactorDetector implements AnomalyDetector {

    public static final int MAX_NEIGHBORS = 20;

    // keeps the local reachability density finite for duplicated points
    private static final double DENSITY_EPSILON = 1e-10;

    @Override
    public DetectorType getType() {
        return DetectorType.LOCAL_OUTLIER_FACTOR;
    }

    static int neighborCount(int n) {
        return Math.min(Math.max(1, Math.min(MAX_NEIGHBORS, n / 5)), n - 1);
    }

    @Override
    public DetectionOutput detect(double[][] points, double contamination) {
        int n = points.length;
        if (n < 2) {
            throw new AlgorithmException(getType(), "local outlier factor needs at least 2 rows, got " + n);
        }
        int k = neighborCount(n);
        NearestNeighbors neighbors = NearestNeighbors.compute(points, k);

        double[] density = new double[n];
        for (int i = 0; i < n; i++) {
            double reach = 0;
            for (int r = 0; r < k; r++) {
                int o = neighbors.getNeighbor(i, r);
                reach += Math.max(neighbors.getKDistance(o), neighbors.getDistance(i, r));
            }
            density[i] = 1.0 / (reach / k + DENSITY_EPSILON);
        }

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            for (int r = 0; r < k; r++) {
                sum += density[neighbors.getNeighbor(i, r)];
            }
            scores[i] = sum / k / density[i];
        }

        double percentile = 100 * (1 - contamination);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("neighbors", k);
        diagnostics.put("threshold", Percentiles.percentile(scores, percentile));
        return new DetectionOutput(Percentiles.indicesAbove(scores, percentile), scores, diagnostics);
    }
}
