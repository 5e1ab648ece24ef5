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

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.statistics.Percentiles;
import com.amazon.dataquality.tree.IsolationForest;

/**
 * Flags the rows whose isolation score is strictly above the
 * {@code (1 - contamination)} percentile of all scores. The forest is fitted
 * and scored on the same matrix.
 */
@Getter
public class IsolationForestDetector implements AnomalyDetector {

    private final int numberOfTrees;

    private final int sampleSize;

    private final long seed;

    public IsolationForestDetector(int numberOfTrees, int sampleSize, long seed) {
        checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(sampleSize > 1, "sampleSize must be greater than 1");
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.ISOLATION_FOREST;
    }

    /**
     * Fits a forest with this detector's settings.
     *
     * @param points training matrix
     * @return the fitted forest
     * @throws AlgorithmException if there are fewer than two rows
     */
    public IsolationForest fit(double[][] points) {
        if (points.length < 2) {
            throw new AlgorithmException(getType(), "isolation forest needs at least 2 rows, got " + points.length);
        }
        return IsolationForest.fit(points, numberOfTrees, sampleSize, seed);
    }

    @Override
    public DetectionOutput detect(double[][] points, double contamination) {
        IsolationForest forest = fit(points);
        double[] scores = forest.score(points);
        double percentile = 100 * (1 - contamination);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("threshold", Percentiles.percentile(scores, percentile));
        diagnostics.put("numberOfTrees", numberOfTrees);
        diagnostics.put("sampleSize", forest.getSampleSize());
        return new DetectionOutput(Percentiles.indicesAbove(scores, percentile), scores, diagnostics);
    }
}
