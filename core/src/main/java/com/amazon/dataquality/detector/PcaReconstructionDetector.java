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

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.exception.AlgorithmException;
import com.amazon.dataquality.statistics.Percentiles;

/**
 * Projects every row onto the dominant principal components and scores it by
 * the mean squared reconstruction error. The basis is the smallest one that
 * captures {@code varianceRetained} of the total variance, with at least one
 * and at most {@code d - 1} components so that some residual always remains.
 */
@Getter
public class PcaReconstructionDetector implements AnomalyDetector {

    private final double varianceRetained;

    public PcaReconstructionDetector(double varianceRetained) {
        checkArgument(varianceRetained > 0 && varianceRetained <= 1, "varianceRetained must be in (0, 1]");
        this.varianceRetained = varianceRetained;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.PCA_RECONSTRUCTION;
    }

    @Override
    public DetectionOutput detect(double[][] points, double contamination) {
        int n = points.length;
        if (n < 2) {
            throw new AlgorithmException(getType(), "PCA needs at least 2 rows, got " + n);
        }
        int d = points[0].length;
        if (d < 2) {
            throw new AlgorithmException(getType(), "PCA needs at least 2 features, got " + d);
        }

        double[] means = new double[d];
        for (double[] point : points) {
            for (int j = 0; j < d; j++) {
                means[j] += point[j] / n;
            }
        }

        RealVector[] components;
        int retained;
        try {
            RealMatrix covariance = new Covariance(points).getCovarianceMatrix();
            EigenDecomposition decomposition = new EigenDecomposition(covariance);
            double[] eigenvalues = decomposition.getRealEigenvalues();
            Integer[] order = new Integer[d];
            for (int j = 0; j < d; j++) {
                order[j] = j;
            }
            Arrays.sort(order, Comparator.comparingDouble((Integer j) -> -eigenvalues[j]));

            double total = 0;
            for (double value : eigenvalues) {
                total += Math.max(0, value);
            }
            if (!(total > 0)) {
                throw new AlgorithmException(getType(), "features have no variance");
            }
            retained = 0;
            double captured = 0;
            while (retained < d - 1 && captured / total < varianceRetained) {
                captured += Math.max(0, eigenvalues[order[retained]]);
                retained++;
            }
            retained = Math.max(1, retained);
            components = new RealVector[retained];
            for (int c = 0; c < retained; c++) {
                components[c] = decomposition.getEigenvector(order[c]);
            }
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            throw new AlgorithmException(getType(), "eigen decomposition failed: " + e.getMessage(), e);
        }

        double[] scores = new double[n];
        double[] centered = new double[d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                centered[j] = points[i][j] - means[j];
            }
            double[] reconstruction = new double[d];
            for (RealVector component : components) {
                double projection = 0;
                for (int j = 0; j < d; j++) {
                    projection += centered[j] * component.getEntry(j);
                }
                for (int j = 0; j < d; j++) {
                    reconstruction[j] += projection * component.getEntry(j);
                }
            }
            double error = 0;
            for (int j = 0; j < d; j++) {
                double t = centered[j] - reconstruction[j];
                error += t * t;
            }
            scores[i] = error / d;
        }

        double percentile = 100 * (1 - contamination);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("components", retained);
        diagnostics.put("threshold", Percentiles.percentile(scores, percentile));
        return new DetectionOutput(Percentiles.indicesAbove(scores, percentile), scores, diagnostics);
    }
}
