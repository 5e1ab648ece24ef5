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

package com.amazon.dataquality.config;

import java.util.Locale;

import com.amazon.dataquality.detector.AnomalyDetector;
import com.amazon.dataquality.detector.DbscanDetector;
import com.amazon.dataquality.detector.IsolationForestDetector;
import com.amazon.dataquality.detector.LocalOutlierFactorDetector;
import com.amazon.dataquality.detector.PcaReconstructionDetector;
import com.amazon.dataquality.exception.ConfigException;

/**
 * The ensemble members available to the multivariate analysis. Each constant
 * knows how to create its detector from a configuration; adding an algorithm
 * means adding a constant here.
 */
public enum DetectorType {

    /**
     * random partitioning ensemble, shorter average isolation depth is more
     * anomalous
     */
    ISOLATION_FOREST("iforest") {
        @Override
        public AnomalyDetector newDetector(MultivariateConfig config) {
            return new IsolationForestDetector(config.getNumberOfTrees(), config.getSampleSize(),
                    config.getRandomSeed());
        }
    },
    /**
     * local density compared to the density of the k nearest neighbors
     */
    LOCAL_OUTLIER_FACTOR("lof") {
        @Override
        public AnomalyDetector newDetector(MultivariateConfig config) {
            return new LocalOutlierFactorDetector();
        }
    },
    /**
     * squared error after projecting onto the dominant principal components
     */
    PCA_RECONSTRUCTION("pca") {
        @Override
        public AnomalyDetector newDetector(MultivariateConfig config) {
            return new PcaReconstructionDetector(config.getVarianceRetained());
        }
    },
    /**
     * points left unassigned by density clustering
     */
    DBSCAN("density_clustering") {
        @Override
        public AnomalyDetector newDetector(MultivariateConfig config) {
            return new DbscanDetector();
        }
    };

    private final String alias;

    DetectorType(String alias) {
        this.alias = alias;
    }

    public abstract AnomalyDetector newDetector(MultivariateConfig config);

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a configured algorithm name. Accepts the constant name in any case
     * and the short aliases ("lof", "pca", "iforest").
     *
     * @param name configured algorithm name
     * @return the matching detector type
     * @throws ConfigException if the name is unknown
     */
    public static DetectorType fromName(String name) {
        if (name == null) {
            throw ConfigException.missingField("algorithms");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DetectorType type : values()) {
            if (type.label().equals(normalized) || type.alias.equals(normalized)) {
                return type;
            }
        }
        throw new ConfigException("unknown algorithm: " + name);
    }
}
