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

import com.amazon.dataquality.config.DetectorType;

/**
 * One member of the multivariate ensemble. A detector receives the scaled
 * feature matrix of a single analysis and flags the rows it considers
 * anomalous. Detectors hold configuration only, never fitted state, so one
 * instance may serve concurrent analyses.
 */
public interface AnomalyDetector {

    DetectorType getType();

    /**
     * @param points        n x d scaled feature matrix
     * @param contamination expected fraction of anomalous rows, in (0, 0.5]
     * @return flagged row indices and a score per row, larger meaning more
     *         anomalous
     * @throws com.amazon.dataquality.exception.AlgorithmException if the
     *                                                             computation
     *                                                             cannot be
     *                                                             carried out
     *                                                             on this data
     */
    DetectionOutput detect(double[][] points, double contamination);
}
