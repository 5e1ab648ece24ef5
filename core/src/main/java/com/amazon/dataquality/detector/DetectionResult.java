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
import static com.amazon.dataquality.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.dataquality.config.DetectorType;
import com.amazon.dataquality.exception.AlgorithmException;

/**
 * The outcome of running one detector: either its output or the error that
 * stopped it. The consensus only consumes successful results; failures are
 * kept for diagnostics.
 */
@Slf4j
@Getter
public class DetectionResult {

    private final DetectorType type;

    private final DetectionOutput output;

    private final AlgorithmException error;

    private DetectionResult(DetectorType type, DetectionOutput output, AlgorithmException error) {
        checkArgument((output == null) != (error == null), "exactly one of output and error must be set");
        this.type = checkNotNull(type, "type must not be null");
        this.output = output;
        this.error = error;
    }

    public static DetectionResult success(DetectorType type, DetectionOutput output) {
        return new DetectionResult(type, checkNotNull(output, "output must not be null"), null);
    }

    public static DetectionResult failure(DetectorType type, AlgorithmException error) {
        return new DetectionResult(type, null, checkNotNull(error, "error must not be null"));
    }

    /**
     * Runs a detector and captures an {@link AlgorithmException} as a failed
     * result.
     */
    public static DetectionResult run(AnomalyDetector detector, double[][] points, double contamination) {
        try {
            return success(detector.getType(), detector.detect(points, contamination));
        } catch (AlgorithmException e) {
            log.warn("{} failed: {}", detector.getType().label(), e.getMessage());
            return failure(detector.getType(), e);
        }
    }

    public boolean isSuccess() {
        return output != null;
    }

    public Optional<DetectionOutput> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<AlgorithmException> getError() {
        return Optional.ofNullable(error);
    }
}
