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

package com.amazon.dataquality.exception;

import lombok.Getter;

import com.amazon.dataquality.config.DetectorType;

/**
 * A single ensemble member failed numerically. The failure is isolated to that
 * member and does not abort the multivariate analysis, unless every member
 * failed; the detector type is null in that case.
 */
@Getter
public class AlgorithmException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DetectorType detectorType;

    public AlgorithmException(String message) {
        this(null, message);
    }

    public AlgorithmException(DetectorType detectorType, String message) {
        super(message);
        this.detectorType = detectorType;
    }

    public AlgorithmException(DetectorType detectorType, String message, Throwable cause) {
        super(message, cause);
        this.detectorType = detectorType;
    }
}
