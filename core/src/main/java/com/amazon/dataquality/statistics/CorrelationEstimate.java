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

package com.amazon.dataquality.statistics;

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A correlation coefficient in [-1, 1] with its significance, when the method
 * provides one.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CorrelationEstimate {

    private final double coefficient;

    private final Double pValue;

    private final int sampleSize;

    public CorrelationEstimate(double coefficient, Double pValue, int sampleSize) {
        this.coefficient = Math.max(-1.0, Math.min(1.0, coefficient));
        this.pValue = pValue;
        this.sampleSize = sampleSize;
    }

    public Optional<Double> getPValue() {
        return Optional.ofNullable(pValue);
    }
}
