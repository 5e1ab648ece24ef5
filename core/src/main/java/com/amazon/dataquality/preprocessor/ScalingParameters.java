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

package com.amazon.dataquality.preprocessor;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * The fitted state of a robust scaling: per column the fill value used for
 * missing entries, the shift (median) and the scale (interquartile range or its
 * fallback). It is produced by {@link FeaturePreparer#fit} and lives only as
 * long as the analysis that fitted it.
 */
@ToString
@EqualsAndHashCode
public class ScalingParameters {

    private final double[] fillValues;

    private final double[] shifts;

    private final double[] scales;

    private final double clipFactor;

    public ScalingParameters(double[] fillValues, double[] shifts, double[] scales, double clipFactor) {
        checkArgument(fillValues.length == shifts.length && shifts.length == scales.length,
                "incorrect lengths of parameters");
        checkArgument(clipFactor > 0, "clipFactor must be positive");
        for (double scale : scales) {
            checkArgument(scale > 0, "scales must be positive");
        }
        this.fillValues = Arrays.copyOf(fillValues, fillValues.length);
        this.shifts = Arrays.copyOf(shifts, shifts.length);
        this.scales = Arrays.copyOf(scales, scales.length);
        this.clipFactor = clipFactor;
    }

    public int getDimensions() {
        return shifts.length;
    }

    public double getFillValue(int i) {
        return fillValues[i];
    }

    public double getShift(int i) {
        return shifts[i];
    }

    public double getScale(int i) {
        return scales[i];
    }

    public double getClipFactor() {
        return clipFactor;
    }
}
