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

import static com.amazon.dataquality.CommonUtils.checkArgument;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Percentiles with linear interpolation between closest ranks, the convention
 * used for every threshold in this library.
 */
public class Percentiles {

    private Percentiles() {
    }

    /**
     * @param values the sample, not modified
     * @param p      the percentile in [0, 100]
     * @return the interpolated percentile, NaN for an empty sample
     */
    public static double percentile(double[] values, double p) {
        checkArgument(p >= 0 && p <= 100, "percentile must be in [0, 100]");
        if (values.length == 0) {
            return Double.NaN;
        }
        if (p == 0) {
            // commons-math requires p > 0
            double min = values[0];
            for (double value : values) {
                min = Math.min(min, value);
            }
            return min;
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /**
     * Indices whose value is strictly above the given percentile of all values,
     * in ascending index order.
     *
     * @param scores one score per row, larger is more anomalous
     * @param p      the percentile in [0, 100]
     * @return flagged indices
     */
    public static int[] indicesAbove(double[] scores, double p) {
        double threshold = percentile(scores, p);
        int count = 0;
        for (double score : scores) {
            if (score > threshold) {
                ++count;
            }
        }
        int[] indices = new int[count];
        int position = 0;
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > threshold) {
                indices[position++] = i;
            }
        }
        return indices;
    }
}
