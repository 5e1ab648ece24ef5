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
import static com.amazon.dataquality.CommonUtils.isFinite;
import static com.amazon.dataquality.statistics.Percentiles.median;
import static com.amazon.dataquality.statistics.Percentiles.percentile;

import java.util.List;

import com.amazon.dataquality.dataset.Dataset;

/**
 * Pure functions turning feature columns into a matrix fit for distance and
 * partition based detectors: missing, non-numeric and infinite values are
 * replaced by the column median, then each column is shifted by its median,
 * divided by its interquartile range and clipped. Medians and quartiles keep a
 * few extreme rows from dictating the scale.
 */
public class FeaturePreparer {

    /**
     * scale factor turning a median absolute deviation into a standard deviation
     * estimate for normal data
     */
    public static final double MAD_TO_SIGMA = 1.4826;

    private FeaturePreparer() {
    }

    /**
     * @param dataset  fetched rows
     * @param features feature columns, in order
     * @return an n x d matrix of raw values, NaN where a cell is not numeric
     */
    public static double[][] extract(Dataset dataset, List<String> features) {
        double[][] raw = new double[dataset.size()][features.size()];
        for (int j = 0; j < features.size(); j++) {
            double[] column = dataset.getNumericColumn(features.get(j));
            for (int i = 0; i < column.length; i++) {
                raw[i][j] = column[i];
            }
        }
        return raw;
    }

    /**
     * Fits the robust scaling on raw values.
     *
     * @param raw        n x d raw matrix, n at least 1
     * @param clipFactor bound on the absolute value of a scaled entry
     * @return the fitted parameters
     */
    public static ScalingParameters fit(double[][] raw, double clipFactor) {
        checkArgument(raw.length > 0, "cannot fit on an empty matrix");
        int dimensions = raw[0].length;
        double[] fillValues = new double[dimensions];
        double[] shifts = new double[dimensions];
        double[] scales = new double[dimensions];
        for (int j = 0; j < dimensions; j++) {
            double[] finite = finiteValues(raw, j);
            fillValues[j] = finite.length == 0 ? 0 : median(finite);
            double[] imputed = imputedColumn(raw, j, fillValues[j]);
            shifts[j] = median(imputed);
            scales[j] = robustScale(imputed, shifts[j]);
        }
        return new ScalingParameters(fillValues, shifts, scales, clipFactor);
    }

    /**
     * Applies fitted parameters to raw values.
     *
     * @param raw        n x d raw matrix
     * @param parameters output of {@link #fit}
     * @return a new n x d scaled matrix
     */
    public static double[][] transform(double[][] raw, ScalingParameters parameters) {
        double[][] scaled = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            checkArgument(raw[i].length == parameters.getDimensions(), "incorrect dimension");
            scaled[i] = new double[raw[i].length];
            for (int j = 0; j < raw[i].length; j++) {
                double value = isFinite(raw[i][j]) ? raw[i][j] : parameters.getFillValue(j);
                double normalized = (value - parameters.getShift(j)) / parameters.getScale(j);
                scaled[i][j] = Math.max(-parameters.getClipFactor(), Math.min(parameters.getClipFactor(), normalized));
            }
        }
        return scaled;
    }

    public static double[][] fitTransform(double[][] raw, double clipFactor) {
        return transform(raw, fit(raw, clipFactor));
    }

    static double robustScale(double[] values, double median) {
        double iqr = percentile(values, 75) - percentile(values, 25);
        if (iqr > 0) {
            return iqr;
        }
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = median(deviations) * MAD_TO_SIGMA;
        return mad > 0 ? mad : 1.0;
    }

    private static double[] finiteValues(double[][] raw, int column) {
        int count = 0;
        for (double[] row : raw) {
            if (isFinite(row[column])) {
                ++count;
            }
        }
        double[] values = new double[count];
        int position = 0;
        for (double[] row : raw) {
            if (isFinite(row[column])) {
                values[position++] = row[column];
            }
        }
        return values;
    }

    private static double[] imputedColumn(double[][] raw, int column, double fill) {
        double[] values = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            values[i] = isFinite(raw[i][column]) ? raw[i][column] : fill;
        }
        return values;
    }
}
