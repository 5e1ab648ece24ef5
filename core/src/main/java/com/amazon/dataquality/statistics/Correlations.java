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
import static com.amazon.dataquality.CommonUtils.isFinite;

import java.util.Optional;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import com.amazon.dataquality.config.CorrelationMethod;

/**
 * Pairwise correlation and the test for a change of correlation between two
 * samples.
 */
public class Correlations {

    /**
     * minimum number of joint observations for a coefficient
     */
    public static final int MIN_OBSERVATIONS = 3;

    /**
     * minimum sample size for the Fisher z test
     */
    public static final int MIN_SHIFT_OBSERVATIONS = 4;

    // atanh diverges at +-1
    private static final double MAX_ABS_COEFFICIENT = 1 - 1e-12;

    private Correlations() {
    }

    /**
     * Computes the correlation of two aligned series, dropping positions where
     * either side is not finite.
     *
     * @param x      first series
     * @param y      second series, same length
     * @param method the estimator
     * @return the estimate, empty when fewer than three joint observations remain
     *         or the coefficient is undefined (a constant series)
     */
    public static Optional<CorrelationEstimate> estimate(double[] x, double[] y, CorrelationMethod method) {
        checkArgument(x.length == y.length, "series must have the same length");
        int n = 0;
        for (int i = 0; i < x.length; i++) {
            if (isFinite(x[i]) && isFinite(y[i])) {
                ++n;
            }
        }
        if (n < MIN_OBSERVATIONS) {
            return Optional.empty();
        }
        double[] a = new double[n];
        double[] b = new double[n];
        int position = 0;
        for (int i = 0; i < x.length; i++) {
            if (isFinite(x[i]) && isFinite(y[i])) {
                a[position] = x[i];
                b[position++] = y[i];
            }
        }

        double coefficient;
        Double pValue = null;
        switch (method) {
        case PEARSON:
            coefficient = new PearsonsCorrelation().correlation(a, b);
            pValue = tTestPValue(coefficient, n);
            break;
        case SPEARMAN:
            coefficient = new SpearmansCorrelation().correlation(a, b);
            pValue = tTestPValue(coefficient, n);
            break;
        case COVARIANCE:
            StandardDeviation deviation = new StandardDeviation();
            double spread = deviation.evaluate(a) * deviation.evaluate(b);
            coefficient = spread > 0 ? new Covariance().covariance(a, b) / spread : Double.NaN;
            break;
        default:
            throw new IllegalStateException("unsupported correlation method " + method);
        }
        if (!isFinite(coefficient)) {
            return Optional.empty();
        }
        return Optional.of(new CorrelationEstimate(coefficient, pValue, n));
    }

    /**
     * Two-sided p-value of the hypothesis of zero correlation, using the t
     * statistic with {@code n - 2} degrees of freedom.
     */
    static Double tTestPValue(double coefficient, int n) {
        if (!isFinite(coefficient)) {
            return null;
        }
        double r = Math.abs(coefficient);
        if (r >= 1.0) {
            return 0.0;
        }
        double t = r * Math.sqrt((n - 2) / (1 - r * r));
        return 2 * (1 - new TDistribution(n - 2).cumulativeProbability(t));
    }

    /**
     * Fisher z statistic for the difference between two correlation
     * coefficients.
     *
     * @param baseline     coefficient of the baseline sample
     * @param baselineSize size of the baseline sample, at least 4
     * @param recent       coefficient of the recent sample
     * @param recentSize   size of the recent sample, at least 4
     * @return the z statistic, positive when the recent correlation is larger
     */
    public static double fisherZ(double baseline, int baselineSize, double recent, int recentSize) {
        checkArgument(baselineSize >= MIN_SHIFT_OBSERVATIONS && recentSize >= MIN_SHIFT_OBSERVATIONS,
                "the Fisher test needs at least 4 observations per sample");
        double standardError = Math.sqrt(1.0 / (baselineSize - 3) + 1.0 / (recentSize - 3));
        return (atanh(recent) - atanh(baseline)) / standardError;
    }

    public static double twoSidedNormalPValue(double z) {
        return 2 * (1 - new NormalDistribution().cumulativeProbability(Math.abs(z)));
    }

    static double atanh(double r) {
        double clipped = Math.max(-MAX_ABS_COEFFICIENT, Math.min(MAX_ABS_COEFFICIENT, r));
        return 0.5 * Math.log((1 + clipped) / (1 - clipped));
    }
}
