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

import static com.amazon.dataquality.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.amazon.dataquality.config.CorrelationMethod;
import com.amazon.dataquality.testutils.SyntheticData;

public class CorrelationsTest {

    @ParameterizedTest
    @CsvSource({ "0.5", "-0.3", "0.95", "0.0" })
    public void testPearsonMatchesConstruction(double rho) {
        double[][] series = SyntheticData.correlatedSeries(50, rho, 17);
        CorrelationEstimate estimate = Correlations.estimate(series[0], series[1], CorrelationMethod.PEARSON).get();
        assertThat(estimate.getCoefficient(), closeTo(rho, EPSILON));
        assertEquals(50, estimate.getSampleSize());
        assertTrue(estimate.getPValue().isPresent());
    }

    @Test
    public void testSpearmanOnMonotoneSeries() {
        double[] x = new double[10];
        double[] y = new double[10];
        for (int i = 0; i < 10; i++) {
            x[i] = i;
            y[i] = Math.pow(i, 3);
        }
        CorrelationEstimate spearman = Correlations.estimate(x, y, CorrelationMethod.SPEARMAN).get();
        assertThat(spearman.getCoefficient(), closeTo(1.0, EPSILON));
        assertThat(spearman.getPValue().get(), closeTo(0.0, EPSILON));
        CorrelationEstimate pearson = Correlations.estimate(x, y, CorrelationMethod.PEARSON).get();
        assertThat(pearson.getCoefficient(), lessThan(1.0));
    }

    @Test
    public void testCovarianceIsNormalized() {
        double[] x = { 1, 2, 3, 4, 5 };
        double[] y = { 3, 5, 7, 9, 11 };
        CorrelationEstimate estimate = Correlations.estimate(x, y, CorrelationMethod.COVARIANCE).get();
        assertThat(estimate.getCoefficient(), closeTo(1.0, EPSILON));
        assertFalse(estimate.getPValue().isPresent());
    }

    @Test
    public void testMissingValuesAreDropped() {
        double[] x = { 1, Double.NaN, 3, 4, Double.POSITIVE_INFINITY };
        double[] y = { 2, 4, 6, 8, 10 };
        CorrelationEstimate estimate = Correlations.estimate(x, y, CorrelationMethod.PEARSON).get();
        assertEquals(3, estimate.getSampleSize());
        assertThat(estimate.getCoefficient(), closeTo(1.0, EPSILON));
    }

    @Test
    public void testUndefinedCorrelation() {
        assertFalse(Correlations.estimate(new double[] { 1, 1, 1, 1 }, new double[] { 1, 2, 3, 4 },
                CorrelationMethod.PEARSON).isPresent());
        assertFalse(Correlations.estimate(new double[] { 1, 2 }, new double[] { 1, 2 }, CorrelationMethod.PEARSON)
                .isPresent());
        assertThrows(IllegalArgumentException.class,
                () -> Correlations.estimate(new double[3], new double[4], CorrelationMethod.PEARSON));
    }

    @Test
    public void testTTestPValue() {
        assertThat(Correlations.tTestPValue(0.5, 30), lessThan(0.01));
        assertThat(Correlations.tTestPValue(0.1, 10), greaterThan(0.5));
        assertEquals(0.0, Correlations.tTestPValue(1.0, 10));
    }

    @Test
    public void testFisherZ() {
        double z = Correlations.fisherZ(0.9, 30, 0.0, 10);
        assertThat(z, closeTo(-Correlations.atanh(0.9) / Math.sqrt(1.0 / 27 + 1.0 / 7), EPSILON));
        assertThat(Correlations.twoSidedNormalPValue(z), lessThan(0.001));
        assertThat(Correlations.fisherZ(0.5, 20, 0.5, 20), closeTo(0.0, EPSILON));
        assertThat(Correlations.twoSidedNormalPValue(1.959964), closeTo(0.05, 1e-5));
        assertThrows(IllegalArgumentException.class, () -> Correlations.fisherZ(0.5, 3, 0.5, 20));
    }

    @Test
    public void testAtanhIsClipped() {
        assertTrue(Double.isFinite(Correlations.atanh(1.0)));
        assertTrue(Double.isFinite(Correlations.atanh(-1.0)));
    }
}
