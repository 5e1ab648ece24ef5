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

package com.amazon.dataquality;

import java.util.Objects;

import com.amazon.dataquality.exception.ConfigException;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws a {@link ConfigException} with the specified message if the specified
     * input is false. Used by the analyzer configurations so that an invalid
     * setting is reported before any data is fetched.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the exception.
     * @throws ConfigException if {@code condition} is false.
     */
    public static void checkConfig(boolean condition, String message) {
        if (!condition) {
            throw new ConfigException(message);
        }
    }

    /**
     * Throws a {@link ConfigException} naming the missing field if the supplied
     * value is null.
     *
     * @param <T>   An arbitrary type.
     * @param value the configured value
     * @param field the name of the required field
     * @return {@code value} if not null.
     */
    public static <T> T checkRequired(T value, String field) {
        if (value == null) {
            throw ConfigException.missingField(field);
        }
        return value;
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Converts a scalar cell into a double. Numbers are widened, numeric strings
     * are parsed, everything else (including null) becomes NaN.
     *
     * @param value a cell of a dataset
     * @return the numeric value or NaN
     */
    public static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    public static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    public static double[][] copyOf(double[][] matrix) {
        checkNotNull(matrix, "matrix must not be null");
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    /**
     * Squared Euclidean distance between two points of the same dimension.
     */
    public static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double t = a[i] - b[i];
            sum += t * t;
        }
        return sum;
    }

    public static double distance(double[] a, double[] b) {
        return Math.sqrt(squaredDistance(a, b));
    }
}
