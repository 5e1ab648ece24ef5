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

package com.amazon.dataquality.tree;

import static com.amazon.dataquality.CommonUtils.checkArgument;

import java.util.Random;

/**
 * A fitted collection of {@link IsolationTree}s. Every tree is grown on its
 * own sample drawn without replacement from the training matrix. The anomaly
 * score of a point is {@code 2^(-E[h(x)] / c(psi))} where {@code E[h(x)]} is
 * the mean path length over the trees and {@code c(psi)} the average path
 * length for the sample size. Scores lie in (0, 1]; values close to 1 mean the
 * point is isolated quickly.
 *
 * <p>
 * Fitting is fully determined by the seed.
 */
public class IsolationForest {

    private final IsolationTree[] trees;

    private final int sampleSize;

    private final int dimensions;

    private IsolationForest(IsolationTree[] trees, int sampleSize, int dimensions) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.dimensions = dimensions;
    }

    /**
     * @param points        training matrix, n x d with n at least 2
     * @param numberOfTrees number of trees
     * @param sampleSize    maximum sample size per tree; capped at n
     * @param seed          random seed
     * @return the fitted forest
     */
    public static IsolationForest fit(double[][] points, int numberOfTrees, int sampleSize, long seed) {
        checkArgument(points.length >= 2, "at least 2 points are required");
        checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(sampleSize > 1, "sampleSize must be greater than 1");
        int n = points.length;
        int psi = Math.min(sampleSize, n);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        Random random = new Random(seed);
        IsolationTree[] trees = new IsolationTree[numberOfTrees];
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        for (int t = 0; t < numberOfTrees; t++) {
            Random treeRandom = new Random(random.nextLong());
            // partial Fisher-Yates shuffle: the first psi entries form the sample
            for (int i = 0; i < psi; i++) {
                int j = i + treeRandom.nextInt(n - i);
                int s = all[i];
                all[i] = all[j];
                all[j] = s;
            }
            int[] sample = new int[psi];
            System.arraycopy(all, 0, sample, 0, psi);
            trees[t] = IsolationTree.grow(points, sample, heightLimit, treeRandom);
        }
        return new IsolationForest(trees, psi, points[0].length);
    }

    public double score(double[] point) {
        checkArgument(point.length == dimensions, "incorrect dimensions");
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        double meanPath = sum / trees.length;
        return Math.pow(2, -meanPath / IsolationTree.averagePathLength(sampleSize));
    }

    public double[] score(double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = score(points[i]);
        }
        return scores;
    }

    public int getNumberOfTrees() {
        return trees.length;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getDimensions() {
        return dimensions;
    }
}
