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

import java.util.Random;

/**
 * An isolation tree grown on a sample of points. Each internal node holds a
 * random {@link Cut}; each leaf remembers how many sample points reached it.
 * The tree is immutable once built.
 */
public class IsolationTree {

    /**
     * Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    private static final double EULER_CONSTANT = 0.5772156649;

    private final Node root;

    private final int heightLimit;

    private IsolationTree(Node root, int heightLimit) {
        this.root = root;
        this.heightLimit = heightLimit;
    }

    /**
     * Grows a tree on the given rows.
     *
     * @param points      the full matrix
     * @param rows        indices of the sample rows; reordered in place
     * @param heightLimit maximum depth of an internal node
     * @param random      source of the cuts
     * @return the tree
     */
    public static IsolationTree grow(double[][] points, int[] rows, int heightLimit, Random random) {
        return new IsolationTree(build(points, rows, 0, rows.length, 0, heightLimit, random), heightLimit);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * n points; used to normalize path lengths and to account for the unbuilt
     * subtree below a leaf holding several points.
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        return 2 * (Math.log(n - 1) + EULER_CONSTANT) - 2 * (n - 1) / n;
    }

    /**
     * @return the depth at which the point is isolated, plus the expected
     *         remaining depth if the leaf holds more than one point
     */
    public double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (node.cut != null) {
            node = Cut.isLeftOf(point, node.cut) ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.mass);
    }

    public int getHeightLimit() {
        return heightLimit;
    }

    private static Node build(double[][] points, int[] rows, int from, int to, int depth, int heightLimit,
            Random random) {
        int mass = to - from;
        if (depth >= heightLimit || mass <= 1) {
            return Node.leaf(mass);
        }
        BoundingBox box = new BoundingBox(points, rows, from, to);
        if (!(box.getRangeSum() > 0)) {
            return Node.leaf(mass);
        }
        Cut cut = Cut.randomCut(random.nextDouble(), box);

        // partition rows[from, to) so that points left of the cut come first
        int split = from;
        for (int i = from; i < to; i++) {
            if (Cut.isLeftOf(points[rows[i]], cut)) {
                int t = rows[i];
                rows[i] = rows[split];
                rows[split] = t;
                split++;
            }
        }
        Node left = build(points, rows, from, split, depth + 1, heightLimit, random);
        Node right = build(points, rows, split, to, depth + 1, heightLimit, random);
        return new Node(cut, left, right, mass);
    }

    private static final class Node {
        private final Cut cut;
        private final Node left;
        private final Node right;
        private final int mass;

        private Node(Cut cut, Node left, Node right, int mass) {
            this.cut = cut;
            this.left = left;
            this.right = right;
            this.mass = mass;
        }

        private static Node leaf(int mass) {
            return new Node(null, null, null, mass);
        }
    }
}
