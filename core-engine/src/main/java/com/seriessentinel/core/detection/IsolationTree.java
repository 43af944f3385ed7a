package com.seriessentinel.core.detection;

import java.util.SplittableRandom;

/**
 * One random isolation tree over a one-dimensional sample.
 *
 * <p>
 * Each internal node splits its values at a threshold drawn uniformly from
 * {@code [min, max)}; values {@code <=} the threshold go left. Growth stops at
 * the height limit, at a single value, or when all values are equal.
 * </p>
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * Grow a tree over {@code sample}. The array is reordered in place.
     *
     * @param sample      values drawn for this tree
     * @param heightLimit maximum depth of internal nodes
     * @param random      generator owned by this tree
     * @return the fitted tree
     */
    static IsolationTree grow(double[] sample, int heightLimit, SplittableRandom random) {
        return new IsolationTree(grow(sample, 0, sample.length, 0, heightLimit, random));
    }

    /**
     * Path length of {@code x}: edges traversed to the terminating leaf plus
     * the expected remaining depth of that leaf's unresolved values.
     *
     * @param x value to route through the tree
     * @return path length
     */
    double pathLength(double x) {
        Node node = root;
        int depth = 0;
        while (node.left != null) {
            node = x <= node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} values; normalises path lengths across sample sizes.
     *
     * @param n number of values
     * @return {@code c(n)}
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static Node grow(double[] values, int from, int to, int depth, int heightLimit,
            SplittableRandom random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }

        double min = values[from];
        double max = values[from];
        for (int i = from + 1; i < to; i++) {
            min = Math.min(min, values[i]);
            max = Math.max(max, values[i]);
        }
        if (min == max) {
            return Node.leaf(size);
        }

        double split = min + random.nextDouble() * (max - min);
        if (split >= max) {
            // rounding pushed the draw onto max; the right side would be empty
            split = min;
        }

        int boundary = partition(values, from, to, split);
        return Node.internal(split,
                grow(values, from, boundary, depth + 1, heightLimit, random),
                grow(values, boundary, to, depth + 1, heightLimit, random));
    }

    /** Moves values {@code <= split} to the front of the range; returns the first index of the rest. */
    private static int partition(double[] values, int from, int to, double split) {
        int boundary = from;
        for (int i = from; i < to; i++) {
            if (values[i] <= split) {
                double tmp = values[boundary];
                values[boundary] = values[i];
                values[i] = tmp;
                boundary++;
            }
        }
        return boundary;
    }

    @Override
    public String toString() {
        return "IsolationTree{" + root + '}';
    }

    private static final class Node {
        private final double split;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node internal(double split, Node left, Node right) {
            return new Node(split, left, right, left.size + right.size);
        }

        @Override
        public String toString() {
            return left == null ? "leaf(" + size + ")" : "split(" + split + ", " + left + ", " + right + ")";
        }
    }
}
