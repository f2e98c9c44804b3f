package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

/**
 * Fitted tree in parallel arrays, nodes numbered depth-first (node, left subtree, right subtree).
 * Leaves have {@link #LEAF} children and feature. {@code value} holds per-class sample counts
 * for a classifier and the single mean target for a regressor.
 *
 * <p>Arrays are copied on the way in and on the way out; the per-node accessors read without copying.
 */
public record TreeStructure(
        int[] childrenLeft,
        int[] childrenRight,
        int[] feature,
        double[] threshold,
        double[][] value,
        double[] impurity,
        int[] nodeSamples
) {
    public static final int LEAF = -1;

    public TreeStructure {
        childrenLeft = childrenLeft == null ? null : childrenLeft.clone();
        childrenRight = childrenRight == null ? null : childrenRight.clone();
        feature = feature == null ? null : feature.clone();
        threshold = threshold == null ? null : threshold.clone();
        value = deepCopy(value);
        impurity = impurity == null ? null : impurity.clone();
        nodeSamples = nodeSamples == null ? null : nodeSamples.clone();
    }

    @Override
    public int[] childrenLeft() { return childrenLeft.clone(); }

    @Override
    public int[] childrenRight() { return childrenRight.clone(); }

    @Override
    public int[] feature() { return feature.clone(); }

    @Override
    public double[] threshold() { return threshold.clone(); }

    @Override
    public double[][] value() { return deepCopy(value); }

    @Override
    public double[] impurity() { return impurity.clone(); }

    @Override
    public int[] nodeSamples() { return nodeSamples.clone(); }

    public int nodeCount() {
        return childrenLeft.length;
    }

    public boolean isLeaf(int node) {
        return childrenLeft[node] == LEAF;
    }

    public int left(int node) { return childrenLeft[node]; }

    public int right(int node) { return childrenRight[node]; }

    public int splitFeature(int node) { return feature[node]; }

    public double splitThreshold(int node) { return threshold[node]; }

    public double nodeImpurity(int node) { return impurity[node]; }

    public int samples(int node) { return nodeSamples[node]; }

    public double[] nodeValue(int node) { return value[node].clone(); }

    /** Index of the leaf the row falls into. */
    public int apply(double[] row) {
        int node = 0;
        while (!isLeaf(node)) {
            node = row[feature[node]] <= threshold[node] ? childrenLeft[node] : childrenRight[node];
        }
        return node;
    }

    /** Levels below {@code node}; a lone leaf has depth 0. */
    public int depth(int node) {
        if (isLeaf(node)) return 0;
        return 1 + Math.max(depth(childrenLeft[node]), depth(childrenRight[node]));
    }

    public int leafCount() {
        int n = 0;
        for (int c : childrenLeft) if (c == LEAF) n++;
        return n;
    }

    /** Normalised total impurity decrease per feature; all zero for a single leaf. */
    public double[] featureImportances(int nFeatures) {
        double[] imp = new double[nFeatures];
        for (int node = 0; node < nodeCount(); node++) {
            if (isLeaf(node)) continue;
            int l = childrenLeft[node];
            int r = childrenRight[node];
            imp[feature[node]] += nodeSamples[node] * impurity[node]
                    - nodeSamples[l] * impurity[l]
                    - nodeSamples[r] * impurity[r];
        }
        double total = 0;
        for (double v : imp) total += v;
        if (total > 0) {
            for (int i = 0; i < imp.length; i++) imp[i] /= total;
        }
        return imp;
    }

    /**
     * Structural and numeric sanity checks for trees coming from outside (persisted blobs).
     *
     * @param classCounts true when node values are class counts, which must be non-negative and not all zero
     */
    public void validate(int nFeatures, int valueWidth, boolean classCounts) {
        int n = childrenLeft == null ? 0 : childrenLeft.length;
        if (n == 0) throw new InvalidArgumentException("Tree has no nodes");
        if (childrenRight == null || feature == null || threshold == null || value == null
                || impurity == null || nodeSamples == null
                || childrenRight.length != n || feature.length != n || threshold.length != n
                || value.length != n || impurity.length != n || nodeSamples.length != n) {
            throw new InvalidArgumentException("Tree arrays have inconsistent lengths");
        }
        for (int i = 0; i < n; i++) {
            boolean leaf = childrenLeft[i] == LEAF;
            if (leaf != (childrenRight[i] == LEAF)) {
                throw new InvalidArgumentException("Node " + i + " has exactly one child");
            }
            if (!leaf) {
                if (childrenLeft[i] <= i || childrenLeft[i] >= n || childrenRight[i] <= i || childrenRight[i] >= n) {
                    throw new InvalidArgumentException("Node " + i + " points outside the tree");
                }
                if (feature[i] < 0 || feature[i] >= nFeatures) {
                    throw new InvalidArgumentException("Node " + i + " splits on unknown feature " + feature[i]);
                }
                if (!Double.isFinite(threshold[i])) {
                    throw new InvalidArgumentException("Node " + i + " has a non-finite threshold");
                }
            }
            if (nodeSamples[i] < 1) {
                throw new InvalidArgumentException("Node " + i + " holds no samples");
            }
            if (!Double.isFinite(impurity[i]) || impurity[i] < 0) {
                throw new InvalidArgumentException("Node " + i + " has invalid impurity " + impurity[i]);
            }
            double[] v = value[i];
            if (v == null || v.length != valueWidth) {
                throw new InvalidArgumentException("Node " + i + " value width is not " + valueWidth);
            }
            double total = 0;
            for (double d : v) {
                if (!Double.isFinite(d) || (classCounts && d < 0)) {
                    throw new InvalidArgumentException("Node " + i + " has invalid value " + d);
                }
                total += d;
            }
            if (classCounts && total <= 0) {
                throw new InvalidArgumentException("Node " + i + " has no class counts");
            }
        }
    }

    private static double[][] deepCopy(double[][] v) {
        if (v == null) return null;
        double[][] out = new double[v.length][];
        for (int i = 0; i < v.length; i++) out[i] = v[i] == null ? null : v[i].clone();
        return out;
    }
}
