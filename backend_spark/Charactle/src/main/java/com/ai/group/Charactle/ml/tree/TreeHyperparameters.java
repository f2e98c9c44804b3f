package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

/**
 * Growth limits shared by the classifier and the regressor.
 *
 * @param maxDepth        deepest level a node may sit at (root is 0); {@code null} grows until pure
 * @param minSamplesSplit fewest samples a node needs before it may be split
 * @param minSamplesLeaf  fewest samples each child of a split must keep
 */
public record TreeHyperparameters(Integer maxDepth, int minSamplesSplit, int minSamplesLeaf) {

    public static final TreeHyperparameters DEFAULTS = new TreeHyperparameters(10, 2, 1);

    public TreeHyperparameters {
        if (maxDepth != null && maxDepth < 1) {
            throw new InvalidArgumentException("max_depth must be >= 1, got " + maxDepth);
        }
        if (minSamplesSplit < 2) {
            throw new InvalidArgumentException("min_samples_split must be >= 2, got " + minSamplesSplit);
        }
        if (minSamplesLeaf < 1) {
            throw new InvalidArgumentException("min_samples_leaf must be >= 1, got " + minSamplesLeaf);
        }
    }

    public boolean depthReached(int depth) {
        return maxDepth != null && depth >= maxDepth;
    }
}
