package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text rules of a fitted tree, one line per branch:
 * <pre>
 * |--- quote_length &lt;= 12.50
 * |   |--- class: batman
 * |--- quote_length &gt;  12.50
 * |   |--- truncated branch of depth 2
 * </pre>
 * Branches below {@code maxDepth} collapse into a "truncated branch" line unless they are a single leaf.
 */
public final class TreeTextExporter {

    private final TreeStructure tree;
    private final List<String> featureNames;
    private final List<String> classNames;
    private final int maxDepth;
    private final String numberFormat;
    private final StringBuilder out = new StringBuilder();

    private TreeTextExporter(TreeStructure tree, List<String> featureNames, List<String> classNames,
                             int maxDepth, int decimals) {
        this.tree = tree;
        this.featureNames = featureNames;
        this.classNames = classNames;
        this.maxDepth = maxDepth;
        this.numberFormat = "%." + decimals + "f";
    }

    /**
     * @param classNames labels for classifier leaves; {@code null} for a regressor, whose leaves print their value
     */
    public static String export(TreeStructure tree, List<String> featureNames, List<String> classNames,
                                int maxDepth, int decimals) {
        if (maxDepth < 0) {
            throw new InvalidArgumentException("max_depth must be >= 0, got " + maxDepth);
        }
        if (decimals < 0) {
            throw new InvalidArgumentException("decimals must be >= 0, got " + decimals);
        }
        TreeTextExporter e = new TreeTextExporter(tree, featureNames, classNames, maxDepth, decimals);
        e.branch(0, 1);
        return e.out.toString();
    }

    private void branch(int node, int depth) {
        String indent = "|   ".repeat(depth - 1) + "|---";
        if (depth <= maxDepth + 1) {
            if (tree.isLeaf(node)) {
                leaf(node, indent);
                return;
            }
            String name = featureNames.get(tree.splitFeature(node));
            String threshold = fmt(tree.splitThreshold(node));
            out.append(indent).append(' ').append(name).append(" <= ").append(threshold).append('\n');
            branch(tree.left(node), depth + 1);
            out.append(indent).append(' ').append(name).append(" >  ").append(threshold).append('\n');
            branch(tree.right(node), depth + 1);
        } else {
            int levels = tree.depth(node) + 1;
            if (levels == 1) {
                leaf(node, indent);
            } else {
                out.append(indent).append(" truncated branch of depth ").append(levels).append('\n');
            }
        }
    }

    private void leaf(int node, String indent) {
        double[] v = tree.nodeValue(node);
        if (classNames != null) {
            out.append(indent).append(" class: ").append(classNames.get(argmax(v))).append('\n');
        } else {
            out.append(indent).append(" value: [").append(fmt(v[0])).append("]\n");
        }
    }

    private String fmt(double v) {
        return String.format(Locale.ROOT, numberFormat, v);
    }

    static int argmax(double[] v) {
        int best = 0;
        for (int i = 1; i < v.length; i++) if (v[i] > v[best]) best = i;
        return best;
    }
}
