package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotTrainedException;
import smile.base.cart.InternalNode;
import smile.base.cart.Node;
import smile.base.cart.OrdinalNode;
import smile.data.DataFrame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared base of {@link DecisionTreeClassifier} and {@link DecisionTreeRegressor}.
 *
 * <p>Smile CART picks the splits. The fitted Smile tree is then flattened into a {@link TreeStructure},
 * with node statistics recomputed from the training rows, and cut wherever this model's
 * hyperparameters say a node must stay a leaf. Prediction, introspection and persistence all work
 * on the flat structure, so a reloaded tree behaves exactly like the one that was trained.
 */
public abstract class DecisionTreeModel {

    static final String TARGET = "target";
    private static final double PURE = 1e-12;
    private static final int UNLIMITED_DEPTH = 1024;

    protected final TreeHyperparameters hyperparameters;
    protected TreeStructure tree;
    protected int nFeatures;

    protected DecisionTreeModel(TreeHyperparameters hyperparameters) {
        this.hyperparameters = hyperparameters == null ? TreeHyperparameters.DEFAULTS : hyperparameters;
    }

    /**
     * Fits a Smile tree on the rows and returns its root, or {@code null} when the targets leave
     * nothing to split (a single class, a constant value).
     */
    abstract Node fitSmile(DataFrame predictors, double[] y);

    /** Node value: class counts for a classifier, the mean target for a regressor. */
    abstract double[] nodeValue(double[] y, int[] samples);

    /** Gini or squared error of the node's samples. */
    abstract double nodeImpurity(double[] y, int[] samples);

    /** Human name used in error messages ("Classifier", "Regressor"). */
    protected abstract String modelName();

    protected void grow(double[][] x, double[] y) {
        if (x.length == 0) {
            throw new InvalidArgumentException(modelName() + " cannot be fitted on zero samples");
        }
        if (x.length != y.length) {
            throw new InvalidArgumentException("Got " + x.length + " feature rows but " + y.length + " targets");
        }
        int width = x[0].length;
        for (double[] row : x) {
            if (row.length != width) throw new InvalidArgumentException("Feature rows differ in width");
        }
        int[] all = new int[x.length];
        for (int i = 0; i < all.length; i++) all[i] = i;

        Node root = x.length < 2 * hyperparameters.minSamplesLeaf() ? null : fitSmile(frame(x), y);
        Builder b = new Builder();
        flatten(root, x, y, all, 0, b);
        this.nFeatures = width;
        this.tree = b.freeze();
    }

    protected void install(int nFeatures, TreeStructure structure, int valueWidth, boolean classCounts) {
        structure.validate(nFeatures, valueWidth, classCounts);
        this.nFeatures = nFeatures;
        this.tree = structure;
    }

    /** Smile depth limit; Smile counts the root as level one, so one extra level is grown and cut afterwards. */
    int smileMaxDepth() {
        Integer maxDepth = hyperparameters.maxDepth();
        return maxDepth == null ? UNLIMITED_DEPTH : maxDepth + 1;
    }

    static int smileMaxNodes(int n) {
        return Math.max(2, n);
    }

    static DataFrame frame(double[][] x) {
        String[] names = new String[x[0].length];
        for (int j = 0; j < names.length; j++) names[j] = "x" + j;
        return DataFrame.of(x, names);
    }

    private int flatten(Node node, double[][] x, double[] y, int[] samples, int depth, Builder b) {
        double impurity = nodeImpurity(y, samples);
        int id = b.add(nodeValue(y, samples), impurity, samples.length);

        boolean leaf = !(node instanceof InternalNode)
                || hyperparameters.depthReached(depth)
                || samples.length < hyperparameters.minSamplesSplit()
                || impurity <= PURE;
        if (leaf) {
            return id;
        }
        if (!(node instanceof OrdinalNode)) {
            throw new IllegalStateException("Unexpected split node " + node.getClass().getSimpleName());
        }
        OrdinalNode split = (OrdinalNode) node;
        int f = split.feature();
        double threshold = split.value();
        int[] left = Arrays.stream(samples).filter(s -> x[s][f] <= threshold).toArray();
        int[] right = Arrays.stream(samples).filter(s -> x[s][f] > threshold).toArray();
        int minLeaf = hyperparameters.minSamplesLeaf();
        if (left.length < minLeaf || right.length < minLeaf) {
            return id;
        }
        int l = flatten(split.trueChild(), x, y, left, depth + 1, b);
        int r = flatten(split.falseChild(), x, y, right, depth + 1, b);
        b.link(id, l, r, f, threshold);
        return id;
    }

    /** Normalised total impurity decrease per feature; sums to 1 unless the tree is a single leaf. */
    public double[] featureImportances() {
        requireFitted();
        return tree.featureImportances(nFeatures);
    }

    public int depth() {
        requireFitted();
        return tree.depth(0);
    }

    public int leafCount() {
        requireFitted();
        return tree.leafCount();
    }

    public boolean isFitted() {
        return tree != null;
    }

    public TreeStructure structure() {
        requireFitted();
        return tree;
    }

    public int nFeatures() {
        requireFitted();
        return nFeatures;
    }

    public TreeHyperparameters hyperparameters() {
        return hyperparameters;
    }

    protected double[] leafValue(double[] row) {
        requireFitted();
        if (row.length != nFeatures) {
            throw new InvalidArgumentException(modelName() + " expects " + nFeatures
                    + " features, got " + row.length);
        }
        return tree.nodeValue(tree.apply(row));
    }

    protected void requireFitted() {
        if (tree == null) throw new NotTrainedException(modelName());
    }

    private static final class Builder {
        private final List<double[]> value = new ArrayList<>();
        private final List<Double> impurity = new ArrayList<>();
        private final List<Integer> samples = new ArrayList<>();
        private final List<int[]> links = new ArrayList<>();   // {left, right, feature}
        private final List<Double> threshold = new ArrayList<>();

        int add(double[] v, double imp, int n) {
            value.add(v);
            impurity.add(imp);
            samples.add(n);
            links.add(new int[]{TreeStructure.LEAF, TreeStructure.LEAF, TreeStructure.LEAF});
            threshold.add(-2.0);
            return value.size() - 1;
        }

        void link(int node, int left, int right, int feature, double thr) {
            links.set(node, new int[]{left, right, feature});
            threshold.set(node, thr);
        }

        TreeStructure freeze() {
            int n = value.size();
            int[] cl = new int[n], cr = new int[n], f = new int[n], ns = new int[n];
            double[] th = new double[n], im = new double[n];
            double[][] v = new double[n][];
            for (int i = 0; i < n; i++) {
                int[] k = links.get(i);
                cl[i] = k[0];
                cr[i] = k[1];
                f[i] = k[2];
                th[i] = threshold.get(i);
                im[i] = impurity.get(i);
                ns[i] = samples.get(i);
                v[i] = value.get(i);
            }
            return new TreeStructure(cl, cr, f, th, v, im, ns);
        }
    }
}
