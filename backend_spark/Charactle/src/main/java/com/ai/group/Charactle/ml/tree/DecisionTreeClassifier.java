package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.eval.Scores;
import smile.base.cart.Node;
import smile.base.cart.SplitRule;
import smile.classification.DecisionTree;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;

import java.util.Arrays;

/** Gini-impurity classification tree over integer class codes {@code 0..nClasses-1}. */
public class DecisionTreeClassifier extends DecisionTreeModel {

    private int nClasses;

    public DecisionTreeClassifier(TreeHyperparameters hyperparameters) {
        super(hyperparameters);
    }

    public static DecisionTreeClassifier restore(TreeHyperparameters hyperparameters, int nFeatures,
                                                 int nClasses, TreeStructure structure) {
        DecisionTreeClassifier c = new DecisionTreeClassifier(hyperparameters);
        c.nClasses = nClasses;
        c.install(nFeatures, structure, nClasses, true);
        return c;
    }

    /**
     * @param nClasses size of the full label space, which may exceed the classes present in {@code y}
     *                 (cross-validation folds); probabilities always have this width
     */
    public DecisionTreeClassifier fit(double[][] x, int[] y, int nClasses) {
        if (nClasses < 1) {
            throw new InvalidArgumentException("nClasses must be >= 1");
        }
        double[] target = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            if (y[i] < 0 || y[i] >= nClasses) {
                throw new InvalidArgumentException("Class code " + y[i] + " outside 0.." + (nClasses - 1));
            }
            target[i] = y[i];
        }
        this.nClasses = nClasses;
        grow(x, target);
        return this;
    }

    public double[] predictProba(double[] row) {
        double[] counts = leafValue(row);
        double total = 0;
        for (double c : counts) total += c;
        double[] p = new double[counts.length];
        for (int i = 0; i < p.length; i++) p[i] = counts[i] / total;
        return p;
    }

    public int predict(double[] row) {
        double[] counts = leafValue(row);
        int best = 0;
        for (int i = 1; i < counts.length; i++) if (counts[i] > counts[best]) best = i;
        return best;
    }

    public int[] predict(double[][] x) {
        int[] out = new int[x.length];
        for (int i = 0; i < x.length; i++) out[i] = predict(x[i]);
        return out;
    }

    /** Mean accuracy on the given rows. */
    public double score(double[][] x, int[] y) {
        return Scores.accuracy(y, predict(x));
    }

    public int nClasses() {
        requireFitted();
        return nClasses;
    }

    @Override
    Node fitSmile(DataFrame predictors, double[] y) {
        int[] codes = Arrays.stream(y).mapToInt(v -> (int) v).toArray();
        if (Arrays.stream(codes).distinct().count() < 2) {
            return null;
        }
        DataFrame data = predictors.merge(IntVector.of(TARGET, codes));
        DecisionTree fitted = DecisionTree.fit(Formula.lhs(TARGET), data, SplitRule.GINI,
                smileMaxDepth(), smileMaxNodes(y.length), hyperparameters.minSamplesLeaf());
        return fitted.root();
    }

    @Override
    double[] nodeValue(double[] y, int[] samples) {
        double[] counts = new double[nClasses];
        for (int s : samples) counts[(int) y[s]] += 1;
        return counts;
    }

    @Override
    double nodeImpurity(double[] y, int[] samples) {
        double n = samples.length;
        double sq = 0;
        for (double c : nodeValue(y, samples)) sq += (c / n) * (c / n);
        return 1.0 - sq;
    }

    @Override
    protected String modelName() {
        return "Classifier";
    }
}
