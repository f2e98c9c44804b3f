package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.eval.Scores;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import smile.base.cart.Node;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.DoubleVector;
import smile.regression.RegressionTree;

/** Squared-error regression tree; leaves predict the mean target of their training samples. */
public class DecisionTreeRegressor extends DecisionTreeModel {

    public DecisionTreeRegressor(TreeHyperparameters hyperparameters) {
        super(hyperparameters);
    }

    public static DecisionTreeRegressor restore(TreeHyperparameters hyperparameters, int nFeatures,
                                                TreeStructure structure) {
        DecisionTreeRegressor r = new DecisionTreeRegressor(hyperparameters);
        r.install(nFeatures, structure, 1, false);
        return r;
    }

    public DecisionTreeRegressor fit(double[][] x, double[] y) {
        grow(x, y.clone());
        return this;
    }

    public double predict(double[] row) {
        return leafValue(row)[0];
    }

    public double[] predict(double[][] x) {
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) out[i] = predict(x[i]);
        return out;
    }

    /** Coefficient of determination on the given rows. */
    public double score(double[][] x, double[] y) {
        return Scores.r2(y, predict(x));
    }

    @Override
    Node fitSmile(DataFrame predictors, double[] y) {
        DescriptiveStatistics stats = new DescriptiveStatistics(y);
        if (stats.getMax() == stats.getMin()) {
            return null;
        }
        DataFrame data = predictors.merge(DoubleVector.of(TARGET, y));
        RegressionTree fitted = RegressionTree.fit(Formula.lhs(TARGET), data,
                smileMaxDepth(), smileMaxNodes(y.length), hyperparameters.minSamplesLeaf());
        return fitted.root();
    }

    @Override
    double[] nodeValue(double[] y, int[] samples) {
        return new double[]{stats(y, samples).getMean()};
    }

    /** Mean squared error around the node mean. */
    @Override
    double nodeImpurity(double[] y, int[] samples) {
        return stats(y, samples).getPopulationVariance();
    }

    private static DescriptiveStatistics stats(double[] y, int[] samples) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int s : samples) stats.addValue(y[s]);
        return stats;
    }

    @Override
    protected String modelName() {
        return "Regressor";
    }
}
