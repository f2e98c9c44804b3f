package com.ai.group.Charactle.ml.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTreeRegressorTest {

    private static final double[][] X = {{1}, {2}, {3}, {4}};

    @Test
    @DisplayName("leaves predict the mean of their samples")
    void leafMeans() {
        var reg = new DecisionTreeRegressor(TreeHyperparameters.DEFAULTS).fit(X, new double[]{1, 1, 9, 9});

        assertEquals(1.0, reg.predict(new double[]{0}));
        assertEquals(9.0, reg.predict(new double[]{10}));
        assertEquals(1.0, reg.score(X, new double[]{1, 1, 9, 9}));
    }

    @Test
    @DisplayName("depth one averages each half")
    void shallowTree() {
        var reg = new DecisionTreeRegressor(new TreeHyperparameters(1, 2, 1)).fit(X, new double[]{1, 3, 9, 11});

        assertEquals(2.0, reg.predict(new double[]{1.5}));
        assertEquals(10.0, reg.predict(new double[]{3.5}));
        assertEquals(2, reg.leafCount());
    }

    @Test
    @DisplayName("constant targets make a single leaf")
    void constantTarget() {
        var reg = new DecisionTreeRegressor(TreeHyperparameters.DEFAULTS).fit(X, new double[]{4, 4, 4, 4});

        assertEquals(1, reg.structure().nodeCount());
        assertEquals(4.0, reg.predict(new double[]{2}));
        assertArrayEquals(new double[]{0.0}, reg.featureImportances());
    }
}
