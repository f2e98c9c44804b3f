package com.ai.group.Charactle.ml.feature;

import java.util.List;

/**
 * Output of {@link FeatureAssembler#build}: one feature row per record plus the raw
 * classification target (character id, {@code null} for id-less inference records)
 * and the regression target (difficulty).
 */
public record FeatureSet(
        double[][] x,
        List<String> classTargets,
        double[] regressionTargets
) {
    public int size() {
        return x.length;
    }
}
