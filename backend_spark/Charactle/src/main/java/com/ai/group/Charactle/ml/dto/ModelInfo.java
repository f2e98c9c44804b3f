package com.ai.group.Charactle.ml.dto;

import java.util.List;

/** Status snapshot of a pipeline; all figures are zero or empty while untrained. */
public record ModelInfo(
        ClassifierInfo classifier,
        RegressorInfo regressor,
        int nFeatures,
        List<String> featureNames
) {
    public record ClassifierInfo(
            boolean trained,
            int nClasses,
            List<String> classes,
            double trainAccuracy,
            double testAccuracy,
            Double cvMean,
            int treeDepth,
            int nLeaves
    ) {}

    public record RegressorInfo(
            boolean trained,
            double trainR2,
            double testR2,
            int treeDepth,
            int nLeaves
    ) {}

    public static ModelInfo untrained() {
        return new ModelInfo(
                new ClassifierInfo(false, 0, List.of(), 0, 0, null, 0, 0),
                new RegressorInfo(false, 0, 0, 0, 0),
                0,
                List.of());
    }
}
