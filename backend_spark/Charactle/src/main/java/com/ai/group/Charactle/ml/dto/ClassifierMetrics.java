package com.ai.group.Charactle.ml.dto;

import java.util.List;

/**
 * @param cvScores per-fold accuracy; empty when cross-validation was skipped, in which case
 *                 {@code cvMean} and {@code cvStd} are {@code null}
 */
public record ClassifierMetrics(
        double trainAccuracy,
        double testAccuracy,
        List<Double> cvScores,
        Double cvMean,
        Double cvStd,
        int nClasses,
        int nFeatures,
        int treeDepth,
        int nLeaves
) {}
