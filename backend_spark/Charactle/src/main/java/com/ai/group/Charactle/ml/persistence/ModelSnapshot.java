package com.ai.group.Charactle.ml.persistence;

import com.ai.group.Charactle.ml.dto.TrainingMetrics;
import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import com.ai.group.Charactle.ml.tree.TreeStructure;

import java.util.List;

/**
 * On-disk shape of a fitted state. Boxed fields so a blob missing any of them is detected
 * instead of silently defaulting.
 */
public record ModelSnapshot(
        Integer formatVersion,
        TreeHyperparameters hyperparameters,
        Integer maxTextFeatures,
        List<String> vocabulary,
        double[] idf,
        List<String> universes,
        List<String> genres,
        List<String> featureNames,
        List<String> classNames,
        Boolean classifierTrained,
        Boolean regressorTrained,
        Integer nFeatures,
        TreeStructure classifierTree,
        TreeStructure regressorTree,
        TrainingMetrics metrics
) {}
