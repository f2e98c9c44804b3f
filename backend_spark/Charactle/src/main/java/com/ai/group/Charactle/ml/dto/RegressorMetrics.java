package com.ai.group.Charactle.ml.dto;

public record RegressorMetrics(
        double trainR2,
        double testR2,
        int treeDepth,
        int nLeaves
) {}
