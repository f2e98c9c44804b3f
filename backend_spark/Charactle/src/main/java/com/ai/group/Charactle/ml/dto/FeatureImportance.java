package com.ai.group.Charactle.ml.dto;

public record FeatureImportance(String feature, double importance) {}
