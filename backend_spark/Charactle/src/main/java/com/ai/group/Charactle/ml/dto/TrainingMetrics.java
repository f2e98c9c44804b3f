package com.ai.group.Charactle.ml.dto;

/**
 * Outcome of one training run.
 *
 * @param nTestSamples  rows held out for testing; 0 for a degraded split
 * @param degradedSplit true when the data set was too small to hold rows out, so the test figures
 *                      were measured on the training rows themselves
 */
public record TrainingMetrics(
        ClassifierMetrics classifier,
        RegressorMetrics regressor,
        int nTrainingSamples,
        int nTestSamples,
        boolean degradedSplit
) {}
