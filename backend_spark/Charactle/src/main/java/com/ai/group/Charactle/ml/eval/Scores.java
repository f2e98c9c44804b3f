package com.ai.group.Charactle.ml.eval;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import smile.validation.metric.Accuracy;
import smile.validation.metric.R2;

import java.util.List;

public final class Scores {

    private Scores() {}

    public static double accuracy(int[] yTrue, int[] yPred) {
        requireSameLength(yTrue.length, yPred.length);
        return Accuracy.of(yTrue, yPred);
    }

    /**
     * Coefficient of determination. Constant targets score 1.0 when predicted exactly and 0.0 otherwise.
     */
    public static double r2(double[] yTrue, double[] yPred) {
        requireSameLength(yTrue.length, yPred.length);
        DescriptiveStatistics truth = new DescriptiveStatistics(yTrue);
        if (truth.getMax() == truth.getMin()) {
            for (int i = 0; i < yTrue.length; i++) {
                if (yTrue[i] != yPred[i]) return 0.0;
            }
            return 1.0;
        }
        return R2.of(yTrue, yPred);
    }

    public static double mean(List<Double> xs) {
        return describe(xs).getMean();
    }

    /** Population standard deviation. */
    public static double std(List<Double> xs) {
        return Math.sqrt(describe(xs).getPopulationVariance());
    }

    private static DescriptiveStatistics describe(List<Double> xs) {
        if (xs.isEmpty()) {
            throw new InvalidArgumentException("Cannot summarise an empty score list");
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        xs.forEach(stats::addValue);
        return stats;
    }

    private static void requireSameLength(int a, int b) {
        if (a == 0 || a != b) {
            throw new InvalidArgumentException("Cannot score " + b + " predictions against " + a + " targets");
        }
    }
}
