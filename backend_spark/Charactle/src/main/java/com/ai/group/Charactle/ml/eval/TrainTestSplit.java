package com.ai.group.Charactle.ml.eval;

/**
 * Row indices of the two partitions. When {@code degraded} is set both arrays hold every row:
 * the data set was too small to hold anything out.
 */
public record TrainTestSplit(int[] train, int[] test, boolean degraded) {

    public static double[][] rows(double[][] x, int[] idx) {
        double[][] out = new double[idx.length][];
        for (int i = 0; i < idx.length; i++) out[i] = x[idx[i]];
        return out;
    }

    public static int[] pick(int[] y, int[] idx) {
        int[] out = new int[idx.length];
        for (int i = 0; i < idx.length; i++) out[i] = y[idx[i]];
        return out;
    }

    public static double[] pick(double[] y, int[] idx) {
        double[] out = new double[idx.length];
        for (int i = 0; i < idx.length; i++) out[i] = y[idx[i]];
        return out;
    }
}
