package com.ai.group.Charactle.ml.eval;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unshuffled stratified k-fold assignment. Classes are spread over folds the way a round-robin deal
 * of the class-sorted labels would, and each class keeps its original row order within the folds.
 */
public final class StratifiedKFold {

    private final int nSplits;

    public StratifiedKFold(int nSplits) {
        if (nSplits < 2) {
            throw new InvalidArgumentException("Cross-validation needs at least 2 folds, got " + nSplits);
        }
        this.nSplits = nSplits;
    }

    /** Test-row indices for each fold; the training rows of a fold are all others. */
    public List<int[]> testFolds(int[] y, int nClasses) {
        if (y.length < nSplits) {
            throw new InvalidArgumentException("Cannot make " + nSplits + " folds from " + y.length + " rows");
        }
        int[] sortedY = y.clone();
        Arrays.sort(sortedY);

        // allocation[f][c]: rows of class c that land in fold f
        int[][] allocation = new int[nSplits][nClasses];
        for (int i = 0; i < sortedY.length; i++) {
            allocation[i % nSplits][sortedY[i]]++;
        }

        int[] foldOf = new int[y.length];
        for (int c = 0; c < nClasses; c++) {
            List<Integer> rows = new ArrayList<>();
            for (int i = 0; i < y.length; i++) if (y[i] == c) rows.add(i);
            int pos = 0;
            for (int f = 0; f < nSplits; f++) {
                for (int j = 0; j < allocation[f][c]; j++) foldOf[rows.get(pos++)] = f;
            }
        }

        List<int[]> folds = new ArrayList<>(nSplits);
        for (int f = 0; f < nSplits; f++) {
            final int fold = f;
            int[] idx = new int[y.length];
            int m = 0;
            for (int i = 0; i < y.length; i++) if (foldOf[i] == fold) idx[m++] = i;
            folds.add(Arrays.copyOf(idx, m));
        }
        return folds;
    }

    public static int[] complement(int n, int[] test) {
        boolean[] held = new boolean[n];
        for (int i : test) held[i] = true;
        int[] out = new int[n - test.length];
        int m = 0;
        for (int i = 0; i < n; i++) if (!held[i]) out[m++] = i;
        return out;
    }

    public int nSplits() {
        return nSplits;
    }
}
