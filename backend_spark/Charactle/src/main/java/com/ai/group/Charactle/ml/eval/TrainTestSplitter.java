package com.ai.group.Charactle.ml.eval;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded stratified hold-out split. A real split needs every class to have at least two rows
 * and more than {@link #MIN_ROWS_EXCLUSIVE} rows overall; otherwise the full set is used for
 * both partitions.
 */
public final class TrainTestSplitter {

    public static final int MIN_ROWS_EXCLUSIVE = 5;

    private final double testFraction;
    private final long seed;

    public TrainTestSplitter(double testFraction, long seed) {
        if (!(testFraction > 0 && testFraction < 1)) {
            throw new InvalidArgumentException("testFraction must be in (0, 1), got " + testFraction);
        }
        this.testFraction = testFraction;
        this.seed = seed;
    }

    public static boolean canStratify(int[] y, int nClasses) {
        int[] counts = classCounts(y, nClasses);
        for (int c : counts) if (c > 0 && c < 2) return false;
        return y.length > MIN_ROWS_EXCLUSIVE;
    }

    public TrainTestSplit split(int[] y, int nClasses) {
        int n = y.length;
        if (!canStratify(y, nClasses)) {
            int[] all = new int[n];
            for (int i = 0; i < n; i++) all[i] = i;
            return new TrainTestSplit(all, all.clone(), true);
        }

        List<List<Integer>> byClass = new ArrayList<>();
        for (int c = 0; c < nClasses; c++) byClass.add(new ArrayList<>());
        for (int i = 0; i < n; i++) byClass.get(y[i]).add(i);
        int present = 0;
        for (List<Integer> rows : byClass) if (!rows.isEmpty()) present++;

        // at least one test row per class, so every class can be scored
        int nTest = Math.max((int) Math.ceil(testFraction * n), present);
        int[] quota = allocate(byClass, n, nTest);

        Random rnd = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (int c = 0; c < nClasses; c++) {
            List<Integer> rows = new ArrayList<>(byClass.get(c));
            Collections.shuffle(rows, rnd);
            test.addAll(rows.subList(0, quota[c]));
            train.addAll(rows.subList(quota[c], rows.size()));
        }
        return new TrainTestSplit(sorted(train), sorted(test), false);
    }

    /** Largest-remainder share of {@code nTest} per class, leaving each class at least one training row. */
    private static int[] allocate(List<List<Integer>> byClass, int n, int nTest) {
        int k = byClass.size();
        int[] quota = new int[k];
        double[] remainder = new double[k];
        int assigned = 0;
        for (int c = 0; c < k; c++) {
            int size = byClass.get(c).size();
            double exact = (double) nTest * size / n;
            quota[c] = Math.min((int) Math.floor(exact), Math.max(0, size - 1));
            remainder[c] = exact - Math.floor(exact);
            assigned += quota[c];
        }
        Integer[] order = new Integer[k];
        for (int c = 0; c < k; c++) order[c] = c;
        Arrays.sort(order, (a, b) -> Double.compare(remainder[b], remainder[a]));
        while (assigned < nTest) {
            boolean progressed = false;
            for (int c : order) {
                if (assigned == nTest) break;
                int size = byClass.get(c).size();
                if (size > 0 && quota[c] < size - 1) {
                    quota[c]++;
                    assigned++;
                    progressed = true;
                }
            }
            if (!progressed) break;
        }
        return quota;
    }

    private static int[] classCounts(int[] y, int nClasses) {
        int[] counts = new int[nClasses];
        for (int v : y) counts[v]++;
        return counts;
    }

    private static int[] sorted(List<Integer> idx) {
        int[] out = idx.stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(out);
        return out;
    }
}
