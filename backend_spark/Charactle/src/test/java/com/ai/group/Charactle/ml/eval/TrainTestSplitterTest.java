package com.ai.group.Charactle.ml.eval;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TrainTestSplitterTest {

    private final TrainTestSplitter splitter = new TrainTestSplitter(0.2, 42);

    @Test
    @DisplayName("a class with one row forces the degraded split")
    void singletonClassDegrades() {
        TrainTestSplit split = splitter.split(new int[]{0, 1, 2}, 3);

        assertTrue(split.degraded());
        assertArrayEquals(new int[]{0, 1, 2}, split.train());
        assertArrayEquals(split.train(), split.test());
    }

    @Test
    @DisplayName("five rows are too few even when every class repeats")
    void tooFewRows() {
        assertTrue(splitter.split(new int[]{0, 0, 1, 1, 1}, 2).degraded());
        assertFalse(TrainTestSplitter.canStratify(new int[]{0, 0, 1, 1, 1}, 2));
        assertTrue(TrainTestSplitter.canStratify(new int[]{0, 0, 1, 1, 1, 1}, 2));
    }

    @Test
    @DisplayName("six rows in three classes hold one row of each class out")
    void everyClassTested() {
        int[] y = {0, 0, 1, 1, 2, 2};
        TrainTestSplit split = splitter.split(y, 3);

        assertFalse(split.degraded());
        assertEquals(3, split.test().length);
        assertEquals(3, split.train().length);
        int[] testClasses = TrainTestSplit.pick(y, split.test());
        Arrays.sort(testClasses);
        assertArrayEquals(new int[]{0, 1, 2}, testClasses);
    }

    @Test
    @DisplayName("partitions are disjoint, cover every row and keep a training row per class")
    void partitions() {
        int[] y = {0, 0, 0, 0, 0, 1, 1, 1, 1, 1, 2, 2, 2};
        TrainTestSplit split = splitter.split(y, 3);

        int[] all = IntStream.concat(Arrays.stream(split.train()), Arrays.stream(split.test())).sorted().toArray();
        assertArrayEquals(IntStream.range(0, y.length).toArray(), all);
        int[] trainClasses = Arrays.stream(TrainTestSplit.pick(y, split.train())).distinct().sorted().toArray();
        assertArrayEquals(new int[]{0, 1, 2}, trainClasses);
        assertTrue(split.test().length >= 3);
    }

    @Test
    @DisplayName("the same seed gives the same split")
    void seeded() {
        int[] y = {0, 1, 0, 1, 0, 1, 0, 1, 0, 1, 0, 1};
        TrainTestSplit a = splitter.split(y, 2);
        TrainTestSplit b = new TrainTestSplitter(0.2, 42).split(y, 2);

        assertArrayEquals(a.test(), b.test());
        assertArrayEquals(a.train(), b.train());
    }

    @Test
    @DisplayName("test fraction must lie strictly between 0 and 1")
    void fractionValidated() {
        assertThrows(InvalidArgumentException.class, () -> new TrainTestSplitter(0, 1));
        assertThrows(InvalidArgumentException.class, () -> new TrainTestSplitter(1, 1));
    }
}
