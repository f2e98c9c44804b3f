package com.ai.group.Charactle.ml.feature;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotFittedException;
import com.ai.group.Charactle.ml.error.UnknownCategoryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabelEncoderTest {

    @Test
    @DisplayName("fit learns sorted unique labels")
    void fitSortsLabels() {
        var enc = new LabelEncoder("universe");
        int[] codes = enc.fitTransform(List.of("Marvel", "DC", "Marvel", "Star Wars"));

        assertEquals(List.of("DC", "Marvel", "Star Wars"), enc.classes());
        assertArrayEquals(new int[]{1, 0, 1, 2}, codes);
        assertEquals(3, enc.size());
    }

    @Test
    @DisplayName("inverse maps codes back to labels")
    void inverse() {
        var enc = new LabelEncoder("genre");
        enc.fit(List.of("b", "a"));

        assertEquals("a", enc.inverse(0));
        assertEquals(List.of("b", "a"), enc.inverse(new int[]{1, 0}));
        assertThrows(InvalidArgumentException.class, () -> enc.inverse(2));
        assertThrows(InvalidArgumentException.class, () -> enc.inverse(-1));
    }

    @Test
    @DisplayName("unseen value names field and value")
    void unknownCategory() {
        var enc = new LabelEncoder("universe");
        enc.fit(List.of("Marvel", "DC"));

        var ex = assertThrows(UnknownCategoryException.class, () -> enc.transform("Pokemon"));
        assertEquals("universe", ex.getField());
        assertEquals("Pokemon", ex.getValue());
    }

    @Test
    @DisplayName("use before fit and second fit are rejected")
    void lifecycle() {
        var enc = new LabelEncoder("genre");
        assertFalse(enc.isFitted());
        assertThrows(NotFittedException.class, () -> enc.transform("x"));
        assertThrows(NotFittedException.class, () -> enc.inverse(0));
        assertThrows(NotFittedException.class, enc::classes);

        enc.fit(List.of("x"));
        assertTrue(enc.isFitted());
        assertThrows(IllegalStateException.class, () -> enc.fit(List.of("y")));
    }

    @Test
    @DisplayName("empty input cannot be fitted")
    void emptyFit() {
        assertThrows(InvalidArgumentException.class, () -> new LabelEncoder("genre").fit(List.of()));
    }

    @Test
    @DisplayName("ofClasses restores a fitted encoder and rejects duplicates")
    void ofClasses() {
        var enc = LabelEncoder.ofClasses("id", List.of("batman", "iron-man"));
        assertEquals(1, enc.transform("iron-man"));

        assertThrows(InvalidArgumentException.class, () -> LabelEncoder.ofClasses("id", List.of("a", "a")));
    }
}
