package com.ai.group.Charactle.ml.feature;

import com.ai.group.Charactle.CharacterFixtures;
import com.ai.group.Charactle.character.model.CharacterRecord;
import com.ai.group.Charactle.ml.error.NotFittedException;
import com.ai.group.Charactle.ml.error.UnknownCategoryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureAssemblerTest {

    @Test
    @DisplayName("rows and names always span 4 + V + 2 columns")
    void widthInvariant() {
        var assembler = new FeatureAssembler(50);
        FeatureSet set = assembler.build(CharacterFixtures.heroes(), true);

        assertEquals(56, assembler.width());
        assertEquals(56, assembler.featureNames().size());
        for (double[] row : set.x()) assertEquals(56, row.length);
        assertEquals(56, assembler.transform(CharacterFixtures.batman()).length);
    }

    @Test
    @DisplayName("column layout: scalars, text weights, then category codes")
    void layout() {
        var assembler = new FeatureAssembler(50);
        double[] row = assembler.build(CharacterFixtures.heroes(), true).x()[0];
        CharacterRecord spidey = CharacterFixtures.spiderMan();
        List<String> names = assembler.featureNames();

        assertEquals(3.0, row[0]);
        assertEquals(spidey.name().length(), row[1]);
        assertEquals(spidey.quote().length(), row[2]);
        assertEquals(spidey.description().length(), row[3]);
        assertEquals(1.0, row[54]); // Marvel after DC
        assertEquals(0.0, row[55]);
        assertEquals("powers_count", names.get(0));
        assertTrue(names.get(4).startsWith("tfidf:"));
        assertEquals("universe", names.get(54));
        assertEquals("genre", names.get(55));
    }

    @Test
    @DisplayName("unused text slots get positional names")
    void unusedSlotNames() {
        var assembler = new FeatureAssembler(500);
        assembler.build(CharacterFixtures.heroes(), true);

        assertEquals("tfidf_499", assembler.featureNames().get(4 + 499));
    }

    @Test
    @DisplayName("transform is idempotent")
    void idempotentTransform() {
        var assembler = new FeatureAssembler(50);
        FeatureSet fitted = assembler.build(CharacterFixtures.heroes(), true);

        double[] once = assembler.transform(CharacterFixtures.ironMan());
        double[] twice = assembler.transform(CharacterFixtures.ironMan());
        assertArrayEquals(once, twice);
        assertArrayEquals(fitted.x()[1], once);
    }

    @Test
    @DisplayName("targets carry ids and difficulties")
    void targets() {
        FeatureSet set = new FeatureAssembler(50).build(CharacterFixtures.heroes(), true);

        assertEquals(List.of("spider-man", "iron-man", "batman"), set.classTargets());
        assertArrayEquals(new double[]{2.0, 3.0, 4.0}, set.regressionTargets());
        assertEquals(3, set.size());
    }

    @Test
    @DisplayName("unknown universe is rejected at transform time")
    void unknownUniverse() {
        var assembler = new FeatureAssembler(50);
        assembler.build(CharacterFixtures.heroes(), true);
        var pikachu = CharacterFixtures.batman().toBuilder().universe("Pokemon").build();

        var ex = assertThrows(UnknownCategoryException.class, () -> assembler.transform(pikachu));
        assertEquals("universe", ex.getField());
    }

    @Test
    @DisplayName("fit happens once and transform needs it")
    void lifecycle() {
        var assembler = new FeatureAssembler(50);
        assertThrows(NotFittedException.class, () -> assembler.build(CharacterFixtures.heroes(), false));
        assertThrows(NotFittedException.class, assembler::featureNames);

        assembler.build(CharacterFixtures.heroes(), true);
        assertThrows(IllegalStateException.class, () -> assembler.build(CharacterFixtures.heroes(), true));
    }
}
