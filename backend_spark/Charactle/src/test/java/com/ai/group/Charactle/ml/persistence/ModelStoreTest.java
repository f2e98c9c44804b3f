package com.ai.group.Charactle.ml.persistence;

import com.ai.group.Charactle.CharacterFixtures;
import com.ai.group.Charactle.ml.pipeline.CharacterDecisionTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelStoreTest {

    @TempDir
    Path dir;

    private final ModelStore store = new ModelStore(new ModelStateCodec());

    @Test
    @DisplayName("save writes the file and leaves no temp files behind")
    void saveAndLoad() throws IOException {
        var model = new CharacterDecisionTree();
        model.train(CharacterFixtures.heroes());
        Path target = dir.resolve("models").resolve("decision_tree_model.json");

        store.save(model.state(), target);

        assertTrue(store.exists(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count());
        }
        var restored = new CharacterDecisionTree();
        restored.restore(store.load(target));
        assertEquals(model.predictCharacter(CharacterFixtures.batman(), 3),
                restored.predictCharacter(CharacterFixtures.batman(), 3));
    }

    @Test
    @DisplayName("saving again replaces the previous model")
    void overwrite() throws IOException {
        Path target = dir.resolve("model.json");
        var first = new CharacterDecisionTree();
        first.train(CharacterFixtures.heroes());
        store.save(first.state(), target);

        var second = new CharacterDecisionTree();
        second.train(CharacterFixtures.roster());
        store.save(second.state(), target);

        assertEquals(4, store.load(target).classNames().size());
    }

    @Test
    @DisplayName("a missing file is an I/O error")
    void missingFile() {
        Path missing = dir.resolve("nope.json");
        assertFalse(store.exists(missing));
        assertThrows(IOException.class, () -> store.load(missing));
    }
}
