package com.ai.group.Charactle.ml.persistence;

import com.ai.group.Charactle.CharacterFixtures;
import com.ai.group.Charactle.character.model.CharacterRecord;
import com.ai.group.Charactle.ml.error.CorruptStateException;
import com.ai.group.Charactle.ml.pipeline.CharacterDecisionTree;
import com.ai.group.Charactle.ml.pipeline.FittedModelState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ModelStateCodecTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ModelStateCodec codec = new ModelStateCodec();
    private CharacterDecisionTree trained;
    private byte[] blob;

    @BeforeEach
    void setUp() {
        trained = new CharacterDecisionTree();
        trained.train(CharacterFixtures.roster());
        blob = codec.save(trained.state());
    }

    @Test
    @DisplayName("predictions survive a round trip unchanged")
    void roundTrip() {
        var restored = new CharacterDecisionTree();
        restored.restore(codec.load(blob));

        for (CharacterRecord r : CharacterFixtures.roster()) {
            assertEquals(trained.predictCharacter(r, 4), restored.predictCharacter(r, 4));
            assertEquals(trained.predictDifficulty(r), restored.predictDifficulty(r));
        }
        assertEquals(trained.decisionRules(5), restored.decisionRules(5));
        assertEquals(trained.modelInfo(), restored.modelInfo());
    }

    @Test
    @DisplayName("loaded state keeps layout, classes and metrics")
    void loadedState() {
        FittedModelState original = trained.state();
        FittedModelState loaded = codec.load(blob);

        assertEquals(original.featureNames(), loaded.featureNames());
        assertEquals(original.classNames(), loaded.classNames());
        assertEquals(original.getHyperparameters(), loaded.getHyperparameters());
        assertEquals(original.getMetrics(), loaded.getMetrics());
        assertTrue(loaded.isClassifierTrained());
        assertTrue(loaded.isRegressorTrained());
    }

    @Test
    @DisplayName("garbage and empty blobs are corrupt")
    void garbage() {
        assertThrows(CorruptStateException.class, () -> codec.load("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CorruptStateException.class, () -> codec.load(new byte[0]));
        assertThrows(CorruptStateException.class, () -> codec.load(null));
    }

    @Test
    @DisplayName("another format version is rejected")
    void versionMismatch() {
        var ex = assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.put("formatVersion", 99))));
        assertTrue(ex.getMessage().contains("99"));
    }

    @Test
    @DisplayName("missing fields are rejected")
    void missingField() {
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.remove("idf"))));
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.remove("classifierTree"))));
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.putObject("metrics"))));
        assertThrows(CorruptStateException.class,
                () -> codec.load(edit(n -> ((ObjectNode) n.get("metrics")).remove("regressor"))));
    }

    @Test
    @DisplayName("inconsistent fields are rejected")
    void inconsistent() {
        assertThrows(CorruptStateException.class,
                () -> codec.load(edit(n -> ((ArrayNode) n.get("featureNames")).set(0, TextNode.valueOf("bogus")))));
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.put("nFeatures", 3))));
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> n.put("unexpected", true))));
    }

    @Test
    @DisplayName("trees with empty class counts or no samples are rejected")
    void invalidTreeNumbers() {
        assertThrows(CorruptStateException.class, () -> codec.load(edit(n -> {
            for (JsonNode counts : n.get("classifierTree").get("value")) {
                ArrayNode row = (ArrayNode) counts;
                for (int i = 0; i < row.size(); i++) row.set(i, DoubleNode.valueOf(0));
            }
        })));
        assertThrows(CorruptStateException.class,
                () -> codec.load(edit(n -> ((ArrayNode) n.get("regressorTree").get("nodeSamples")).set(0, IntNode.valueOf(-1)))));
        assertThrows(CorruptStateException.class,
                () -> codec.load(edit(n -> ((ArrayNode) n.get("classifierTree").get("impurity")).set(0, DoubleNode.valueOf(-0.5)))));
    }

    private byte[] edit(Consumer<ObjectNode> change) throws Exception {
        ObjectNode node = (ObjectNode) om.readTree(blob);
        change.accept(node);
        return om.writeValueAsBytes(node);
    }
}
