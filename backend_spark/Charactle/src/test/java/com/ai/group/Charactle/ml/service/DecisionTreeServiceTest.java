package com.ai.group.Charactle.ml.service;

import com.ai.group.Charactle.CharacterFixtures;
import com.ai.group.Charactle.character.CharacterCatalog;
import com.ai.group.Charactle.ml.config.DecisionTreeProperties;
import com.ai.group.Charactle.ml.dto.FeatureImportance;
import com.ai.group.Charactle.ml.dto.TrainingMetrics;
import com.ai.group.Charactle.ml.dto.TreeDiagram;
import com.ai.group.Charactle.ml.error.CorruptStateException;
import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.persistence.ModelStateCodec;
import com.ai.group.Charactle.ml.persistence.ModelStore;
import com.ai.group.Charactle.ml.pipeline.CharacterDecisionTree;
import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DecisionTreeServiceTest {

    @TempDir
    Path dir;

    private CharacterCatalog catalog;
    private DecisionTreeProperties props;
    private ModelStore store;
    private DecisionTreeService service;

    @BeforeEach
    void setUp() {
        catalog = mock(CharacterCatalog.class);
        props = new DecisionTreeProperties();
        props.setModelPath(dir.resolve("model.json").toString());
        store = new ModelStore(new ModelStateCodec());
        service = newService();
    }

    private DecisionTreeService newService() {
        return new DecisionTreeService(new CharacterDecisionTree(), store, catalog, props);
    }

    @Test
    @DisplayName("trainFromCatalog trains on the configured catalog")
    void trainFromCatalog() throws IOException {
        when(catalog.load("classpath:data/characters.json")).thenReturn(CharacterFixtures.heroes());

        TrainingMetrics metrics = service.trainFromCatalog();

        assertEquals(3, metrics.classifier().nClasses());
        verify(catalog).load("classpath:data/characters.json");
        assertEquals("batman", service.predictCharacter(CharacterFixtures.batman()).get(0).character());
    }

    @Test
    @DisplayName("explicit hyperparameters override the configured ones")
    void hyperparameters() {
        service.train(CharacterFixtures.roster(), new TreeHyperparameters(1, 2, 1));

        assertEquals(1, service.modelInfo().classifier().treeDepth());
    }

    @Test
    @DisplayName("introspection dispatches on kind with defaults")
    void introspect() {
        service.train(CharacterFixtures.heroes());

        @SuppressWarnings("unchecked")
        var importance = (List<FeatureImportance>) service.introspect("importance", Map.of("top_n", "2"));
        assertTrue(importance.size() <= 2);

        var rules = (String) service.introspect("rules", null);
        assertTrue(rules.contains("class: "));

        var diagram = (TreeDiagram) service.introspect("diagram", Map.of("tree_type", "regressor", "max_depth", 1));
        assertEquals("svg", diagram.format());
        assertEquals("base64", diagram.encoding());
        assertFalse(diagram.image().isEmpty());
    }

    @Test
    @DisplayName("unknown kinds and bad parameters are rejected")
    void introspectRejects() {
        service.train(CharacterFixtures.heroes());

        assertThrows(InvalidArgumentException.class, () -> service.introspect("forest", Map.of()));
        assertThrows(InvalidArgumentException.class, () -> service.introspect("importance", Map.of("top_n", "many")));
        assertThrows(InvalidArgumentException.class,
                () -> service.introspect("diagram", Map.of("tree_type", "forest")));
    }

    @Test
    @DisplayName("a saved model is picked up at startup")
    void saveThenAutoLoad() throws IOException {
        service.train(CharacterFixtures.heroes());
        Path saved = service.save();
        assertTrue(Files.exists(saved));

        var restarted = newService();
        restarted.init();

        assertTrue(restarted.modelInfo().classifier().trained());
        assertEquals(service.predictDifficulty(CharacterFixtures.ironMan()),
                restarted.predictDifficulty(CharacterFixtures.ironMan()));
    }

    @Test
    @DisplayName("startup without a saved model leaves the service untrained")
    void noSavedModel() {
        service.init();
        assertFalse(service.modelInfo().classifier().trained());
    }

    @Test
    @DisplayName("auto-load can be switched off")
    void autoLoadDisabled() throws IOException {
        service.train(CharacterFixtures.heroes());
        service.save();
        props.setAutoLoad(false);

        var restarted = newService();
        restarted.init();

        assertFalse(restarted.modelInfo().classifier().trained());
    }

    @Test
    @DisplayName("a corrupt file never replaces the live model")
    void corruptLoad() throws IOException {
        service.train(CharacterFixtures.heroes());
        double before = service.predictDifficulty(CharacterFixtures.batman());
        Files.write(dir.resolve("model.json"), "{\"formatVersion\":1}".getBytes(StandardCharsets.UTF_8));

        assertThrows(CorruptStateException.class, service::load);
        assertEquals(before, service.predictDifficulty(CharacterFixtures.batman()));
    }
}
