package com.ai.group.Charactle.ml.service;

import com.ai.group.Charactle.character.CharacterCatalog;
import com.ai.group.Charactle.character.model.CharacterRecord;
import com.ai.group.Charactle.ml.config.DecisionTreeProperties;
import com.ai.group.Charactle.ml.dto.CharacterPrediction;
import com.ai.group.Charactle.ml.dto.ModelInfo;
import com.ai.group.Charactle.ml.dto.TrainingMetrics;
import com.ai.group.Charactle.ml.dto.TreeDiagram;
import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.persistence.ModelStore;
import com.ai.group.Charactle.ml.pipeline.CharacterDecisionTree;
import com.ai.group.Charactle.ml.pipeline.FittedModelState;
import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import com.ai.group.Charactle.ml.tree.TreeKind;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Serving entry point for the decision-tree pipeline. Training and loading swap the model under the
 * write lock; everything that only reads the fitted state shares the read lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionTreeService {

    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_TOP_N = 20;
    public static final int DEFAULT_MAX_DEPTH = 3;

    public static final String KIND_IMPORTANCE = "importance";
    public static final String KIND_RULES = "rules";
    public static final String KIND_DIAGRAM = "diagram";

    private final CharacterDecisionTree model;
    private final ModelStore store;
    private final CharacterCatalog catalog;
    private final DecisionTreeProperties props;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @PostConstruct
    public void init() {
        if (!props.isAutoLoad()) {
            log.info("Decision tree auto-load disabled");
            return;
        }
        Path path = modelPath();
        if (!store.exists(path)) {
            log.info("No saved decision tree model at {}; waiting for training", path.toAbsolutePath());
            return;
        }
        try {
            load();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load decision tree model from " + path, e);
        }
    }

    // ===== training

    public TrainingMetrics train(List<CharacterRecord> characters) {
        return train(characters, null);
    }

    public TrainingMetrics train(List<CharacterRecord> characters, TreeHyperparameters hyperparameters) {
        return write(() -> model.train(characters, hyperparameters));
    }

    public TrainingMetrics trainFromCatalog() throws IOException {
        List<CharacterRecord> characters = catalog.load(props.getCatalogPath());
        return train(characters);
    }

    // ===== prediction

    public List<CharacterPrediction> predictCharacter(CharacterRecord character) {
        return predictCharacter(character, DEFAULT_TOP_K);
    }

    public List<CharacterPrediction> predictCharacter(CharacterRecord character, int topK) {
        return read(() -> model.predictCharacter(character, topK));
    }

    public double predictDifficulty(CharacterRecord character) {
        return read(() -> model.predictDifficulty(character));
    }

    // ===== introspection

    /**
     * @param kind   {@code importance}, {@code rules} or {@code diagram}
     * @param params optional {@code top_n}, {@code max_depth}, {@code tree_type}
     * @return a {@code List<FeatureImportance>}, the rule text, or a {@link TreeDiagram}
     */
    public Object introspect(String kind, Map<String, ?> params) {
        Map<String, ?> p = params == null ? Map.of() : params;
        String k = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        switch (k) {
            case KIND_IMPORTANCE: {
                int topN = intParam(p, "top_n", DEFAULT_TOP_N);
                return read(() -> model.featureImportance(topN));
            }
            case KIND_RULES: {
                int maxDepth = intParam(p, "max_depth", DEFAULT_MAX_DEPTH);
                return read(() -> model.decisionRules(maxDepth));
            }
            case KIND_DIAGRAM: {
                int maxDepth = intParam(p, "max_depth", DEFAULT_MAX_DEPTH);
                Object rawType = p.get("tree_type");
                TreeKind tree = TreeKind.parse(rawType == null ? TreeKind.CLASSIFIER.name() : rawType.toString());
                return read(() -> TreeDiagram.svgBase64(model.visualizeTree(tree, maxDepth)));
            }
            default:
                throw new InvalidArgumentException("Unsupported introspection kind '" + kind
                        + "' (expected importance, rules or diagram)");
        }
    }

    public ModelInfo modelInfo() {
        return read(model::modelInfo);
    }

    // ===== persistence

    public Path save() throws IOException {
        Path path = modelPath();
        lock.readLock().lock();
        try {
            store.save(model.state(), path);
        } finally {
            lock.readLock().unlock();
        }
        return path;
    }

    /** Parses the file first; the live model is only replaced once the whole blob checked out. */
    public void load() throws IOException {
        FittedModelState loaded = store.load(modelPath());
        write(() -> {
            model.restore(loaded);
            return null;
        });
    }

    private Path modelPath() {
        return Path.of(props.getModelPath());
    }

    private static int intParam(Map<String, ?> params, String name, int fallback) {
        Object raw = params.get(name);
        if (raw == null) return fallback;
        if (raw instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(name + " must be an integer, got '" + raw + "'");
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
