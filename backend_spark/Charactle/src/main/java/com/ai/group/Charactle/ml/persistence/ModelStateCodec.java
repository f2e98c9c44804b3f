package com.ai.group.Charactle.ml.persistence;

import com.ai.group.Charactle.ml.error.CorruptStateException;
import com.ai.group.Charactle.ml.error.ModelPipelineException;
import com.ai.group.Charactle.ml.feature.FeatureAssembler;
import com.ai.group.Charactle.ml.feature.LabelEncoder;
import com.ai.group.Charactle.ml.feature.TfidfVectorizer;
import com.ai.group.Charactle.ml.pipeline.FittedModelState;
import com.ai.group.Charactle.ml.tree.DecisionTreeClassifier;
import com.ai.group.Charactle.ml.tree.DecisionTreeRegressor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a {@link FittedModelState} into one self-contained, versioned JSON blob and back.
 * Loading validates the whole blob before building anything, so a bad blob never yields a
 * half-usable state.
 */
public class ModelStateCodec {

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper om;

    public ModelStateCodec() {
        this(new ObjectMapper());
    }

    public ModelStateCodec(ObjectMapper om) {
        this.om = om.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] save(FittedModelState state) {
        FeatureAssembler a = state.getAssembler();
        TfidfVectorizer v = a.vectorizer();
        ModelSnapshot snapshot = new ModelSnapshot(
                FORMAT_VERSION,
                state.getHyperparameters(),
                v.maxFeatures(),
                v.vocabulary(),
                v.idf(),
                a.universeEncoder().classes(),
                a.genreEncoder().classes(),
                a.featureNames(),
                state.classNames(),
                state.isClassifierTrained(),
                state.isRegressorTrained(),
                a.width(),
                state.isClassifierTrained() ? state.getClassifier().structure() : null,
                state.isRegressorTrained() ? state.getRegressor().structure() : null,
                state.getMetrics());
        try {
            return om.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialise model state", e);
        }
    }

    public FittedModelState load(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new CorruptStateException("Model blob is empty");
        }
        ModelSnapshot s;
        try {
            s = om.readValue(blob, ModelSnapshot.class);
        } catch (IOException e) {
            throw new CorruptStateException("Model blob is not a readable model state: " + e.getMessage(), e);
        }
        if (s.formatVersion() == null || s.formatVersion() != FORMAT_VERSION) {
            throw new CorruptStateException("Incompatible model format version " + s.formatVersion()
                    + " (expected " + FORMAT_VERSION + ")");
        }
        requirePresent(s);
        try {
            return rebuild(s);
        } catch (CorruptStateException e) {
            throw e;
        } catch (ModelPipelineException | IllegalArgumentException | IllegalStateException e) {
            throw new CorruptStateException("Model blob is inconsistent: " + e.getMessage(), e);
        }
    }

    private FittedModelState rebuild(ModelSnapshot s) {
        TfidfVectorizer vectorizer = TfidfVectorizer.restore(s.maxTextFeatures(), s.vocabulary(), s.idf());
        FeatureAssembler assembler = FeatureAssembler.restore(
                vectorizer,
                LabelEncoder.ofClasses(FeatureAssembler.UNIVERSE, s.universes()),
                LabelEncoder.ofClasses(FeatureAssembler.GENRE, s.genres()));
        if (!assembler.featureNames().equals(s.featureNames()) || assembler.width() != s.nFeatures()) {
            throw new CorruptStateException("Stored feature names do not match the stored vocabulary and encoders");
        }
        LabelEncoder labels = LabelEncoder.ofClasses("id", s.classNames());
        if (!labels.classes().equals(s.classNames())) {
            throw new CorruptStateException("Stored class names are not sorted and unique");
        }

        DecisionTreeClassifier classifier = s.classifierTrained()
                ? DecisionTreeClassifier.restore(s.hyperparameters(), s.nFeatures(), labels.size(), s.classifierTree())
                : null;
        DecisionTreeRegressor regressor = s.regressorTrained()
                ? DecisionTreeRegressor.restore(s.hyperparameters(), s.nFeatures(), s.regressorTree())
                : null;
        return new FittedModelState(assembler, labels, classifier, regressor, s.hyperparameters(), s.metrics());
    }

    private static void requirePresent(ModelSnapshot s) {
        Map<String, Object> required = new LinkedHashMap<>();
        required.put("hyperparameters", s.hyperparameters());
        required.put("maxTextFeatures", s.maxTextFeatures());
        required.put("vocabulary", s.vocabulary());
        required.put("idf", s.idf());
        required.put("universes", s.universes());
        required.put("genres", s.genres());
        required.put("featureNames", s.featureNames());
        required.put("classNames", s.classNames());
        required.put("classifierTrained", s.classifierTrained());
        required.put("regressorTrained", s.regressorTrained());
        required.put("nFeatures", s.nFeatures());
        required.put("metrics", s.metrics());
        required.forEach((field, value) -> {
            if (value == null) throw new CorruptStateException("Model blob is missing field '" + field + "'");
        });
        if (s.classifierTrained() && s.classifierTree() == null) {
            throw new CorruptStateException("Model blob is missing field 'classifierTree'");
        }
        if (s.regressorTrained() && s.regressorTree() == null) {
            throw new CorruptStateException("Model blob is missing field 'regressorTree'");
        }
        if (!s.classifierTrained() && !s.regressorTrained()) {
            throw new CorruptStateException("Model blob holds no trained model");
        }
        if (s.classifierTrained() && (s.metrics().classifier() == null || s.metrics().classifier().cvScores() == null)) {
            throw new CorruptStateException("Model blob is missing field 'metrics.classifier'");
        }
        if (s.regressorTrained() && s.metrics().regressor() == null) {
            throw new CorruptStateException("Model blob is missing field 'metrics.regressor'");
        }
    }
}
