package com.ai.group.Charactle.ml.pipeline;

import com.ai.group.Charactle.character.model.CharacterRecord;
import com.ai.group.Charactle.ml.dto.CharacterPrediction;
import com.ai.group.Charactle.ml.dto.ClassifierMetrics;
import com.ai.group.Charactle.ml.dto.FeatureImportance;
import com.ai.group.Charactle.ml.dto.ModelInfo;
import com.ai.group.Charactle.ml.dto.RegressorMetrics;
import com.ai.group.Charactle.ml.dto.TrainingMetrics;
import com.ai.group.Charactle.ml.error.InsufficientDataException;
import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.InvalidRecordException;
import com.ai.group.Charactle.ml.error.NotTrainedException;
import com.ai.group.Charactle.ml.eval.Scores;
import com.ai.group.Charactle.ml.eval.StratifiedKFold;
import com.ai.group.Charactle.ml.eval.TrainTestSplit;
import com.ai.group.Charactle.ml.eval.TrainTestSplitter;
import com.ai.group.Charactle.ml.feature.FeatureAssembler;
import com.ai.group.Charactle.ml.feature.FeatureSet;
import com.ai.group.Charactle.ml.feature.LabelEncoder;
import com.ai.group.Charactle.ml.tree.DecisionTreeClassifier;
import com.ai.group.Charactle.ml.tree.DecisionTreeModel;
import com.ai.group.Charactle.ml.tree.DecisionTreeRegressor;
import com.ai.group.Charactle.ml.tree.TreeDiagramRenderer;
import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import com.ai.group.Charactle.ml.tree.TreeKind;
import com.ai.group.Charactle.ml.tree.TreeTextExporter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Decision-tree pair for the guessing game: a classifier that names the character and a regressor
 * that estimates its difficulty (0-10), trained together on one feature layout.
 *
 * <p>Engineered features:
 * <ul>
 *   <li>numeric: powers count, name / quote / description length</li>
 *   <li>text: TF-IDF over quote + name + description</li>
 *   <li>categorical: universe and genre codes</li>
 * </ul>
 *
 * <p>Untrained until {@link #train} succeeds; a successful train or {@link #restore} replaces the
 * whole {@link FittedModelState} at once. Not thread-safe: callers serialise {@code train} and
 * {@code restore} against every other call.
 */
@Slf4j
public class CharacterDecisionTree {

    public static final double TEST_FRACTION = 0.2;
    public static final long SPLIT_SEED = 42L;
    public static final int MIN_ROWS_FOR_CV = 10;
    public static final int MAX_CV_FOLDS = 5;
    public static final double MIN_DIFFICULTY = 0.0;
    public static final double MAX_DIFFICULTY = 10.0;
    public static final int DEFAULT_TEXT_FEATURES = 50;
    private static final int RULE_DECIMALS = 2;

    private final TreeHyperparameters defaultHyperparameters;
    private final int maxTextFeatures;
    private FittedModelState state;

    public CharacterDecisionTree() {
        this(TreeHyperparameters.DEFAULTS, DEFAULT_TEXT_FEATURES);
    }

    public CharacterDecisionTree(TreeHyperparameters defaultHyperparameters, int maxTextFeatures) {
        this.defaultHyperparameters = defaultHyperparameters == null ? TreeHyperparameters.DEFAULTS : defaultHyperparameters;
        this.maxTextFeatures = maxTextFeatures;
    }

    // ===== training

    public TrainingMetrics train(List<CharacterRecord> characters) {
        return train(characters, defaultHyperparameters);
    }

    public TrainingMetrics train(List<CharacterRecord> characters, TreeHyperparameters hyperparameters) {
        if (characters == null || characters.isEmpty()) {
            throw new InsufficientDataException("Need at least 1 character to train, got 0");
        }
        for (int i = 0; i < characters.size(); i++) {
            CharacterRecord c = characters.get(i);
            if (c == null || !c.hasId()) throw new InvalidRecordException(i, "id");
        }
        TreeHyperparameters hp = hyperparameters == null ? defaultHyperparameters : hyperparameters;
        int n = characters.size();
        log.info("Training Decision Tree with {} characters (max_depth={}, min_samples_split={}, min_samples_leaf={})",
                n, hp.maxDepth(), hp.minSamplesSplit(), hp.minSamplesLeaf());

        FeatureAssembler assembler = new FeatureAssembler(maxTextFeatures);
        FeatureSet features = assembler.build(characters, true);
        double[][] x = features.x();

        LabelEncoder labels = new LabelEncoder("id");
        int[] y = labels.fitTransform(features.classTargets());
        int nClasses = labels.size();

        TrainTestSplit split = new TrainTestSplitter(TEST_FRACTION, SPLIT_SEED).split(y, nClasses);
        if (split.degraded()) {
            log.warn("Using all {} characters for both training and testing (too few samples for a stratified split)", n);
        }
        double[][] xTrain = TrainTestSplit.rows(x, split.train());
        double[][] xTest = TrainTestSplit.rows(x, split.test());
        int[] yTrain = TrainTestSplit.pick(y, split.train());
        int[] yTest = TrainTestSplit.pick(y, split.test());
        double[] dTrain = TrainTestSplit.pick(features.regressionTargets(), split.train());
        double[] dTest = TrainTestSplit.pick(features.regressionTargets(), split.test());

        DecisionTreeClassifier classifier = new DecisionTreeClassifier(hp).fit(xTrain, yTrain, nClasses);
        double trainAccuracy = classifier.score(xTrain, yTrain);
        double testAccuracy = classifier.score(xTest, yTest);

        List<Double> cvScores = List.of();
        if (!split.degraded() && n >= MIN_ROWS_FOR_CV) {
            cvScores = crossValidate(x, y, nClasses, hp);
        }

        DecisionTreeRegressor regressor = new DecisionTreeRegressor(hp).fit(xTrain, dTrain);
        double trainR2 = regressor.score(xTrain, dTrain);
        double testR2 = regressor.score(xTest, dTest);

        TrainingMetrics metrics = new TrainingMetrics(
                new ClassifierMetrics(
                        trainAccuracy,
                        testAccuracy,
                        cvScores,
                        cvScores.isEmpty() ? null : Scores.mean(cvScores),
                        cvScores.isEmpty() ? null : Scores.std(cvScores),
                        nClasses,
                        assembler.width(),
                        classifier.depth(),
                        classifier.leafCount()),
                new RegressorMetrics(trainR2, testR2, regressor.depth(), regressor.leafCount()),
                split.train().length,
                split.degraded() ? 0 : split.test().length, // nothing was held out
                split.degraded());

        this.state = new FittedModelState(assembler, labels, classifier, regressor, hp, metrics);
        log.info("Decision Tree Classifier trained (accuracy {}), Regressor trained (R2 {})",
                String.format(Locale.ROOT, "%.2f%%", testAccuracy * 100), String.format(Locale.ROOT, "%.4f", testR2));
        return metrics;
    }

    private List<Double> crossValidate(double[][] x, int[] y, int nClasses, TreeHyperparameters hp) {
        int folds = Math.min(MAX_CV_FOLDS, nClasses);
        if (folds < 2) {
            log.debug("Skipping cross-validation: a single class gives {} fold(s)", folds);
            return List.of();
        }
        List<Double> scores = new ArrayList<>(folds);
        for (int[] test : new StratifiedKFold(folds).testFolds(y, nClasses)) {
            if (test.length == 0) continue;
            int[] train = StratifiedKFold.complement(y.length, test);
            DecisionTreeClassifier fold = new DecisionTreeClassifier(hp)
                    .fit(TrainTestSplit.rows(x, train), TrainTestSplit.pick(y, train), nClasses);
            scores.add(fold.score(TrainTestSplit.rows(x, test), TrainTestSplit.pick(y, test)));
        }
        return List.copyOf(scores);
    }

    // ===== prediction

    /**
     * Most likely characters for the record, best first. Only classes with non-zero probability
     * are returned; classes with equal probability keep their label order.
     */
    public List<CharacterPrediction> predictCharacter(CharacterRecord character, int topK) {
        FittedModelState s = requireState("Classifier");
        if (topK < 1) {
            throw new InvalidArgumentException("top_k must be >= 1, got " + topK);
        }
        double[] row = s.getAssembler().transform(character);
        double[] p = s.requireClassifier().predictProba(row);

        Integer[] order = new Integer[p.length];
        for (int i = 0; i < p.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(p[b], p[a]));

        List<CharacterPrediction> out = new ArrayList<>(Math.min(topK, p.length));
        for (int idx : order) {
            if (out.size() == topK || p[idx] <= 0) break;
            out.add(new CharacterPrediction(s.getLabelEncoder().inverse(idx), p[idx], p[idx] * 100));
        }
        return out;
    }

    /** Estimated difficulty, clipped to 0..10. */
    public double predictDifficulty(CharacterRecord character) {
        FittedModelState s = requireState("Regressor");
        double raw = s.requireRegressor().predict(s.getAssembler().transform(character));
        return Math.max(MIN_DIFFICULTY, Math.min(MAX_DIFFICULTY, raw));
    }

    // ===== introspection

    public List<FeatureImportance> featureImportance(int topN) {
        FittedModelState s = requireState("Classifier");
        if (topN < 1) {
            throw new InvalidArgumentException("top_n must be >= 1, got " + topN);
        }
        double[] importances = s.requireClassifier().featureImportances();
        List<String> names = s.featureNames();

        Integer[] order = new Integer[importances.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(importances[b], importances[a]));

        List<FeatureImportance> out = new ArrayList<>();
        for (int idx : order) {
            if (out.size() == topN || importances[idx] <= 0) break;
            out.add(new FeatureImportance(names.get(idx), importances[idx]));
        }
        return out;
    }

    public String decisionRules(int maxDepth) {
        FittedModelState s = requireState("Classifier");
        return TreeTextExporter.export(s.requireClassifier().structure(), s.featureNames(), s.classNames(),
                maxDepth, RULE_DECIMALS);
    }

    /** Base64 of an SVG drawing of the chosen tree, cut at {@code maxDepth}. */
    public String visualizeTree(TreeKind kind, int maxDepth) {
        if (kind == null) {
            throw new InvalidArgumentException("Tree type is required");
        }
        FittedModelState s = requireState(kind.label());
        DecisionTreeModel model = kind == TreeKind.CLASSIFIER ? s.requireClassifier() : s.requireRegressor();
        List<String> classNames = kind == TreeKind.CLASSIFIER ? s.classNames() : null;
        byte[] svg = TreeDiagramRenderer.render(model.structure(), kind, s.featureNames(), classNames, maxDepth);
        return Base64.encodeBase64String(svg);
    }

    public String visualizeTree(String treeType, int maxDepth) {
        return visualizeTree(TreeKind.parse(treeType), maxDepth);
    }

    public ModelInfo modelInfo() {
        FittedModelState s = state;
        if (s == null) {
            return ModelInfo.untrained();
        }
        TrainingMetrics m = s.getMetrics();
        DecisionTreeClassifier c = s.getClassifier();
        DecisionTreeRegressor r = s.getRegressor();
        return new ModelInfo(
                new ModelInfo.ClassifierInfo(
                        c != null,
                        c != null ? s.classNames().size() : 0,
                        c != null ? s.classNames() : List.of(),
                        c != null ? m.classifier().trainAccuracy() : 0,
                        c != null ? m.classifier().testAccuracy() : 0,
                        c != null ? m.classifier().cvMean() : null,
                        c != null ? c.depth() : 0,
                        c != null ? c.leafCount() : 0),
                new ModelInfo.RegressorInfo(
                        r != null,
                        r != null ? m.regressor().trainR2() : 0,
                        r != null ? m.regressor().testR2() : 0,
                        r != null ? r.depth() : 0,
                        r != null ? r.leafCount() : 0),
                s.featureNames().size(),
                s.featureNames());
    }

    // ===== state

    public boolean isTrained() {
        return state != null;
    }

    /** Current fitted state, for persistence. */
    public FittedModelState state() {
        return requireState("Decision Tree");
    }

    /** Replaces the whole fitted state, e.g. with one read back from disk. */
    public void restore(FittedModelState restored) {
        if (restored == null) {
            throw new InvalidArgumentException("Cannot restore an empty state");
        }
        this.state = restored;
        log.info("Decision Tree state restored: {} classes, {} features",
                restored.classNames().size(), restored.featureNames().size());
    }

    private FittedModelState requireState(String model) {
        FittedModelState s = state;
        if (s == null) throw new NotTrainedException(model);
        return s;
    }
}
