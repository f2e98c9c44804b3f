package com.ai.group.Charactle.ml.pipeline;

import com.ai.group.Charactle.ml.dto.TrainingMetrics;
import com.ai.group.Charactle.ml.error.InvalidArgumentException;
import com.ai.group.Charactle.ml.error.NotTrainedException;
import com.ai.group.Charactle.ml.feature.FeatureAssembler;
import com.ai.group.Charactle.ml.feature.LabelEncoder;
import com.ai.group.Charactle.ml.tree.DecisionTreeClassifier;
import com.ai.group.Charactle.ml.tree.DecisionTreeRegressor;
import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import lombok.Getter;

import java.util.List;

/**
 * Everything a trained pipeline knows: the fitted feature layout (vectorizer and category encoders),
 * the character label encoder, both trees, their hyperparameters and the metrics of the run that
 * produced them. Built whole by training or loading and never modified afterwards.
 */
@Getter
public final class FittedModelState {

    private final FeatureAssembler assembler;
    private final LabelEncoder labelEncoder;
    private final DecisionTreeClassifier classifier;
    private final DecisionTreeRegressor regressor;
    private final TreeHyperparameters hyperparameters;
    private final TrainingMetrics metrics;

    public FittedModelState(FeatureAssembler assembler,
                            LabelEncoder labelEncoder,
                            DecisionTreeClassifier classifier,
                            DecisionTreeRegressor regressor,
                            TreeHyperparameters hyperparameters,
                            TrainingMetrics metrics) {
        if (assembler == null || !assembler.isFitted()) {
            throw new InvalidArgumentException("Fitted state needs a fitted feature assembler");
        }
        if (labelEncoder == null || !labelEncoder.isFitted()) {
            throw new InvalidArgumentException("Fitted state needs a fitted label encoder");
        }
        int width = assembler.width();
        if (classifier != null && classifier.nFeatures() != width) {
            throw new InvalidArgumentException("Classifier expects " + classifier.nFeatures()
                    + " features but the layout has " + width);
        }
        if (classifier != null && classifier.nClasses() != labelEncoder.size()) {
            throw new InvalidArgumentException("Classifier knows " + classifier.nClasses()
                    + " classes but the label encoder has " + labelEncoder.size());
        }
        if (regressor != null && regressor.nFeatures() != width) {
            throw new InvalidArgumentException("Regressor expects " + regressor.nFeatures()
                    + " features but the layout has " + width);
        }
        this.assembler = assembler;
        this.labelEncoder = labelEncoder;
        this.classifier = classifier;
        this.regressor = regressor;
        this.hyperparameters = hyperparameters;
        this.metrics = metrics;
    }

    public boolean isClassifierTrained() {
        return classifier != null;
    }

    public boolean isRegressorTrained() {
        return regressor != null;
    }

    public List<String> featureNames() {
        return assembler.featureNames();
    }

    public List<String> classNames() {
        return labelEncoder.classes();
    }

    public DecisionTreeClassifier requireClassifier() {
        if (classifier == null) throw new NotTrainedException("Classifier");
        return classifier;
    }

    public DecisionTreeRegressor requireRegressor() {
        if (regressor == null) throw new NotTrainedException("Regressor");
        return regressor;
    }
}
