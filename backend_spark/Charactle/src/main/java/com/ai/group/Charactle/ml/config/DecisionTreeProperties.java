package com.ai.group.Charactle.ml.config;

import com.ai.group.Charactle.ml.tree.TreeHyperparameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "charactle.decision-tree")
public class DecisionTreeProperties {

    /** Deepest level a tree may grow to; 0 or less means unlimited. */
    private int maxDepth = 10;
    private int minSamplesSplit = 2;
    private int minSamplesLeaf = 1;

    /** TF-IDF columns in every feature row. */
    private int maxTextFeatures = 50;

    private String modelPath = "models/decision_tree_model.json";

    /** Restore {@link #modelPath} at startup when the file exists. */
    private boolean autoLoad = true;

    /** Character JSON used by trainFromCatalog; {@code classpath:} or a file path. */
    private String catalogPath = "classpath:data/characters.json";

    public TreeHyperparameters toHyperparameters() {
        return new TreeHyperparameters(maxDepth > 0 ? maxDepth : null, minSamplesSplit, minSamplesLeaf);
    }
}
