package com.ai.group.Charactle.ml.tree;

import com.ai.group.Charactle.ml.error.InvalidArgumentException;

import java.util.Locale;

public enum TreeKind {
    CLASSIFIER,
    REGRESSOR;

    public static TreeKind parse(String raw) {
        if (raw != null) {
            switch (raw.strip().toLowerCase(Locale.ROOT)) {
                case "classifier":
                    return CLASSIFIER;
                case "regressor":
                    return REGRESSOR;
                default:
                    break;
            }
        }
        throw new InvalidArgumentException("Unsupported tree type '" + raw + "': expected classifier or regressor");
    }

    public String label() {
        return this == CLASSIFIER ? "Classifier" : "Regressor";
    }
}
