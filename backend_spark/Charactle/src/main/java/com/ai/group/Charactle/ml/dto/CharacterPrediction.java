// com/ai/group/Charactle/ml/dto/CharacterPrediction.java
package com.ai.group.Charactle.ml.dto;

public record CharacterPrediction(
        String character,     // character id
        double probability,   // 0..1
        double confidence     // probability as a percentage
) {}
