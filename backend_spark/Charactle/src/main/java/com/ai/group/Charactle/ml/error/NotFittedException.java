package com.ai.group.Charactle.ml.error;

/**
 * Thrown when an encoder, vectorizer or feature assembler is used for transformation
 * before it has been fitted.
 */
public class NotFittedException extends ModelPipelineException {
    public NotFittedException(String component) {
        super(component + " is not fitted yet");
    }
}
