package com.ai.group.Charactle.ml.error;

/**
 * Thrown when a prediction or introspection call reaches a model that has not been trained.
 */
public class NotTrainedException extends ModelPipelineException {
    public NotTrainedException(String model) {
        super(model + " not trained. Call train() first.");
    }
}
