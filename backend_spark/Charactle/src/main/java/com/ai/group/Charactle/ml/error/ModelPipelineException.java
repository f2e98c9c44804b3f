package com.ai.group.Charactle.ml.error;

/**
 * Root of the typed failures raised by the training, prediction, introspection
 * and persistence operations. Callers translate these into user-facing responses.
 */
public class ModelPipelineException extends RuntimeException {
    public ModelPipelineException(String message) {
        super(message);
    }

    public ModelPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
