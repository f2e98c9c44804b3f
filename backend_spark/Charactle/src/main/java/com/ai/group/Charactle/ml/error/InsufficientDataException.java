package com.ai.group.Charactle.ml.error;

public class InsufficientDataException extends ModelPipelineException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
