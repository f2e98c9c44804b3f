package com.ai.group.Charactle.ml.error;

public class InvalidArgumentException extends ModelPipelineException {
    public InvalidArgumentException(String message) {
        super(message);
    }
}
