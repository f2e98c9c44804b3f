package com.ai.group.Charactle.ml.error;

import lombok.Getter;

/**
 * Thrown when a categorical value was never seen while the encoder was fitted.
 */
@Getter
public class UnknownCategoryException extends ModelPipelineException {

    private final String field;
    private final String value;

    public UnknownCategoryException(String field, String value) {
        super("Unknown " + field + " '" + value + "': not present in training data");
        this.field = field;
        this.value = value;
    }
}
