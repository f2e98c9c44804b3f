package com.ai.group.Charactle.ml.error;

import lombok.Getter;

/**
 * Thrown when a character record lacks a field the operation requires.
 */
@Getter
public class InvalidRecordException extends ModelPipelineException {

    private final int index;
    private final String field;

    public InvalidRecordException(int index, String field) {
        super("Character record #" + index + " is missing required field '" + field + "'");
        this.index = index;
        this.field = field;
    }
}
