package com.ai.group.Charactle.ml.error;

/**
 * Thrown when a persisted model blob cannot be turned back into a usable fitted state:
 * unreadable bytes, an incompatible format version, or missing and inconsistent fields.
 */
public class CorruptStateException extends ModelPipelineException {
    public CorruptStateException(String message) {
        super(message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
