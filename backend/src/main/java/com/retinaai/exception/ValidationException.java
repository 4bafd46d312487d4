package com.retinaai.exception;

/**
 * Malformed or missing required input, e.g. an empty rejection comment.
 */
public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
