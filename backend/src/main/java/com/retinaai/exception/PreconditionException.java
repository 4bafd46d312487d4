package com.retinaai.exception;

/**
 * Required upstream state is missing, e.g. no active model or no approved review.
 */
public class PreconditionException extends PipelineException {

    public PreconditionException(String message) {
        super(message);
    }

    public PreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
