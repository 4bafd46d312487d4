package com.retinaai.exception;

/**
 * Base type for errors raised by pipeline services.
 * Each subtype corresponds to one error kind surfaced to callers unchanged.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
