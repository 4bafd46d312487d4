package com.retinaai.exception;

/**
 * The requested state already holds or the creation would duplicate an existing record.
 */
public class ConflictException extends PipelineException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
