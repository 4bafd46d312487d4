package com.retinaai.exception;

/**
 * A referenced entity id does not exist.
 */
public class NotFoundException extends PipelineException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
