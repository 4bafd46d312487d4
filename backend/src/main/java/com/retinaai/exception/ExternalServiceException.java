package com.retinaai.exception;

/**
 * The external scorer failed or timed out.
 * The orchestrator absorbs this into a failed analysis instead of propagating it.
 */
public class ExternalServiceException extends PipelineException {

    private final boolean timeout;

    public ExternalServiceException(String message) {
        this(message, null, false);
    }

    public ExternalServiceException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ExternalServiceException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static ExternalServiceException timeout(String message) {
        return new ExternalServiceException(message, null, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
