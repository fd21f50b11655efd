package com.ai.assistant.exception;

/**
 * A collaborator call (complaint backend, retrieval, generation) failed. Retryable.
 */
public class BackendFailureException extends RuntimeException {

    public BackendFailureException(String message) {
        super(message);
    }

    public BackendFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
