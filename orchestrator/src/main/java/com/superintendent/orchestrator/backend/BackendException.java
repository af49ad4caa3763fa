package com.superintendent.orchestrator.backend;

/**
 * Thrown when the sandbox executor service returns an error or is unreachable.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
