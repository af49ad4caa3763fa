package com.superintendent.orchestrator.source;

/**
 * Thrown when a task source cannot read or write its backing store.
 */
public class TaskSourceException extends RuntimeException {

    public TaskSourceException(String message) {
        super(message);
    }

    public TaskSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
