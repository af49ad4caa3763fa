package com.superintendent.orchestrator.service;

/**
 * Thrown when a run cannot be started from the submitted inputs: no tasks
 * were found, or the chosen mode and target are not allowed together.
 */
public class InvalidRunRequestException extends RuntimeException {

    public InvalidRunRequestException(String message) {
        super(message);
    }
}
