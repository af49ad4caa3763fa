package com.superintendent.orchestrator.plan;

/**
 * Thrown when a plan cannot be serialized to, or parsed from, its JSON wire format.
 */
public class PlanFormatException extends RuntimeException {

    public PlanFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
