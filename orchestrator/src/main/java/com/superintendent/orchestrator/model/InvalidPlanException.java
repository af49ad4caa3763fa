package com.superintendent.orchestrator.model;

import java.util.List;

/**
 * Thrown when a plan is asked for its execution order (or built by the
 * Planner) while {@link WorkflowPlan#validate()} still reports errors.
 */
public class InvalidPlanException extends RuntimeException {

    private final List<String> errors;

    public InvalidPlanException(List<String> errors) {
        super("Invalid plan: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() { return errors; }
}
