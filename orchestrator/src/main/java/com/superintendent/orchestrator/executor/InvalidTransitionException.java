package com.superintendent.orchestrator.executor;

import com.superintendent.orchestrator.model.WorkflowState;

/**
 * Raised when a step would move the workflow backwards (or sideways) through
 * the state order. It points at a malformed plan or action table, not at a
 * runtime condition.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(WorkflowState from, WorkflowState to) {
        super("Cannot transition from " + from + " to " + to);
    }
}
