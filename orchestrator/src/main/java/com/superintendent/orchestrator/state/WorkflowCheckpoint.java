package com.superintendent.orchestrator.state;

import java.time.Instant;
import java.util.List;

/**
 * Persisted progress of one agent's workflow, written once its plan has run.
 *
 * @param workflowId   the agent id
 * @param sandboxName  null for local agents
 * @param worktreePath null when the plan never reached create_worktree
 */
public record WorkflowCheckpoint(
        String workflowId,
        String currentState,
        List<String> completedSteps,
        String sandboxName,
        String worktreePath,
        Instant createdAt,
        Instant updatedAt) {

    public WorkflowCheckpoint {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
    }

    /** Same checkpoint moved to a new state, with updatedAt refreshed. */
    public WorkflowCheckpoint withState(String state) {
        return new WorkflowCheckpoint(workflowId, state, completedSteps, sandboxName, worktreePath,
                createdAt, Instant.now());
    }
}
