package com.superintendent.orchestrator.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * States a single agent workflow moves through while its plan is executed.
 *
 * Transitions (happy path):
 *   INIT → ENSURING_REPO → CREATING_WORKTREE → PREPARING_SANDBOX →
 *   AUTHENTICATING → INITIALIZING_STATE → STARTING_AGENT → AGENT_RUNNING → COMPLETED
 *
 * Any non-terminal state can transition to FAILED. Nothing transitions back
 * into INIT, and COMPLETED / FAILED have no outgoing transitions.
 */
public enum WorkflowState {
    INIT,
    ENSURING_REPO,
    CREATING_WORKTREE,
    PREPARING_SANDBOX,
    AUTHENTICATING,
    INITIALIZING_STATE,
    STARTING_AGENT,
    AGENT_RUNNING,
    COMPLETED,
    FAILED;

    /** The linear progression, terminal states excluded. */
    public static final List<WorkflowState> ORDER = List.of(
            INIT,
            ENSURING_REPO,
            CREATING_WORKTREE,
            PREPARING_SANDBOX,
            AUTHENTICATING,
            INITIALIZING_STATE,
            STARTING_AGENT,
            AGENT_RUNNING
    );

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** States reachable in one step from this one. */
    public Set<WorkflowState> successors() {
        return switch (this) {
            case COMPLETED, FAILED -> EnumSet.noneOf(WorkflowState.class);
            case AGENT_RUNNING     -> EnumSet.of(COMPLETED, FAILED);
            default                -> EnumSet.of(ORDER.get(ORDER.indexOf(this) + 1), FAILED);
        };
    }

    public boolean canTransitionTo(WorkflowState target) {
        return successors().contains(target);
    }

    /** Position in {@link #ORDER}, or -1 for terminal states. */
    public int position() {
        return ORDER.indexOf(this);
    }
}
