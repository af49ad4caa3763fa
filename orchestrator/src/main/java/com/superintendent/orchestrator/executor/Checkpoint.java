package com.superintendent.orchestrator.executor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of executor progress, recorded after every step whether it
 * succeeded or not.
 *
 * @param completedSteps Steps that had succeeded before this one ran.
 */
public record Checkpoint(String stepId, String state, boolean success,
                         List<String> completedSteps, Instant timestamp) {

    public Checkpoint {
        completedSteps = List.copyOf(completedSteps);
    }
}
