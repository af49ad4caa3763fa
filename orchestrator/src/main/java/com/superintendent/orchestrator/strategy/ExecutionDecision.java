package com.superintendent.orchestrator.strategy;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;

import java.util.List;

/**
 * What {@link ExecutionStrategy#decide} settled on.
 *
 * @param taskGroups One entry per agent; tasks in a group depend on each other.
 * @param reasoning  Human-readable trace of the rules applied. Never parsed.
 */
public record ExecutionDecision(
        Mode                 mode,
        Target               target,
        int                  parallelism,
        List<List<TaskInfo>> taskGroups,
        String               reasoning) {

    public ExecutionDecision {
        taskGroups = taskGroups == null
                ? List.of()
                : taskGroups.stream().map(List::copyOf).toList();
        reasoning = reasoning == null ? "" : reasoning;
    }
}
