package com.superintendent.orchestrator.service;

import java.util.List;

/**
 * Final partition of an orchestration run.
 *
 * Every task name the run ever knew about appears in exactly one of
 * completed, failed and skipped.
 */
public record OrchestratorResult(
        List<String> completedTasks,
        List<String> failedTasks,
        List<String> skippedTasks,
        int          agentsSpawned,
        List<String> errors,
        double       totalTimeSeconds) {

    public OrchestratorResult {
        completedTasks = List.copyOf(completedTasks);
        failedTasks    = List.copyOf(failedTasks);
        skippedTasks   = List.copyOf(skippedTasks);
        errors         = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return failedTasks.isEmpty() && skippedTasks.isEmpty();
    }
}
