package com.superintendent.orchestrator.report;

import java.util.List;

/**
 * Receives orchestration progress events. Implementations decide how progress
 * is displayed; the Orchestrator only calls these hooks.
 *
 * {@link #summarize} is called exactly once per run, after the loop ends.
 */
public interface Reporter {

    /** @param sandboxName null for local agents */
    void onAgentStarted(String agentId, List<String> taskNames, String sandboxName);

    void onAgentCompleted(String agentId, List<String> taskNames, double durationSeconds);

    void onAgentFailed(String agentId, List<String> taskNames, String error);

    void onProgress(int running, int completed, int pending, int failed);

    String summarize(List<String> completedTasks,
                     List<String> failedTasks,
                     List<String> skippedTasks,
                     int agentsSpawned,
                     double totalTimeSeconds,
                     List<String> errors);
}
