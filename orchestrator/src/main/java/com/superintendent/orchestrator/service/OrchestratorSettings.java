package com.superintendent.orchestrator.service;

import java.time.Duration;

/**
 * Tuning knobs for one {@link Orchestrator}.
 *
 * @param maxParallel   agents running at once, at least 1
 * @param pollInterval  sleep between poll rounds while agents are running
 * @param maxRetries    extra attempts per group under {@link FailurePolicy#RETRY}
 */
public record OrchestratorSettings(
        int           maxParallel,
        Duration      pollInterval,
        FailurePolicy failurePolicy,
        int           maxRetries) {

    public OrchestratorSettings {
        if (maxParallel < 1) throw new IllegalArgumentException("maxParallel must be >= 1");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (pollInterval == null || pollInterval.isNegative()) pollInterval = Duration.ZERO;
        if (failurePolicy == null) failurePolicy = FailurePolicy.SKIP;
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(3, Duration.ofSeconds(5), FailurePolicy.SKIP, 1);
    }

    public OrchestratorSettings withMaxParallel(int maxParallel) {
        return new OrchestratorSettings(maxParallel, pollInterval, failurePolicy, maxRetries);
    }
}
