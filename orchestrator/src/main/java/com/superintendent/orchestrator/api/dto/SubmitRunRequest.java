package com.superintendent.orchestrator.api.dto;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.strategy.StrategyOverrides;

/**
 * Request body for POST /runs.
 *
 * Required: repo (local path or git URL)
 * Optional: task (a single task description), source ("auto", "single" or
 *   "markdown"; defaults to auto), and the override fields, which replace
 *   whatever the strategy would decide.
 */
public record SubmitRunRequest(String repo,
                               String task,
                               String source,
                               Mode modeOverride,
                               Target targetOverride,
                               Integer parallelismOverride,
                               boolean dangerouslySkipIsolation) {

    public SubmitRunRequest {
        if (source == null || source.isBlank()) source = "auto";
    }

    public StrategyOverrides overrides() {
        return new StrategyOverrides(modeOverride, targetOverride, parallelismOverride);
    }
}
