package com.superintendent.orchestrator.api.dto;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.plan.PlannerInput;

/**
 * Request body for POST /plans.
 *
 * Required: repo, task
 * Optional: mode (default autonomous), target (default sandbox), branch,
 *   contextFile, sandboxName, force
 */
public record PlanRequest(String repo, String task, Mode mode, Target target,
                          String branch, String contextFile, String sandboxName, boolean force) {

    public PlannerInput toInput() {
        return new PlannerInput(repo, task, mode, target, branch, contextFile, sandboxName, force);
    }
}
