package com.superintendent.orchestrator.plan;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;

/**
 * Everything the Planner needs to build a plan for one agent.
 *
 * Required: repo, task, mode, target.
 * Optional: branch (defaults to agent/&lt;repo-name&gt;), contextFile,
 *   sandboxName (defaults to claude-&lt;repo-name&gt;), force.
 */
public record PlannerInput(
        String  repo,
        String  task,
        Mode    mode,
        Target  target,
        String  branch,
        String  contextFile,
        String  sandboxName,
        boolean force) {

    public PlannerInput {
        if (repo == null || repo.isBlank()) throw new IllegalArgumentException("repo is required");
        if (task == null) task = "";
        if (mode == null) mode = Mode.AUTONOMOUS;
        if (target == null) target = Target.SANDBOX;
    }

    public PlannerInput(String repo, String task, Mode mode, Target target, String sandboxName) {
        this(repo, task, mode, target, null, null, sandboxName, false);
    }
}
