package com.superintendent.orchestrator.executor;

import com.superintendent.orchestrator.model.WorkflowStep;

/**
 * Performs the side effects of one plan step (cloning, creating a worktree,
 * provisioning a sandbox, starting the agent, ...).
 *
 * The StepExecutor calls {@link #execute} at most once per step per run.
 * Whatever a handler puts in {@link StepResult#data()} becomes visible to
 * later steps through {@link StepExecutionContext#outputOf(String)}.
 */
public interface StepHandler {

    StepResult execute(WorkflowStep step, StepExecutionContext ctx);
}
