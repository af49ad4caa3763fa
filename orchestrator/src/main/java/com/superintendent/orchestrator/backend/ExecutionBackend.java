package com.superintendent.orchestrator.backend;

import com.superintendent.orchestrator.executor.StepHandler;

/**
 * Where workflow steps actually run.
 *
 * The Orchestrator asks for a fresh {@link StepHandler} per agent it spawns,
 * and probes sandboxed agents by name until they report an exit code.
 */
public interface ExecutionBackend {

    /** Handler for one agent's plan. Not shared between agents. */
    StepHandler newStepHandler();

    /**
     * Run the agent-status command in {@code sandboxName}.
     *
     * Never throws: an unreachable sandbox is reported as
     * {@link ProbeResult#unavailable()}.
     */
    ProbeResult probeAgent(String sandboxName);
}
