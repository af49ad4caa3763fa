package com.superintendent.orchestrator.backend;

import com.superintendent.orchestrator.backend.dto.ExecResponse;
import com.superintendent.orchestrator.backend.dto.StepExecuteRequest;
import com.superintendent.orchestrator.backend.dto.StepExecuteResponse;
import com.superintendent.orchestrator.executor.StepHandler;
import com.superintendent.orchestrator.executor.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend that forwards every step to the sandbox executor service and probes
 * agents by running a status command inside their sandbox.
 */
public class RemoteBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteBackend.class);

    /** Exits 1 until the agent writes its done marker, then prints its exit code. */
    static final String AGENT_STATUS_COMMAND =
            "test -f /tmp/.agent-done && cat /tmp/.agent-exit-code || exit 1";

    private static final int PROBE_TIMEOUT_SEC = 30;

    private final SandboxClient client;

    public RemoteBackend(SandboxClient client) {
        this.client = client;
    }

    @Override
    public StepHandler newStepHandler() {
        return (step, ctx) -> {
            StepExecuteRequest request = new StepExecuteRequest(
                    step.id(), step.action(), step.params(), ctx.planMetadata(), ctx.stepOutputs());
            try {
                StepExecuteResponse resp = client.executeStep(request);
                return resp.success()
                        ? StepResult.ok(step.id(), resp.data())
                        : StepResult.failed(step.id(), resp.message());
            } catch (BackendException e) {
                log.warn("Step '{}' could not be executed remotely: {}", step.id(), e.getMessage());
                return StepResult.failed(step.id(), e.getMessage());
            }
        };
    }

    @Override
    public ProbeResult probeAgent(String sandboxName) {
        try {
            ExecResponse resp = client.exec(sandboxName, AGENT_STATUS_COMMAND, PROBE_TIMEOUT_SEC);
            return new ProbeResult(resp.exit_code(), resp.stdout());
        } catch (BackendException e) {
            log.debug("Sandbox '{}' unavailable: {}", sandboxName, e.getMessage());
            return ProbeResult.unavailable();
        }
    }
}
