package com.superintendent.orchestrator.backend;

import com.superintendent.orchestrator.backend.dto.ExecResponse;
import com.superintendent.orchestrator.backend.dto.StepExecuteRequest;
import com.superintendent.orchestrator.backend.dto.StepExecuteResponse;
import com.superintendent.orchestrator.executor.StepExecutionContext;
import com.superintendent.orchestrator.executor.StepResult;
import com.superintendent.orchestrator.model.WorkflowStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RemoteBackend with SandboxClient mocked out.
 */
@ExtendWith(MockitoExtension.class)
class RemoteBackendTest {

    @Mock SandboxClient client;

    // ------------------------------------------------------------------
    // Step handler
    // ------------------------------------------------------------------

    @Test
    void step_forwardsStepWithMetadataAndPriorOutputs() {
        when(client.executeStep(any())).thenReturn(
                new StepExecuteResponse(true, "", Map.of("worktree_path", "/wt/app")));
        StepExecutionContext ctx = new StepExecutionContext(
                Map.of("repo", "/src/app"), Map.of("validate_repo", Map.of("repo_path", "/src/app")));

        StepResult result = new RemoteBackend(client).newStepHandler()
                .execute(new WorkflowStep("create_worktree", "create_worktree", Map.of("branch", "b")), ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.data()).containsEntry("worktree_path", "/wt/app");

        ArgumentCaptor<StepExecuteRequest> captor = ArgumentCaptor.forClass(StepExecuteRequest.class);
        verify(client).executeStep(captor.capture());
        assertThat(captor.getValue().step_id()).isEqualTo("create_worktree");
        assertThat(captor.getValue().params()).containsEntry("branch", "b");
        assertThat(captor.getValue().metadata()).containsEntry("repo", "/src/app");
        assertThat(captor.getValue().step_outputs()).containsKey("validate_repo");
    }

    @Test
    void step_remoteFailure_becomesFailedResult() {
        when(client.executeStep(any())).thenReturn(new StepExecuteResponse(false, "no docker", null));

        StepResult result = new RemoteBackend(client).newStepHandler()
                .execute(new WorkflowStep("prepare_sandbox", "prepare_sandbox", Map.of()),
                        new StepExecutionContext(Map.of(), Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("no docker");
    }

    @Test
    void step_transportError_becomesFailedResult() {
        when(client.executeStep(any())).thenThrow(new BackendException("executeStep failed: HTTP 502"));

        StepResult result = new RemoteBackend(client).newStepHandler()
                .execute(new WorkflowStep("authenticate", "authenticate", Map.of()),
                        new StepExecutionContext(Map.of(), Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).contains("HTTP 502");
    }

    // ------------------------------------------------------------------
    // Probe
    // ------------------------------------------------------------------

    @Test
    void probe_runsAgentStatusCommand() {
        when(client.exec(eq("sb-1"), eq(RemoteBackend.AGENT_STATUS_COMMAND), anyInt()))
                .thenReturn(new ExecResponse(0, "0\n", ""));

        ProbeResult probe = new RemoteBackend(client).probeAgent("sb-1");

        assertThat(probe).isEqualTo(new ProbeResult(0, "0"));
    }

    @Test
    void probe_unreachableSandbox_isUnavailable() {
        when(client.exec(any(), any(), anyInt())).thenThrow(new BackendException("connection refused"));

        ProbeResult probe = new RemoteBackend(client).probeAgent("sb-1");

        assertThat(probe.exitCode()).isNotZero();
    }
}
