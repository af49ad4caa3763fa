package com.superintendent.orchestrator.executor;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.model.WorkflowState;
import com.superintendent.orchestrator.model.WorkflowStep;
import com.superintendent.orchestrator.plan.Planner;
import com.superintendent.orchestrator.plan.PlannerInput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StepExecutor against hand-written handlers. No Spring context.
 */
class StepExecutorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<String>        calls    = new ArrayList<>();

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void run_sandboxPlan_allStepsSucceed_endsAgentRunning() {
        StepExecutor executor = new StepExecutor(recording(null), registry);

        ExecutionResult result = executor.run(plan(Target.SANDBOX));

        assertThat(result.getState()).isEqualTo(WorkflowState.AGENT_RUNNING);
        assertThat(result.isFailed()).isFalse();
        assertThat(result.getCompletedSteps()).containsExactly(
                "validate_repo", "create_worktree", "prepare_sandbox",
                "authenticate", "initialize_state", "start_agent");
        assertThat(executor.getCheckpoints()).hasSize(6).allMatch(Checkpoint::success);
        assertThat(executor.getState()).isEqualTo(WorkflowState.AGENT_RUNNING);
    }

    @Test
    void run_localPlan_walksForwardOverSkippedStates() {
        List<WorkflowState> seen = new ArrayList<>();
        StepExecutor[] holder = new StepExecutor[1];
        holder[0] = new StepExecutor((step, ctx) -> {
            seen.add(holder[0].getState());
            return StepResult.ok(step.id());
        }, registry);

        ExecutionResult result = holder[0].run(plan(Target.LOCAL));

        assertThat(result.getState()).isEqualTo(WorkflowState.AGENT_RUNNING);
        assertThat(seen).containsExactly(
                WorkflowState.ENSURING_REPO,
                WorkflowState.CREATING_WORKTREE,
                WorkflowState.INITIALIZING_STATE,
                WorkflowState.STARTING_AGENT);
    }

    @Test
    void run_stepOutputs_visibleToLaterSteps() {
        List<String> worktreeSawRepo = new ArrayList<>();
        StepHandler handler = (step, ctx) -> switch (step.action()) {
            case "validate_repo" -> StepResult.ok(step.id(), Map.of("repo_path", "/abs/app"));
            case "create_worktree" -> {
                ctx.outputValue("validate_repo", "repo_path").ifPresent(worktreeSawRepo::add);
                yield StepResult.ok(step.id(), Map.of("worktree_path", "/wt/app"));
            }
            default -> StepResult.ok(step.id());
        };

        ExecutionResult result = new StepExecutor(handler, registry).run(plan(Target.LOCAL));

        assertThat(worktreeSawRepo).containsExactly("/abs/app");
        assertThat(result.getStepOutputs()).containsOnlyKeys("validate_repo", "create_worktree");
        assertThat(result.getStepOutputs().get("create_worktree")).containsEntry("worktree_path", "/wt/app");
    }

    @Test
    void run_contextExposesPlanMetadata() {
        List<Object> repos = new ArrayList<>();
        StepHandler handler = (step, ctx) -> {
            repos.add(ctx.planMetadata().get("repo"));
            return StepResult.ok(step.id());
        };

        new StepExecutor(handler, registry).run(plan(Target.LOCAL));

        assertThat(repos).hasSize(4).containsOnly("/src/app");
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void run_handlerFailsOnPrepareSandbox_stopsWithPrefixCompleted() {
        StepExecutor executor = new StepExecutor(recording("prepare_sandbox"), registry);

        ExecutionResult result = executor.run(plan(Target.SANDBOX));

        assertThat(result.getState()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.getCompletedSteps()).containsExactly("validate_repo", "create_worktree");
        assertThat(result.getFailedStep()).isEqualTo("prepare_sandbox");
        assertThat(result.getError()).isEqualTo("boom at prepare_sandbox");
        assertThat(calls).containsExactly("validate_repo", "create_worktree", "prepare_sandbox");

        List<Checkpoint> checkpoints = executor.getCheckpoints();
        assertThat(checkpoints).hasSize(3);
        Checkpoint last = checkpoints.get(2);
        assertThat(last.success()).isFalse();
        assertThat(last.state()).isEqualTo("PREPARING_SANDBOX");
        assertThat(last.completedSteps()).containsExactly("validate_repo", "create_worktree");
        assertThat(executor.getState()).isEqualTo(WorkflowState.FAILED);
    }

    @Test
    void run_invalidPlan_failsWithoutCallingHandler() {
        WorkflowPlan cyclic = new WorkflowPlan(List.of(
                new WorkflowStep("a", "validate_repo", Map.of(), List.of("b")),
                new WorkflowStep("b", "create_worktree", Map.of(), List.of("a"))), Map.of());

        ExecutionResult result = new StepExecutor(recording(null), registry).run(cyclic);

        assertThat(result.getState()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.getError()).startsWith("Invalid plan").contains("cycle");
        assertThat(calls).isEmpty();
    }

    @Test
    void run_noHandler_failsCleanly() {
        ExecutionResult result = new StepExecutor(null, registry).run(plan(Target.LOCAL));

        assertThat(result.getState()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.getError()).isEqualTo("No step handler configured");
        assertThat(result.getCompletedSteps()).isEmpty();
    }

    @Test
    void run_unknownAction_fails() {
        WorkflowPlan plan = new WorkflowPlan(List.of(
                new WorkflowStep("validate_repo", "validate_repo", Map.of()),
                new WorkflowStep("deploy", "deploy_to_prod", Map.of(), List.of("validate_repo"))), Map.of());

        ExecutionResult result = new StepExecutor(recording(null), registry).run(plan);

        assertThat(result.getState()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.getFailedStep()).isEqualTo("deploy");
        assertThat(result.getError()).contains("Unknown action: deploy_to_prod");
        assertThat(calls).containsExactly("validate_repo");
    }

    @Test
    void run_backwardTransition_failsBeforeCallingHandler() {
        WorkflowPlan plan = new WorkflowPlan(List.of(
                new WorkflowStep("a", "create_worktree", Map.of()),
                new WorkflowStep("b", "validate_repo", Map.of(), List.of("a"))), Map.of());

        ExecutionResult result = new StepExecutor(recording(null), registry).run(plan);

        assertThat(result.getState()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.getFailedStep()).isEqualTo("b");
        assertThat(result.getError()).isEqualTo("Cannot transition from CREATING_WORKTREE to ENSURING_REPO");
        assertThat(result.getCompletedSteps()).containsExactly("a");
        assertThat(calls).containsExactly("a");
    }

    @Test
    void run_handlerThrows_becomesFailedStep() {
        StepHandler handler = (step, ctx) -> {
            if (step.action().equals("create_worktree")) throw new IllegalStateException("disk full");
            return StepResult.ok(step.id());
        };

        ExecutionResult result = new StepExecutor(handler, registry).run(plan(Target.LOCAL));

        assertThat(result.getFailedStep()).isEqualTo("create_worktree");
        assertThat(result.getError()).contains("disk full");
        assertThat(result.getCompletedSteps()).containsExactly("validate_repo");
    }

    @Test
    void transition_sameState_isRejected() {
        StepExecutor executor = new StepExecutor(recording(null), registry);
        executor.transition(WorkflowState.CREATING_WORKTREE);

        assertThatThrownBy(() -> executor.transition(WorkflowState.CREATING_WORKTREE))
                .isInstanceOf(InvalidTransitionException.class);
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    @Test
    void run_recordsStepTimersByActionAndStatus() {
        new StepExecutor(recording("create_worktree"), registry).run(plan(Target.LOCAL));

        assertThat(registry.get("superintendent.step.duration")
                .tags("action", "validate_repo", "status", "success").timer().count()).isEqualTo(1);
        assertThat(registry.get("superintendent.step.duration")
                .tags("action", "create_worktree", "status", "failed").timer().count()).isEqualTo(1);
        assertThat(registry.find("superintendent.step.duration")
                .tags("action", "initialize_state").timer()).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkflowPlan plan(Target target) {
        return new Planner().createPlan(new PlannerInput("/src/app", "Fix it", Mode.AUTONOMOUS, target, "sb"));
    }

    /** Records every call; fails on the step whose id equals {@code failOn}. */
    private StepHandler recording(String failOn) {
        return (step, ctx) -> {
            calls.add(step.id());
            return step.id().equals(failOn)
                    ? StepResult.failed(step.id(), "boom at " + step.id())
                    : StepResult.ok(step.id());
        };
    }
}
