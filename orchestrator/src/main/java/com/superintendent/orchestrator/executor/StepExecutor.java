package com.superintendent.orchestrator.executor;

import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.model.WorkflowState;
import com.superintendent.orchestrator.model.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one {@link WorkflowPlan} through the {@link WorkflowState} machine.
 *
 * For each step in topological order:
 *   1. map the step's action to the state it enters,
 *   2. transition (walking forward over states a local plan skips),
 *   3. call the {@link StepHandler},
 *   4. record a checkpoint, then either continue or stop on failure.
 *
 * An executor instance is single-use: it keeps the current state and the
 * checkpoint list of exactly one run. The Orchestrator creates a fresh one
 * per agent.
 *
 * A successful run ends in AGENT_RUNNING, not COMPLETED: "agent started" is
 * the executor's notion of success. Waiting for the agent to finish is the
 * Orchestrator's job.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    /** Action tag → state entered while that action runs. */
    static final Map<String, WorkflowState> ACTION_TO_STATE = Map.of(
            "validate_repo",    WorkflowState.ENSURING_REPO,
            "create_worktree",  WorkflowState.CREATING_WORKTREE,
            "prepare_sandbox",  WorkflowState.PREPARING_SANDBOX,
            "authenticate",     WorkflowState.AUTHENTICATING,
            "initialize_state", WorkflowState.INITIALIZING_STATE,
            "start_agent",      WorkflowState.STARTING_AGENT
    );

    private final StepHandler   handler;
    private final MeterRegistry meterRegistry;

    private WorkflowState          state       = WorkflowState.INIT;
    private final List<Checkpoint> checkpoints = new ArrayList<>();

    public StepExecutor(StepHandler handler, MeterRegistry meterRegistry) {
        this.handler       = handler;
        this.meterRegistry = meterRegistry;
    }

    public StepExecutor(StepHandler handler) {
        this(handler, Metrics.globalRegistry);
    }

    public WorkflowState getState() { return state; }

    public List<Checkpoint> getCheckpoints() {
        return List.copyOf(checkpoints);
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    public ExecutionResult run(WorkflowPlan plan) {
        List<String> errors = plan.validate();
        if (!errors.isEmpty()) {
            state = WorkflowState.FAILED;
            return ExecutionResult.failed("Invalid plan: " + String.join("; ", errors));
        }
        if (handler == null) {
            state = WorkflowState.FAILED;
            return ExecutionResult.failed("No step handler configured");
        }

        ExecutionResult result = new ExecutionResult(WorkflowState.INIT);
        StepExecutionContext ctx = new StepExecutionContext(plan.getMetadata(), result.stepOutputsMutable());

        for (WorkflowStep step : plan.executionOrder()) {
            WorkflowState target = ACTION_TO_STATE.get(step.action());
            if (target == null) {
                state = WorkflowState.FAILED;
                result.fail(step.id(), "Unknown action: " + step.action());
                log.error("Step '{}' has unknown action '{}'", step.id(), step.action());
                return result;
            }

            try {
                transition(target);
            } catch (InvalidTransitionException e) {
                state = WorkflowState.FAILED;
                result.fail(step.id(), e.getMessage());
                log.error("Step '{}' rejected: {}", step.id(), e.getMessage());
                return result;
            }

            StepResult stepResult = invoke(step, ctx);
            result.stepResultsMutable().put(step.id(), stepResult);
            checkpoints.add(new Checkpoint(step.id(), state.name(), stepResult.success(),
                    result.completedStepsMutable(), Instant.now()));

            if (!stepResult.success()) {
                transition(WorkflowState.FAILED);
                result.fail(step.id(), stepResult.message());
                log.warn("Step '{}' failed in state {}: {}", step.id(), target, stepResult.message());
                return result;
            }

            result.completedStepsMutable().add(step.id());
            if (!stepResult.data().isEmpty()) {
                result.stepOutputsMutable().put(step.id(), stepResult.data());
            }
            log.debug("Step '{}' done, state={}", step.id(), state);
        }

        if (state == WorkflowState.STARTING_AGENT) {
            transition(WorkflowState.AGENT_RUNNING);
        }
        result.setState(state);
        return result;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Move to {@code target}. When there is no direct edge, advance through the
     * intermediate states in order (a local plan has no sandbox/auth steps).
     *
     * @throws InvalidTransitionException if target is not ahead of the current state
     */
    void transition(WorkflowState target) {
        if (state.canTransitionTo(target)) {
            state = target;
            return;
        }
        int from = state.position();
        int to   = target.position();
        if (from < 0 || to <= from) {
            throw new InvalidTransitionException(state, target);
        }
        for (int i = from + 1; i <= to; i++) {
            state = WorkflowState.ORDER.get(i);
        }
    }

    /** Call the handler, turning an unexpected exception into a failed StepResult. */
    private StepResult invoke(WorkflowStep step, StepExecutionContext ctx) {
        Timer.Sample sample = Timer.start(meterRegistry);
        StepResult stepResult;
        try {
            stepResult = handler.execute(step, ctx);
            if (stepResult == null) {
                stepResult = StepResult.failed(step.id(), "Handler returned no result");
            }
        } catch (RuntimeException e) {
            log.error("Handler threw while executing step '{}'", step.id(), e);
            stepResult = StepResult.failed(step.id(),
                    "Unexpected error in step '" + step.id() + "': " + e.getMessage());
        }
        sample.stop(meterRegistry.timer("superintendent.step.duration",
                "action", step.action(),
                "status", stepResult.success() ? "success" : "failed"));
        return stepResult;
    }
}
