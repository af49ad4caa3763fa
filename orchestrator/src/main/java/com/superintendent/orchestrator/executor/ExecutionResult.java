package com.superintendent.orchestrator.executor;

import com.superintendent.orchestrator.model.WorkflowState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running a whole plan.
 *
 * Failures are data, not exceptions: on FAILED, {@link #getFailedStep()} and
 * {@link #getError()} say where and why, and {@link #getCompletedSteps()}
 * holds the partial progress.
 */
public class ExecutionResult {

    private WorkflowState state;
    private final List<String> completedSteps = new ArrayList<>();
    private String failedStep;
    private String error;
    private final Map<String, StepResult> stepResults = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> stepOutputs = new LinkedHashMap<>();

    ExecutionResult(WorkflowState state) {
        this.state = state;
    }

    static ExecutionResult failed(String error) {
        ExecutionResult result = new ExecutionResult(WorkflowState.FAILED);
        result.error = error;
        return result;
    }

    void fail(String stepId, String error) {
        this.state      = WorkflowState.FAILED;
        this.failedStep = stepId;
        this.error      = error;
    }

    void setState(WorkflowState state) { this.state = state; }

    List<String> completedStepsMutable()                   { return completedSteps; }
    Map<String, StepResult> stepResultsMutable()           { return stepResults; }
    Map<String, Map<String, Object>> stepOutputsMutable()  { return stepOutputs; }

    public WorkflowState getState()          { return state; }
    public List<String>  getCompletedSteps() { return List.copyOf(completedSteps); }
    public String        getFailedStep()     { return failedStep; }
    public String        getError()          { return error; }
    public boolean       isFailed()          { return state == WorkflowState.FAILED; }

    public Map<String, StepResult> getStepResults() {
        return Map.copyOf(stepResults);
    }

    /** Outputs of successful steps, keyed by step id, in execution order. */
    public Map<String, Map<String, Object>> getStepOutputs() {
        return Collections.unmodifiableMap(stepOutputs);
    }
}
