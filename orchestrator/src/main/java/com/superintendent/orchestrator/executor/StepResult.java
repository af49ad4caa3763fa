package com.superintendent.orchestrator.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one {@link StepHandler#execute} call.
 *
 * @param data Outputs exposed to later steps (e.g. repo_path, worktree_path).
 */
public record StepResult(boolean success, String stepId, String message, Map<String, Object> data) {

    public StepResult {
        message = message == null ? "" : message;
        data    = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static StepResult ok(String stepId) {
        return new StepResult(true, stepId, "", Map.of());
    }

    public static StepResult ok(String stepId, Map<String, Object> data) {
        return new StepResult(true, stepId, "", data);
    }

    public static StepResult failed(String stepId, String message) {
        return new StepResult(false, stepId, message, Map.of());
    }
}
