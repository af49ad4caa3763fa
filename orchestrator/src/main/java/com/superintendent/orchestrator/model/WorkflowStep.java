package com.superintendent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One named action inside a {@link WorkflowPlan}.
 *
 * @param id        Unique within its plan.
 * @param action    Tag naming the handler operation (e.g. "create_worktree").
 * @param params    Opaque, handler-specific parameters.
 * @param dependsOn Ids of steps that must run before this one.
 */
public record WorkflowStep(
        String id,
        String action,
        Map<String, Object> params,
        @JsonProperty("depends_on") List<String> dependsOn) {

    public WorkflowStep {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        // LinkedHashMap rather than Map.copyOf: params may carry null values
        // and their order is part of the wire format.
        params    = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public WorkflowStep(String id, String action, Map<String, Object> params) {
        this(id, action, params, List.of());
    }

    /** Step whose id equals its action, the shape the Planner emits. */
    public static WorkflowStep of(String action, Map<String, Object> params, String... dependsOn) {
        return new WorkflowStep(action, action, params, List.of(dependsOn));
    }
}
