package com.superintendent.orchestrator.executor;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime context passed to every step handler call.
 *
 * @param planMetadata Metadata of the plan being executed.
 * @param stepOutputs  Read-only view of the data returned by steps that already
 *                     succeeded in this run, keyed by step id.
 */
public record StepExecutionContext(Map<String, Object> planMetadata,
                                   Map<String, Map<String, Object>> stepOutputs) {

    public StepExecutionContext {
        planMetadata = planMetadata == null ? Map.of() : Collections.unmodifiableMap(planMetadata);
        stepOutputs  = stepOutputs == null ? Map.of() : Collections.unmodifiableMap(stepOutputs);
    }

    public Optional<Map<String, Object>> outputOf(String stepId) {
        return Optional.ofNullable(stepOutputs.get(stepId));
    }

    /** Convenience lookup of a single output value; empty if the step or key is absent. */
    public Optional<String> outputValue(String stepId, String key) {
        return outputOf(stepId)
                .map(data -> data.get(key))
                .map(String::valueOf);
    }
}
