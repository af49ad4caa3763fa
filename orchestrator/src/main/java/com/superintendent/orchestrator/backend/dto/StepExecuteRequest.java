package com.superintendent.orchestrator.backend.dto;

import java.util.Map;

/**
 * Body of POST /steps/execute.
 */
public record StepExecuteRequest(
        String step_id,
        String action,
        Map<String, Object> params,
        Map<String, Object> metadata,
        Map<String, Map<String, Object>> step_outputs
) {}
