package com.superintendent.orchestrator.backend.dto;

import java.util.Map;

/**
 * Response from POST /steps/execute.
 */
public record StepExecuteResponse(
        boolean success,
        String message,
        Map<String, Object> data
) {}
