package com.superintendent.orchestrator.api.dto;

import com.superintendent.orchestrator.service.OrchestratorResult;
import com.superintendent.orchestrator.service.Run;
import com.superintendent.orchestrator.strategy.ExecutionDecision;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 * result and summary stay null until the run has finished.
 */
public record RunResponse(
        UUID               id,
        String             state,
        String             repo,
        String             source,
        ExecutionDecision  decision,
        OrchestratorResult result,
        String             summary,
        String             error,
        Instant            createdAt,
        Instant            updatedAt
) {
    public static RunResponse from(Run run) {
        return new RunResponse(
                run.getId(),
                run.getState().name(),
                run.getRepo(),
                run.getSourceName(),
                run.getDecision(),
                run.getResult(),
                run.getSummary(),
                run.getError(),
                run.getCreatedAt(),
                run.getUpdatedAt()
        );
    }
}
