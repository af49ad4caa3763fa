package com.superintendent.orchestrator.service;

import com.superintendent.orchestrator.strategy.ExecutionDecision;

import java.time.Instant;
import java.util.UUID;

/**
 * One submitted orchestration run.
 *
 * Written by the worker thread executing the run and read by request threads,
 * hence the volatile fields.
 */
public class Run {

    private final UUID              id;
    private final String            repo;
    private final String            sourceName;
    private final ExecutionDecision decision;
    private final Instant           createdAt;

    private volatile RunState           state = RunState.QUEUED;
    private volatile OrchestratorResult result;
    private volatile String             summary;
    private volatile String             error;
    private volatile Instant            updatedAt;

    public Run(UUID id, String repo, String sourceName, ExecutionDecision decision) {
        this.id         = id;
        this.repo       = repo;
        this.sourceName = sourceName;
        this.decision   = decision;
        this.createdAt  = Instant.now();
        this.updatedAt  = createdAt;
    }

    void markRunning() {
        state     = RunState.RUNNING;
        updatedAt = Instant.now();
    }

    void markFinished(OrchestratorResult result, String summary) {
        this.result  = result;
        this.summary = summary;
        this.state   = result.isSuccess() ? RunState.DONE : RunState.FAILED;
        updatedAt    = Instant.now();
    }

    void markFailed(String error) {
        this.error = error;
        this.state = RunState.FAILED;
        updatedAt  = Instant.now();
    }

    public UUID               getId()         { return id; }
    public String             getRepo()       { return repo; }
    public String             getSourceName() { return sourceName; }
    public ExecutionDecision  getDecision()   { return decision; }
    public Instant            getCreatedAt()  { return createdAt; }
    public RunState           getState()      { return state; }
    public OrchestratorResult getResult()     { return result; }
    public String             getSummary()    { return summary; }
    public String             getError()      { return error; }
    public Instant            getUpdatedAt()  { return updatedAt; }
}
