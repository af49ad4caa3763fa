package com.superintendent.orchestrator.service;

/**
 * Lifecycle of a submitted run.
 *
 * QUEUED → RUNNING → DONE | FAILED
 */
public enum RunState {
    QUEUED,
    RUNNING,
    /** The loop finished and every task completed. */
    DONE,
    /** A task failed, or the run itself threw. */
    FAILED
}
