package com.superintendent.orchestrator.service;

/** Result of polling one spawned agent. */
public enum AgentStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
