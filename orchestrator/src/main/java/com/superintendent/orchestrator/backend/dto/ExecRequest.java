package com.superintendent.orchestrator.backend.dto;

/** Body of POST /sandboxes/{name}/exec. */
public record ExecRequest(String command, int timeout_sec) {}
