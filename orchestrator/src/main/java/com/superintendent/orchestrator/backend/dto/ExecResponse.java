package com.superintendent.orchestrator.backend.dto;

/**
 * Response from POST /sandboxes/{name}/exec.
 */
public record ExecResponse(
        int exit_code,
        String stdout,
        String stderr
) {
    public boolean success() {
        return exit_code == 0;
    }
}
