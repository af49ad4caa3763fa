package com.superintendent.orchestrator.backend;

/**
 * Outcome of running the agent-status command inside a sandbox.
 *
 * @param exitCode exit status of the probe command
 * @param output   trimmed stdout; the agent's own exit code once it has finished
 */
public record ProbeResult(int exitCode, String output) {

    /** The sandbox could not be reached at all. */
    public static ProbeResult unavailable() {
        return new ProbeResult(-1, "");
    }

    public ProbeResult {
        output = output == null ? "" : output.strip();
    }
}
