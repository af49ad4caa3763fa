package com.superintendent.orchestrator.service;

import java.util.Locale;

/** What the Orchestrator does when an agent finishes unsuccessfully. */
public enum FailurePolicy {
    /** Re-enqueue the group until its retries are used up, then fail it. */
    RETRY,
    /** Record the group as failed and keep going. */
    SKIP,
    /** Record the group as failed, skip everything still pending, stop spawning. */
    ABORT;

    public static FailurePolicy fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
