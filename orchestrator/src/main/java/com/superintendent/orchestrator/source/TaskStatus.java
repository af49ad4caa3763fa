package com.superintendent.orchestrator.source;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Lifecycle of a task as tracked by its TaskSource. */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
