package com.superintendent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How much the spawned agent is allowed to do without a human in the loop. */
public enum Mode {
    INTERACTIVE,
    AUTONOMOUS;

    /** Lower-case wire value ("interactive", "autonomous"). */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Mode fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
