package com.superintendent.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an agent runs.
 *
 * SANDBOX   : isolated sandbox with persistent auth; status is probed remotely.
 * CONTAINER : dev container built from the repo's Dockerfile / devcontainer.
 * LOCAL     : a process on this machine; finished as soon as it has started.
 */
public enum Target {
    SANDBOX,
    CONTAINER,
    LOCAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Target fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
