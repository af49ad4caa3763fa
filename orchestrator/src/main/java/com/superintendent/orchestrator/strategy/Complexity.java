package com.superintendent.orchestrator.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Rough size of a task, weighted when deciding between interactive and autonomous mode. */
public enum Complexity {
    SIMPLE(1),
    MODERATE(2),
    COMPLEX(4);

    private final int weight;

    Complexity(int weight) {
        this.weight = weight;
    }

    public int weight() { return weight; }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown labels count as SIMPLE. */
    @JsonCreator
    public static Complexity fromValue(String value) {
        if (value == null) return SIMPLE;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SIMPLE;
        }
    }
}
