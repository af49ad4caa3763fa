package com.superintendent.orchestrator.strategy;

import com.superintendent.orchestrator.source.Task;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lightweight task descriptor used for strategy decisions and agent spawning.
 *
 * The full {@link Task} lives in the TaskSource; this is the minimum the
 * strategy and orchestrator need. {@code name} is the task id reported back
 * to the TaskSource.
 */
public record TaskInfo(
        String              name,
        String              description,
        boolean             destructive,
        Complexity          complexity,
        List<String>        dependsOn,
        Map<String, String> labels) {

    public TaskInfo {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (description == null || description.isBlank()) description = name;
        if (complexity == null) complexity = Complexity.SIMPLE;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        labels    = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public static TaskInfo named(String name) {
        return new TaskInfo(name, name, false, Complexity.SIMPLE, List.of(), Map.of());
    }

    /**
     * Map a TaskSource task. The optional labels "complexity" and
     * "destructive" carry the strategy hints.
     */
    public static TaskInfo from(Task task) {
        Map<String, String> labels = task.labels();
        boolean destructive = Boolean.parseBoolean(
                labels.getOrDefault("destructive", "false").toLowerCase(Locale.ROOT));
        return new TaskInfo(
                task.taskId(),
                task.title(),
                destructive,
                Complexity.fromValue(labels.get("complexity")),
                task.dependencies(),
                labels);
    }
}
