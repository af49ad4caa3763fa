package com.superintendent.orchestrator.source;

import java.util.List;
import java.util.Map;

/**
 * The simplest source: one ad-hoc task string.
 *
 * Always ready; status updates are no-ops because nothing is persisted.
 */
public class SingleTaskSource implements TaskSource {

    private final String description;
    private final String taskId;

    public SingleTaskSource(String description) {
        this(description, null);
    }

    public SingleTaskSource(String description, String taskId) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("task description is required");
        }
        this.description = description;
        this.taskId      = taskId != null ? taskId : TaskIds.digest("single", description);
    }

    @Override public String name() { return "single"; }

    @Override
    public List<Task> getTasks() {
        return List.of(new Task(taskId, description, description, TaskStatus.PENDING,
                List.of(), Map.of(), "single"));
    }

    @Override
    public List<Task> getReadyTasks() {
        return getTasks();
    }

    @Override
    public void updateStatus(String taskId, TaskStatus status) {
        // ephemeral
    }

    @Override
    public boolean claimTask(String taskId) {
        return true;
    }
}
