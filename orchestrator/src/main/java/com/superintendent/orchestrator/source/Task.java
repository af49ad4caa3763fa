package com.superintendent.orchestrator.source;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work as reported by a {@link TaskSource}.
 *
 * Owned by the source; the orchestrator only reads tasks and reports
 * status changes back through {@link TaskSource#updateStatus}.
 */
public record Task(
        String              taskId,
        String              title,
        String              description,
        TaskStatus          status,
        List<String>        dependencies,
        Map<String, String> labels,
        String              sourceRef) {

    public Task {
        if (taskId == null || taskId.isBlank()) throw new IllegalArgumentException("taskId is required");
        if (title == null) title = taskId;
        if (description == null) description = title;
        if (status == null) status = TaskStatus.PENDING;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        labels       = labels == null ? Map.of() : Map.copyOf(labels);
        if (sourceRef == null) sourceRef = "";
    }

    /** True if some dependency is not in {@code completedIds}. */
    public boolean isBlocked(Set<String> completedIds) {
        return !completedIds.containsAll(dependencies);
    }
}
