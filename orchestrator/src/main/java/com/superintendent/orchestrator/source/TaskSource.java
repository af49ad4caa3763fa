package com.superintendent.orchestrator.source;

import java.util.List;

/**
 * Where tasks come from: a checklist file, an issue tracker, a single ad-hoc
 * task string. The orchestrator never looks at how tasks are stored.
 *
 * A source is owned by exactly one orchestration run while that run is active.
 */
public interface TaskSource {

    /** Short identifier ("single", "markdown", ...). */
    String name();

    List<Task> getTasks();

    /** Tasks that are not completed and whose dependencies are all completed. */
    List<Task> getReadyTasks();

    void updateStatus(String taskId, TaskStatus status);

    /** Claim a task for an agent. Sources without ownership semantics always succeed. */
    boolean claimTask(String taskId);
}
