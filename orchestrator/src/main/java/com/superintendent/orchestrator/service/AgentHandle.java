package com.superintendent.orchestrator.service;

import com.superintendent.orchestrator.executor.ExecutionResult;
import com.superintendent.orchestrator.strategy.TaskInfo;

import java.time.Instant;
import java.util.List;

/**
 * A spawned agent the Orchestrator is polling.
 *
 * @param sandboxName null for local agents, which are done as soon as they start
 * @param retryCount  how many times this task group has already been retried
 */
public record AgentHandle(
        String          id,
        List<TaskInfo>  taskGroup,
        String          sandboxName,
        Instant         startedAt,
        ExecutionResult executionResult,
        int             retryCount) {

    public AgentHandle {
        taskGroup = List.copyOf(taskGroup);
    }

    public List<String> taskNames() {
        return taskGroup.stream().map(TaskInfo::name).toList();
    }
}
