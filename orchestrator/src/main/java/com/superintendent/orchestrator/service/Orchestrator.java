package com.superintendent.orchestrator.service;

import com.superintendent.orchestrator.backend.ExecutionBackend;
import com.superintendent.orchestrator.backend.ProbeResult;
import com.superintendent.orchestrator.executor.ExecutionResult;
import com.superintendent.orchestrator.executor.StepExecutor;
import com.superintendent.orchestrator.model.InvalidPlanException;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.model.WorkflowState;
import com.superintendent.orchestrator.plan.Planner;
import com.superintendent.orchestrator.plan.PlannerInput;
import com.superintendent.orchestrator.report.LoggingReporter;
import com.superintendent.orchestrator.report.Reporter;
import com.superintendent.orchestrator.source.Task;
import com.superintendent.orchestrator.source.TaskSource;
import com.superintendent.orchestrator.source.TaskSourceException;
import com.superintendent.orchestrator.source.TaskStatus;
import com.superintendent.orchestrator.state.CheckpointStore;
import com.superintendent.orchestrator.state.WorkflowCheckpoint;
import com.superintendent.orchestrator.strategy.ExecutionDecision;
import com.superintendent.orchestrator.strategy.TaskInfo;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spawns, polls and retries agents for the task groups of an {@link ExecutionDecision}.
 *
 * One call to {@link #run} is a single cooperative loop:
 *   1. spawn pending groups while fewer than maxParallel agents run,
 *   2. poll every running agent,
 *   3. record finished agents (applying the {@link FailurePolicy} to failures)
 *      and enqueue tasks the TaskSource now reports as ready,
 *   4. report progress, then sleep pollInterval if anything is still running.
 *
 * Only the calling thread mutates loop state, so nothing here is locked.
 * An Orchestrator instance may be reused for several runs, but not concurrently.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    static final String MDC_AGENT_ID = "agentId";

    private final ExecutionBackend     backend;
    private final TaskSource           taskSource;
    private final Reporter             reporter;
    private final OrchestratorSettings settings;
    private final MeterRegistry        meterRegistry;
    private final CheckpointStore      checkpointStore;
    private final String               agentPrefix;
    private final Planner              planner = new Planner();

    private int agentCounter;

    /**
     * @param taskSource      may be null; then no status updates and no newly-unblocked discovery
     * @param reporter        may be null; defaults to {@link LoggingReporter}
     * @param checkpointStore may be null; then nothing is persisted
     * @param runTag          prefixed to agent ids ({@code <runTag>-agent-N}) so that
     *                        concurrent runs never share a sandbox or checkpoint file;
     *                        null or blank gives plain {@code agent-N}
     */
    public Orchestrator(ExecutionBackend backend,
                        TaskSource taskSource,
                        Reporter reporter,
                        OrchestratorSettings settings,
                        MeterRegistry meterRegistry,
                        CheckpointStore checkpointStore,
                        String runTag) {
        this.backend         = backend;
        this.taskSource      = taskSource;
        this.reporter        = reporter != null ? reporter : new LoggingReporter();
        this.settings        = settings != null ? settings : OrchestratorSettings.defaults();
        this.meterRegistry   = meterRegistry != null ? meterRegistry : Metrics.globalRegistry;
        this.checkpointStore = checkpointStore;
        this.agentPrefix     = runTag == null || runTag.isBlank() ? "" : runTag.strip() + "-";
    }

    public Orchestrator(ExecutionBackend backend,
                        TaskSource taskSource,
                        Reporter reporter,
                        OrchestratorSettings settings,
                        MeterRegistry meterRegistry,
                        CheckpointStore checkpointStore) {
        this(backend, taskSource, reporter, settings, meterRegistry, checkpointStore, null);
    }

    public Orchestrator(ExecutionBackend backend, TaskSource taskSource, Reporter reporter,
                        OrchestratorSettings settings) {
        this(backend, taskSource, reporter, settings, Metrics.globalRegistry, null, null);
    }

    public OrchestratorSettings getSettings() { return settings; }

    /** A task group waiting for an agent. */
    private record PendingGroup(List<TaskInfo> tasks, int retryCount) {}

    /** Accumulates the partition while the loop runs. */
    private static final class Tally {
        final List<String> completed = new ArrayList<>();
        final List<String> failed    = new ArrayList<>();
        final List<String> skipped   = new ArrayList<>();
        final List<String> errors    = new ArrayList<>();
        int agentsSpawned;
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    public OrchestratorResult run(ExecutionDecision decision, String repo) {
        Instant startedAt = Instant.now();
        Timer.Sample runTimer = Timer.start(meterRegistry);

        Deque<PendingGroup>      pending = new ArrayDeque<>();
        Map<String, AgentHandle> running = new LinkedHashMap<>();
        Set<String>              known   = new LinkedHashSet<>();
        Tally tally = new Tally();

        for (List<TaskInfo> group : decision.taskGroups()) {
            pending.addLast(new PendingGroup(group, 0));
            group.forEach(t -> known.add(t.name()));
        }
        log.info("Orchestrating {} task group(s) ({} tasks), target={}, maxParallel={}, policy={}",
                pending.size(), known.size(), decision.target().value(),
                settings.maxParallel(), settings.failurePolicy());

        boolean aborted     = false;
        boolean interrupted = false;

        while (!pending.isEmpty() || !running.isEmpty()) {
            // Spawn
            while (!aborted && !pending.isEmpty() && running.size() < settings.maxParallel()) {
                PendingGroup group = pending.pollFirst();
                spawn(group, decision, repo).ifPresentOrElse(handle -> {
                    running.put(handle.id(), handle);
                    tally.agentsSpawned++;
                    reporter.onAgentStarted(handle.id(), handle.taskNames(), handle.sandboxName());
                }, () -> {
                    List<String> names = names(group.tasks());
                    tally.failed.addAll(names);
                    names.forEach(name -> updateStatus(name, TaskStatus.FAILED));
                    tally.errors.add("Failed to spawn agent for: " + String.join(", ", names));
                });
            }

            if (running.isEmpty()) {
                break;
            }

            // Poll
            Map<String, AgentStatus> finished = new LinkedHashMap<>();
            running.forEach((id, handle) -> {
                AgentStatus status = poll(handle, decision.target());
                if (status != AgentStatus.RUNNING) {
                    finished.put(id, status);
                }
            });

            // Finish
            for (Map.Entry<String, AgentStatus> entry : finished.entrySet()) {
                AgentHandle handle = running.remove(entry.getKey());
                if (entry.getValue() == AgentStatus.COMPLETED) {
                    onCompleted(handle, tally);
                    if (!aborted) {
                        enqueueNewlyReady(pending, known);
                    }
                } else {
                    boolean abort = onFailed(handle, tally, pending);
                    if (abort && !aborted) {
                        aborted = true;
                        for (PendingGroup group : pending) {
                            tally.skipped.addAll(names(group.tasks()));
                        }
                        pending.clear();
                        log.warn("Aborting: {} agent(s) still running will be polled to completion",
                                running.size());
                    }
                }
            }

            reporter.onProgress(running.size(), tally.completed.size(),
                    pending.stream().mapToInt(g -> g.tasks().size()).sum(), tally.failed.size());

            if (!running.isEmpty() && !sleep()) {
                interrupted = true;
                break;
            }
        }

        if (interrupted) {
            log.warn("Orchestration interrupted with {} agent(s) running and {} group(s) pending",
                    running.size(), pending.size());
        }

        Set<String> accounted = new HashSet<>(tally.completed);
        accounted.addAll(tally.failed);
        accounted.addAll(tally.skipped);
        for (String name : known) {
            if (accounted.add(name)) {
                tally.skipped.add(name);
            }
        }

        runTimer.stop(meterRegistry.timer("superintendent.run.duration"));
        double totalSeconds = secondsSince(startedAt);

        OrchestratorResult result = new OrchestratorResult(tally.completed, tally.failed, tally.skipped,
                tally.agentsSpawned, tally.errors, totalSeconds);
        reporter.summarize(result.completedTasks(), result.failedTasks(), result.skippedTasks(),
                result.agentsSpawned(), result.totalTimeSeconds(), result.errors());
        log.info("Orchestration finished: {} completed, {} failed, {} skipped, {} agent(s) spawned",
                result.completedTasks().size(), result.failedTasks().size(),
                result.skippedTasks().size(), result.agentsSpawned());
        return result;
    }

    // ------------------------------------------------------------------
    // Spawn
    // ------------------------------------------------------------------

    /**
     * Plan and execute one agent's workflow. Empty when the plan cannot be
     * built or the executor ends in FAILED.
     */
    private Optional<AgentHandle> spawn(PendingGroup group, ExecutionDecision decision, String repo) {
        String agentId     = nextAgentId();
        String sandboxName = "superintendent-" + agentId;
        String task        = group.tasks().stream()
                .map(TaskInfo::description)
                .collect(Collectors.joining("; "));

        MDC.put(MDC_AGENT_ID, agentId);
        try {
            WorkflowPlan plan;
            try {
                plan = planner.createPlan(new PlannerInput(
                        repo, task, decision.mode(), decision.target(), sandboxName));
            } catch (InvalidPlanException | IllegalArgumentException e) {
                log.warn("Could not plan agent {}: {}", agentId, e.getMessage());
                return Optional.empty();
            }

            ExecutionResult execResult = new StepExecutor(backend.newStepHandler(), meterRegistry).run(plan);
            String handleSandbox = decision.target() == Target.LOCAL ? null : sandboxName;
            saveCheckpoint(agentId, execResult, handleSandbox);

            if (execResult.getState() == WorkflowState.FAILED) {
                log.warn("Agent {} failed to start at step '{}': {}",
                        agentId, execResult.getFailedStep(), execResult.getError());
                return Optional.empty();
            }

            meterRegistry.counter("superintendent.agents.spawned").increment();
            log.info("Spawned agent {} (retry {}) for {}", agentId, group.retryCount(), names(group.tasks()));
            return Optional.of(new AgentHandle(agentId, group.tasks(), handleSandbox,
                    Instant.now(), execResult, group.retryCount()));
        } finally {
            MDC.remove(MDC_AGENT_ID);
        }
    }

    private String nextAgentId() {
        agentCounter++;
        return agentPrefix + "agent-" + agentCounter;
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    AgentStatus poll(AgentHandle handle, Target target) {
        if (target == Target.LOCAL || handle.sandboxName() == null) {
            return AgentStatus.COMPLETED;
        }
        ProbeResult probe = backend.probeAgent(handle.sandboxName());
        if (probe.exitCode() != 0) {
            return AgentStatus.RUNNING;
        }
        return probe.output().isEmpty() || probe.output().equals("0")
                ? AgentStatus.COMPLETED
                : AgentStatus.FAILED;
    }

    // ------------------------------------------------------------------
    // Finish
    // ------------------------------------------------------------------

    private void onCompleted(AgentHandle handle, Tally tally) {
        List<String> names = handle.taskNames();
        tally.completed.addAll(names);
        names.forEach(name -> updateStatus(name, TaskStatus.COMPLETED));
        meterRegistry.counter("superintendent.agents.finished", "outcome", "completed").increment();
        updateCheckpoint(handle.id(), WorkflowState.COMPLETED);
        reporter.onAgentCompleted(handle.id(), names, secondsSince(handle.startedAt()));
    }

    /** @return true when the run should abort */
    private boolean onFailed(AgentHandle handle, Tally tally, Deque<PendingGroup> pending) {
        List<String> names = handle.taskNames();
        meterRegistry.counter("superintendent.agents.finished", "outcome", "failed").increment();
        updateCheckpoint(handle.id(), WorkflowState.FAILED);
        reporter.onAgentFailed(handle.id(), names, "Agent " + handle.id() + " failed");

        if (settings.failurePolicy() == FailurePolicy.RETRY && handle.retryCount() < settings.maxRetries()) {
            log.warn("Retrying tasks {} ({}/{})", names, handle.retryCount() + 1, settings.maxRetries());
            pending.addLast(new PendingGroup(handle.taskGroup(), handle.retryCount() + 1));
            return false;
        }

        tally.failed.addAll(names);
        names.forEach(name -> updateStatus(name, TaskStatus.FAILED));
        tally.errors.add("Agent " + handle.id() + " failed (tasks: " + String.join(", ", names) + ")");
        return settings.failurePolicy() == FailurePolicy.ABORT;
    }

    /** Ready tasks the run has never seen each become a new single-task group. */
    private void enqueueNewlyReady(Deque<PendingGroup> pending, Set<String> known) {
        if (taskSource == null) {
            return;
        }
        List<Task> ready;
        try {
            ready = taskSource.getReadyTasks();
        } catch (TaskSourceException e) {
            log.warn("Could not query {} task source for ready tasks: {}", taskSource.name(), e.getMessage());
            return;
        }
        for (Task task : ready) {
            if (known.add(task.taskId())) {
                log.info("Task '{}' is now unblocked", task.taskId());
                pending.addLast(new PendingGroup(List.of(TaskInfo.from(task)), 0));
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void updateStatus(String taskId, TaskStatus status) {
        if (taskSource == null) {
            return;
        }
        try {
            taskSource.updateStatus(taskId, status);
        } catch (TaskSourceException e) {
            log.warn("Could not mark task '{}' {} in {} task source: {}",
                    taskId, status.value(), taskSource.name(), e.getMessage());
        }
    }

    private void saveCheckpoint(String agentId, ExecutionResult execResult, String sandboxName) {
        if (checkpointStore == null) {
            return;
        }
        Object worktree = execResult.getStepOutputs()
                .getOrDefault("create_worktree", Map.of())
                .get("worktree_path");
        Instant now = Instant.now();
        try {
            checkpointStore.save(new WorkflowCheckpoint(agentId, execResult.getState().name(),
                    execResult.getCompletedSteps(), sandboxName,
                    worktree != null ? worktree.toString() : null, now, now));
        } catch (UncheckedIOException e) {
            log.warn("Could not write checkpoint for {}: {}", agentId, e.getMessage());
        }
    }

    private void updateCheckpoint(String agentId, WorkflowState state) {
        if (checkpointStore == null) {
            return;
        }
        try {
            checkpointStore.load(agentId)
                    .map(cp -> cp.withState(state.name()))
                    .ifPresent(checkpointStore::save);
        } catch (UncheckedIOException e) {
            log.warn("Could not update checkpoint for {}: {}", agentId, e.getMessage());
        }
    }

    /** @return false if the thread was interrupted while sleeping */
    private boolean sleep() {
        if (settings.pollInterval().isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(settings.pollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static double secondsSince(Instant start) {
        return Duration.between(start, Instant.now()).toNanos() / 1_000_000_000.0;
    }

    private static List<String> names(List<TaskInfo> tasks) {
        return tasks.stream().map(TaskInfo::name).toList();
    }
}
