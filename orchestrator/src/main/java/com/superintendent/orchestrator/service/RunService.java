package com.superintendent.orchestrator.service;

import com.superintendent.orchestrator.backend.ExecutionBackend;
import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.plan.Planner;
import com.superintendent.orchestrator.plan.PlannerInput;
import com.superintendent.orchestrator.report.LoggingReporter;
import com.superintendent.orchestrator.report.Reporter;
import com.superintendent.orchestrator.source.TaskSource;
import com.superintendent.orchestrator.source.TaskSources;
import com.superintendent.orchestrator.state.CheckpointStore;
import com.superintendent.orchestrator.strategy.ExecutionDecision;
import com.superintendent.orchestrator.strategy.ExecutionStrategy;
import com.superintendent.orchestrator.strategy.RepoInfo;
import com.superintendent.orchestrator.strategy.StrategyOverrides;
import com.superintendent.orchestrator.strategy.TaskInfo;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Accepts orchestration runs and executes them in the background.
 *
 * Submitting a run:
 *  1. Detect the TaskSource for the repo and read its ready tasks
 *  2. Collect repo signals (only for a local checkout)
 *  3. Let the ExecutionStrategy decide mode, target and task groups
 *  4. Register the run as QUEUED and hand it to the run worker pool
 *
 * Runs live in memory only; a restart forgets them. A finished run stays
 * queryable for the retention period and is evicted on a later submission.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final String MDC_RUN_ID = "runId";

    private final ExecutionBackend          backend;
    private final ExecutionStrategy         strategy;
    private final OrchestratorSettings      settings;
    private final MeterRegistry             meterRegistry;
    private final Optional<CheckpointStore> checkpointStore;
    private final Executor                  runExecutor;
    private final Duration                  retention;
    private final Planner                   planner = new Planner();

    private final Map<UUID, Run> runs = new ConcurrentHashMap<>();

    public RunService(ExecutionBackend backend,
                      ExecutionStrategy strategy,
                      OrchestratorSettings settings,
                      MeterRegistry meterRegistry,
                      Optional<CheckpointStore> checkpointStore,
                      @Qualifier("runExecutor") Executor runExecutor,
                      @Value("${superintendent.runs.retention:1h}") Duration retention) {
        this.backend         = backend;
        this.strategy        = strategy;
        this.settings        = settings;
        this.meterRegistry   = meterRegistry;
        this.checkpointStore = checkpointStore;
        this.runExecutor     = runExecutor;
        this.retention       = retention;
    }

    // ------------------------------------------------------------------
    // Plans
    // ------------------------------------------------------------------

    /** Build the plan a single agent would execute, without running anything. */
    public WorkflowPlan preview(PlannerInput input) {
        return planner.createPlan(input);
    }

    // ------------------------------------------------------------------
    // Run submission
    // ------------------------------------------------------------------

    /**
     * Decide how to execute the repo's tasks and start the run.
     *
     * @param sourceType "auto", "single" or "markdown"; null means auto
     * @throws InvalidRunRequestException when no tasks are found, or autonomous
     *         mode would run on the local machine without explicit consent
     */
    public Run submit(String repo,
                      String task,
                      String sourceType,
                      StrategyOverrides overrides,
                      boolean dangerouslySkipIsolation) {
        if (repo == null || repo.isBlank()) {
            throw new InvalidRunRequestException("repo is required");
        }
        Optional<Path> localRepo = localDirectory(repo);

        TaskSource source = TaskSources.detect(localRepo.orElse(null), sourceType, task)
                .orElseThrow(() -> new InvalidRunRequestException(
                        "No tasks found: provide a task or a tasks.md / TODO.md checklist"));
        List<TaskInfo> tasks = source.getReadyTasks().stream().map(TaskInfo::from).toList();
        if (tasks.isEmpty()) {
            throw new InvalidRunRequestException("No ready tasks in " + source.name() + " task source");
        }

        RepoInfo repoInfo = localRepo.map(RepoInfo::fromPath).orElseGet(RepoInfo::none);
        ExecutionDecision decision = strategy.decide(tasks, repoInfo,
                overrides != null ? overrides : StrategyOverrides.none());

        if (decision.mode() == Mode.AUTONOMOUS && decision.target() == Target.LOCAL && !dangerouslySkipIsolation) {
            throw new InvalidRunRequestException(
                    "autonomous + local requires dangerouslySkipIsolation=true");
        }

        evictFinishedRuns();
        Run run = new Run(UUID.randomUUID(), repo, source.name(), decision);
        runs.put(run.getId(), run);
        log.info("Run {} queued: {} task(s) in {} group(s) from {} source, mode={}, target={}",
                run.getId(), tasks.size(), decision.taskGroups().size(), source.name(),
                decision.mode().value(), decision.target().value());

        runExecutor.execute(() -> execute(run, source));
        return run;
    }

    public Optional<Run> findById(UUID id) {
        return Optional.ofNullable(runs.get(id));
    }

    // ------------------------------------------------------------------
    // Execution (on a run worker thread)
    // ------------------------------------------------------------------

    void execute(Run run, TaskSource source) {
        MDC.put(MDC_RUN_ID, run.getId().toString());
        try {
            run.markRunning();
            ExecutionDecision decision = run.getDecision();
            int maxParallel = Math.max(1, Math.min(settings.maxParallel(), decision.parallelism()));
            SummaryCapture reporter = new SummaryCapture(new LoggingReporter());

            Orchestrator orchestrator = new Orchestrator(backend, source, reporter,
                    settings.withMaxParallel(maxParallel), meterRegistry, checkpointStore.orElse(null),
                    runTag(run));
            OrchestratorResult result = orchestrator.run(decision, run.getRepo());
            run.markFinished(result, reporter.summary);
            log.info("Run {} {}", run.getId(), run.getState());
        } catch (Exception e) {
            log.error("Unhandled error in run {}: {}", run.getId(), e.getMessage(), e);
            run.markFailed("Unhandled exception: " + e.getMessage());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    /** Drop DONE / FAILED runs whose last update is older than the retention period. */
    void evictFinishedRuns() {
        Instant cutoff = Instant.now().minus(retention);
        runs.values().removeIf(run -> {
            boolean finished = run.getState() == RunState.DONE || run.getState() == RunState.FAILED;
            boolean expired  = finished && !run.getUpdatedAt().isAfter(cutoff);
            if (expired) {
                log.debug("Evicting run {} ({}, last updated {})", run.getId(), run.getState(), run.getUpdatedAt());
            }
            return expired;
        });
    }

    /** Short, run-scoped prefix for agent ids and sandbox names. */
    static String runTag(Run run) {
        return run.getId().toString().substring(0, 8);
    }

    private static Optional<Path> localDirectory(String repo) {
        try {
            Path path = Path.of(repo);
            return Files.isDirectory(path) ? Optional.of(path) : Optional.empty();
        } catch (InvalidPathException e) {
            log.debug("'{}' is not a local path: {}", repo, e.getMessage());
            return Optional.empty();
        }
    }

    /** Delegates every event and keeps the rendered summary for the run record. */
    private static final class SummaryCapture implements Reporter {

        private final Reporter delegate;
        private String summary;

        SummaryCapture(Reporter delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onAgentStarted(String agentId, List<String> taskNames, String sandboxName) {
            delegate.onAgentStarted(agentId, taskNames, sandboxName);
        }

        @Override
        public void onAgentCompleted(String agentId, List<String> taskNames, double durationSeconds) {
            delegate.onAgentCompleted(agentId, taskNames, durationSeconds);
        }

        @Override
        public void onAgentFailed(String agentId, List<String> taskNames, String error) {
            delegate.onAgentFailed(agentId, taskNames, error);
        }

        @Override
        public void onProgress(int running, int completed, int pending, int failed) {
            delegate.onProgress(running, completed, pending, failed);
        }

        @Override
        public String summarize(List<String> completedTasks, List<String> failedTasks, List<String> skippedTasks,
                                int agentsSpawned, double totalTimeSeconds, List<String> errors) {
            summary = delegate.summarize(completedTasks, failedTasks, skippedTasks,
                    agentsSpawned, totalTimeSeconds, errors);
            return summary;
        }
    }
}
