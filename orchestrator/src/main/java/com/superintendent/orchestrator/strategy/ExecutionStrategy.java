package com.superintendent.orchestrator.strategy;

import com.superintendent.orchestrator.model.Mode;
import com.superintendent.orchestrator.model.Target;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides HOW a set of tasks should run: interaction mode, execution target,
 * parallelism and grouping.
 *
 * A pure function of (tasks, repo signals, overrides). Each rule is evaluated
 * on its own; overrides then replace the computed value and are noted in the
 * decision's reasoning.
 *
 * <ul>
 *   <li>Mode: any destructive task, or total complexity weight &ge; 6, means
 *       INTERACTIVE; otherwise AUTONOMOUS.</li>
 *   <li>Target: auth needs or env files mean SANDBOX (checked first);
 *       a Dockerfile or devcontainer means CONTAINER; otherwise LOCAL.</li>
 *   <li>Groups: connected components of the dependency graph, in order of
 *       first appearance. Parallelism is min(groups, maxParallelAgents).</li>
 * </ul>
 *
 * Task names are ids: when several tasks share a name only the first is kept.
 */
public class ExecutionStrategy {

    static final int INTERACTIVE_COMPLEXITY_THRESHOLD = 6;
    public static final int DEFAULT_MAX_PARALLEL_AGENTS = 8;

    private final int maxParallelAgents;

    public ExecutionStrategy(int maxParallelAgents) {
        if (maxParallelAgents < 1) {
            throw new IllegalArgumentException("maxParallelAgents must be >= 1, got " + maxParallelAgents);
        }
        this.maxParallelAgents = maxParallelAgents;
    }

    public ExecutionStrategy() {
        this(DEFAULT_MAX_PARALLEL_AGENTS);
    }

    public int getMaxParallelAgents() { return maxParallelAgents; }

    public ExecutionDecision decide(List<TaskInfo> tasks, RepoInfo repo) {
        return decide(tasks, repo, StrategyOverrides.none());
    }

    public ExecutionDecision decide(List<TaskInfo> tasks, RepoInfo repo, StrategyOverrides overrides) {
        List<String> reasons = new ArrayList<>();
        tasks = distinctByName(tasks);

        Mode mode = decideMode(tasks, reasons);
        if (overrides.mode() != null) {
            mode = overrides.mode();
            reasons.add("Mode overridden to " + mode.value());
        }

        Target target = decideTarget(repo, reasons);
        if (overrides.target() != null) {
            target = overrides.target();
            reasons.add("Target overridden to " + target.value());
        }

        List<List<TaskInfo>> groups = groupTasks(tasks);
        int parallelism = Math.min(groups.size(), maxParallelAgents);
        if (overrides.parallelism() != null) {
            parallelism = overrides.parallelism();
            reasons.add("Parallelism overridden to " + parallelism);
        }

        return new ExecutionDecision(mode, target, parallelism, groups, String.join("; ", reasons));
    }

    /** Multi-line, human-readable rendering of a decision. */
    public String explain(ExecutionDecision decision) {
        StringBuilder sb = new StringBuilder()
                .append("Mode: ").append(decision.mode().value()).append('\n')
                .append("Target: ").append(decision.target().value()).append('\n')
                .append("Parallelism: ").append(decision.parallelism()).append('\n')
                .append("Task groups: ").append(decision.taskGroups().size());
        if (!decision.reasoning().isEmpty()) {
            sb.append('\n').append("Reasoning: ").append(decision.reasoning());
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    private Mode decideMode(List<TaskInfo> tasks, List<String> reasons) {
        if (tasks.stream().anyMatch(TaskInfo::destructive)) {
            reasons.add("Destructive operations detected, using interactive mode");
            return Mode.INTERACTIVE;
        }
        int total = tasks.stream().mapToInt(t -> t.complexity().weight()).sum();
        if (total >= INTERACTIVE_COMPLEXITY_THRESHOLD) {
            reasons.add("High total complexity (" + total + "), using interactive mode");
            return Mode.INTERACTIVE;
        }
        reasons.add("Tasks are well-scoped, using autonomous mode");
        return Mode.AUTONOMOUS;
    }

    private Target decideTarget(RepoInfo repo, List<String> reasons) {
        if (repo.needsAuth() || repo.hasEnvFile()) {
            List<String> parts = new ArrayList<>();
            if (repo.needsAuth())  parts.add("auth requirements");
            if (repo.hasEnvFile()) parts.add("environment files");
            reasons.add("Detected " + String.join(" and ", parts) + ", using sandbox for persistent auth");
            return Target.SANDBOX;
        }
        if (repo.hasDockerfile() || repo.hasDevcontainer()) {
            reasons.add("Detected container configuration, using container for isolation");
            return Target.CONTAINER;
        }
        reasons.add("No special requirements, using local execution");
        return Target.LOCAL;
    }

    /**
     * Union-find over dependency edges; each connected component is one group.
     * Dependencies on names outside the task list are ignored.
     */
    List<List<TaskInfo>> groupTasks(List<TaskInfo> tasks) {
        Map<String, String> parent = new HashMap<>();
        for (TaskInfo task : tasks) {
            parent.put(task.name(), task.name());
        }
        for (TaskInfo task : tasks) {
            for (String dep : task.dependsOn()) {
                if (parent.containsKey(dep)) {
                    union(parent, task.name(), dep);
                }
            }
        }

        Map<String, List<TaskInfo>> groups = new LinkedHashMap<>();
        for (TaskInfo task : tasks) {
            groups.computeIfAbsent(find(parent, task.name()), k -> new ArrayList<>()).add(task);
        }
        return new ArrayList<>(groups.values());
    }

    static List<TaskInfo> distinctByName(List<TaskInfo> tasks) {
        Set<String> seen = new HashSet<>();
        return tasks.stream().filter(t -> seen.add(t.name())).toList();
    }

    private static String find(Map<String, String> parent, String x) {
        while (!parent.get(x).equals(x)) {
            String grandparent = parent.get(parent.get(x));
            parent.put(x, grandparent);   // path halving
            x = grandparent;
        }
        return x;
    }

    private static void union(Map<String, String> parent, String a, String b) {
        String ra = find(parent, a);
        String rb = find(parent, b);
        if (!ra.equals(rb)) {
            parent.put(ra, rb);
        }
    }
}
