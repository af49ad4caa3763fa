package com.superintendent.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A DAG of {@link WorkflowStep}s plus free-form metadata.
 *
 * A plan is validated once and then queried for its execution order. It is
 * never mutated during execution; the StepExecutor tracks progress itself.
 *
 * <p>Structural rules checked by {@link #validate()}:
 * <ul>
 *   <li>step ids are unique,</li>
 *   <li>every {@code depends_on} entry names an existing step,</li>
 *   <li>the dependency relation is acyclic.</li>
 * </ul>
 */
public final class WorkflowPlan {

    private enum Color { WHITE, GRAY, BLACK }

    private final List<WorkflowStep>        steps;
    private final Map<String, Object>       metadata;
    private final Map<String, WorkflowStep> stepById = new HashMap<>();

    public WorkflowPlan(List<WorkflowStep> steps, Map<String, Object> metadata) {
        this.steps    = steps == null ? List.of() : List.copyOf(steps);
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        // First occurrence wins; duplicates are reported by validate().
        for (WorkflowStep step : this.steps) {
            stepById.putIfAbsent(step.id(), step);
        }
    }

    public List<WorkflowStep>  getSteps()    { return steps; }
    public Map<String, Object> getMetadata() { return metadata; }

    public Optional<WorkflowStep> getStep(String id) {
        return Optional.ofNullable(stepById.get(id));
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Return every structural problem with this plan, or an empty list.
     *
     * Duplicate ids and missing dependencies are both reported so that all
     * malformed edges surface together. Cycle detection only runs on an
     * otherwise well-formed graph.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!seen.add(step.id())) {
                errors.add("Duplicate step ID: " + step.id());
            }
        }

        for (WorkflowStep step : steps) {
            for (String dep : step.dependsOn()) {
                if (!stepById.containsKey(dep)) {
                    errors.add("Step '%s' depends on unknown step '%s'".formatted(step.id(), dep));
                }
            }
        }

        if (errors.isEmpty()) {
            List<String> cycle = findCycle();
            if (!cycle.isEmpty()) {
                errors.add("Dependency cycle detected: " + String.join(" -> ", cycle));
            }
        }
        return errors;
    }

    /** Three-color DFS along depends_on edges. Returns one cycle, or an empty list. */
    private List<String> findCycle() {
        Map<String, Color>  color  = new HashMap<>();
        Map<String, String> parent = new HashMap<>();
        for (WorkflowStep step : steps) {
            color.put(step.id(), Color.WHITE);
        }
        for (WorkflowStep step : steps) {
            if (color.get(step.id()) == Color.WHITE) {
                List<String> cycle = visit(step.id(), color, parent);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        return List.of();
    }

    private List<String> visit(String node, Map<String, Color> color, Map<String, String> parent) {
        color.put(node, Color.GRAY);
        for (String dep : stepById.get(node).dependsOn()) {
            Color c = color.get(dep);
            if (c == Color.GRAY) {
                // Walk parent pointers from node back up to dep.
                List<String> cycle = new ArrayList<>();
                cycle.add(dep);
                cycle.add(node);
                String current = node;
                while (parent.get(current) != null && !parent.get(current).equals(dep)) {
                    current = parent.get(current);
                    cycle.add(current);
                }
                Collections.reverse(cycle);
                return cycle;
            }
            if (c == Color.WHITE) {
                parent.put(dep, node);
                List<String> cycle = visit(dep, color, parent);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        color.put(node, Color.BLACK);
        return List.of();
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    /**
     * Topological order via Kahn's algorithm.
     *
     * Among ready steps the lexicographically smallest id always goes first,
     * which makes the order deterministic for plans with independent steps.
     *
     * @throws InvalidPlanException if {@link #validate()} reports anything
     */
    public List<WorkflowStep> executionOrder() {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            throw new InvalidPlanException(errors);
        }

        Map<String, Integer>      inDegree   = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (WorkflowStep step : steps) {
            inDegree.put(step.id(), step.dependsOn().size());
            dependents.putIfAbsent(step.id(), new ArrayList<>());
        }
        for (WorkflowStep step : steps) {
            for (String dep : step.dependsOn()) {
                dependents.get(dep).add(step.id());
            }
        }

        TreeSet<String> ready = new TreeSet<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });

        List<WorkflowStep> ordered = new ArrayList<>(steps.size());
        while (!ready.isEmpty()) {
            String current = ready.pollFirst();
            ordered.add(stepById.get(current));
            for (String dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        return ordered;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowPlan other)) return false;
        return steps.equals(other.steps) && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * steps.hashCode() + metadata.hashCode();
    }

    @Override
    public String toString() {
        return "WorkflowPlan{steps=" + steps.size() + ", metadata=" + metadata + "}";
    }
}
