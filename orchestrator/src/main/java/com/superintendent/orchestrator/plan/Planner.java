package com.superintendent.orchestrator.plan;

import com.superintendent.orchestrator.model.InvalidPlanException;
import com.superintendent.orchestrator.model.Target;
import com.superintendent.orchestrator.model.WorkflowPlan;
import com.superintendent.orchestrator.model.WorkflowStep;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical {@link WorkflowPlan} for one agent.
 *
 * Stateless: it takes inputs and produces a validated plan. Running the plan
 * is the StepExecutor's job.
 *
 * Step chains per target:
 *   local     : validate_repo → create_worktree → initialize_state → start_agent
 *   sandbox   : validate_repo → create_worktree → prepare_sandbox → authenticate
 *               → initialize_state → start_agent
 *   container : as sandbox, with the provisioning step named prepare_container
 */
public class Planner {

    public WorkflowPlan createPlan(PlannerInput in) {
        String repoName = repoName(in.repo());
        String envName  = in.sandboxName() != null ? in.sandboxName() : "claude-" + repoName;
        String branch   = in.branch() != null ? in.branch() : "agent/" + repoName;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("repo",      in.repo());
        metadata.put("repo_name", repoName);
        metadata.put("task",      in.task());
        metadata.put("mode",      in.mode().value());
        metadata.put("target",    in.target().value());
        metadata.put("branch",    branch);
        metadata.put(in.target() == Target.CONTAINER ? "container_name" : "sandbox_name", envName);
        if (in.contextFile() != null) {
            metadata.put("context_file", in.contextFile());
        }

        WorkflowPlan plan = new WorkflowPlan(buildSteps(in, repoName, branch, envName), metadata);
        List<String> errors = plan.validate();
        if (!errors.isEmpty()) {
            throw new InvalidPlanException(errors);
        }
        return plan;
    }

    private List<WorkflowStep> buildSteps(PlannerInput in, String repoName, String branch, String envName) {
        List<WorkflowStep> steps = new ArrayList<>();

        steps.add(WorkflowStep.of("validate_repo", params(
                "repo",   in.repo(),
                "is_url", isUrl(in.repo()))));

        steps.add(WorkflowStep.of("create_worktree", params(
                "branch",    branch,
                "repo_name", repoName),
                "validate_repo"));

        String initDependsOn = "create_worktree";
        Map<String, Object> startParams = params("task", in.task());

        if (in.target() != Target.LOCAL) {
            // Containers reuse the sandbox provisioning action; only the step id
            // and the name key differ.
            String nameKey     = in.target() == Target.CONTAINER ? "container_name" : "sandbox_name";
            String provisionId = in.target() == Target.CONTAINER ? "prepare_container" : "prepare_sandbox";

            steps.add(new WorkflowStep(provisionId, "prepare_sandbox",
                    params(nameKey, envName, "force", in.force()),
                    List.of("create_worktree")));
            steps.add(WorkflowStep.of("authenticate", params(nameKey, envName), provisionId));

            initDependsOn = "authenticate";
            startParams   = params(nameKey, envName, "task", in.task());
        }

        steps.add(WorkflowStep.of("initialize_state", params(
                "task",         in.task(),
                "context_file", in.contextFile()),
                initDependsOn));
        steps.add(WorkflowStep.of("start_agent", startParams, "initialize_state"));
        return steps;
    }

    /** Short repo name from a URL ("…/repo.git" → "repo") or a local path. */
    static String repoName(String repo) {
        if (isUrl(repo)) {
            String trimmed = repo.replaceAll("/+$", "");
            String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
            // git@host:repo.git has no slash before the name
            name = name.substring(name.lastIndexOf(':') + 1);
            return name.endsWith(".git") ? name.substring(0, name.length() - 4) : name;
        }
        Path path = Path.of(repo).normalize();
        Path fileName = path.getFileName();
        if (fileName == null || fileName.toString().isEmpty()) {
            Path parent = path.toAbsolutePath().getFileName();
            return parent == null ? "repo" : parent.toString();
        }
        return fileName.toString();
    }

    static boolean isUrl(String repo) {
        return repo.startsWith("http://") || repo.startsWith("https://") || repo.startsWith("git@");
    }

    /** Ordered params map that tolerates null values (e.g. an absent context_file). */
    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
