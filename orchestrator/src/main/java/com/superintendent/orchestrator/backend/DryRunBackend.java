package com.superintendent.orchestrator.backend;

import com.superintendent.orchestrator.executor.StepHandler;
import com.superintendent.orchestrator.executor.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Backend that touches nothing. Every step succeeds, the outputs later steps
 * read are synthesized from plan metadata, and every agent reports done.
 */
public class DryRunBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(DryRunBackend.class);

    @Override
    public StepHandler newStepHandler() {
        return (step, ctx) -> {
            Map<String, Object> meta = ctx.planMetadata();
            log.info("[dry-run] {} ({})", step.id(), step.action());
            return switch (step.action()) {
                case "validate_repo" -> StepResult.ok(step.id(),
                        Map.of("repo_path", String.valueOf(meta.get("repo"))));
                case "create_worktree" -> StepResult.ok(step.id(),
                        Map.of("worktree_path", worktreePath(meta)));
                case "prepare_sandbox" -> StepResult.ok(step.id(),
                        Map.of("sandbox_name", envName(meta)));
                default -> StepResult.ok(step.id());
            };
        };
    }

    @Override
    public ProbeResult probeAgent(String sandboxName) {
        return new ProbeResult(0, "0");
    }

    private static String worktreePath(Map<String, Object> meta) {
        return "/tmp/superintendent/worktrees/" + meta.getOrDefault("repo_name", "repo")
                + "/" + meta.getOrDefault("branch", "agent");
    }

    private static String envName(Map<String, Object> meta) {
        Object name = meta.containsKey("sandbox_name") ? meta.get("sandbox_name") : meta.get("container_name");
        return String.valueOf(name);
    }
}
