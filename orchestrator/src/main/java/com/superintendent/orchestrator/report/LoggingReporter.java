package com.superintendent.orchestrator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Reporter that writes lifecycle events to the application log and renders
 * a plain-text summary block.
 */
public class LoggingReporter implements Reporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingReporter.class);

    @Override
    public void onAgentStarted(String agentId, List<String> taskNames, String sandboxName) {
        String location = sandboxName != null ? " in " + sandboxName : "";
        log.info("[started] Agent {}{} (tasks: {})", agentId, location, String.join(", ", taskNames));
    }

    @Override
    public void onAgentCompleted(String agentId, List<String> taskNames, double durationSeconds) {
        log.info("[completed] Agent {} completed in {} (tasks: {})",
                agentId, formatDuration(durationSeconds), String.join(", ", taskNames));
    }

    @Override
    public void onAgentFailed(String agentId, List<String> taskNames, String error) {
        log.warn("[FAILED] Agent {} FAILED (tasks: {}): {}", agentId, String.join(", ", taskNames), error);
    }

    @Override
    public void onProgress(int running, int completed, int pending, int failed) {
        int total = running + completed + pending + failed;
        log.info("[progress] {}/{} completed, {} running, {} pending, {} failed",
                completed, total, running, pending, failed);
    }

    @Override
    public String summarize(List<String> completedTasks, List<String> failedTasks, List<String> skippedTasks,
                            int agentsSpawned, double totalTimeSeconds, List<String> errors) {
        StringBuilder sb = new StringBuilder("--- Orchestration Summary ---\n");
        sb.append("Total time: ").append(formatDuration(totalTimeSeconds)).append('\n');
        sb.append("Agents spawned: ").append(agentsSpawned).append('\n');
        sb.append("Completed: ").append(completedTasks.size()).append(" tasks\n");
        appendItems(sb, completedTasks);
        if (!failedTasks.isEmpty()) {
            sb.append("Failed: ").append(failedTasks.size()).append(" tasks\n");
            appendItems(sb, failedTasks);
        }
        if (!skippedTasks.isEmpty()) {
            sb.append("Skipped: ").append(skippedTasks.size()).append(" tasks\n");
            appendItems(sb, skippedTasks);
        }
        if (!errors.isEmpty()) {
            sb.append("Errors (").append(errors.size()).append("):\n");
            appendItems(sb, errors);
        }
        String summary = sb.toString().stripTrailing();
        log.info("\n{}", summary);
        return summary;
    }

    /** "42s" under a minute, "2.5m" from a minute up. */
    static String formatDuration(double seconds) {
        double minutes = seconds / 60;
        return minutes >= 1
                ? String.format(Locale.ROOT, "%.1fm", minutes)
                : String.format(Locale.ROOT, "%.0fs", seconds);
    }

    private static void appendItems(StringBuilder sb, List<String> items) {
        items.forEach(item -> sb.append("  - ").append(item).append('\n'));
    }
}
