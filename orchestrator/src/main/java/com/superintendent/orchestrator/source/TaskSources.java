package com.superintendent.orchestrator.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the {@link TaskSource} for a repository.
 *
 * Explicit types: "single" (needs a task description) and "markdown" (uses the
 * first of tasks.md / TODO.md at the repo root). "auto" tries the markdown
 * checklist first and falls back to a single task when a description is given.
 */
public final class TaskSources {

    private TaskSources() {}

    public static Optional<TaskSource> detect(Path repoRoot, String sourceType, String taskDescription) {
        String type = sourceType == null ? "auto" : sourceType.trim().toLowerCase(Locale.ROOT);

        return switch (type) {
            case "single"   -> singleTask(taskDescription);
            case "markdown" -> findChecklist(repoRoot);
            case "auto"     -> findChecklist(repoRoot).or(() -> singleTask(taskDescription));
            default         -> Optional.empty();
        };
    }

    private static Optional<TaskSource> singleTask(String taskDescription) {
        if (taskDescription == null || taskDescription.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new SingleTaskSource(taskDescription));
    }

    private static Optional<TaskSource> findChecklist(Path repoRoot) {
        if (repoRoot == null || !Files.isDirectory(repoRoot)) {
            return Optional.empty();
        }
        return MarkdownTaskSource.CANDIDATES.stream()
                .map(repoRoot::resolve)
                .filter(Files::isRegularFile)
                .findFirst()
                .<TaskSource>map(MarkdownTaskSource::new);
    }
}
