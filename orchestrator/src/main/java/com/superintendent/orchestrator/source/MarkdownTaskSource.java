package com.superintendent.orchestrator.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tasks parsed from a markdown checklist.
 *
 * Supported line shapes:
 * <pre>
 *   - [ ] Task description
 *   - [x] [T001] Task with an explicit id
 *     - [ ] Nested task (depends on the item above it)
 * </pre>
 *
 * Items without an explicit id get {@code md-<sha256(text)[0..8]>}. Status
 * updates rewrite the checkbox in place: checked for COMPLETED, unchecked for
 * everything else.
 */
public class MarkdownTaskSource implements TaskSource {

    private static final Logger log = LoggerFactory.getLogger(MarkdownTaskSource.class);

    // Groups: indent, checkbox, optional explicit id, text
    private static final Pattern TASK_LINE = Pattern.compile(
            "^(\\s*)-\\s+\\[([ xX])\\]\\s+(?:\\[([^\\]]+)\\]\\s+)?(.+)$");

    /** File names probed, in order, by auto-detection. */
    public static final List<String> CANDIDATES = List.of("tasks.md", "TODO.md");

    private final Path path;

    public MarkdownTaskSource(Path path) {
        this.path = path;
    }

    public Path getPath() { return path; }

    @Override public String name() { return "markdown"; }

    @Override
    public List<Task> getTasks() {
        return parse(read());
    }

    @Override
    public List<Task> getReadyTasks() {
        List<Task> tasks = getTasks();
        Set<String> completed = tasks.stream()
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .map(Task::taskId)
                .collect(Collectors.toSet());
        return tasks.stream()
                .filter(t -> t.status() != TaskStatus.COMPLETED && !t.isBlocked(completed))
                .toList();
    }

    @Override
    public void updateStatus(String taskId, TaskStatus status) {
        List<String> lines = read().lines().toList();
        List<String> updated = new ArrayList<>(lines.size());
        boolean changed = false;

        for (String line : lines) {
            Matcher m = TASK_LINE.matcher(line);
            if (m.matches()) {
                String explicitId = m.group(3);
                String text       = m.group(4);
                String lineId     = explicitId != null ? explicitId : TaskIds.digest("md", text.strip());
                if (lineId.equals(taskId)) {
                    String check  = status == TaskStatus.COMPLETED ? "x" : " ";
                    String idPart = explicitId != null ? "[" + explicitId + "] " : "";
                    line = m.group(1) + "- [" + check + "] " + idPart + text;
                    changed = true;
                }
            }
            updated.add(line);
        }

        if (!changed) {
            log.debug("No checklist item with id {} in {}", taskId, path);
            return;
        }
        try {
            Files.writeString(path, String.join("\n", updated) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskSourceException("Could not update " + path, e);
        }
    }

    @Override
    public boolean claimTask(String taskId) {
        return true;
    }

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    private record Parent(int indent, String taskId) {}

    List<Task> parse(String content) {
        List<Task> tasks = new ArrayList<>();
        Deque<Parent> parents = new ArrayDeque<>();

        for (String line : content.lines().toList()) {
            Matcher m = TASK_LINE.matcher(line);
            if (!m.matches()) continue;

            int    indent = m.group(1).length();
            String text   = m.group(4).strip();
            String taskId = m.group(3) != null ? m.group(3) : TaskIds.digest("md", text);
            TaskStatus status = m.group(2).equalsIgnoreCase("x") ? TaskStatus.COMPLETED : TaskStatus.PENDING;

            while (!parents.isEmpty() && parents.peek().indent() >= indent) {
                parents.pop();
            }
            List<String> deps = parents.isEmpty() ? List.of() : List.of(parents.peek().taskId());

            tasks.add(new Task(taskId, text, text, status, deps, Map.of(), path.toString()));
            parents.push(new Parent(indent, taskId));
        }
        return tasks;
    }

    private String read() {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaskSourceException("Could not read " + path, e);
        }
    }
}
