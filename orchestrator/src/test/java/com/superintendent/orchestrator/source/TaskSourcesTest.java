package com.superintendent.orchestrator.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TaskSourcesTest {

    @TempDir Path repo;

    @Test
    void auto_prefersChecklistOverTaskDescription() throws IOException {
        Files.writeString(repo.resolve("TODO.md"), "- [ ] thing\n");

        assertThat(TaskSources.detect(repo, "auto", "ad-hoc task"))
                .get().isInstanceOf(MarkdownTaskSource.class);
    }

    @Test
    void auto_tasksMdWinsOverTodoMd() throws IOException {
        Files.writeString(repo.resolve("TODO.md"), "- [ ] todo\n");
        Files.writeString(repo.resolve("tasks.md"), "- [ ] tasks\n");

        assertThat(TaskSources.detect(repo, null, null))
                .get().isInstanceOfSatisfying(MarkdownTaskSource.class,
                        md -> assertThat(md.getPath().getFileName().toString()).isEqualTo("tasks.md"));
    }

    @Test
    void auto_noChecklist_fallsBackToSingle() {
        assertThat(TaskSources.detect(repo, "auto", "ad-hoc task"))
                .get().isInstanceOf(SingleTaskSource.class);
    }

    @Test
    void auto_nothingAvailable_isEmpty() {
        assertThat(TaskSources.detect(repo, "auto", null)).isEmpty();
        assertThat(TaskSources.detect(null, "auto", " ")).isEmpty();
    }

    @Test
    void explicitTypes() throws IOException {
        Files.writeString(repo.resolve("tasks.md"), "- [ ] thing\n");

        assertThat(TaskSources.detect(repo, "single", "do it")).get().isInstanceOf(SingleTaskSource.class);
        assertThat(TaskSources.detect(repo, "MARKDOWN", null)).get().isInstanceOf(MarkdownTaskSource.class);
        assertThat(TaskSources.detect(repo, "single", null)).isEmpty();
        assertThat(TaskSources.detect(repo, "beads", "x")).isEmpty();
    }
}
