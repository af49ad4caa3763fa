package com.superintendent.orchestrator.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores one JSON file per workflow under a directory: {@code <dir>/<workflowId>.json}.
 *
 * Writes go to a temp file first and are then moved into place, so a reader
 * never sees a half-written checkpoint.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path         dir;
    private final ObjectMapper json;

    public CheckpointStore(Path dir, ObjectMapper objectMapper) {
        this.dir  = dir;
        this.json = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public CheckpointStore(Path dir) {
        this(dir, new ObjectMapper().findAndRegisterModules());
    }

    public Path getDir() { return dir; }

    /** @throws UncheckedIOException if the directory or file cannot be written */
    public void save(WorkflowCheckpoint checkpoint) {
        Path target = fileFor(checkpoint.workflowId());
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, checkpoint.workflowId(), ".tmp");
            json.writeValue(tmp.toFile(), checkpoint);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Checkpoint for '{}' saved to {}", checkpoint.workflowId(), target);
        } catch (IOException e) {
            UncheckedIOException failure = new UncheckedIOException("Failed to save checkpoint " + target, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    /** Empty when no checkpoint exists for {@code workflowId}. */
    public Optional<WorkflowCheckpoint> load(String workflowId) {
        Path file = fileFor(workflowId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(json.readValue(file.toFile(), WorkflowCheckpoint.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }

    public boolean delete(String workflowId) {
        try {
            return Files.deleteIfExists(fileFor(workflowId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint for " + workflowId, e);
        }
    }

    private Path fileFor(String workflowId) {
        return dir.resolve(workflowId + ".json");
    }
}
