package com.di.loannova.orchestrator;

import com.di.loannova.config.PipelineConfig;
import com.di.loannova.exception.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * JSON file holding the {@link RunState}. Single writer: concurrent runs against one state
 * file are not supported.
 */
@Slf4j
public class RunStateStore {

    private final Path file;
    private final ObjectMapper objectMapper = PipelineConfig.artifactMapper();

    public RunStateStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /** Missing file means nothing has been processed yet. */
    public RunState load() {
        if (!Files.isRegularFile(file)) {
            return RunState.empty();
        }
        try {
            return objectMapper.readValue(file.toFile(), RunState.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read run state " + file, e);
        }
    }

    public void save(RunState state) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), state);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[ORCHESTRATOR] run state saved: last_run_id={}", state.lastRunId());
        } catch (IOException e) {
            throw new PersistenceException("Failed to write run state " + file, e);
        }
    }
}
