package com.di.loannova.output;

import com.di.loannova.config.PipelineConfig;
import com.di.loannova.exception.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Serialises a {@link Manifest} to JSON under the run's artifact directory.
 */
@Component
@Slf4j
public class ManifestWriter {

    public static final String SUFFIX = "_manifest.json";

    private final ObjectMapper objectMapper = PipelineConfig.artifactMapper();

    public static Path location(Path artifactsDir, String runId) {
        return artifactsDir.resolve(runId).resolve(runId + SUFFIX);
    }

    /**
     * Writes the manifest to {@code {artifactsDir}/{run}/{run}_manifest.json} and returns the path.
     * The file is replaced atomically so readers never see half a manifest.
     */
    public Path write(Path artifactsDir, Manifest manifest) {
        Path target = location(artifactsDir, manifest.getRunId());
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), manifest);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            log.info("[MANIFEST] written {} metric(s) / {} file(s) -> {}",
                    sizeOf(manifest.getMetrics()), sizeOf(manifest.getFiles()), target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write manifest " + target, e);
        }
    }

    private static int sizeOf(Map<?, ?> map) {
        return map == null ? 0 : map.size();
    }
}
