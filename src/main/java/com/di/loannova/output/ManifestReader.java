package com.di.loannova.output;

import com.di.loannova.config.PipelineConfig;
import com.di.loannova.exception.PersistenceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads manifests of earlier runs: for idempotency (same source hash) and as the anomaly baseline.
 *
 * <p>Unreadable manifests are logged and skipped; they never fail the current run.
 */
@Component
@Slf4j
public class ManifestReader {

    private final ObjectMapper objectMapper = PipelineConfig.artifactMapper();

    public Manifest read(Path manifestPath) {
        try {
            return objectMapper.readValue(manifestPath.toFile(), Manifest.class);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read manifest " + manifestPath, e);
        }
    }

    /** Every {@code *_manifest.json} one level below {@code artifactsDir}. */
    public List<Path> list(Path artifactsDir) {
        if (!Files.isDirectory(artifactsDir)) {
            return List.of();
        }
        List<Path> out = new ArrayList<>();
        try (Stream<Path> runs = Files.list(artifactsDir)) {
            for (Path runDir : runs.filter(Files::isDirectory).toList()) {
                try (Stream<Path> files = Files.list(runDir)) {
                    files.filter(p -> p.getFileName().toString().endsWith(ManifestWriter.SUFFIX)).forEach(out::add);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list manifests under " + artifactsDir, e);
        }
        return out;
    }

    /** Complete manifest of an earlier run whose input had the given content hash. */
    public Optional<Path> findBySourceHash(Path artifactsDir, String sourceHash) {
        for (Path p : list(artifactsDir)) {
            Optional<JsonNode> node = readTree(p).filter(ManifestReader::complete);
            if (node.isPresent() && sourceHash.equals(node.get().path("source_hash").asText(null))) {
                return Optional.of(p);
            }
        }
        log.debug("[MANIFEST-READ] no complete manifest for source hash {}", sourceHash);
        return Optional.empty();
    }

    /**
     * Metric values of the most recently modified complete manifest other than {@code currentRunId}'s.
     * Metrics without a numeric value are left out; no prior manifest yields an empty map.
     */
    public Map<String, Double> latestBaseline(Path artifactsDir, String currentRunId) {
        List<Path> candidates = list(artifactsDir).stream()
                .filter(p -> !p.getFileName().toString().equals(currentRunId + ManifestWriter.SUFFIX))
                .sorted(Comparator.comparing(ManifestReader::modified).reversed())
                .toList();
        Map<String, Double> baseline = new LinkedHashMap<>();
        for (Path p : candidates) {
            Optional<JsonNode> node = readTree(p).filter(ManifestReader::complete);
            if (node.isEmpty()) continue;
            node.get().path("metrics").fields().forEachRemaining(e -> {
                JsonNode value = e.getValue().path("value");
                if (value.isNumber()) baseline.put(e.getKey(), value.asDouble());
            });
            log.debug("[MANIFEST-READ] baseline {} metric(s) from {}", baseline.size(), p);
            break;
        }
        return baseline;
    }

    /** Manifests written before the status field existed count as complete. */
    static boolean complete(JsonNode manifest) {
        String status = manifest.path("status").asText(null);
        return status == null || Manifest.STATUS_COMPLETE.equals(status);
    }

    private Optional<JsonNode> readTree(Path p) {
        try {
            return Optional.of(objectMapper.readTree(p.toFile()));
        } catch (IOException e) {
            log.warn("[MANIFEST-READ] skipping unreadable manifest {}: {}", p, e.getMessage());
            return Optional.empty();
        }
    }

    private static FileTime modified(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            log.debug("[MANIFEST-READ] no modification time for {}: {}", p, e.getMessage());
            return FileTime.fromMillis(0);
        }
    }
}
