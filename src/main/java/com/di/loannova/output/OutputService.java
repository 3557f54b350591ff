package com.di.loannova.output;

import com.di.loannova.common.Dataset;
import com.di.loannova.common.Hashing;
import com.di.loannova.common.SubRunIds;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.PersistenceException;
import com.di.loannova.observability.ObservabilityContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Phase 4: persists the transformed dataset and the metrics, hashes every artifact, writes the
 * manifest and optionally exports everything to the cloud object store.
 *
 * <p>When a manifest for the same source hash already exists and {@code force} is off the phase
 * returns a skipped result without touching any file. A write failure aborts the phase; files
 * already written stay in place. With cloud export the manifest is written as {@code exporting}
 * and marked {@code complete} only after every upload succeeded, so a failed export is retried
 * by the next run of the same input.
 */
@Slf4j
@Service
public class OutputService {

    public static final String ARROW = "arrow";
    public static final String CSV = "csv";
    public static final String METRICS_JSON = "metrics_json";

    private final PipelineProperties properties;
    private final DatasetWriter writer;
    private final ManifestWriter manifestWriter;
    private final ManifestReader manifestReader;
    private final ObjectProvider<CloudObjectStore> cloudStore;
    private final Clock clock;

    public OutputService(PipelineProperties properties,
                         DatasetWriter writer,
                         ManifestWriter manifestWriter,
                         ManifestReader manifestReader,
                         ObjectProvider<CloudObjectStore> cloudStore,
                         Clock clock) {
        this.properties = properties;
        this.writer = writer;
        this.manifestWriter = manifestWriter;
        this.manifestReader = manifestReader;
        this.cloudStore = cloudStore;
        this.clock = clock;
    }

    public OutputResult persist(OutputRequest request, ObservabilityContext ctx) {
        String outRunId = SubRunIds.next("out");
        Path artifactsDir = Path.of(properties.getRun().getArtifactsDir());
        String runId = request.runId();

        if (!request.force() && request.sourceHash() != null) {
            Optional<Path> existing = manifestReader.findBySourceHash(artifactsDir, request.sourceHash());
            if (existing.isPresent()) {
                log.info("[OUTPUT] {} skipped: manifest for source hash {} already at {}",
                        runId, abbreviate(request.sourceHash()), existing.get());
                return OutputResult.skipped(outRunId, existing.get());
            }
        }

        Path outDir = Path.of(properties.getOutput().getBaseDir()).resolve(runId);
        Map<String, String> files = new LinkedHashMap<>();
        for (String format : properties.getOutput().getFormats()) {
            Path written = writeFormat(format.trim().toLowerCase(Locale.ROOT), request, outDir);
            if (written != null) files.put(format, written.toString());
        }

        Map<String, String> timeseries = new LinkedHashMap<>();
        request.calculation().timeseries().forEach((rollup, table) -> timeseries.put(rollup,
                writer.writeCsv(table, outDir.resolve("timeseries").resolve(runId + "_" + rollup + ".csv")).toString()));

        Map<String, String> hashes = new LinkedHashMap<>();
        files.forEach((key, path) -> hashes.put(key, hash(path)));
        timeseries.forEach((key, path) -> hashes.put("timeseries_" + key, hash(path)));

        Map<String, String> subRuns = new LinkedHashMap<>(request.subRuns());
        subRuns.put("output", outRunId);

        CloudObjectStore store = properties.getOutput().getCloud().isEnabled() ? cloudStore.getIfAvailable() : null;
        Manifest manifest = Manifest.builder()
                .runId(runId)
                .subRuns(subRuns)
                .generatedAt(clock.instant())
                .sourceHash(request.sourceHash())
                .status(store != null ? Manifest.STATUS_EXPORTING : Manifest.STATUS_COMPLETE)
                .metrics(request.calculation().metrics())
                .anomalies(request.calculation().anomalies())
                .metadata(request.metadata())
                .qualityChecks(request.qualityChecks())
                .files(files)
                .fileHashes(hashes)
                .timeseries(timeseries)
                .complianceReport(request.complianceReport() == null ? null : request.complianceReport().toString())
                .build();
        Path manifestPath = manifestWriter.write(artifactsDir, manifest);

        if (store != null) {
            List<Path> uploads = new ArrayList<>();
            files.values().forEach(p -> uploads.add(Path.of(p)));
            timeseries.values().forEach(p -> uploads.add(Path.of(p)));
            if (request.complianceReport() != null) uploads.add(request.complianceReport());
            uploads.add(manifestPath);
            Map<String, String> blobs = new CloudExporter(store, properties.getOutput().getCloud())
                    .export(uploads, runId, ctx);
            if (!blobs.isEmpty()) manifest.setCloudBlobs(blobs);
            manifest.setStatus(Manifest.STATUS_COMPLETE);
            manifestWriter.write(artifactsDir, manifest);
        } else if (properties.getOutput().getCloud().isEnabled()) {
            log.warn("[OUTPUT] cloud export enabled but no object store is configured; skipped");
        }

        log.info("[OUTPUT] {} complete: {} file(s), {} timeseries, manifest {}",
                runId, files.size(), timeseries.size(), manifestPath);
        return new OutputResult(outRunId, false, manifest, manifestPath, files);
    }

    private Path writeFormat(String format, OutputRequest request, Path outDir) {
        String runId = request.runId();
        Dataset ds = request.dataset();
        switch (format) {
            case ARROW:
                return writer.writeArrow(ds, outDir.resolve(runId + ".arrow"));
            case CSV:
                return writer.writeCsv(ds, outDir.resolve(runId + ".csv"));
            case METRICS_JSON:
                Map<String, Object> doc = new LinkedHashMap<>();
                doc.put("run_id", runId);
                doc.put("generated_at", clock.instant());
                doc.put("metrics", request.calculation().metrics());
                return writer.writeJson(doc, outDir.resolve(runId + "_metrics.json"));
            default:
                log.warn("[OUTPUT] unknown output format '{}' ignored", format);
                return null;
        }
    }

    private static String hash(String path) {
        try {
            return Hashing.sha256Hex(Path.of(path));
        } catch (IOException e) {
            throw new PersistenceException("Failed to hash " + path, e);
        }
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
