package com.di.loannova.output;

import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.PersistenceException;
import com.di.loannova.observability.MdcPropagation;
import com.di.loannova.observability.ObservabilityContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uploads a run's artifacts to a {@link CloudObjectStore} under {@code {prefix}/{run}/{file name}}.
 *
 * <h3>Concurrency</h3>
 * A fixed pool of {@code min(files, max-workers)} threads; each worker owns one file, so no
 * coordination is needed until all uploads have finished. Uploads overwrite, which makes a
 * repeated export harmless.
 *
 * <h3>Error handling</h3>
 * Each upload future absorbs its own failure so every file gets its attempt; collected failures
 * are raised together as a {@link PersistenceException} afterwards.
 */
@Slf4j
public class CloudExporter {

    static final long TIMEOUT_MINUTES = 30;

    private final CloudObjectStore store;
    private final PipelineProperties.Cloud cfg;

    public CloudExporter(CloudObjectStore store, PipelineProperties.Cloud cfg) {
        this.store = store;
        this.cfg   = cfg;
    }

    /** @return file name to object URL for every uploaded file */
    public Map<String, String> export(List<Path> files, String runId, ObservabilityContext ctx) {
        List<Path> existing = files.stream().filter(Files::isRegularFile).toList();
        if (existing.isEmpty()) {
            return Map.of();
        }
        store.createContainerIfAbsent();

        int workers = Math.max(1, Math.min(existing.size(), cfg.getMaxWorkers()));
        ThreadFactory   tf       = r -> { var t = new Thread(r, "cloud-upload"); t.setDaemon(true); return t; };
        ExecutorService executor = Executors.newFixedThreadPool(workers, tf);

        Map<String, String>           uploaded = new ConcurrentHashMap<>();
        ConcurrentLinkedQueue<String> errors   = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures  = new ArrayList<>(existing.size());

        for (Path file : existing) {
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(MdcPropagation.wrapRunnable(() -> {
                        String name = file.getFileName().toString();
                        uploaded.put(name, store.upload(read(file), key(runId, name), contentType(name)));
                        if (ctx.metrics() != null) ctx.metrics().recordCloudUpload();
                    }), executor)
                    .exceptionally(ex -> {
                        String msg = file.getFileName() + ": " + ex.getMessage();
                        errors.add(msg);
                        log.error("[OUTPUT] upload {} FAILED", msg);
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(TIMEOUT_MINUTES, TimeUnit.MINUTES);
        } catch (TimeoutException e) {
            throw new PersistenceException("Cloud export timed out after " + TIMEOUT_MINUTES + " minutes", e);
        } catch (ExecutionException e) {
            throw new PersistenceException("Cloud export failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Cloud export interrupted", e);
        } finally {
            executor.shutdown();
        }

        if (!errors.isEmpty()) {
            throw new PersistenceException(String.format("Cloud export failed for %d/%d file(s): %s",
                    errors.size(), existing.size(), String.join(" | ", errors)));
        }
        log.info("[OUTPUT] exported {} file(s) for {}", uploaded.size(), runId);

        Map<String, String> ordered = new LinkedHashMap<>();
        existing.forEach(p -> ordered.put(p.getFileName().toString(), uploaded.get(p.getFileName().toString())));
        return ordered;
    }

    String key(String runId, String fileName) {
        String prefix = cfg.getPrefix() == null ? "" : cfg.getPrefix().replaceAll("/+$", "");
        return prefix.isEmpty() ? runId + "/" + fileName : prefix + "/" + runId + "/" + fileName;
    }

    static String contentType(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".csv")) return "text/csv";
        if (lower.endsWith(".json")) return "application/json";
        if (lower.endsWith(".arrow")) return "application/vnd.apache.arrow.file";
        return "application/octet-stream";
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file + " for upload", e);
        }
    }
}
