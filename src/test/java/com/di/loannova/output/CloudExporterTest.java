package com.di.loannova.output;

import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.PersistenceException;
import com.di.loannova.observability.ObservabilityContext;
import com.di.loannova.observability.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("CloudExporter Tests")
class CloudExporterTest {

    @TempDir
    Path tempDir;

    private CloudObjectStore store;
    private PipelineProperties.Cloud cfg;
    private SimpleMeterRegistry registry;
    private ObservabilityContext ctx;

    @BeforeEach
    void setUp() {
        store = mock(CloudObjectStore.class);
        when(store.upload(any(), anyString(), anyString()))
                .thenAnswer(inv -> "gs://bucket/" + inv.getArgument(1));
        cfg = new PipelineProperties.Cloud();
        cfg.setEnabled(true);
        cfg.setBucket("bucket");
        cfg.setPrefix("loannova/");
        cfg.setMaxWorkers(2);
        registry = new SimpleMeterRegistry();
        ctx = new ObservabilityContext("run_1", "tester", "export", ObservationRegistry.NOOP,
                new PipelineMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Path file(String name, String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content);
    }

    @Test
    @DisplayName("Should upload every file under prefix/run/name and return URLs in input order")
    void testExport_Uploads() throws Exception {
        Path csv = file("run_1.csv", "a\n1\n");
        Path manifest = file("run_1_manifest.json", "{}");
        Path json = file("run_1_metrics.json", "{}");

        Map<String, String> blobs = new CloudExporter(store, cfg).export(List.of(csv, manifest, json), "run_1", ctx);

        assertEquals(List.of("run_1.csv", "run_1_manifest.json", "run_1_metrics.json"), List.copyOf(blobs.keySet()));
        assertEquals("gs://bucket/loannova/run_1/run_1.csv", blobs.get("run_1.csv"));
        verify(store).createContainerIfAbsent();
        verify(store).upload(any(), eq("loannova/run_1/run_1.csv"), eq("text/csv"));
        verify(store).upload(any(), eq("loannova/run_1/run_1_manifest.json"), eq("application/json"));
        assertEquals(3.0, registry.find("loannova.cloud.uploads").counter().count());
    }

    @Test
    @DisplayName("Should skip missing files and do nothing when none exist")
    void testExport_NothingToUpload() {
        Map<String, String> blobs = new CloudExporter(store, cfg)
                .export(List.of(tempDir.resolve("absent.csv")), "run_1", ctx);

        assertTrue(blobs.isEmpty());
        verify(store, never()).createContainerIfAbsent();
        verify(store, never()).upload(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("Should attempt every file and report all failures together")
    void testExport_PartialFailure() throws Exception {
        Path ok = file("ok.csv", "a\n");
        Path bad = file("bad.csv", "b\n");
        when(store.upload(any(), eq("loannova/run_1/bad.csv"), anyString()))
                .thenThrow(new IllegalStateException("permission denied"));

        PersistenceException e = assertThrows(PersistenceException.class,
                () -> new CloudExporter(store, cfg).export(List.of(ok, bad), "run_1", ctx));

        assertTrue(e.getMessage().contains("1/2"));
        assertTrue(e.getMessage().contains("permission denied"));
        verify(store).upload(any(), eq("loannova/run_1/ok.csv"), anyString());
    }

    @ParameterizedTest
    @CsvSource({
            "loannova,   loannova/run_1/f.csv",
            "loannova//, loannova/run_1/f.csv",
            "'',         run_1/f.csv"
    })
    @DisplayName("Should build object keys from prefix, run and file name")
    void testKey(String prefix, String expected) {
        cfg.setPrefix(prefix);

        assertEquals(expected, new CloudExporter(store, cfg).key("run_1", "f.csv"));
    }

    @ParameterizedTest
    @CsvSource({
            "a.csv,   text/csv",
            "a.JSON,  application/json",
            "a.arrow, application/vnd.apache.arrow.file",
            "a.bin,   application/octet-stream"
    })
    @DisplayName("Should map file suffixes to content types")
    void testContentType(String name, String expected) {
        assertEquals(expected, CloudExporter.contentType(name));
    }
}
