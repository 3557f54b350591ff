package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.contract.ContractValidator;
import com.di.loannova.contract.LoanTapeSchema;
import com.di.loannova.exception.ContractViolationException;
import com.di.loannova.exception.SchemaDriftException;
import com.di.loannova.observability.ObservabilityContext;
import com.di.loannova.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionService Tests")
class IngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-01T06:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path workDir;

    private PipelineProperties properties;
    private IngestionService service;
    private ObservabilityContext ctx;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getRun().setRawArchiveDir(workDir.resolve("archive").toString());
        properties.getSource().setType("file");
        properties.getSource().setPath(Fixtures.path("loan_tape.csv").toString());

        TabularParser parser = new TabularParser();
        SourceAdapterRegistry registry = new SourceAdapterRegistry(List.of(
                new FileSourceAdapter(parser), new BiExportSourceAdapter(parser, CLOCK)));
        registry.initialize();
        service = new IngestionService(registry, new ContractValidator(CLOCK), properties, CLOCK);
        ctx = ObservabilityContext.noop("run_test");
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Path writeCsv(String name, String content) throws Exception {
        Path file = workDir.resolve(name);
        Files.writeString(file, content);
        properties.getSource().setPath(file.toString());
        return file;
    }

    @Test
    @DisplayName("Should archive the raw extract under its content hash")
    void testAcquire_Archives() {
        RawExtract extract = service.acquire(ctx);

        assertNotNull(extract.archivedPath());
        assertTrue(Files.exists(extract.archivedPath()));
        assertTrue(extract.archivedPath().getFileName().toString().contains(extract.sha256()));
    }

    @Test
    @DisplayName("Should ingest the loan tape fixture into canonical rows with metadata")
    void testIngest_LoanTape() {
        RawExtract extract = service.acquire(ctx);

        IngestionResult result = service.ingest(extract, ctx);

        assertTrue(result.runId().startsWith("ingest_"));
        assertEquals(extract.sha256(), result.sourceHash());
        assertEquals(4, result.dataset().size());
        assertEquals(LoanTapeSchema.LOAN_ID, result.dataset().columns().get(0));
        assertTrue(result.dataset().hasColumn("borrower_name"));
        assertEquals(4, result.metadata().get("row_count"));
        assertEquals(0, result.metadata().get("error_count"));
        assertEquals(extract.sha256(), result.metadata().get("checksum"));
        assertTrue(result.metadata().containsKey("column_resolution"));
        assertEquals(100.0, result.qualityReport().score());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    @DisplayName("Should resolve aliased source columns before validation")
    void testIngest_Aliases() throws Exception {
        writeCsv("aliased.csv", "Loan Number,outstanding_balance,total_eligible,discounted_balance\nA,100,90,80\n");

        IngestionResult result = service.ingest(service.acquire(ctx), ctx);

        assertEquals("A", result.dataset().value(0, "loan_id"));
        assertEquals(100.0, result.dataset().value(0, "total_receivable_usd"));
        @SuppressWarnings("unchecked")
        Map<String, Object> resolution = (Map<String, Object>) result.metadata().get("column_resolution");
        assertTrue(resolution.containsKey("total_receivable_usd"));
    }

    @Test
    @DisplayName("Should halt with a critical violation when a core column is missing")
    void testIngest_MissingCoreColumn() throws Exception {
        writeCsv("partial.csv", "loan_id,total_receivable_usd\nA,100\n");

        RawExtract extract = service.acquire(ctx);
        ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> service.ingest(extract, ctx));

        assertTrue(e.isCritical());
        assertTrue(e.getViolations().stream().anyMatch(v -> v.rule().equals("required_column")));
    }

    @Test
    @DisplayName("Should halt on future-dated records regardless of strict mode")
    void testIngest_FutureDateIsCritical() throws Exception {
        properties.getValidation().setStrict(false);
        writeCsv("future.csv", "loan_id,total_receivable_usd,total_eligible_usd,discounted_balance_usd,measurement_date\n"
                + "A,100,100,100,2024-12-31\n");

        RawExtract extract = service.acquire(ctx);
        ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> service.ingest(extract, ctx));

        assertTrue(e.isCritical());
    }

    @Test
    @DisplayName("Should halt on non-critical violations in strict mode")
    void testIngest_StrictMode() throws Exception {
        writeCsv("negative.csv", "loan_id,total_receivable_usd,total_eligible_usd,discounted_balance_usd\n"
                + "A,100,100,100\nB,-5,100,100\n");

        RawExtract extract = service.acquire(ctx);
        ContractViolationException e = assertThrows(ContractViolationException.class,
                () -> service.ingest(extract, ctx));

        assertFalse(e.isCritical());
        assertEquals("non_negative", e.getViolations().get(0).rule());
    }

    @Test
    @DisplayName("Should drop failing rows and carry violations forward when not strict")
    void testIngest_LenientMode() throws Exception {
        properties.getValidation().setStrict(false);
        writeCsv("negative.csv", "loan_id,total_receivable_usd,total_eligible_usd,discounted_balance_usd\n"
                + "A,100,100,100\nB,-5,100,100\n");

        IngestionResult result = service.ingest(service.acquire(ctx), ctx);

        assertEquals(1, result.dataset().size());
        assertEquals(1, result.violations().size());
        assertEquals(1, result.metadata().get("rows_dropped"));
    }

    @Test
    @DisplayName("Should keep the first occurrence of duplicate keys")
    void testIngest_Deduplicates() throws Exception {
        writeCsv("dupes.csv", "loan_id,total_receivable_usd,total_eligible_usd,discounted_balance_usd\n"
                + "A,100,100,100\nA,200,200,200\nB,50,50,50\n");

        IngestionResult result = service.ingest(service.acquire(ctx), ctx);

        assertEquals(2, result.dataset().size());
        assertEquals(100.0, result.dataset().value(0, "total_receivable_usd"));
        assertEquals(1, result.metadata().get("deduped_count"));
    }

    @Test
    @DisplayName("Should convert a BI export and raise schema drift for an unknown layout")
    void testIngest_BiExport() {
        properties.getSource().setType("bi-export");
        properties.getSource().setPath(Fixtures.path("bi_par_balances.csv").toString());
        properties.getSource().setFinancialsPath(Fixtures.path("financials.csv").toString());

        IngestionResult result = service.ingest(service.acquire(ctx), ctx);
        assertEquals(2, result.dataset().size());
        assertEquals(5500.0, result.dataset().value(1, "cash_available_usd"));

        properties.getSource().setPath(Fixtures.path("bi_unknown.csv").toString());
        RawExtract unknown = service.acquire(ctx);
        assertThrows(SchemaDriftException.class, () -> service.ingest(unknown, ctx));
    }

    @Test
    @DisplayName("Should ignore dedup keys that are not in the dataset")
    void testDeduplicate_MissingKey() {
        Dataset ds = Dataset.of(List.of("a"), List.of(Map.of("a", 1), Map.of("a", 1)));

        assertSame(ds, IngestionService.deduplicate(ds, List.of("loan_id")));
        assertEquals(1, IngestionService.deduplicate(ds, List.of("a")).size());
    }
}
