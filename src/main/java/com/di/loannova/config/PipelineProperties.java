package com.di.loannova.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single binding for every pipeline setting.
 *
 * <pre>
 * loannova:
 *   pipeline:
 *     run-on-startup: false
 *     run:
 *       id-strategy: timestamp        # or deterministic
 *       artifacts-dir: logs/runs
 *     source:
 *       type: file                    # file | http | bi-export
 *       path: data/raw/loan_tape.csv
 *     http:
 *       max-retries: 3
 *       failure-threshold: 3
 *     validation:
 *       strict: true
 *     output:
 *       formats: arrow,csv,metrics_json
 * </pre>
 *
 * Values come from {@code application.yml}, profile files and the environment; the pipeline
 * only ever reads this object.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "loannova.pipeline")
public class PipelineProperties {

    /** Run the configured pipeline once when the application starts. */
    private boolean runOnStartup = false;

    @Valid
    private Run run = new Run();

    @Valid
    private Source source = new Source();

    @Valid
    private Http http = new Http();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Transformation transformation = new Transformation();

    @Valid
    private Calculation calculation = new Calculation();

    @Valid
    private Output output = new Output();

    @Valid
    private Alerts alerts = new Alerts();

    // ------------------------------------------------------------------ //
    // Run identity and state                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Run {

        /** {@code timestamp} gives a fresh id per run; {@code deterministic} derives it from the input hash. */
        @Pattern(regexp = "timestamp|deterministic")
        private String idStrategy = "timestamp";

        /** Root for manifests, compliance reports, run summaries and {@code latest.json}. */
        @NotBlank
        private String artifactsDir = "logs/runs";

        /** Last-processed raw hashes. */
        @NotBlank
        private String stateFile = "logs/runs/state.json";

        /** Content-addressed copies of every fetched extract. */
        @NotBlank
        private String rawArchiveDir = "data/archives/raw";

        private String user = "system";

        private String action = "pipeline_run";

        /** Reprocess even when the input hash matches the last successful run. */
        private boolean force = false;
    }

    // ------------------------------------------------------------------ //
    // Source                                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Source {

        @Pattern(regexp = "(?i)file|http|bi-export")
        private String type = "file";

        private String path;

        private String url;

        /** Name of the environment variable holding the bearer token; unset or empty means no auth header. */
        private String authTokenEnv;

        @Min(1)
        private int timeoutSeconds = 30;

        private Map<String, String> headers = new LinkedHashMap<>();

        /** BI export: column carrying the snapshot date; wins over the strategy when present. */
        private String measurementDateColumn;

        @Pattern(regexp = "today|max_disburse_date|max_maturity_date")
        private String measurementDateStrategy = "today";

        /** BI export: optional CSV (or directory of CSVs, newest wins) with cash balances per date. */
        private String financialsPath;

        private List<String> financialsDateCandidates =
                new ArrayList<>(List.of("reporting_date", "as_of_date", "date", "fecha", "fecha_corte"));

        private List<String> financialsCashCandidates =
                new ArrayList<>(List.of("cash_balance_usd", "cash_balance", "cash_usd", "cash"));
    }

    // ------------------------------------------------------------------ //
    // HTTP resilience                                                     //
    // ------------------------------------------------------------------ //

    @Data
    public static class Http {

        @Min(0)
        private int maxRetries = 3;

        @DecimalMin("0.0")
        private double backoffSeconds = 1.0;

        @DecimalMin("0.0")
        private double jitterSeconds = 0.0;

        @Min(1)
        private int failureThreshold = 3;

        @Min(0)
        private int resetSeconds = 60;

        @Min(1)
        private int maxRequestsPerMinute = 60;
    }

    // ------------------------------------------------------------------ //
    // Contract and quality                                                //
    // ------------------------------------------------------------------ //

    @Data
    public static class Validation {

        /** Enables the post-transformation quality gate. */
        private boolean enabled = true;

        /** Any contract violation at ingestion halts the run. */
        private boolean strict = true;

        private List<String> requiredColumns = new ArrayList<>();

        private List<String> numericColumns = new ArrayList<>();

        private List<String> dateColumns = new ArrayList<>();

        private List<String> percentageColumns = new ArrayList<>();

        private List<String> nonNegativeColumns = new ArrayList<>();

        private List<String> keyColumns = new ArrayList<>(List.of("loan_id"));

        /** Enforce uniqueness of key columns, not only presence. */
        private boolean uniqueKeys = false;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double completenessThreshold = 0.98;

        private boolean dedupEnabled = true;

        private List<String> dedupKeyColumns = new ArrayList<>(List.of("loan_id"));

        /** Canonical column to ordered source candidates, merged over the built-in aliases. */
        private Map<String, List<String>> columnAliases = new LinkedHashMap<>();

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double minDataQualityScore = 95.0;
    }

    // ------------------------------------------------------------------ //
    // Transformation                                                      //
    // ------------------------------------------------------------------ //

    @Data
    public static class Transformation {

        private boolean lowercaseColumns = true;

        private boolean stripWhitespace = true;

        @Pattern(regexp = "fill_zero|drop_rows")
        private String nullStrategy = "fill_zero";

        /** Columns the null strategy applies to; empty leaves nulls untouched. */
        private List<String> nullColumns = new ArrayList<>();

        private boolean outlierEnabled = true;

        @DecimalMin("0.0")
        private double outlierZscoreThreshold = 4.0;

        private boolean piiEnabled = true;

        private List<String> piiKeywords = new ArrayList<>(List.of(
                "name", "email", "phone", "address", "ssn", "tin", "identifier", "id_number"));

        private List<String> piiColumns = new ArrayList<>();

        @Pattern(regexp = "mask|redact")
        private String piiAction = "mask";
    }

    // ------------------------------------------------------------------ //
    // Calculation                                                         //
    // ------------------------------------------------------------------ //

    @Data
    public static class Calculation {

        private boolean anomalyEnabled = true;

        /** Relative change versus the previous run that raises an anomaly flag. */
        @DecimalMin("0.0")
        private double anomalyMaxChangePct = 0.2;

        private boolean timeseriesEnabled = true;

        private String timeseriesTimeColumn = "measurement_date";

        private List<String> timeseriesRollups = new ArrayList<>(List.of("daily", "weekly", "monthly"));

        /** Per-KPI overrides of the catalogue thresholds. */
        private Map<String, Threshold> thresholds = new LinkedHashMap<>();
    }

    @Data
    public static class Threshold {
        private Double warning;
        private Double critical;
    }

    // ------------------------------------------------------------------ //
    // Output                                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Output {

        @NotBlank
        private String baseDir = "data/metrics";

        @NotEmpty
        private List<String> formats = new ArrayList<>(List.of("arrow", "csv", "metrics_json"));

        @Valid
        @NotNull
        private Cloud cloud = new Cloud();
    }

    @Data
    public static class Cloud {

        private boolean enabled = false;

        private String bucket;

        private String prefix = "loannova";

        @Min(1)
        private int maxWorkers = 10;
    }

    // ------------------------------------------------------------------ //
    // Alerts                                                              //
    // ------------------------------------------------------------------ //

    @Data
    public static class Alerts {

        private String kpiChannel = "kpi-compliance";

        private String contractChannel = "data-engineering-alerts";
    }
}
