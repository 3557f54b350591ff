package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.exception.PipelineException;
import com.di.loannova.observability.ObservabilityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Local CSV / JSON / NDJSON / Arrow file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSourceAdapter implements SourceAdapter {

    private final TabularParser parser;

    @Override
    public String type() {
        return "file";
    }

    @Override
    public RawExtract fetch(PipelineProperties.Source source, ObservabilityContext ctx) {
        return readFile(type(), source.getPath(), ctx);
    }

    @Override
    public Dataset parse(RawExtract extract, PipelineProperties.Source source, ObservabilityContext ctx) {
        Dataset dataset = parser.parse(extract.content(), TabularParser.Format.fromSuffix(extract.suffix()));
        ctx.event("ingestion", "raw_read", "success",
                Map.of("rows", dataset.size(), "checksum", extract.sha256(), "file_type", extract.suffix()));
        return dataset;
    }

    static RawExtract readFile(String type, String location, ObservabilityContext ctx) {
        if (location == null || location.isBlank()) {
            throw new PipelineException("No source path configured for source type '" + type + "'");
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            ctx.event("ingestion", "file_check", "failed", Map.of("path", location));
            throw new PipelineException("Input file not found: " + path);
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            RawExtract extract = RawExtract.of(type, path.toString(), path.getFileName().toString(), null, bytes);
            log.info("[INGESTION] read {} bytes from {} (sha256={})", bytes.length, path, extract.sha256());
            return extract;
        } catch (IOException e) {
            throw new PipelineException("Failed to read input file " + path, e);
        }
    }
}
