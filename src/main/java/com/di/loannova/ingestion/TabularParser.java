package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.exception.PipelineException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses raw extracts into {@link Dataset}s.
 *
 * <p>Supported: CSV (header row; all-numeric columns become doubles, empty cells null),
 * JSON array, NDJSON, a JSON object wrapping a {@code data} or {@code records} array,
 * and Arrow IPC files. Parquet and spreadsheets are rejected.
 */
@Slf4j
@Component
public class TabularParser {

    public enum Format {
        CSV, JSON, ARROW;

        /** Format implied by a file suffix such as {@code .csv}. */
        public static Format fromSuffix(String suffix) {
            switch (suffix.toLowerCase(Locale.ROOT)) {
                case ".json":
                case ".ndjson":
                case ".jsonl":
                    return JSON;
                case ".arrow":
                case ".feather":
                case ".ipc":
                    return ARROW;
                case ".parquet":
                case ".pq":
                case ".xlsx":
                case ".xls":
                    throw new PipelineException("Unsupported source format '" + suffix
                            + "'; export the extract as CSV, JSON or Arrow IPC");
                default:
                    return CSV;
            }
        }
    }

    private final ObjectMapper json = new ObjectMapper();
    private final CsvMapper csv = new CsvMapper();

    public Dataset parse(byte[] content, Format format) {
        switch (format) {
            case JSON:
                return parseJson(content);
            case ARROW:
                return parseArrow(content);
            default:
                return parseCsv(content);
        }
    }

    /**
     * HTTP bodies: JSON when the content type says so or the body starts with {@code [} / {@code {},
     * falling back to CSV when JSON parsing fails.
     */
    public Dataset parseResponse(byte[] content, String contentType) {
        String head = new String(content, 0, Math.min(content.length, 64), StandardCharsets.UTF_8).stripLeading();
        boolean looksJson = (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json"))
                || head.startsWith("[") || head.startsWith("{");
        if (looksJson) {
            try {
                return parseJson(content);
            } catch (PipelineException e) {
                log.warn("[INGESTION] response is not valid JSON ({}); trying CSV", e.getMessage());
            }
        }
        return parseCsv(content);
    }

    /* ------------------------------------------------------------------ */
    /* CSV                                                                  */
    /* ------------------------------------------------------------------ */

    public Dataset parseCsv(byte[] content) {
        List<List<String>> lines = new ArrayList<>();
        try (MappingIterator<List<String>> it = csv.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(content)) {
            while (it.hasNext()) {
                lines.add(it.next());
            }
        } catch (IOException | RuntimeException e) {
            throw new PipelineException("Failed to parse CSV: " + e.getMessage(), e);
        }
        if (lines.isEmpty()) {
            return Dataset.empty();
        }

        List<String> header = new ArrayList<>();
        for (String h : lines.get(0)) {
            header.add(h == null ? "" : h.trim());
        }
        List<Map<String, Object>> rows = new ArrayList<>(lines.size() - 1);
        for (List<String> line : lines.subList(1, lines.size())) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                String cell = c < line.size() ? line.get(c) : null;
                row.put(header.get(c), cell == null || cell.isBlank() ? null : cell);
            }
            rows.add(row);
        }
        coerceNumericColumns(header, rows);
        return Dataset.of(header, rows);
    }

    private static void coerceNumericColumns(List<String> header, List<Map<String, Object>> rows) {
        for (String column : header) {
            boolean numeric = false;
            for (Map<String, Object> row : rows) {
                Object v = row.get(column);
                if (v == null) continue;
                if (Dataset.toDouble(v) == null) {
                    numeric = false;
                    break;
                }
                numeric = true;
            }
            if (numeric) {
                for (Map<String, Object> row : rows) {
                    row.put(column, Dataset.toDouble(row.get(column)));
                }
            }
        }
    }

    /* ------------------------------------------------------------------ */
    /* JSON                                                                 */
    /* ------------------------------------------------------------------ */

    public Dataset parseJson(byte[] content) {
        List<JsonNode> records = new ArrayList<>();
        try (MappingIterator<JsonNode> it = json.readerFor(JsonNode.class).readValues(content)) {
            List<JsonNode> roots = new ArrayList<>();
            while (it.hasNext()) {
                roots.add(it.next());
            }
            if (roots.size() == 1) {
                JsonNode root = roots.get(0);
                if (root.isArray()) {
                    root.forEach(records::add);
                } else if (root.isObject() && root.path("data").isArray()) {
                    root.get("data").forEach(records::add);
                } else if (root.isObject() && root.path("records").isArray()) {
                    root.get("records").forEach(records::add);
                } else {
                    records.add(root);
                }
            } else {
                records.addAll(roots);
            }
        } catch (IOException | RuntimeException e) {
            throw new PipelineException("Failed to parse JSON: " + e.getMessage(), e);
        }

        LinkedHashSet<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (JsonNode node : records) {
            if (!node.isObject()) {
                throw new PipelineException("Expected JSON objects as records, got " + node.getNodeType());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                columns.add(f.getKey());
                row.put(f.getKey(), scalar(f.getValue()));
            }
            rows.add(row);
        }
        return Dataset.of(new ArrayList<>(columns), rows);
    }

    private static Object scalar(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) return null;
        if (value.isNumber()) return value.doubleValue();
        if (value.isBoolean()) return value.booleanValue();
        if (value.isTextual()) return value.textValue();
        return value.toString();
    }

    /* ------------------------------------------------------------------ */
    /* Arrow IPC                                                            */
    /* ------------------------------------------------------------------ */

    public Dataset parseArrow(byte[] content) {
        try (BufferAllocator allocator = new RootAllocator();
             ArrowFileReader reader = new ArrowFileReader(new ByteArrayReadableSeekableByteChannel(content), allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            List<String> columns = new ArrayList<>();
            for (Field field : root.getSchema().getFields()) {
                columns.add(field.getName());
            }
            List<Map<String, Object>> rows = new ArrayList<>();
            while (reader.loadNextBatch()) {
                for (int i = 0; i < root.getRowCount(); i++) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (FieldVector vector : root.getFieldVectors()) {
                        row.put(vector.getName(), arrowValue(vector.getObject(i)));
                    }
                    rows.add(row);
                }
            }
            return Dataset.of(columns, rows);
        } catch (IOException | RuntimeException e) {
            throw new PipelineException("Failed to read Arrow IPC file: " + e.getMessage(), e);
        }
    }

    private static Object arrowValue(Object value) {
        if (value == null) return null;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean) return value;
        return value.toString();
    }
}
