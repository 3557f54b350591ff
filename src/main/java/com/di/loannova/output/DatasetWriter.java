package com.di.loannova.output;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineConfig;
import com.di.loannova.exception.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes datasets and JSON documents to local files: Arrow IPC for the columnar copy, CSV for
 * the row copy, and pretty-printed JSON for metrics and run artifacts.
 */
@Slf4j
@Component
public class DatasetWriter {

    private final ObjectMapper json = PipelineConfig.artifactMapper();
    private final CsvMapper csv = new CsvMapper();

    public Path writeCsv(Dataset ds, Path target) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        ds.columns().forEach(schema::addColumn);
        List<List<String>> rows = new ArrayList<>(ds.size());
        for (Map<String, Object> row : ds.rows()) {
            List<String> cells = new ArrayList<>(ds.columns().size());
            for (String c : ds.columns()) {
                cells.add(Dataset.render(row.get(c)));
            }
            rows.add(cells);
        }
        try {
            createParent(target);
            csv.writer(schema.build()).writeValue(target.toFile(), rows);
            log.debug("[OUTPUT] csv {} row(s) -> {}", ds.size(), target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write CSV " + target, e);
        }
    }

    /**
     * Columns whose non-null cells are all numbers become float64, all booleans become bit,
     * anything else is written as UTF-8 text.
     */
    public Path writeArrow(Dataset ds, Path target) {
        List<Field> fields = new ArrayList<>();
        for (String c : ds.columns()) {
            fields.add(new Field(c, FieldType.nullable(arrowType(ds.values(c))), null));
        }
        try (BufferAllocator allocator = new RootAllocator();
             VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator)) {
            createParent(target);
            root.allocateNew();
            for (FieldVector vector : root.getFieldVectors()) {
                fill(vector, ds.values(vector.getName()));
            }
            root.setRowCount(ds.size());
            try (OutputStream out = Files.newOutputStream(target);
                 ArrowFileWriter writer = new ArrowFileWriter(root, null, Channels.newChannel(out))) {
                writer.start();
                writer.writeBatch();
                writer.end();
            }
            log.debug("[OUTPUT] arrow {} row(s) -> {}", ds.size(), target);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write Arrow file " + target, e);
        }
    }

    public Path writeJson(Object document, Path target) {
        try {
            createParent(target);
            json.writeValue(target.toFile(), document);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write JSON " + target, e);
        }
    }

    private static ArrowType arrowType(List<Object> values) {
        boolean numeric = true;
        boolean bool = true;
        boolean any = false;
        for (Object v : values) {
            if (v == null) continue;
            any = true;
            numeric &= v instanceof Number;
            bool &= v instanceof Boolean;
        }
        if (any && numeric) return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        if (any && bool) return ArrowType.Bool.INSTANCE;
        return ArrowType.Utf8.INSTANCE;
    }

    private static void fill(FieldVector vector, List<Object> values) {
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            if (vector instanceof Float8Vector f) {
                if (v == null) f.setNull(i); else f.setSafe(i, ((Number) v).doubleValue());
            } else if (vector instanceof BitVector b) {
                if (v == null) b.setNull(i); else b.setSafe(i, Boolean.TRUE.equals(v) ? 1 : 0);
            } else if (vector instanceof VarCharVector s) {
                if (v == null) s.setNull(i); else s.setSafe(i, Dataset.render(v).getBytes(StandardCharsets.UTF_8));
            }
        }
        vector.setValueCount(values.size());
    }

    private static void createParent(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
