package com.di.loannova.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dataset Tests")
class DatasetTest {

    private static Dataset sample() {
        Map<String, Object> first = new HashMap<>();
        first.put("loan_id", "L1");
        first.put("balance", "100.5");
        Map<String, Object> second = new HashMap<>();
        second.put("loan_id", "L2");
        second.put("balance", null);
        Map<String, Object> third = new HashMap<>();
        third.put("loan_id", "L3");
        third.put("balance", 20);
        return Dataset.of(List.of("loan_id", "balance"), List.of(first, second, third));
    }

    @Test
    @DisplayName("Should project every row onto the declared columns")
    void testBuild_ProjectsRows() {
        Dataset ds = Dataset.of(List.of("a"), List.of(Map.of("a", 1, "ignored", 2)));

        assertEquals(List.of("a"), ds.columns());
        assertEquals(Map.of("a", 1), ds.rows().get(0));
    }

    @Test
    @DisplayName("Should fill absent cells with null")
    void testBuild_AbsentCellsAreNull() {
        Dataset ds = Dataset.of(List.of("a", "b"), List.of(Map.of("a", 1)));

        assertTrue(ds.rows().get(0).containsKey("b"));
        assertNull(ds.value(0, "b"));
    }

    @Test
    @DisplayName("Should reject mutation of built rows")
    void testRows_AreImmutable() {
        Dataset ds = sample();

        assertThrows(UnsupportedOperationException.class, () -> ds.rows().get(0).put("loan_id", "X"));
        assertThrows(UnsupportedOperationException.class, () -> ds.rows().remove(0));
    }

    @Test
    @DisplayName("Should sum numeric cells and skip nulls")
    void testSum_IgnoresNulls() {
        assertEquals(120.5, sample().sum("balance"), 1e-9);
    }

    @Test
    @DisplayName("Should count null and blank cells")
    void testNullCount() {
        Dataset ds = Dataset.of(List.of("a"), List.<Map<String, ?>>of(Map.of("a", " "), Map.of("a", "x"), Map.of()));

        assertEquals(2, ds.nullCount("a"));
    }

    @Test
    @DisplayName("Should coerce numbers leniently")
    void testToDouble() {
        assertEquals(1.5, Dataset.toDouble("1.5"));
        assertEquals(-2e3, Dataset.toDouble(" -2e3 "));
        assertEquals(7.0, Dataset.toDouble(7));
        assertNull(Dataset.toDouble("abc"));
        assertNull(Dataset.toDouble(""));
        assertNull(Dataset.toDouble(null));
    }

    @Test
    @DisplayName("Should render doubles without trailing zeros")
    void testRender() {
        assertEquals("100", Dataset.render(100.0));
        assertEquals("0.25", Dataset.render(0.25));
        assertEquals("", Dataset.render(null));
        assertEquals("abc", Dataset.render("abc"));
    }

    @Test
    @DisplayName("Should produce the same content hash for equal content")
    void testContentHash_Stable() {
        assertEquals(sample().contentHash(), sample().contentHash());
        assertEquals(64, sample().contentHash().length());
    }

    @Test
    @DisplayName("Should change the content hash when a cell changes")
    void testContentHash_SensitiveToContent() {
        Dataset changed = Dataset.of(List.of("loan_id", "balance"), List.of(Map.of("loan_id", "L1", "balance", "100.6")));
        Dataset original = Dataset.of(List.of("loan_id", "balance"), List.of(Map.of("loan_id", "L1", "balance", "100.5")));

        assertNotEquals(original.contentHash(), changed.contentHash());
    }

    @Test
    @DisplayName("Should derive a new dataset through toBuilder without touching the source")
    void testToBuilder_AddColumn() {
        Dataset original = sample();
        Dataset.Builder builder = original.toBuilder().addColumn("flag");
        builder.rows().forEach(r -> r.put("flag", true));
        Dataset derived = builder.build();

        assertEquals(List.of("loan_id", "balance", "flag"), derived.columns());
        assertEquals(Boolean.TRUE, derived.value(2, "flag"));
        assertFalse(original.hasColumn("flag"));
    }
}
