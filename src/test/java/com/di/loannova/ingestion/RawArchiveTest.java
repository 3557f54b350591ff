package com.di.loannova.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawArchive Tests")
class RawArchiveTest {

    private static RawExtract extract(String body) {
        return RawExtract.of("file", "/data/loan_tape.csv", "loan_tape.csv", null, body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should name archive entries by stem, hash and suffix")
    void testArchiveName() {
        RawExtract e = extract("a,b\n1,2\n");

        assertEquals("loan_tape." + e.sha256() + ".csv", RawArchive.archiveName(e));
    }

    @Test
    @DisplayName("Should write the bytes once and never overwrite an existing entry")
    void testArchive_Idempotent(@TempDir Path dir) throws Exception {
        RawArchive archive = new RawArchive(dir.resolve("raw"));
        RawExtract e = extract("a,b\n1,2\n");

        Path first = archive.archive(e).archivedPath();
        FileTime stamp = FileTime.from(Instant.parse("2024-01-01T00:00:00Z"));
        Files.setLastModifiedTime(first, stamp);
        Path second = archive.archive(e).archivedPath();

        assertEquals(first, second);
        assertEquals("a,b\n1,2\n", Files.readString(first));
        assertEquals(stamp, Files.getLastModifiedTime(second));
    }

    @Test
    @DisplayName("Should keep different content under different names")
    void testArchive_DifferentContent(@TempDir Path dir) {
        RawArchive archive = new RawArchive(dir);

        Path a = archive.archive(extract("v1")).archivedPath();
        Path b = archive.archive(extract("v2")).archivedPath();

        assertNotEquals(a, b);
        assertEquals("file:loan_tape.csv", extract("v1").stateKey());
    }
}
