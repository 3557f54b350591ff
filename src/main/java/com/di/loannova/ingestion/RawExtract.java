package com.di.loannova.ingestion;

import com.di.loannova.common.Hashing;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Bytes fetched from a source, with where they came from and their SHA-256.
 *
 * <p>Immutable: the content array is copied in and out. Two extracts are equal when
 * their hashes and descriptors are equal.
 *
 * @param sourceType   adapter type that produced the bytes ({@code file}, {@code http}, {@code bi-export})
 * @param location     path or URL the bytes were read from
 * @param fileName     name used for the archive copy and the run-state key
 * @param contentType  MIME type when known (HTTP), otherwise derived from the file suffix
 * @param content      raw bytes
 * @param sha256       hex digest of {@code content}
 * @param archivedPath content-addressed archive copy, {@code null} until archived
 */
public record RawExtract(String sourceType,
                         String location,
                         String fileName,
                         String contentType,
                         byte[] content,
                         String sha256,
                         Path archivedPath) {

    public RawExtract {
        content = content.clone();
    }

    public static RawExtract of(String sourceType, String location, String fileName, String contentType, byte[] content) {
        return new RawExtract(sourceType, location, fileName, contentType, content, Hashing.sha256Hex(content), null);
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    /** Key under which the last processed hash of this source is remembered. */
    public String stateKey() {
        return sourceType + ":" + fileName;
    }

    /** Lower-cased file suffix including the dot, or empty. */
    public String suffix() {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    public RawExtract withArchivedPath(Path path) {
        return new RawExtract(sourceType, location, fileName, contentType, content, sha256, path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawExtract other)) return false;
        return sha256.equals(other.sha256) && sourceType.equals(other.sourceType)
                && location.equals(other.location) && fileName.equals(other.fileName);
    }

    @Override
    public int hashCode() {
        return sha256.hashCode();
    }

    @Override
    public String toString() {
        return "RawExtract{" + sourceType + ":" + location + ", bytes=" + content.length
                + ", sha256=" + sha256 + ", archived=" + archivedPath + "}";
    }
}
