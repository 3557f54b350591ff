package com.di.loannova.ingestion;

import com.di.loannova.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Content-addressed store of raw extracts: {@code {stem}.{sha256}{suffix}}.
 * An existing archive entry is never rewritten, so re-fetching identical bytes is a no-op.
 */
@Slf4j
public class RawArchive {

    private final Path directory;

    public RawArchive(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /** Archive file name for an extract, independent of whether it was written yet. */
    public static String archiveName(RawExtract extract) {
        String name = extract.fileName();
        String suffix = extract.suffix();
        String stem = suffix.isEmpty() ? name : name.substring(0, name.length() - suffix.length());
        return stem + "." + extract.sha256() + suffix;
    }

    public RawExtract archive(RawExtract extract) {
        Path target = directory.resolve(archiveName(extract));
        try {
            Files.createDirectories(directory);
            if (Files.exists(target)) {
                log.info("[INGESTION] raw extract already archived at {}", target);
                return extract.withArchivedPath(target);
            }
            Files.write(target, extract.content(), StandardOpenOption.CREATE_NEW);
            log.info("[INGESTION] archived {} bytes -> {}", extract.size(), target);
            return extract.withArchivedPath(target);
        } catch (FileAlreadyExistsException e) {
            log.info("[INGESTION] raw extract archived concurrently at {}", target);
            return extract.withArchivedPath(target);
        } catch (IOException e) {
            throw new PersistenceException("Failed to archive raw extract to " + target, e);
        }
    }
}
