package com.example.canonical.ingestion.model;

import java.time.Instant;
import java.util.List;

/**
 * Provenance and counters for one source file. {@code sha256} is taken from the stored bytes
 * before the file is parsed and is empty when the file could not be read at all.
 * {@code coercionCount} counts coerced fields, {@code coercedRecordCount} the accepted rows with at
 * least one of them; {@code normalizationCount} counts rewritten player names.
 */
public record FileMetadata(
        String path,
        String sha256,
        String encoding,
        String delimiter,
        long rowCount,
        int columnCount,
        long parsedRows,
        long quarantinedRows,
        long coercionCount,
        long coercedRecordCount,
        long nullCount,
        long duplicateCount,
        long normalizationCount,
        Instant loadedAt,
        long durationMillis,
        List<ValidationIssue> exceptions) {

    public FileMetadata {
        exceptions = List.copyOf(exceptions);
    }

    public static FileMetadata unreadable(String path, ValidationIssue issue) {
        return new FileMetadata(path, "", null, null, 0, 0, 0, 0, 0, 0, 0, 0, 0, Instant.now(), 0, List.of(issue));
    }
}
