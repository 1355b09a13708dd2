package com.example.canonical.ingestion.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cross-file totals plus the per-file breakdown keyed by path relative to the input root.
 */
public record AuditReport(
        Instant generatedAt,
        int totalFiles,
        int successfulLoads,
        int failedLoads,
        long totalRowsRead,
        long totalRowsParsed,
        long totalRowsQuarantined,
        long totalCoercions,
        long totalCoercedRecords,
        long totalNulls,
        long totalDuplicates,
        double quarantineRatio,
        Map<String, FileEntry> files) {

    public AuditReport {
        files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public DataStats toDataStats() {
        return new DataStats(totalFiles, successfulLoads, failedLoads, totalRowsRead, totalRowsParsed,
                totalRowsQuarantined, totalCoercions, totalNulls, totalDuplicates, quarantineRatio);
    }

    public record FileEntry(LoadStatus status, FileMetadata metadata) {
    }
}
