package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.AuditReport;
import com.example.canonical.ingestion.model.FileLoadResult;
import com.example.canonical.ingestion.model.FileMetadata;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Pure reduction of per-file load results into run-level totals. Files are listed in path
 * order so two runs over the same tree produce the same report body.
 */
@Component
public class AuditAggregator {

    private final Clock clock;

    public AuditAggregator() {
        this(Clock.systemUTC());
    }

    AuditAggregator(Clock clock) {
        this.clock = clock;
    }

    public AuditReport aggregate(Map<String, FileLoadResult> results) {
        int successful = 0;
        int failed = 0;
        long read = 0;
        long parsed = 0;
        long quarantined = 0;
        long coercions = 0;
        long coercedRecords = 0;
        long nulls = 0;
        long duplicates = 0;
        Map<String, AuditReport.FileEntry> files = new LinkedHashMap<>();

        for (Map.Entry<String, FileLoadResult> entry : new TreeMap<>(results).entrySet()) {
            FileLoadResult result = entry.getValue();
            FileMetadata metadata = result.metadata();
            files.put(entry.getKey(), new AuditReport.FileEntry(result.status(), metadata));
            if (result.isFailed()) {
                failed++;
                continue;
            }
            successful++;
            read += metadata.rowCount();
            parsed += metadata.parsedRows();
            quarantined += metadata.quarantinedRows();
            coercions += metadata.coercionCount();
            coercedRecords += metadata.coercedRecordCount();
            nulls += metadata.nullCount();
            duplicates += metadata.duplicateCount();
        }

        return new AuditReport(Instant.now(clock), results.size(), successful, failed, read, parsed, quarantined,
                coercions, coercedRecords, nulls, duplicates, quarantineRatio(quarantined, parsed), files);
    }

    /**
     * Quarantined rows over parsed (accepted) rows. A run that parsed nothing but quarantined
     * something counts as fully quarantined.
     */
    public static double quarantineRatio(long quarantined, long parsed) {
        if (parsed == 0) {
            return quarantined > 0 ? 1.0 : 0.0;
        }
        return (double) quarantined / parsed;
    }
}
