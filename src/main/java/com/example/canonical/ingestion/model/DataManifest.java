package com.example.canonical.ingestion.model;

import java.time.Instant;
import java.util.Map;

public record DataManifest(
        String version,
        Instant generatedAt,
        String pipelineVersion,
        String runId,
        String dataLocation,
        Map<String, ManifestFile> files,
        DataStats statistics,
        boolean integrityVerified,
        String auditReport) {

    public record ManifestFile(String path, long sizeBytes, Instant modified, String format) {
    }
}
