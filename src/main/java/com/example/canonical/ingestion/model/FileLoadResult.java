package com.example.canonical.ingestion.model;

import java.util.List;

public record FileLoadResult(
        String file,
        LoadStatus status,
        FileMetadata metadata,
        List<TypedRecord> accepted,
        List<QuarantinedRecord> quarantined) {

    public FileLoadResult {
        accepted = List.copyOf(accepted);
        quarantined = List.copyOf(quarantined);
    }

    public static FileLoadResult failed(String file, FileMetadata metadata) {
        return new FileLoadResult(file, LoadStatus.FAILED, metadata, List.of(), List.of());
    }

    public boolean isFailed() {
        return status == LoadStatus.FAILED;
    }

    public List<String> errors() {
        return metadata.exceptions().stream()
                .filter(issue -> !issue.recovered() && issue.row() == null)
                .map(issue -> issue.location() + ": " + issue.message())
                .toList();
    }
}
