package com.example.canonical.ingestion.model;

import java.time.Instant;
import java.util.List;

/**
 * Frozen record of one pipeline run. Stage lists keep execution order; {@code stagesFailed}
 * holds every configured stage that did not complete once the run has failed.
 */
public record PipelineRun(
        String runId,
        String pipelineVersion,
        RunStatus status,
        Instant startedAt,
        Instant endedAt,
        long durationMillis,
        List<PipelineStage> stagesAttempted,
        List<PipelineStage> stagesCompleted,
        List<PipelineStage> stagesFailed,
        IntegrityStatus integrityStatus,
        DataStats dataStats,
        List<FileMetadata> files,
        List<RunError> errors,
        List<String> warnings,
        String auditReportPath,
        String manifestPath) {

    public PipelineRun {
        stagesAttempted = List.copyOf(stagesAttempted);
        stagesCompleted = List.copyOf(stagesCompleted);
        stagesFailed = List.copyOf(stagesFailed);
        files = List.copyOf(files);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean succeeded() {
        return status == RunStatus.SUCCEEDED;
    }

    public boolean hasError(ErrorKind kind) {
        return errors.stream().anyMatch(error -> error.kind() == kind);
    }
}
