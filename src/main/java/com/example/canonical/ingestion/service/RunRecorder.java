package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.DataStats;
import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.FileMetadata;
import com.example.canonical.ingestion.model.IntegrityStatus;
import com.example.canonical.ingestion.model.PipelineRun;
import com.example.canonical.ingestion.model.PipelineStage;
import com.example.canonical.ingestion.model.RunError;
import com.example.canonical.ingestion.model.RunStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a run in progress. Only the orchestrator touches it; everyone else sees
 * {@link PipelineRun} snapshots.
 */
final class RunRecorder {

    private final String runId;
    private final String pipelineVersion;
    private final Instant startedAt;
    private final List<PipelineStage> attempted = new ArrayList<>();
    private final List<PipelineStage> completed = new ArrayList<>();
    private final Set<PipelineStage> failedStages = EnumSet.noneOf(PipelineStage.class);
    private final List<RunError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private List<FileMetadata> files = List.of();
    private DataStats dataStats = DataStats.EMPTY;
    private IntegrityStatus integrityStatus = IntegrityStatus.UNKNOWN;
    private PipelineStage current;
    private String auditReportPath;
    private String manifestPath;
    private boolean failed;

    RunRecorder(String runId, String pipelineVersion, Instant startedAt) {
        this.runId = runId;
        this.pipelineVersion = pipelineVersion;
        this.startedAt = startedAt;
    }

    void begin(PipelineStage stage) {
        current = stage;
        attempted.add(stage);
    }

    void complete(PipelineStage stage) {
        if (!failedStages.contains(stage)) {
            completed.add(stage);
        }
        current = null;
    }

    /**
     * Records a violation that fails the run without stopping it; the stage will not count
     * as completed.
     */
    void flag(PipelineStage stage, ErrorKind kind, String message) {
        failed = true;
        failedStages.add(stage);
        errors.add(new RunError(stage, kind, message));
    }

    void abort(PipelineStage stage, ErrorKind kind, String message) {
        flag(stage == null ? current : stage, kind, message);
        current = null;
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    void integrity(IntegrityStatus status) {
        if (integrityStatus != IntegrityStatus.VIOLATED) {
            integrityStatus = status;
        }
    }

    void loaded(List<FileMetadata> files, DataStats stats, String auditReportPath) {
        this.files = List.copyOf(files);
        this.dataStats = stats;
        this.auditReportPath = auditReportPath;
    }

    void manifest(String manifestPath) {
        this.manifestPath = manifestPath;
    }

    String runId() {
        return runId;
    }

    PipelineStage current() {
        return current;
    }

    IntegrityStatus integrityStatus() {
        return integrityStatus;
    }

    DataStats dataStats() {
        return dataStats;
    }

    String auditReportPath() {
        return auditReportPath;
    }

    boolean failed() {
        return failed;
    }

    PipelineRun snapshot(Instant now) {
        return build(RunStatus.RUNNING, now, List.of());
    }

    PipelineRun freeze(Instant endedAt) {
        if (!failed) {
            return build(RunStatus.SUCCEEDED, endedAt, List.of());
        }
        List<PipelineStage> notCompleted = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            if (!completed.contains(stage)) {
                notCompleted.add(stage);
            }
        }
        return build(RunStatus.FAILED, endedAt, notCompleted);
    }

    private PipelineRun build(RunStatus status, Instant at, List<PipelineStage> stagesFailed) {
        Instant endedAt = status == RunStatus.RUNNING ? null : at;
        return new PipelineRun(runId, pipelineVersion, status, startedAt, endedAt,
                Duration.between(startedAt, at).toMillis(), attempted, completed, stagesFailed, integrityStatus,
                dataStats, files, errors, warnings, auditReportPath, manifestPath);
    }
}
