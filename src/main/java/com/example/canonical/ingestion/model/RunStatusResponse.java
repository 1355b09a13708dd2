package com.example.canonical.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Live view of a run. {@code run} is the latest snapshot while running and the frozen record
 * once the run has finished.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStatusResponse(
        String runId,
        RunStatus status,
        Instant createdAt,
        PipelineStage currentStage,
        List<PipelineStage> stagesCompleted,
        String errorMessage,
        PipelineRun run) {

    public static RunStatusResponse pending(String runId, Instant createdAt) {
        return new RunStatusResponse(runId, RunStatus.PENDING, createdAt, null, List.of(), null, null);
    }

    public static RunStatusResponse of(Instant createdAt, PipelineRun run) {
        List<PipelineStage> attempted = run.stagesAttempted();
        PipelineStage current = run.status() == RunStatus.RUNNING && !attempted.isEmpty()
                && !run.stagesCompleted().contains(attempted.get(attempted.size() - 1))
                ? attempted.get(attempted.size() - 1)
                : null;
        String error = run.errors().isEmpty() ? null : run.errors().get(0).message();
        return new RunStatusResponse(run.runId(), run.status(), createdAt, current, run.stagesCompleted(), error,
                run);
    }

    public static RunStatusResponse crashed(String runId, Instant createdAt, String message) {
        return new RunStatusResponse(runId, RunStatus.FAILED, createdAt, null, List.of(), message, null);
    }
}
