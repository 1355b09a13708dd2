package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.PipelineRun;
import com.example.canonical.ingestion.model.RunStatus;
import com.example.canonical.ingestion.model.RunStatusResponse;
import com.example.canonical.ingestion.support.FileProcessingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts run requests and executes them one at a time on the pipeline executor. Status of
 * runs started by this process is kept in memory; older runs are read back from their
 * persisted {@code pipeline_run_<runId>.json}.
 */
@Slf4j
public class PipelineRunService {

    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");
    static final int DEFAULT_RETAINED_RUNS = 100;

    private final PipelineOrchestrator orchestrator;
    private final ReportWriter reportWriter;
    private final ExecutorService executor;
    private final int retainedRuns;
    private final Map<String, RunStatusResponse> runs = new ConcurrentHashMap<>();
    private final Deque<String> submitted = new ArrayDeque<>();
    private final Object submitLock = new Object();

    public PipelineRunService(PipelineOrchestrator orchestrator, ReportWriter reportWriter,
            ExecutorService executor) {
        this(orchestrator, reportWriter, executor, DEFAULT_RETAINED_RUNS);
    }

    /**
     * @param retainedRuns how many runs to keep in memory; older finished runs are still found
     *     through their persisted run file
     */
    public PipelineRunService(PipelineOrchestrator orchestrator, ReportWriter reportWriter,
            ExecutorService executor, int retainedRuns) {
        if (retainedRuns < 1) {
            throw new IllegalArgumentException("retainedRuns must be >= 1");
        }
        this.orchestrator = orchestrator;
        this.reportWriter = reportWriter;
        this.executor = executor;
        this.retainedRuns = retainedRuns;
    }

    public RunStatusResponse enqueue() {
        synchronized (submitLock) {
            if (runInProgress()) {
                throw new FileProcessingException("A pipeline run is already in progress. Please wait for it to finish.");
            }

            String runId = PipelineOrchestrator.newRunId();
            Instant createdAt = Instant.now();
            RunStatusResponse pending = RunStatusResponse.pending(runId, createdAt);
            runs.put(runId, pending);
            try {
                executor.submit(() -> execute(runId, createdAt));
            } catch (RejectedExecutionException ex) {
                runs.remove(runId);
                throw new FileProcessingException("Pipeline executor is not accepting runs", ex);
            }
            submitted.addLast(runId);
            evictFinishedRuns();
            log.info("Queued pipeline run={}", runId);
            return pending;
        }
    }

    public Optional<RunStatusResponse> find(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            return Optional.empty();
        }
        RunStatusResponse live = runs.get(runId);
        if (live != null) {
            return Optional.of(live);
        }
        Path persisted = reportWriter.runPath(runId);
        if (!Files.isRegularFile(persisted)) {
            return Optional.empty();
        }
        PipelineRun run = reportWriter.read(persisted, PipelineRun.class);
        return Optional.of(RunStatusResponse.of(run.startedAt(), run));
    }

    private void execute(String runId, Instant createdAt) {
        try {
            PipelineRun run = orchestrator.run(runId, snapshot -> runs.put(runId, RunStatusResponse.of(createdAt,
                    snapshot)));
            runs.put(runId, RunStatusResponse.of(createdAt, run));
        } catch (RuntimeException ex) {
            log.error("Pipeline run {} crashed: {}", runId, ex.getMessage(), ex);
            runs.put(runId, RunStatusResponse.crashed(runId, createdAt, ex.getMessage()));
        } catch (Error ex) {
            log.error("Pipeline run {} died: {}", runId, ex.toString(), ex);
            runs.put(runId, RunStatusResponse.crashed(runId, createdAt, ex.toString()));
            throw ex;
        }
    }

    private void evictFinishedRuns() {
        while (submitted.size() > retainedRuns) {
            String oldest = submitted.peekFirst();
            RunStatusResponse status = runs.get(oldest);
            if (status != null && (status.status() == RunStatus.PENDING || status.status() == RunStatus.RUNNING)) {
                return;
            }
            submitted.removeFirst();
            runs.remove(oldest);
            log.debug("Evicted run={} from the in-memory history", oldest);
        }
    }

    private boolean runInProgress() {
        boolean active = runs.values().stream()
                .anyMatch(run -> run.status() == RunStatus.PENDING || run.status() == RunStatus.RUNNING);
        if (active) {
            log.warn("Rejecting pipeline request because another run is in progress");
        }
        return active;
    }
}
