package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.AuditReport;
import com.example.canonical.ingestion.model.DataManifest;
import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.FileLoadResult;
import com.example.canonical.ingestion.model.FileMetadata;
import com.example.canonical.ingestion.model.IntegrityStatus;
import com.example.canonical.ingestion.model.PipelineRun;
import com.example.canonical.ingestion.model.PipelineStage;
import com.example.canonical.ingestion.model.ValidationIssue;
import com.example.canonical.ingestion.support.CompressionSupport;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.example.canonical.ingestion.support.OutputLayout;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the fixed stage sequence over the canonical tree:
 * {@code integrity_pre_check -> data_loading -> data_validation -> data_transformation ->
 * integrity_post_check -> metadata_generation}. Whatever happens, the run record is frozen
 * and written to {@code reports/pipeline_run_<runId>.json} before {@link #run} returns.
 */
@Slf4j
public class PipelineOrchestrator {

    static final String MANIFEST_VERSION = "1.0";

    private final OutputLayout layout;
    private final PipelinePolicy policy;
    private final CsvFileLoader loader;
    private final AuditAggregator aggregator;
    private final ReportWriter reportWriter;
    private final IntegrityGateRunner integrityGate;
    private final List<RecordTransformer> transformers;
    private final CompressionSupport compressionSupport;
    private final Clock clock;

    public PipelineOrchestrator(OutputLayout layout,
            PipelinePolicy policy,
            CsvFileLoader loader,
            AuditAggregator aggregator,
            ReportWriter reportWriter,
            IntegrityGateRunner integrityGate,
            List<RecordTransformer> transformers,
            CompressionSupport compressionSupport,
            Clock clock) {
        this.layout = layout;
        this.policy = policy;
        this.loader = loader;
        this.aggregator = aggregator;
        this.reportWriter = reportWriter;
        this.integrityGate = integrityGate;
        this.transformers = List.copyOf(transformers);
        this.compressionSupport = compressionSupport;
        this.clock = clock;
    }

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    public PipelineRun run() {
        return run(newRunId(), run -> {
        });
    }

    /**
     * @param progress receives a {@code RUNNING} snapshot after every stage transition
     */
    public PipelineRun run(String runId, Consumer<PipelineRun> progress) {
        RunRecorder recorder = new RunRecorder(runId, policy.pipelineVersion(), clock.instant());
        Map<String, FileLoadResult> results = new LinkedHashMap<>();
        log.info("Starting pipeline run={} version={} input={} output={}", runId, policy.pipelineVersion(),
                layout.inputRoot(), layout.outputRoot());

        PipelineRun run;
        try {
            stage(recorder, PipelineStage.INTEGRITY_PRE_CHECK, progress,
                    () -> checkIntegrity(recorder, PipelineStage.INTEGRITY_PRE_CHECK, IntegrityPhase.PRE));
            stage(recorder, PipelineStage.DATA_LOADING, progress, () -> loadAll(recorder, results));
            stage(recorder, PipelineStage.DATA_VALIDATION, progress, () -> validate(recorder, results));
            stage(recorder, PipelineStage.DATA_TRANSFORMATION, progress, () -> transform(results));
            stage(recorder, PipelineStage.INTEGRITY_POST_CHECK, progress,
                    () -> checkIntegrity(recorder, PipelineStage.INTEGRITY_POST_CHECK, IntegrityPhase.POST));
            stage(recorder, PipelineStage.METADATA_GENERATION, progress, () -> generateManifest(recorder));
        } catch (ValidationAbort ex) {
            log.error("Pipeline run={} aborted after validation: {}", runId, ex.getMessage());
        } catch (PipelineStageException ex) {
            log.error("Pipeline run={} aborted in stage={}: {}", runId, ex.stage().stageName(), ex.getMessage());
            recorder.abort(ex.stage(), ex.kind(), ex.getMessage());
        } catch (RuntimeException ex) {
            PipelineStage failedStage = recorder.current();
            log.error("Pipeline run={} failed in stage={}", runId, failedStage, ex);
            recorder.abort(failedStage, ErrorKind.STAGE_FAILURE,
                    "%s: %s".formatted(ex.getClass().getSimpleName(), ex.getMessage()));
        } catch (Error ex) {
            PipelineStage failedStage = recorder.current();
            log.error("Pipeline run={} hit a fatal error in stage={}", runId, failedStage, ex);
            recorder.abort(failedStage, ErrorKind.STAGE_FAILURE,
                    "%s: %s".formatted(ex.getClass().getSimpleName(), ex.getMessage()));
            throw ex;
        } finally {
            run = finish(recorder);
        }
        return run;
    }

    private PipelineRun finish(RunRecorder recorder) {
        PipelineRun run = recorder.freeze(clock.instant());
        try {
            reportWriter.writeRun(run);
        } catch (FileProcessingException ex) {
            log.error("Failed to persist run metadata for run={}", run.runId(), ex);
        }
        log.info("Completed pipeline run={} status={} stagesCompleted={} stagesFailed={} errors={} durationMs={}",
                run.runId(), run.status(), run.stagesCompleted().size(), run.stagesFailed().size(),
                run.errors().size(), run.durationMillis());
        return run;
    }

    private void stage(RunRecorder recorder, PipelineStage stage, Consumer<PipelineRun> progress, Runnable action) {
        recorder.begin(stage);
        progress.accept(recorder.snapshot(clock.instant()));
        log.info("Stage {} started for run={}", stage.stageName(), recorder.runId());
        action.run();
        recorder.complete(stage);
        log.info("Stage {} finished for run={}", stage.stageName(), recorder.runId());
        progress.accept(recorder.snapshot(clock.instant()));
    }

    private void checkIntegrity(RunRecorder recorder, PipelineStage stage, IntegrityPhase phase) {
        IntegrityCheckResult result = integrityGate.run(phase);
        result.warnings().forEach(warning -> recorder.warn("%s: %s".formatted(stage.stageName(), warning)));
        if (result.skipped()) {
            recorder.integrity(IntegrityStatus.SKIPPED);
            return;
        }
        if (result.passed()) {
            recorder.integrity(IntegrityStatus.VERIFIED);
            return;
        }

        recorder.integrity(IntegrityStatus.VIOLATED);
        String message = "Integrity check failed: %s".formatted(result.output());
        if (policy.failOnIntegrityViolation()) {
            throw new PipelineStageException(stage, ErrorKind.INTEGRITY_GATE_FAILURE, message);
        }
        recorder.warn("%s: %s".formatted(stage.stageName(), message));
    }

    private void loadAll(RunRecorder recorder, Map<String, FileLoadResult> results) {
        List<Path> sources = discover();
        if (sources.isEmpty()) {
            recorder.warn("No canonical files found under %s".formatted(layout.inputRoot()));
        }

        for (Path source : sources) {
            String relative = layout.relativize(source);
            String fileName = compressionSupport.logicalName(source.getFileName().toString());
            FileLoadResult result = loader.load(source, relative, policy.loadOptionsFor(fileName),
                    (file, read, accepted, quarantined) -> log.debug(
                            "Loading file={} read={} accepted={} quarantined={}", file, read, accepted, quarantined));
            results.put(result.file(), result);
        }

        AuditReport report = aggregator.aggregate(results);
        Path auditPath = reportWriter.writeAuditReport(recorder.runId(), report);
        List<FileMetadata> files = results.values().stream().map(FileLoadResult::metadata).toList();
        recorder.loaded(files, report.toDataStats(), auditPath.toString());
        log.info("Loaded files={} successful={} failed={} parsed={} quarantined={} ratio={}",
                report.totalFiles(), report.successfulLoads(), report.failedLoads(), report.totalRowsParsed(),
                report.totalRowsQuarantined(), report.quarantineRatio());
    }

    private List<Path> discover() {
        try (Stream<Path> files = Files.walk(layout.inputRoot())) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> policy.accepts(compressionSupport.logicalName(file.getFileName().toString())))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to scan canonical tree %s".formatted(layout.inputRoot()), ex);
        }
    }

    private void validate(RunRecorder recorder, Map<String, FileLoadResult> results) {
        List<String> violations = new ArrayList<>();
        ErrorKind firstKind = null;

        for (FileLoadResult result : results.values()) {
            if (!result.isFailed()) {
                continue;
            }
            Optional<ValidationIssue> cause = result.metadata().exceptions().stream()
                    .filter(issue -> !issue.recovered())
                    .findFirst();
            ErrorKind kind = cause.map(ValidationIssue::kind).orElse(ErrorKind.READ_FAILURE);
            String message = "File %s failed to load: %s".formatted(result.file(),
                    cause.map(ValidationIssue::message).orElse("unknown error"));
            recorder.flag(PipelineStage.DATA_VALIDATION, kind, message);
            violations.add(message);
            firstKind = firstKind == null ? kind : firstKind;
        }

        double ratio = recorder.dataStats().quarantineRatio();
        if (policy.ratioExceeded(ratio)) {
            String message = "Quarantine ratio %.4f exceeds maximum %.4f".formatted(ratio,
                    policy.maxQuarantineRatio());
            recorder.flag(PipelineStage.DATA_VALIDATION, ErrorKind.QUARANTINE_RATIO_EXCEEDED, message);
            violations.add(message);
            firstKind = firstKind == null ? ErrorKind.QUARANTINE_RATIO_EXCEEDED : firstKind;
        }

        if (violations.isEmpty()) {
            return;
        }
        if (policy.failOnValidationError()) {
            throw new ValidationAbort(violations.size(), firstKind);
        }
        log.warn("Validation found {} violations, continuing: {}", violations.size(), violations);
    }

    private void transform(Map<String, FileLoadResult> results) {
        if (transformers.isEmpty()) {
            log.info("No record transformers registered");
            return;
        }
        Map<String, FileLoadResult> loaded = new LinkedHashMap<>();
        results.forEach((file, result) -> {
            if (!result.isFailed()) {
                loaded.put(file, result);
            }
        });
        for (RecordTransformer transformer : transformers) {
            try {
                transformer.transform(loaded, layout);
                log.info("Transformer {} applied to {} files", transformer.name(), loaded.size());
            } catch (Exception ex) {
                throw new PipelineStageException(PipelineStage.DATA_TRANSFORMATION, ErrorKind.STAGE_FAILURE,
                        "Transformer %s failed: %s".formatted(transformer.name(), ex.getMessage()), ex);
            }
        }
    }

    private void generateManifest(RunRecorder recorder) {
        Map<String, DataManifest.ManifestFile> files = new LinkedHashMap<>();
        Path cleanRoot = layout.cleanRoot();
        if (Files.isDirectory(cleanRoot)) {
            try (Stream<Path> paths = Files.walk(cleanRoot)) {
                for (Path file : paths.filter(Files::isRegularFile).sorted().toList()) {
                    String relative = cleanRoot.relativize(file).toString().replace('\\', '/');
                    String name = file.getFileName().toString();
                    int dot = name.lastIndexOf('.');
                    files.put(relative, new DataManifest.ManifestFile(
                            layout.outputRoot().relativize(file).toString().replace('\\', '/'),
                            Files.size(file),
                            Files.getLastModifiedTime(file).toInstant(),
                            dot > 0 ? name.substring(dot + 1) : ""));
                }
            } catch (IOException ex) {
                throw new FileProcessingException("Failed to list clean data under %s".formatted(cleanRoot), ex);
            }
        }

        DataManifest manifest = new DataManifest(MANIFEST_VERSION, clock.instant(), policy.pipelineVersion(),
                recorder.runId(), cleanRoot.toString(), files, recorder.dataStats(),
                recorder.integrityStatus() == IntegrityStatus.VERIFIED, recorder.auditReportPath());
        recorder.manifest(reportWriter.writeManifest(manifest).toString());
    }

    /**
     * Stops the stage sequence after validation violations that were already recorded.
     */
    static final class ValidationAbort extends PipelineStageException {

        ValidationAbort(int violations, ErrorKind kind) {
            super(PipelineStage.DATA_VALIDATION, kind,
                    "Validation failed with %d violation(s)".formatted(violations));
        }
    }
}
