package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.DataManifest;
import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.IntegrityStatus;
import com.example.canonical.ingestion.model.LoadMode;
import com.example.canonical.ingestion.model.PipelineRun;
import com.example.canonical.ingestion.model.PipelineStage;
import com.example.canonical.ingestion.model.RunStatus;
import com.example.canonical.ingestion.schema.ColumnSpec;
import com.example.canonical.ingestion.schema.ColumnType;
import com.example.canonical.ingestion.schema.FileSchema;
import com.example.canonical.ingestion.schema.ReferenceData;
import com.example.canonical.ingestion.schema.SchemaRegistry;
import com.example.canonical.ingestion.support.CamelCsvParserFactory;
import com.example.canonical.ingestion.support.CompressionSupport;
import com.example.canonical.ingestion.support.ContentHasher;
import com.example.canonical.ingestion.support.FormatDetector;
import com.example.canonical.ingestion.support.OutputLayout;
import com.example.canonical.ingestion.support.StandardNameNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PipelineOrchestratorTest {

    private static final String PLAYERS = "players.csv";
    private static final String HEADER = "name,position,team,points\n";

    @TempDir
    Path tempDir;

    private final ReferenceData reference = ReferenceData.defaults();
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private final ContentHasher hasher = new ContentHasher();

    private Path input;
    private OutputLayout layout;
    private ReportWriter reportWriter;
    private ExecutorService gateExecutor;

    @BeforeEach
    void setUp() {
        input = tempDir.resolve("canonical");
        layout = new OutputLayout(input, tempDir.resolve("processed"));
        reportWriter = new ReportWriter(layout, objectMapper);
        gateExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        gateExecutor.shutdownNow();
    }

    private static PipelinePolicy.PipelinePolicyBuilder policy() {
        return PipelinePolicy.builder()
                .pipelineVersion("test")
                .loadMode(LoadMode.LENIENT)
                .failOnIntegrityViolation(true)
                .failOnValidationError(true)
                .maxQuarantineRatio(0.10);
    }

    private CsvFileLoader loader() {
        FileSchema players = FileSchema.of(PLAYERS, List.of(
                ColumnSpec.string("name", false),
                ColumnSpec.builder().name("position").type(ColumnType.STRING).nullable(false)
                        .allowedValues(reference.validPositions()).build(),
                ColumnSpec.builder().name("team").type(ColumnType.STRING).nullable(false)
                        .allowedValues(reference.validTeams()).aliases(reference.teamAliases()).teamCode(true)
                        .build(),
                ColumnSpec.decimal("points", false, 0, 500)),
                List.of("name", "position", "team"));
        return new CsvFileLoader(new SchemaRegistry(List.of(players)),
                new ValueCoercer(reference, new StandardNameNormalizer()),
                new DuplicateDetector(),
                new FormatDetector(),
                new CamelCsvParserFactory(),
                new CompressionSupport(),
                hasher,
                new RecordSinkWriter(layout, objectMapper),
                1000);
    }

    private PipelineOrchestrator orchestrator(PipelinePolicy policy, IntegrityGate gate, Duration timeout,
            List<RecordTransformer> transformers) {
        return orchestrator(policy, loader(), gate, timeout, transformers);
    }

    private PipelineOrchestrator orchestrator(PipelinePolicy policy, CsvFileLoader loader, IntegrityGate gate,
            Duration timeout, List<RecordTransformer> transformers) {
        return new PipelineOrchestrator(layout, policy, loader, new AuditAggregator(), reportWriter,
                new IntegrityGateRunner(gate, gateExecutor, timeout), transformers, new CompressionSupport(),
                Clock.systemUTC());
    }

    private PipelineOrchestrator snapshotOrchestrator(PipelinePolicy policy) {
        return orchestrator(policy, HashIntegrityGate.snapshot(input, hasher), Duration.ofSeconds(10), List.of());
    }

    private Path write(String relative, String content) throws IOException {
        Path file = input.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private void writePlayers(int good, int bad) throws IOException {
        StringBuilder csv = new StringBuilder(HEADER);
        for (int i = 1; i <= good; i++) {
            csv.append("Player ").append(i).append(",WR,KC,").append(100 + i % 50).append('\n');
        }
        for (int i = 1; i <= bad; i++) {
            csv.append("Broken ").append(i).append(",WR,XYZ,10\n");
        }
        write(PLAYERS, csv.toString());
    }

    private PipelineRun persisted(PipelineRun run) {
        return reportWriter.read(reportWriter.runPath(run.runId()), PipelineRun.class);
    }

    @Test
    void run_shouldCompleteEveryStageOnCleanInput() throws IOException {
        writePlayers(10, 0);
        write("extra/notes.txt", "id,label\n1,a\n");

        PipelineRun run = snapshotOrchestrator(policy().build()).run();

        assertThat(run.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(run.stagesCompleted()).containsExactly(PipelineStage.values());
        assertThat(run.stagesFailed()).isEmpty();
        assertThat(run.errors()).isEmpty();
        assertThat(run.integrityStatus()).isEqualTo(IntegrityStatus.VERIFIED);
        assertThat(run.dataStats().filesProcessed()).isEqualTo(2);
        assertThat(run.dataStats().rowsParsed()).isEqualTo(11);
        assertThat(run.endedAt()).isNotNull();

        DataManifest manifest = reportWriter.read(layout.manifestPath(), DataManifest.class);
        assertThat(manifest.runId()).isEqualTo(run.runId());
        assertThat(manifest.integrityVerified()).isTrue();
        assertThat(manifest.files()).containsOnlyKeys("players.csv", "extra/notes.txt");
        assertThat(manifest.files().get("players.csv").format()).isEqualTo("csv");
        assertThat(manifest.auditReport()).isEqualTo(run.auditReportPath());
        assertThat(Path.of(run.auditReportPath())).exists();

        PipelineRun stored = persisted(run);
        assertThat(stored.runId()).isEqualTo(run.runId());
        assertThat(stored.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(stored.stagesCompleted()).isEqualTo(run.stagesCompleted());
        assertThat(stored.files()).hasSameSizeAs(run.files());
    }

    @Test
    void run_shouldNotModifyCanonicalTree() throws IOException {
        writePlayers(20, 5);
        Map<String, String> before = HashIntegrityGate.snapshot(input, hasher).hashTree();

        snapshotOrchestrator(policy().build()).run();

        assertThat(HashIntegrityGate.snapshot(input, hasher).hashTree()).isEqualTo(before);
    }

    @Nested
    @DisplayName("Quarantine ratio")
    class QuarantineRatio {

        @Test
        @DisplayName("15 quarantined of 100 parsed aborts after validation but keeps audit artifacts")
        void run_shouldFailWhenRatioExceededAndValidationIsFatal() throws IOException {
            writePlayers(100, 15);

            PipelineRun run = snapshotOrchestrator(policy().build()).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.hasError(ErrorKind.QUARANTINE_RATIO_EXCEEDED)).isTrue();
            assertThat(run.errors()).hasSize(1);
            assertThat(run.dataStats().quarantineRatio()).isEqualTo(0.15);
            assertThat(run.stagesCompleted())
                    .containsExactly(PipelineStage.INTEGRITY_PRE_CHECK, PipelineStage.DATA_LOADING);
            assertThat(run.stagesFailed()).containsExactly(PipelineStage.DATA_VALIDATION,
                    PipelineStage.DATA_TRANSFORMATION, PipelineStage.INTEGRITY_POST_CHECK,
                    PipelineStage.METADATA_GENERATION);

            assertThat(Path.of(run.auditReportPath())).exists();
            assertThat(layout.cleanFileFor(PLAYERS)).exists();
            assertThat(layout.quarantineFileFor(PLAYERS)).exists();
            assertThat(persisted(run).status()).isEqualTo(RunStatus.FAILED);
            assertThat(layout.manifestPath()).doesNotExist();
        }

        @Test
        void run_shouldRecordViolationAndContinueWhenValidationIsNotFatal() throws IOException {
            writePlayers(100, 15);

            PipelineRun run = snapshotOrchestrator(policy().failOnValidationError(false).build()).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.hasError(ErrorKind.QUARANTINE_RATIO_EXCEEDED)).isTrue();
            assertThat(run.stagesAttempted()).containsExactly(PipelineStage.values());
            assertThat(run.stagesFailed()).containsExactly(PipelineStage.DATA_VALIDATION);
            assertThat(layout.manifestPath()).exists();
        }

        @Test
        void run_shouldPassWhenRatioWithinBoundOrDisabled() throws IOException {
            writePlayers(100, 5);

            assertThat(snapshotOrchestrator(policy().build()).run().succeeded()).isTrue();
            assertThat(snapshotOrchestrator(policy().maxQuarantineRatio(null).build()).run().succeeded()).isTrue();
        }
    }

    @Test
    void run_shouldTreatFailedFileLoadAsValidationViolation() throws IOException {
        write(PLAYERS, "name,position,team\nJosh Allen,QB,BUF\n");

        PipelineRun run = snapshotOrchestrator(policy().loadMode(LoadMode.STRICT).build()).run();

        assertThat(run.status()).isEqualTo(RunStatus.FAILED);
        assertThat(run.hasError(ErrorKind.MISSING_REQUIRED_COLUMN)).isTrue();
        assertThat(run.errors().get(0).stage()).isEqualTo(PipelineStage.DATA_VALIDATION);
        assertThat(run.errors().get(0).message()).contains(PLAYERS);
        assertThat(run.dataStats().failedLoads()).isEqualTo(1);
        assertThat(layout.cleanFileFor(PLAYERS)).doesNotExist();
    }

    @Nested
    @DisplayName("Integrity gate")
    class IntegrityGateBehaviour {

        @Test
        void run_shouldAbortBeforeLoadingWhenPreCheckFails() throws IOException {
            writePlayers(10, 0);
            IntegrityGate failing = phase -> IntegrityCheckResult.failed("checksum mismatch");

            PipelineRun run = orchestrator(policy().build(), failing, Duration.ofSeconds(5), List.of()).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.hasError(ErrorKind.INTEGRITY_GATE_FAILURE)).isTrue();
            assertThat(run.errors().get(0).message()).contains("checksum mismatch");
            assertThat(run.integrityStatus()).isEqualTo(IntegrityStatus.VIOLATED);
            assertThat(run.stagesCompleted()).isEmpty();
            assertThat(run.stagesFailed()).containsExactly(PipelineStage.values());
            assertThat(layout.cleanFileFor(PLAYERS)).doesNotExist();
            assertThat(reportWriter.runPath(run.runId())).exists();
        }

        @Test
        @DisplayName("a gate that does not answer in time fails closed")
        void run_shouldFailClosedOnTimeout() throws IOException {
            writePlayers(10, 0);
            IntegrityGate hanging = phase -> {
                Thread.sleep(10_000);
                return IntegrityCheckResult.passed("too late");
            };

            PipelineRun run = orchestrator(policy().build(), hanging, Duration.ofMillis(100), List.of()).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errors()).singleElement().satisfies(error -> {
                assertThat(error.kind()).isEqualTo(ErrorKind.INTEGRITY_GATE_FAILURE);
                assertThat(error.stage()).isEqualTo(PipelineStage.INTEGRITY_PRE_CHECK);
                assertThat(error.message()).contains("timed out");
            });
        }

        @Test
        void run_shouldOnlyWarnWhenIntegrityViolationIsNotFatal() throws IOException {
            writePlayers(10, 0);
            IntegrityGate failing = phase -> IntegrityCheckResult.failed("drift");

            PipelineRun run = orchestrator(policy().failOnIntegrityViolation(false).build(), failing,
                    Duration.ofSeconds(5), List.of()).run();

            assertThat(run.status()).isEqualTo(RunStatus.SUCCEEDED);
            assertThat(run.integrityStatus()).isEqualTo(IntegrityStatus.VIOLATED);
            assertThat(run.warnings()).hasSize(2).allSatisfy(warning -> assertThat(warning).contains("drift"));
        }

        @Test
        void run_shouldDetectCanonicalChangeBetweenChecks() throws IOException {
            writePlayers(10, 0);
            Path source = input.resolve(PLAYERS);
            RecordTransformer tamper = (loaded, outputLayout) -> Files.writeString(source, "Intruder,QB,KC,1\n",
                    StandardOpenOption.APPEND);

            PipelineRun run = orchestrator(policy().build(), HashIntegrityGate.snapshot(input, hasher),
                    Duration.ofSeconds(10), List.of(tamper)).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errors()).singleElement().satisfies(error -> {
                assertThat(error.stage()).isEqualTo(PipelineStage.INTEGRITY_POST_CHECK);
                assertThat(error.message()).contains("modified: players.csv");
            });
            assertThat(run.stagesFailed())
                    .containsExactly(PipelineStage.INTEGRITY_POST_CHECK, PipelineStage.METADATA_GENERATION);
        }

        @Test
        void run_shouldMarkIntegritySkippedWhenDisabled() throws IOException {
            writePlayers(3, 0);

            PipelineRun run = orchestrator(policy().build(), IntegrityGate.NONE, Duration.ofSeconds(5), List.of())
                    .run();

            assertThat(run.succeeded()).isTrue();
            assertThat(run.integrityStatus()).isEqualTo(IntegrityStatus.SKIPPED);
        }
    }

    @Nested
    @DisplayName("Finalization")
    class Finalization {

        @Test
        void run_shouldPersistRunWhenTransformerFails() throws IOException {
            writePlayers(3, 0);
            RecordTransformer broken = (loaded, outputLayout) -> {
                throw new IOException("disk full");
            };

            PipelineRun run = orchestrator(policy().build(), IntegrityGate.NONE, Duration.ofSeconds(5),
                    List.of(broken)).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errors()).singleElement().satisfies(error -> {
                assertThat(error.stage()).isEqualTo(PipelineStage.DATA_TRANSFORMATION);
                assertThat(error.kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
                assertThat(error.message()).contains("disk full");
            });
            assertThat(persisted(run).stagesFailed()).containsExactly(PipelineStage.DATA_TRANSFORMATION,
                    PipelineStage.INTEGRITY_POST_CHECK, PipelineStage.METADATA_GENERATION);
        }

        @Test
        void run_shouldPersistRunWhenLoaderThrowsUnexpectedly() throws IOException {
            writePlayers(3, 0);
            CsvFileLoader exploding = mock(CsvFileLoader.class);
            when(exploding.load(any(Path.class), anyString(), any(LoadOptions.class), any()))
                    .thenThrow(new IllegalStateException("boom"));

            PipelineRun run = orchestrator(policy().build(), exploding, IntegrityGate.NONE, Duration.ofSeconds(5),
                    List.of()).run();

            assertThat(run.status()).isEqualTo(RunStatus.FAILED);
            assertThat(run.errors()).singleElement().satisfies(error -> {
                assertThat(error.stage()).isEqualTo(PipelineStage.DATA_LOADING);
                assertThat(error.kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
                assertThat(error.message()).contains("boom");
            });
            assertThat(run.durationMillis()).isGreaterThanOrEqualTo(0);
            assertThat(reportWriter.runPath(run.runId())).exists();
        }

        @Test
        void run_shouldPersistRunBeforeRethrowingError() throws IOException {
            writePlayers(3, 0);
            RecordTransformer recursive = (loaded, outputLayout) -> {
                throw new StackOverflowError("deep");
            };
            PipelineOrchestrator orchestrator = orchestrator(policy().build(), IntegrityGate.NONE,
                    Duration.ofSeconds(5), List.of(recursive));

            assertThatThrownBy(() -> orchestrator.run("run-error", snapshot -> {
            })).isInstanceOf(StackOverflowError.class);

            PipelineRun stored = reportWriter.read(reportWriter.runPath("run-error"), PipelineRun.class);
            assertThat(stored.status()).isEqualTo(RunStatus.FAILED);
            assertThat(stored.errors()).singleElement().satisfies(error -> {
                assertThat(error.stage()).isEqualTo(PipelineStage.DATA_TRANSFORMATION);
                assertThat(error.kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
                assertThat(error.message()).contains("StackOverflowError");
            });
        }

        @Test
        void run_shouldPublishRunningSnapshots() throws IOException {
            writePlayers(3, 0);
            List<PipelineRun> snapshots = new ArrayList<>();

            PipelineRun run = orchestrator(policy().build(), IntegrityGate.NONE, Duration.ofSeconds(5), List.of())
                    .run("run-1", snapshots::add);

            assertThat(run.runId()).isEqualTo("run-1");
            assertThat(snapshots).hasSize(PipelineStage.values().length * 2)
                    .allSatisfy(snapshot -> assertThat(snapshot.status()).isEqualTo(RunStatus.RUNNING));
            assertThat(snapshots.get(snapshots.size() - 1).stagesCompleted()).hasSize(6);
        }
    }

    @Test
    void run_shouldWarnWhenNoFilesAreFound() throws IOException {
        Files.createDirectories(input);

        PipelineRun run = snapshotOrchestrator(policy().build()).run();

        assertThat(run.succeeded()).isTrue();
        assertThat(run.warnings()).anySatisfy(warning -> assertThat(warning).contains("No canonical files"));
        assertThat(run.dataStats().filesProcessed()).isZero();
    }
}
