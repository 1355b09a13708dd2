package com.example.canonical.ingestion.config;

import com.example.canonical.ingestion.model.LoadMode;
import com.example.canonical.ingestion.service.PipelinePolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties("app.pipeline")
public class PipelineProperties {

    private Path inputRoot = Path.of("data", "canonical");
    private Path outputRoot = Path.of("data", "processed");
    private String version = "1.0.0";
    private LoadMode loadMode = LoadMode.LENIENT;
    private boolean failOnIntegrityViolation = true;
    private boolean failOnValidationError = false;
    /**
     * Leave unset to disable the quarantine ratio check.
     */
    private Double maxQuarantineRatio = 0.10;
    /**
     * Metadata lines before the header, keyed by file name. Keys containing dots must be
     * written in bracket form, e.g. {@code "[adp5_2025.txt]": 7}.
     */
    private Map<String, Integer> skipLines = new LinkedHashMap<>();
    private Set<String> fileExtensions = new LinkedHashSet<>(List.of("csv", "txt"));
    private long progressUpdateInterval = 10_000;
    /** Runs kept in memory for status lookups; older ones are read from their run file. */
    private int retainedRuns = 100;
    private Integrity integrity = new Integrity();

    public PipelinePolicy toPolicy() {
        return PipelinePolicy.builder()
                .pipelineVersion(version)
                .loadMode(loadMode)
                .failOnIntegrityViolation(failOnIntegrityViolation)
                .failOnValidationError(failOnValidationError)
                .maxQuarantineRatio(maxQuarantineRatio)
                .skipLines(skipLines)
                .fileExtensions(fileExtensions)
                .build();
    }

    public enum IntegrityMode {
        SNAPSHOT,
        BASELINE,
        COMMAND,
        NONE
    }

    @Getter
    @Setter
    public static class Integrity {

        private IntegrityMode mode = IntegrityMode.SNAPSHOT;
        private Path baselineFile;
        private List<String> command = new ArrayList<>();
        private Duration timeout = Duration.ofSeconds(30);
    }
}
