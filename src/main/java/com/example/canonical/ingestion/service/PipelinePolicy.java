package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.LoadMode;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;

/**
 * Run-level knobs of the orchestrator. A null {@code maxQuarantineRatio} disables the ratio
 * check.
 */
@Builder(toBuilder = true)
public record PipelinePolicy(
        String pipelineVersion,
        LoadMode loadMode,
        boolean failOnIntegrityViolation,
        boolean failOnValidationError,
        Double maxQuarantineRatio,
        Map<String, Integer> skipLines,
        Set<String> fileExtensions) {

    public PipelinePolicy {
        pipelineVersion = pipelineVersion == null ? "dev" : pipelineVersion;
        loadMode = loadMode == null ? LoadMode.LENIENT : loadMode;
        skipLines = skipLines == null ? Map.of() : Map.copyOf(skipLines);
        fileExtensions = fileExtensions == null || fileExtensions.isEmpty() ? Set.of("csv", "txt")
                : fileExtensions.stream()
                        .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                        .collect(Collectors.toUnmodifiableSet());
        if (maxQuarantineRatio != null && (maxQuarantineRatio < 0 || maxQuarantineRatio.isNaN())) {
            throw new IllegalArgumentException("maxQuarantineRatio must be >= 0");
        }
    }

    public LoadOptions loadOptionsFor(String fileName) {
        return new LoadOptions(loadMode, skipLines.getOrDefault(fileName, 0));
    }

    public boolean accepts(String logicalFileName) {
        int dot = logicalFileName.lastIndexOf('.');
        return dot > 0 && fileExtensions.contains(logicalFileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public boolean ratioExceeded(double ratio) {
        return maxQuarantineRatio != null && ratio > maxQuarantineRatio;
    }
}
