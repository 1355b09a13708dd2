package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.AuditReport;
import com.example.canonical.ingestion.model.DataManifest;
import com.example.canonical.ingestion.model.PipelineRun;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.example.canonical.ingestion.support.OutputLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the JSON artifacts of a run under the reports tree and the manifest at the output
 * root. Files are replaced atomically.
 */
@Slf4j
public class ReportWriter {

    private final OutputLayout layout;
    private final ObjectMapper objectMapper;

    public ReportWriter(OutputLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.objectMapper = objectMapper;
    }

    public Path auditReportPath(String runId) {
        return layout.requireOutsideInput(layout.reportsRoot().resolve("pipeline_audit_%s.json".formatted(runId)));
    }

    public Path runPath(String runId) {
        return layout.requireOutsideInput(layout.reportsRoot().resolve("pipeline_run_%s.json".formatted(runId)));
    }

    public Path writeAuditReport(String runId, AuditReport report) {
        return writeJson(auditReportPath(runId), report);
    }

    public Path writeRun(PipelineRun run) {
        return writeJson(runPath(run.runId()), run);
    }

    public Path writeManifest(DataManifest manifest) {
        return writeJson(layout.requireOutsideInput(layout.manifestPath()), manifest);
    }

    public <T> T read(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to read %s".formatted(file), ex);
        }
    }

    private Path writeJson(Path target, Object value) {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to write %s".formatted(target), ex);
        }
        log.info("Wrote {}", target);
        return target;
    }
}
