package com.example.canonical.ingestion.support;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a run reads from and writes to. The output tree must lie outside the input tree and
 * every sink path is checked against the input root before it is opened.
 */
public record OutputLayout(Path inputRoot, Path outputRoot) {

    public static final String CLEAN_DIR = "clean_data";
    public static final String QUARANTINE_DIR = "quarantine";
    public static final String REPORTS_DIR = "reports";
    public static final String MANIFEST_FILE = "data_manifest.json";
    public static final String QUARANTINE_SUFFIX = "_quarantine";

    public OutputLayout {
        Objects.requireNonNull(inputRoot, "inputRoot");
        Objects.requireNonNull(outputRoot, "outputRoot");
        inputRoot = inputRoot.toAbsolutePath().normalize();
        outputRoot = outputRoot.toAbsolutePath().normalize();
        if (outputRoot.startsWith(inputRoot)) {
            throw new IllegalArgumentException(
                    "Output root %s must not be inside input root %s".formatted(outputRoot, inputRoot));
        }
    }

    public Path cleanRoot() {
        return outputRoot.resolve(CLEAN_DIR);
    }

    public Path quarantineRoot() {
        return outputRoot.resolve(QUARANTINE_DIR);
    }

    public Path reportsRoot() {
        return outputRoot.resolve(REPORTS_DIR);
    }

    public Path manifestPath() {
        return outputRoot.resolve(MANIFEST_FILE);
    }

    public Path cleanFileFor(String relativePath) {
        return requireOutsideInput(cleanRoot().resolve(relativePath).normalize());
    }

    /**
     * {@code adp/adp0_2025.csv} becomes {@code quarantine/adp/adp0_2025_quarantine.csv}.
     */
    public Path quarantineFileFor(String relativePath) {
        Path relative = Path.of(relativePath);
        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String quarantineName = dot > 0
                ? name.substring(0, dot) + QUARANTINE_SUFFIX + name.substring(dot)
                : name + QUARANTINE_SUFFIX;
        Path parent = relative.getParent();
        Path target = parent == null ? quarantineRoot().resolve(quarantineName)
                : quarantineRoot().resolve(parent).resolve(quarantineName);
        return requireOutsideInput(target.normalize());
    }

    public Path requireOutsideInput(Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        if (absolute.startsWith(inputRoot)) {
            throw new FileProcessingException("Refusing to write %s inside the canonical tree %s"
                    .formatted(absolute, inputRoot));
        }
        if (!absolute.startsWith(outputRoot)) {
            throw new FileProcessingException("Refusing to write %s outside the output tree %s"
                    .formatted(absolute, outputRoot));
        }
        return absolute;
    }

    public String relativize(Path source) {
        Path absolute = source.toAbsolutePath().normalize();
        if (absolute.startsWith(inputRoot)) {
            return inputRoot.relativize(absolute).toString().replace('\\', '/');
        }
        return absolute.getFileName().toString();
    }
}
