package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.support.ContentHasher;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares SHA-256 digests of every file under the canonical root against a reference.
 * With a baseline file the reference is that JSON map of relative path to digest; without
 * one the reference is the snapshot taken in the {@link IntegrityPhase#PRE} phase of the
 * current run. Changed and missing files fail the gate, new files are only reported.
 */
@Slf4j
public class HashIntegrityGate implements IntegrityGate {

    private static final TypeReference<Map<String, String>> BASELINE_TYPE = new TypeReference<>() {
    };

    private final Path inputRoot;
    private final Path baselineFile;
    private final ContentHasher hasher;
    private final ObjectMapper objectMapper;

    private volatile Map<String, String> snapshot;

    public HashIntegrityGate(Path inputRoot, Path baselineFile, ContentHasher hasher, ObjectMapper objectMapper) {
        this.inputRoot = inputRoot.toAbsolutePath().normalize();
        this.baselineFile = baselineFile;
        this.hasher = hasher;
        this.objectMapper = objectMapper;
    }

    public static HashIntegrityGate snapshot(Path inputRoot, ContentHasher hasher) {
        return new HashIntegrityGate(inputRoot, null, hasher, null);
    }

    public static HashIntegrityGate baseline(Path inputRoot, Path baselineFile, ContentHasher hasher,
            ObjectMapper objectMapper) {
        return new HashIntegrityGate(inputRoot, baselineFile, hasher, objectMapper);
    }

    @Override
    public IntegrityCheckResult check(IntegrityPhase phase) {
        Map<String, String> current = hashTree();
        if (baselineFile == null && phase == IntegrityPhase.PRE) {
            snapshot = current;
            return IntegrityCheckResult.passed("Snapshot of %d canonical files taken".formatted(current.size()));
        }

        Map<String, String> expected = baselineFile != null ? readBaseline() : snapshot;
        if (expected == null) {
            return IntegrityCheckResult.failed("No pre-check snapshot to compare against");
        }
        return compare(expected, current);
    }

    /**
     * Digest of every regular file below the root, keyed by relative path with {@code /}
     * separators.
     */
    public Map<String, String> hashTree() {
        Map<String, String> digests = new TreeMap<>();
        try (Stream<Path> files = Files.walk(inputRoot)) {
            files.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> digests.put(inputRoot.relativize(file).toString().replace('\\', '/'),
                            hasher.sha256(file)));
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to walk canonical tree %s".formatted(inputRoot), ex);
        }
        return digests;
    }

    private Map<String, String> readBaseline() {
        if (!Files.isRegularFile(baselineFile)) {
            throw new FileProcessingException("Integrity baseline %s does not exist".formatted(baselineFile));
        }
        try {
            return objectMapper.readValue(baselineFile.toFile(), BASELINE_TYPE);
        } catch (IOException ex) {
            throw new FileProcessingException("Failed to read integrity baseline %s".formatted(baselineFile), ex);
        }
    }

    private static IntegrityCheckResult compare(Map<String, String> expected, Map<String, String> current) {
        List<String> problems = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, String> entry : expected.entrySet()) {
            String actual = current.get(entry.getKey());
            if (actual == null) {
                problems.add("missing: " + entry.getKey());
            } else if (!actual.equalsIgnoreCase(entry.getValue())) {
                problems.add("modified: " + entry.getKey());
            }
        }
        for (String file : current.keySet()) {
            if (!expected.containsKey(file)) {
                warnings.add("new file: " + file);
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Canonical tree changed: {}", problems);
            return IntegrityCheckResult.failed(String.join("\n", problems));
        }
        return IntegrityCheckResult.passed("%d canonical files verified".formatted(expected.size()), warnings);
    }
}
