package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.support.ContentHasher;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashIntegrityGateTest {

    @TempDir
    Path tempDir;

    private final ContentHasher hasher = new ContentHasher();
    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("canonical");
        Files.createDirectories(input.resolve("adp"));
        Files.writeString(input.resolve("players.csv"), "name\nJosh Allen\n");
        Files.writeString(input.resolve("adp/adp0_2025.csv"), "rank\n1\n");
    }

    @Test
    void snapshot_shouldPassWhenTreeIsUnchanged() throws IOException {
        HashIntegrityGate gate = HashIntegrityGate.snapshot(input, hasher);

        assertThat(gate.check(IntegrityPhase.PRE).passed()).isTrue();
        IntegrityCheckResult post = gate.check(IntegrityPhase.POST);

        assertThat(post.passed()).isTrue();
        assertThat(post.output()).isEqualTo("2 canonical files verified");
        assertThat(post.warnings()).isEmpty();
    }

    @Test
    void snapshot_shouldFailOnModifiedOrMissingFiles() throws IOException {
        HashIntegrityGate gate = HashIntegrityGate.snapshot(input, hasher);
        gate.check(IntegrityPhase.PRE);

        Files.writeString(input.resolve("players.csv"), "name\nSomeone Else\n");
        Files.delete(input.resolve("adp/adp0_2025.csv"));
        IntegrityCheckResult post = gate.check(IntegrityPhase.POST);

        assertThat(post.passed()).isFalse();
        assertThat(post.output()).contains("modified: players.csv", "missing: adp/adp0_2025.csv");
    }

    @Test
    void snapshot_shouldOnlyWarnAboutNewFiles() throws IOException {
        HashIntegrityGate gate = HashIntegrityGate.snapshot(input, hasher);
        gate.check(IntegrityPhase.PRE);

        Files.writeString(input.resolve("late.csv"), "x\n");
        IntegrityCheckResult post = gate.check(IntegrityPhase.POST);

        assertThat(post.passed()).isTrue();
        assertThat(post.warnings()).containsExactly("new file: late.csv");
    }

    @Test
    void snapshot_shouldFailPostCheckWithoutPreCheck() {
        IntegrityCheckResult post = HashIntegrityGate.snapshot(input, hasher).check(IntegrityPhase.POST);

        assertThat(post.passed()).isFalse();
        assertThat(post.output()).contains("No pre-check snapshot");
    }

    @Test
    void baseline_shouldCompareAgainstRecordedDigests() throws IOException {
        HashIntegrityGate snapshot = HashIntegrityGate.snapshot(input, hasher);
        Path baseline = tempDir.resolve("baseline.json");
        objectMapper.writeValue(baseline.toFile(), snapshot.hashTree());
        HashIntegrityGate gate = HashIntegrityGate.baseline(input, baseline, hasher, objectMapper);

        assertThat(gate.check(IntegrityPhase.PRE).passed()).isTrue();

        Files.writeString(input.resolve("players.csv"), "tampered\n");
        assertThat(gate.check(IntegrityPhase.PRE).passed()).isFalse();
    }

    @Test
    void baseline_shouldThrowWhenBaselineFileIsMissing() {
        HashIntegrityGate gate = HashIntegrityGate.baseline(input, tempDir.resolve("nope.json"), hasher,
                objectMapper);

        assertThatThrownBy(() -> gate.check(IntegrityPhase.PRE))
                .isInstanceOf(FileProcessingException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void hashTree_shouldKeyByRelativePathInOrder() {
        assertThat(HashIntegrityGate.snapshot(input, hasher).hashTree())
                .containsOnlyKeys("adp/adp0_2025.csv", "players.csv")
                .allSatisfy((file, digest) -> assertThat(digest).hasSize(64));
    }
}
