package com.example.canonical.ingestion.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an external verification command. Exit code 0 passes; combined stdout/stderr is kept
 * as the gate output. The phase is passed in the {@code INTEGRITY_PHASE} environment variable.
 */
@Slf4j
public class CommandIntegrityGate implements IntegrityGate {

    static final String PHASE_ENV = "INTEGRITY_PHASE";

    private final List<String> command;
    private final Path workingDirectory;
    private final Duration timeout;

    public CommandIntegrityGate(List<String> command, Path workingDirectory, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Integrity command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
    }

    @Override
    public IntegrityCheckResult check(IntegrityPhase phase) throws IOException, InterruptedException {
        Path output = Files.createTempFile("integrity-", ".log");
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(output.toFile());
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().put(PHASE_ENV, phase.name().toLowerCase(Locale.ROOT));

        log.info("Running integrity command={} phase={}", command, phase);
        Process process = builder.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return IntegrityCheckResult.failed("Integrity command timed out after %s".formatted(timeout));
            }
            String text = Files.readString(output, StandardCharsets.UTF_8).strip();
            int exit = process.exitValue();
            return exit == 0 ? IntegrityCheckResult.passed(text)
                    : IntegrityCheckResult.failed("exit code %d: %s".formatted(exit, text));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(output);
        }
    }
}
