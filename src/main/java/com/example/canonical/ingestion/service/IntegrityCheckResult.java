package com.example.canonical.ingestion.service;

import java.util.List;

/**
 * Outcome of one integrity gate invocation. {@code output} carries whatever the gate printed
 * or found; {@code warnings} do not fail the gate.
 */
public record IntegrityCheckResult(boolean passed, boolean skipped, String output, List<String> warnings) {

    public IntegrityCheckResult {
        output = output == null ? "" : output;
        warnings = List.copyOf(warnings);
    }

    public static IntegrityCheckResult passed(String output) {
        return new IntegrityCheckResult(true, false, output, List.of());
    }

    public static IntegrityCheckResult passed(String output, List<String> warnings) {
        return new IntegrityCheckResult(true, false, output, warnings);
    }

    public static IntegrityCheckResult failed(String output) {
        return new IntegrityCheckResult(false, false, output, List.of());
    }

    public static IntegrityCheckResult disabled() {
        return new IntegrityCheckResult(true, true, "integrity checks disabled", List.of());
    }
}
