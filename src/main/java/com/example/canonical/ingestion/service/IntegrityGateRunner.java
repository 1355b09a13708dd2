package com.example.canonical.ingestion.service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Invokes an {@link IntegrityGate} under a timeout. Every way the gate can fail to answer
 * (timeout, exception, interrupt) is reported as a failed check.
 */
@Slf4j
public class IntegrityGateRunner {

    private final IntegrityGate gate;
    private final ExecutorService executor;
    private final Duration timeout;

    public IntegrityGateRunner(IntegrityGate gate, ExecutorService executor, Duration timeout) {
        this.gate = gate;
        this.executor = executor;
        this.timeout = timeout;
    }

    public IntegrityCheckResult run(IntegrityPhase phase) {
        Future<IntegrityCheckResult> future = executor.submit(() -> gate.check(phase));
        try {
            IntegrityCheckResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return IntegrityCheckResult.failed("Integrity gate returned no result");
            }
            log.info("Integrity gate phase={} passed={} skipped={}", phase, result.passed(), result.skipped());
            return result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Integrity gate phase={} timed out after {}", phase, timeout);
            return IntegrityCheckResult.failed("Integrity check timed out after %s".formatted(timeout));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Integrity gate phase={} failed", phase, cause);
            return IntegrityCheckResult.failed("Integrity check failed: %s".formatted(cause.getMessage()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return IntegrityCheckResult.failed("Interrupted while waiting for integrity check");
        }
    }
}
