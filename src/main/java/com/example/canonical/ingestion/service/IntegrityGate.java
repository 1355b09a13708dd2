package com.example.canonical.ingestion.service;

/**
 * Opaque pass/fail check that the canonical tree has not been modified out of band. Invoked
 * once before loading and once after, always through {@link IntegrityGateRunner}.
 */
@FunctionalInterface
public interface IntegrityGate {

    IntegrityGate NONE = phase -> IntegrityCheckResult.disabled();

    IntegrityCheckResult check(IntegrityPhase phase) throws Exception;
}
