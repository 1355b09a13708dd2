package com.example.canonical.ingestion.model;

public enum IntegrityStatus {
    UNKNOWN,
    VERIFIED,
    VIOLATED,
    SKIPPED
}
