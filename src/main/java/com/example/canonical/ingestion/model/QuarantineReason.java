package com.example.canonical.ingestion.model;

public enum QuarantineReason {
    SCHEMA_VIOLATION,
    DUPLICATE_OF,
    MISSING_REQUIRED_COLUMN
}
