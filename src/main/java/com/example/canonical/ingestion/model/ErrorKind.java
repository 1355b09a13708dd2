package com.example.canonical.ingestion.model;

public enum ErrorKind {
    FILE_NOT_FOUND,
    ENCODING_UNDETERMINED,
    READ_FAILURE,
    WRITE_FAILURE,
    MISSING_REQUIRED_COLUMN,
    EXTRA_COLUMN,
    MALFORMED_ROW,
    REQUIRED_VALUE_MISSING,
    TYPE_COERCION_FAILURE,
    RANGE_VIOLATION,
    INVALID_CATEGORICAL_VALUE,
    DUPLICATE_RECORD,
    INTEGRITY_GATE_FAILURE,
    QUARANTINE_RATIO_EXCEEDED,
    STAGE_FAILURE
}
