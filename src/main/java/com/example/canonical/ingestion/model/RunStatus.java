package com.example.canonical.ingestion.model;

public enum RunStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED
}
