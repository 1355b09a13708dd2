package com.example.canonical.ingestion.model;

public enum LoadStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED
}
