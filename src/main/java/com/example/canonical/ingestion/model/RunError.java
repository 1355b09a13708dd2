package com.example.canonical.ingestion.model;

public record RunError(PipelineStage stage, ErrorKind kind, String message) {
}
