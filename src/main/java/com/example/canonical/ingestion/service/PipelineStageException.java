package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.PipelineStage;

public class PipelineStageException extends RuntimeException {

    private final PipelineStage stage;
    private final ErrorKind kind;

    public PipelineStageException(PipelineStage stage, ErrorKind kind, String message) {
        super(message);
        this.stage = stage;
        this.kind = kind;
    }

    public PipelineStageException(PipelineStage stage, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.kind = kind;
    }

    public PipelineStage stage() {
        return stage;
    }

    public ErrorKind kind() {
        return kind;
    }
}
