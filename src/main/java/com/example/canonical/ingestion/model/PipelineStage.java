package com.example.canonical.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineStage {
    INTEGRITY_PRE_CHECK("integrity_pre_check"),
    DATA_LOADING("data_loading"),
    DATA_VALIDATION("data_validation"),
    DATA_TRANSFORMATION("data_transformation"),
    INTEGRITY_POST_CHECK("integrity_post_check"),
    METADATA_GENERATION("metadata_generation");

    private final String stageName;

    PipelineStage(String stageName) {
        this.stageName = stageName;
    }

    @JsonValue
    public String stageName() {
        return stageName;
    }
}
