package com.example.canonical.ingestion.model;

public enum LoadMode {
    /** Any missing column or rejected row fails the whole file. */
    STRICT,
    /** Rejected rows are quarantined and the file continues. */
    LENIENT
}
