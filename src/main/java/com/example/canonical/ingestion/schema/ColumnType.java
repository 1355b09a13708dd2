package com.example.canonical.ingestion.schema;

public enum ColumnType {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
