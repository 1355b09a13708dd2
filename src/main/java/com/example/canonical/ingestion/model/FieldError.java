package com.example.canonical.ingestion.model;

/**
 * A problem with a single field, before it is tied to a file and row.
 */
public record FieldError(ErrorKind kind, String column, String rawValue, String message) {

    public ValidationIssue at(String file, long row, boolean recovered) {
        return new ValidationIssue(kind, file, row, column, rawValue, message, recovered);
    }
}
