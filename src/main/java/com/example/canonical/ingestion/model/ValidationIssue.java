package com.example.canonical.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One located problem found while loading. {@code row} and {@code column} are null for
 * file-level issues. Recovered issues did not reject the row they were found on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
        ErrorKind kind,
        String file,
        Long row,
        String column,
        String rawValue,
        String message,
        boolean recovered) {

    public static ValidationIssue fileLevel(ErrorKind kind, String file, String message) {
        return new ValidationIssue(kind, file, null, null, null, message, false);
    }

    public static ValidationIssue fileWarning(ErrorKind kind, String file, String message) {
        return new ValidationIssue(kind, file, null, null, null, message, true);
    }

    public String location() {
        StringBuilder sb = new StringBuilder(file == null ? "<unknown>" : file);
        if (row != null) {
            sb.append(" row ").append(row);
        }
        if (column != null) {
            sb.append(" column '").append(column).append('\'');
        }
        return sb.toString();
    }
}
