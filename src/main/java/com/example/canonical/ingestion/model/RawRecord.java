package com.example.canonical.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tokens of one data row keyed by header name, exactly as the reader produced them.
 * {@code sourceRow} counts data rows from 1; the header and skipped metadata lines are not counted.
 */
public record RawRecord(long sourceRow, Map<String, String> values, int cellCount) {

    public RawRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
