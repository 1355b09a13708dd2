package com.example.canonical.ingestion.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registered layout for one logical file name: ordered column specs plus the columns that form
 * its duplicate-detection key.
 */
public record FileSchema(String fileName, Map<String, ColumnSpec> columns, List<String> keyColumns) {

    public FileSchema {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        keyColumns = List.copyOf(keyColumns);
        for (String key : keyColumns) {
            if (!columns.containsKey(key)) {
                throw new IllegalArgumentException("Key column %s is not declared for %s".formatted(key, fileName));
            }
        }
    }

    public static FileSchema of(String fileName, List<ColumnSpec> specs, List<String> keyColumns) {
        Map<String, ColumnSpec> columns = new LinkedHashMap<>();
        for (ColumnSpec spec : specs) {
            if (columns.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate column %s in %s".formatted(spec.name(), fileName));
            }
        }
        return new FileSchema(fileName, columns, keyColumns);
    }

    /**
     * Explicit key columns when registered, otherwise the primary-key flagged columns in
     * declaration order. Empty means the file is not deduplicated.
     */
    public List<String> deduplicationKey() {
        if (!keyColumns.isEmpty()) {
            return keyColumns;
        }
        return columns.values().stream()
                .filter(ColumnSpec::primaryKey)
                .map(ColumnSpec::name)
                .toList();
    }
}
