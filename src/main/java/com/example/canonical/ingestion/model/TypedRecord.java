package com.example.canonical.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public record TypedRecord(long sourceRow, Map<String, Object> values, Set<String> coercedColumns) {

    public TypedRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        coercedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(coercedColumns));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean wasCoerced() {
        return !coercedColumns.isEmpty();
    }
}
