package com.example.canonical.ingestion.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only lookup of file schemas by logical file name. Safe to share between loaders.
 */
@Slf4j
public class SchemaRegistry {

    private final Map<String, FileSchema> schemas;

    public SchemaRegistry(Collection<FileSchema> schemas) {
        Map<String, FileSchema> byName = new LinkedHashMap<>();
        for (FileSchema schema : schemas) {
            if (byName.putIfAbsent(schema.fileName(), schema) != null) {
                throw new IllegalArgumentException("Schema registered twice for " + schema.fileName());
            }
        }
        this.schemas = Collections.unmodifiableMap(byName);
        log.info("Schema registry initialised with {} file schemas: {}", byName.size(), byName.keySet());
    }

    public Optional<FileSchema> schemaFor(String fileName) {
        return Optional.ofNullable(schemas.get(fileName));
    }

    public Optional<Map<String, ColumnSpec>> specFor(String fileName) {
        return schemaFor(fileName).map(FileSchema::columns);
    }

    public Set<String> registeredFiles() {
        return schemas.keySet();
    }
}
