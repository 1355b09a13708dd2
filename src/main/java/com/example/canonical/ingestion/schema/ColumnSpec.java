package com.example.canonical.ingestion.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;

/**
 * Declared shape of one column. {@code allowedValues} applies to string columns, {@code range}
 * to numeric ones; {@code aliases} maps upper-cased non-standard tokens to a canonical allowed
 * value. {@code teamCode} columns also consult the team-code normalizer; {@code playerName}
 * columns are rewritten to the canonical player spelling once the row is accepted.
 */
@Builder(toBuilder = true)
public record ColumnSpec(
        String name,
        ColumnType type,
        boolean nullable,
        NumericRange range,
        Set<String> allowedValues,
        Map<String, String> aliases,
        boolean teamCode,
        boolean playerName,
        boolean unique,
        boolean primaryKey) {

    public ColumnSpec {
        Objects.requireNonNull(name, "name");
        type = type == null ? ColumnType.STRING : type;
        allowedValues = allowedValues == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedValues));
        Map<String, String> upperAliases = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((alias, canonical) -> upperAliases.put(alias.toUpperCase(Locale.ROOT), canonical));
        }
        aliases = Collections.unmodifiableMap(upperAliases);
        if (range != null && !type.isNumeric()) {
            throw new IllegalArgumentException("Range declared on non-numeric column " + name);
        }
    }

    public static ColumnSpec string(String name, boolean nullable) {
        return ColumnSpec.builder().name(name).type(ColumnType.STRING).nullable(nullable).build();
    }

    public static ColumnSpec integer(String name, boolean nullable, double low, double high) {
        return ColumnSpec.builder().name(name).type(ColumnType.INTEGER).nullable(nullable)
                .range(NumericRange.of(low, high)).build();
    }

    public static ColumnSpec decimal(String name, boolean nullable) {
        return ColumnSpec.builder().name(name).type(ColumnType.FLOAT).nullable(nullable).build();
    }

    public static ColumnSpec decimal(String name, boolean nullable, double low, double high) {
        return ColumnSpec.builder().name(name).type(ColumnType.FLOAT).nullable(nullable)
                .range(NumericRange.of(low, high)).build();
    }

    public static ColumnSpec bool(String name, boolean nullable) {
        return ColumnSpec.builder().name(name).type(ColumnType.BOOLEAN).nullable(nullable).build();
    }

    public Optional<NumericRange> numericRange() {
        return Optional.ofNullable(range);
    }

    public boolean isCategorical() {
        return !allowedValues.isEmpty();
    }
}
