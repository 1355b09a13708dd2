package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.QuarantinedRecord;
import com.example.canonical.ingestion.model.TypedRecord;
import com.example.canonical.ingestion.model.ValidationIssue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * First occurrence of a composite business key wins; later occurrences are quarantined as
 * {@code DuplicateOf(firstRow)}. Input order is preserved in both partitions.
 */
@Slf4j
@Component
public class DuplicateDetector {

    static final String KEY_SEPARATOR = "|";

    public DedupeResult dedupe(List<TypedRecord> records, List<String> keyColumns) {
        return dedupe(null, records, keyColumns);
    }

    public DedupeResult dedupe(String file, List<TypedRecord> records, List<String> keyColumns) {
        if (keyColumns.isEmpty()) {
            return new DedupeResult(List.copyOf(records), List.of());
        }

        Map<String, Long> firstRowByKey = new HashMap<>();
        List<TypedRecord> unique = new ArrayList<>(records.size());
        List<QuarantinedRecord> duplicates = new ArrayList<>();

        for (TypedRecord record : records) {
            String key = compositeKey(record, keyColumns);
            Long firstRow = firstRowByKey.putIfAbsent(key, record.sourceRow());
            if (firstRow == null) {
                unique.add(record);
                continue;
            }
            ValidationIssue issue = new ValidationIssue(ErrorKind.DUPLICATE_RECORD, file, record.sourceRow(), null,
                    key, "Duplicate of row %d on key %s".formatted(firstRow, keyColumns), true);
            duplicates.add(QuarantinedRecord.duplicate(record, firstRow, issue));
            log.debug("Row {} of {} duplicates row {} on key '{}'", record.sourceRow(), file, firstRow, key);
        }

        if (!duplicates.isEmpty()) {
            log.info("Quarantined {} duplicate rows in file={} keyColumns={}", duplicates.size(), file, keyColumns);
        }
        return new DedupeResult(unique, duplicates);
    }

    static String compositeKey(TypedRecord record, List<String> keyColumns) {
        StringJoiner joiner = new StringJoiner(KEY_SEPARATOR);
        for (String column : keyColumns) {
            Object value = record.get(column);
            joiner.add(value == null ? "" : value.toString().strip().toLowerCase(Locale.ROOT));
        }
        return joiner.toString();
    }

    public record DedupeResult(List<TypedRecord> unique, List<QuarantinedRecord> duplicates) {

        public DedupeResult {
            unique = List.copyOf(unique);
            duplicates = List.copyOf(duplicates);
        }
    }
}
