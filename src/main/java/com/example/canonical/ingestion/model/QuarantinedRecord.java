package com.example.canonical.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A row that was kept out of the clean output. Rows rejected while typing keep their raw
 * tokens; duplicates keep their typed values. {@code duplicateOfRow} is set only for
 * {@link QuarantineReason#DUPLICATE_OF}.
 */
public record QuarantinedRecord(
        long sourceRow,
        Map<String, Object> values,
        QuarantineReason reason,
        Long duplicateOfRow,
        List<ValidationIssue> issues) {

    public QuarantinedRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        issues = List.copyOf(issues);
    }

    public static QuarantinedRecord rejected(RawRecord raw, QuarantineReason reason, List<ValidationIssue> issues) {
        return new QuarantinedRecord(raw.sourceRow(), new LinkedHashMap<>(raw.values()), reason, null, issues);
    }

    public static QuarantinedRecord duplicate(TypedRecord record, long firstRow, ValidationIssue issue) {
        return new QuarantinedRecord(record.sourceRow(), record.values(), QuarantineReason.DUPLICATE_OF, firstRow,
                List.of(issue));
    }

    public String reasonLabel() {
        return reason == QuarantineReason.DUPLICATE_OF ? "DuplicateOf(" + duplicateOfRow + ")" : reason.name();
    }
}
