package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.QuarantineReason;
import com.example.canonical.ingestion.model.QuarantinedRecord;
import com.example.canonical.ingestion.model.TypedRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateDetectorTest {

    private static final List<String> KEY = List.of("playerName", "position", "teamName");

    private final DuplicateDetector detector = new DuplicateDetector();

    private static TypedRecord record(long row, String name, String position, String team, double points) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("playerName", name);
        values.put("position", position);
        values.put("teamName", team);
        values.put("fantasyPoints", points);
        return new TypedRecord(row, values, Set.of());
    }

    @Test
    void dedupe_shouldKeepFirstOccurrenceAndReferenceItsRow() {
        List<TypedRecord> records = List.of(
                record(1, "Josh Allen", "QB", "BUF", 380.2),
                record(2, "Josh Allen", "QB", "BUF", 379.0));

        DuplicateDetector.DedupeResult result = detector.dedupe("projections_2025.csv", records, KEY);

        assertThat(result.unique()).extracting(TypedRecord::sourceRow).containsExactly(1L);
        assertThat(result.duplicates()).hasSize(1);
        QuarantinedRecord duplicate = result.duplicates().get(0);
        assertThat(duplicate.sourceRow()).isEqualTo(2L);
        assertThat(duplicate.reason()).isEqualTo(QuarantineReason.DUPLICATE_OF);
        assertThat(duplicate.duplicateOfRow()).isEqualTo(1L);
        assertThat(duplicate.reasonLabel()).isEqualTo("DuplicateOf(1)");
        assertThat(duplicate.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(ErrorKind.DUPLICATE_RECORD);
            assertThat(issue.recovered()).isTrue();
            assertThat(issue.row()).isEqualTo(2L);
        });
    }

    @Test
    void dedupe_shouldKeepExactlyOneOfNDuplicates() {
        List<TypedRecord> records = new ArrayList<>();
        records.add(record(1, "Bijan Robinson", "RB", "ATL", 300));
        for (int row = 2; row <= 6; row++) {
            records.add(record(row, "Bijan Robinson", "RB", "ATL", 300 - row));
        }
        records.add(record(7, "Drake London", "WR", "ATL", 220));

        DuplicateDetector.DedupeResult result = detector.dedupe(records, KEY);

        assertThat(result.unique()).extracting(TypedRecord::sourceRow).containsExactly(1L, 7L);
        assertThat(result.duplicates()).hasSize(5)
                .allSatisfy(duplicate -> assertThat(duplicate.duplicateOfRow()).isEqualTo(1L));
    }

    @Test
    void dedupe_shouldCompareKeysCaseAndWhitespaceInsensitively() {
        List<TypedRecord> records = List.of(
                record(1, "CeeDee Lamb", "WR", "DAL", 280),
                record(2, " ceedee lamb ", "wr", "dal", 281));

        DuplicateDetector.DedupeResult result = detector.dedupe(records, KEY);

        assertThat(result.duplicates()).extracting(QuarantinedRecord::sourceRow).containsExactly(2L);
    }

    @Test
    void dedupe_shouldBeStableAcrossRepeatedRuns() {
        List<TypedRecord> records = List.of(
                record(1, "A", "QB", "KC", 1),
                record(2, "B", "QB", "KC", 2),
                record(3, "A", "QB", "KC", 3),
                record(4, "B", "QB", "KC", 4));

        DuplicateDetector.DedupeResult first = detector.dedupe(records, KEY);
        DuplicateDetector.DedupeResult second = detector.dedupe(records, KEY);

        assertThat(second).isEqualTo(first);
        assertThat(first.duplicates()).extracting(QuarantinedRecord::duplicateOfRow).containsExactly(1L, 2L);
    }

    @Test
    void dedupe_shouldTreatEveryRecordAsUniqueWithoutKeyColumns() {
        List<TypedRecord> records = List.of(record(1, "A", "QB", "KC", 1), record(2, "A", "QB", "KC", 1));

        DuplicateDetector.DedupeResult result = detector.dedupe(records, List.of());

        assertThat(result.unique()).hasSize(2);
        assertThat(result.duplicates()).isEmpty();
    }

    @Test
    void compositeKey_shouldRenderNullAsEmpty() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("playerName", "X");
        values.put("position", null);
        values.put("teamName", "KC");

        assertThat(DuplicateDetector.compositeKey(new TypedRecord(1, values, Set.of()), KEY)).isEqualTo("x||kc");
    }
}
