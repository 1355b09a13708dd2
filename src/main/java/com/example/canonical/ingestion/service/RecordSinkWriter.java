package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.QuarantinedRecord;
import com.example.canonical.ingestion.model.TypedRecord;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.example.canonical.ingestion.support.OutputLayout;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the clean and quarantine sinks for one source file. Each sink is written to a
 * temporary sibling and moved into place, so a sink is either complete or absent.
 */
@Slf4j
public class RecordSinkWriter {

    static final String SOURCE_ROW_COLUMN = "_source_row";
    static final String REASON_COLUMN = "_quarantine_reason";
    static final String DUPLICATE_OF_COLUMN = "_duplicate_of_row";
    static final String EXCEPTIONS_COLUMN = "_exceptions";

    private final OutputLayout layout;
    private final ObjectMapper objectMapper;

    public RecordSinkWriter(OutputLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.objectMapper = objectMapper;
    }

    public SinkPaths write(String relativePath, List<String> columns, List<TypedRecord> accepted,
            List<QuarantinedRecord> quarantined) {
        Path cleanFile = layout.cleanFileFor(relativePath);
        Path quarantineFile = layout.quarantineFileFor(relativePath);

        writeCsv(cleanFile, columns.toArray(String[]::new), csv -> {
            for (TypedRecord record : accepted) {
                Object[] row = new Object[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    row[i] = format(record.get(columns.get(i)));
                }
                csv.writeRow(row);
            }
        });

        List<String> quarantineHeaders = new ArrayList<>(columns.size() + 4);
        quarantineHeaders.add(SOURCE_ROW_COLUMN);
        quarantineHeaders.addAll(columns);
        quarantineHeaders.add(REASON_COLUMN);
        quarantineHeaders.add(DUPLICATE_OF_COLUMN);
        quarantineHeaders.add(EXCEPTIONS_COLUMN);
        writeCsv(quarantineFile, quarantineHeaders.toArray(String[]::new), csv -> {
            for (QuarantinedRecord record : quarantined) {
                List<Object> row = new ArrayList<>(quarantineHeaders.size());
                row.add(record.sourceRow());
                for (String column : columns) {
                    row.add(format(record.values().get(column)));
                }
                row.add(record.reasonLabel());
                row.add(record.duplicateOfRow());
                row.add(toJson(record));
                csv.writeRow(row.toArray());
            }
        });

        log.debug("Wrote clean={} ({} rows) quarantine={} ({} rows)", cleanFile, accepted.size(), quarantineFile,
                quarantined.size());
        return new SinkPaths(cleanFile, quarantineFile);
    }

    /**
     * Removes sinks left by an earlier run of a file that has now failed to load.
     */
    public void discard(String relativePath) {
        for (Path sink : List.of(layout.cleanFileFor(relativePath), layout.quarantineFileFor(relativePath))) {
            try {
                if (Files.deleteIfExists(sink)) {
                    log.info("Removed stale sink {}", sink);
                }
            } catch (IOException ex) {
                throw new FileProcessingException("Failed to remove stale sink %s".formatted(sink), ex);
            }
        }
    }

    static Object format(Object value) {
        if (value instanceof Double number) {
            return BigDecimal.valueOf(number).toPlainString();
        }
        return value;
    }

    private String toJson(QuarantinedRecord record) {
        try {
            return objectMapper.writeValueAsString(record.issues());
        } catch (JsonProcessingException ex) {
            throw new FileProcessingException("Failed to serialise exceptions for row %d".formatted(record.sourceRow()),
                    ex);
        }
    }

    private void writeCsv(Path target, String[] headers, Consumer<CsvWriter> rows) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            Files.createDirectories(target.getParent());
            try (Writer writer = new OutputStreamWriter(Files.newOutputStream(temp), StandardCharsets.UTF_8)) {
                CsvWriter csvWriter = new CsvWriter(writer, settings);
                csvWriter.writeHeaders(headers);
                rows.accept(csvWriter);
                csvWriter.flush();
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new FileProcessingException("Failed to write sink %s".formatted(target), ex);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Failed to delete temp sink {}: {}", temp, ex.getMessage());
        }
    }

    public record SinkPaths(Path cleanFile, Path quarantineFile) {
    }
}
