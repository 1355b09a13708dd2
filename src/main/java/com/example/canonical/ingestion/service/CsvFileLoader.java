package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.ErrorKind;
import com.example.canonical.ingestion.model.FieldError;
import com.example.canonical.ingestion.model.FileLoadResult;
import com.example.canonical.ingestion.model.FileMetadata;
import com.example.canonical.ingestion.model.LoadStatus;
import com.example.canonical.ingestion.model.QuarantineReason;
import com.example.canonical.ingestion.model.QuarantinedRecord;
import com.example.canonical.ingestion.model.RawRecord;
import com.example.canonical.ingestion.model.TypedRecord;
import com.example.canonical.ingestion.model.ValidationIssue;
import com.example.canonical.ingestion.schema.ColumnSpec;
import com.example.canonical.ingestion.schema.FileSchema;
import com.example.canonical.ingestion.schema.SchemaRegistry;
import com.example.canonical.ingestion.support.CamelCsvParserFactory;
import com.example.canonical.ingestion.support.CompressionSupport;
import com.example.canonical.ingestion.support.ContentHasher;
import com.example.canonical.ingestion.support.DetectedEncoding;
import com.example.canonical.ingestion.support.FileProcessingException;
import com.example.canonical.ingestion.support.FormatDetector;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads one canonical file into typed records. The source is opened read-only and hashed
 * before parsing; every data row ends up either accepted or quarantined, never both.
 */
@Slf4j
public class CsvFileLoader {

    static final int SAMPLE_BYTES = 8 * 1024;
    static final int SAMPLE_CHARS = 8 * 1024;

    private final SchemaRegistry registry;
    private final ValueCoercer coercer;
    private final DuplicateDetector duplicateDetector;
    private final FormatDetector formatDetector;
    private final CamelCsvParserFactory parserFactory;
    private final CompressionSupport compressionSupport;
    private final ContentHasher hasher;
    private final RecordSinkWriter sinkWriter;
    private final long progressUpdateInterval;

    public CsvFileLoader(SchemaRegistry registry,
            ValueCoercer coercer,
            DuplicateDetector duplicateDetector,
            FormatDetector formatDetector,
            CamelCsvParserFactory parserFactory,
            CompressionSupport compressionSupport,
            ContentHasher hasher,
            RecordSinkWriter sinkWriter,
            long progressUpdateInterval) {
        this.registry = registry;
        this.coercer = coercer;
        this.duplicateDetector = duplicateDetector;
        this.formatDetector = formatDetector;
        this.parserFactory = parserFactory;
        this.compressionSupport = compressionSupport;
        this.hasher = hasher;
        this.sinkWriter = sinkWriter;
        this.progressUpdateInterval = progressUpdateInterval;
    }

    public FileLoadResult load(Path source, LoadOptions options) {
        return load(source, source.getFileName().toString(), options, null);
    }

    /**
     * @param relativePath path of the source below the input root, used to key metadata and to
     *     place the sinks
     * @param listener optional, notified every {@code progressUpdateInterval} rows
     */
    public FileLoadResult load(Path source, String relativePath, LoadOptions options, ProgressListener listener) {
        Instant start = Instant.now();
        String file = compressionSupport.logicalName(relativePath);
        FileLoadAccumulator accumulator = new FileLoadAccumulator(file, start, listener, progressUpdateInterval);

        if (!Files.isRegularFile(source)) {
            accumulator.fail(ErrorKind.FILE_NOT_FOUND, "File not found: %s".formatted(source));
            return finish(accumulator, List.of());
        }

        List<String> columns;
        try {
            accumulator.sha256 = hasher.sha256(source);
            columns = read(source, file, options, accumulator);
        } catch (IOException | FileProcessingException | TextParsingException ex) {
            log.warn("Failed to read file={}: {}", file, ex.getMessage());
            accumulator.fail(ErrorKind.READ_FAILURE, "Failed to read %s: %s".formatted(file, ex.getMessage()));
            return finish(accumulator, List.of());
        }
        if (!accumulator.failed) {
            deduplicate(file, columns, accumulator);
        }
        return finish(accumulator, columns);
    }

    private List<String> read(Path source, String file, LoadOptions options, FileLoadAccumulator accumulator)
            throws IOException {
        try (InputStream raw = Files.newInputStream(source, StandardOpenOption.READ);
                InputStream decoded = compressionSupport.decodeIfNecessary(raw, source.getFileName().toString());
                BufferedInputStream in = new BufferedInputStream(decoded, SAMPLE_BYTES * 2)) {
            in.mark(SAMPLE_BYTES);
            byte[] head = in.readNBytes(SAMPLE_BYTES);
            in.reset();

            DetectedEncoding encoding = formatDetector.detectEncoding(head);
            accumulator.encoding = encoding.charset().name();
            if (!encoding.determined()) {
                accumulator.warn(ErrorKind.ENCODING_UNDETERMINED,
                        "Encoding could not be determined, decoding as %s".formatted(encoding.charset().name()));
            }
            in.skipNBytes(encoding.bomLength());

            BufferedReader reader = new BufferedReader(new InputStreamReader(in, encoding.charset()));
            for (int i = 0; i < options.skipLines(); i++) {
                if (reader.readLine() == null) {
                    break;
                }
            }

            char delimiter = formatDetector.sniffDelimiter(sample(reader));
            accumulator.delimiter = String.valueOf(delimiter);
            Optional<FileSchema> schema = registry.schemaFor(compressionSupport.logicalName(
                    source.getFileName().toString()));
            if (schema.isEmpty()) {
                log.debug("No schema registered for file={}, columns pass through as text", file);
            }
            return parseRows(parserFactory.newParser(delimiter), delimiter, reader, schema.orElse(null), options,
                    accumulator);
        }
    }

    private static String sample(BufferedReader reader) throws IOException {
        char[] buffer = new char[SAMPLE_CHARS];
        reader.mark(SAMPLE_CHARS);
        int filled = 0;
        int read;
        while (filled < buffer.length && (read = reader.read(buffer, filled, buffer.length - filled)) != -1) {
            filled += read;
        }
        reader.reset();
        return new String(buffer, 0, filled);
    }

    private List<String> parseRows(CsvParser parser, char delimiter, BufferedReader reader, FileSchema schema,
            LoadOptions options, FileLoadAccumulator accumulator) {
        parser.beginParsing(reader);
        try {
            String[] header = parser.parseNext();
            List<String> columns = header == null ? List.of() : headerColumns(header, accumulator);
            accumulator.columnCount = columns.size();
            if (!validateHeader(columns, schema, options, accumulator)) {
                return columns;
            }

            String[] row;
            long sourceRow = 0;
            while ((row = parser.parseNext()) != null) {
                sourceRow++;
                accumulator.incrementRead();
                RawRecord raw = toRawRecord(sourceRow, columns, row, cellCount(parser, row, delimiter),
                        accumulator);
                RowOutcome outcome = typeRow(raw, columns, schema, accumulator);
                if (outcome.accepted() != null) {
                    accumulator.accept(outcome.accepted(), outcome.notices());
                    continue;
                }
                if (options.strictMode()) {
                    ValidationIssue first = outcome.quarantined().issues().get(0);
                    accumulator.issues.addAll(outcome.quarantined().issues());
                    accumulator.fail(first.kind(), "Strict mode: rejected %s: %s"
                            .formatted(first.location(), first.message()));
                    return columns;
                }
                accumulator.quarantine(outcome.quarantined());
            }
            return columns;
        } finally {
            parser.stopParsing();
        }
    }

    private static List<String> headerColumns(String[] header, FileLoadAccumulator accumulator) {
        List<String> columns = new ArrayList<>(header.length);
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].strip();
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            if (!seen.add(name)) {
                String renamed = name + "_" + (i + 1);
                accumulator.warn(ErrorKind.MALFORMED_ROW,
                        "Duplicate header '%s' at position %d renamed to '%s'".formatted(name, i + 1, renamed));
                name = renamed;
                seen.add(name);
            }
            columns.add(name);
        }
        return columns;
    }

    private static boolean validateHeader(List<String> columns, FileSchema schema, LoadOptions options,
            FileLoadAccumulator accumulator) {
        if (schema == null) {
            return true;
        }
        List<String> missing = schema.columns().keySet().stream()
                .filter(column -> !columns.contains(column))
                .toList();
        List<String> extra = columns.stream()
                .filter(column -> !schema.columns().containsKey(column))
                .toList();

        if (!extra.isEmpty()) {
            accumulator.warn(ErrorKind.EXTRA_COLUMN, "Unexpected columns passed through: %s".formatted(extra));
        }
        if (missing.isEmpty()) {
            return true;
        }
        if (options.strictMode()) {
            accumulator.fail(ErrorKind.MISSING_REQUIRED_COLUMN, "Missing columns: %s".formatted(missing));
            return false;
        }
        accumulator.warn(ErrorKind.MISSING_REQUIRED_COLUMN, "Missing columns: %s".formatted(missing));
        return true;
    }

    /**
     * Cells present in the record just parsed. The parser pads short rows up to the header
     * width, so the count comes from the record's own text.
     */
    private static int cellCount(CsvParser parser, String[] row, char delimiter) {
        String content = parser.getContext().currentParsedContent();
        if (content == null || content.isEmpty()) {
            return row.length;
        }
        return Math.min(row.length, FormatDetector.countDelimiters(content, delimiter) + 1);
    }

    private static RawRecord toRawRecord(long sourceRow, List<String> columns, String[] row, int cells,
            FileLoadAccumulator accumulator) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            values.put(columns.get(i), i < cells ? row[i] : null);
        }
        if (cells > columns.size()) {
            accumulator.issues.add(new ValidationIssue(ErrorKind.MALFORMED_ROW, accumulator.file, sourceRow, null,
                    null, "Row has %d cells but header has %d; extra cells dropped".formatted(cells,
                            columns.size()), true));
        }
        return new RawRecord(sourceRow, values, cells);
    }

    private RowOutcome typeRow(RawRecord raw, List<String> columns, FileSchema schema,
            FileLoadAccumulator accumulator) {
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> coerced = new LinkedHashSet<>();
        List<ValidationIssue> rejections = new ArrayList<>();
        List<ValidationIssue> notices = new ArrayList<>();
        QuarantineReason reason = QuarantineReason.SCHEMA_VIOLATION;
        long nulls = 0;

        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i);
            String token = raw.values().get(column);
            ColumnSpec spec = schema == null ? null : schema.columns().get(column);
            if (spec == null) {
                values.put(column, ValueCoercer.passthrough(token));
                continue;
            }
            if (i >= raw.cellCount() && !spec.nullable()) {
                reason = QuarantineReason.MISSING_REQUIRED_COLUMN;
                rejections.add(new FieldError(ErrorKind.MISSING_REQUIRED_COLUMN, column, null,
                        "Row ends before required column %s".formatted(column))
                        .at(accumulator.file, raw.sourceRow(), false));
                continue;
            }

            CoercionResult result = coercer.parse(token, spec);
            if (result.rejected()) {
                rejections.add(result.error().at(accumulator.file, raw.sourceRow(), false));
                continue;
            }
            values.put(column, result.value());
            if (result.coerced()) {
                coerced.add(column);
            }
            if (result.value() == null) {
                nulls++;
            }
            result.notice().ifPresent(notice -> notices.add(notice.at(accumulator.file, raw.sourceRow(), true)));
        }

        if (!rejections.isEmpty()) {
            List<ValidationIssue> issues = new ArrayList<>(rejections);
            issues.addAll(notices);
            return RowOutcome.quarantined(QuarantinedRecord.rejected(raw, reason, issues));
        }
        accumulator.nulls += nulls;
        accumulator.coercions += coerced.size();
        if (!coerced.isEmpty()) {
            accumulator.coercedRecords++;
        }
        if (schema != null) {
            accumulator.normalizations += normalizePlayerNames(values, schema, raw.sourceRow(), accumulator.file);
        }
        return RowOutcome.accepted(new TypedRecord(raw.sourceRow(), values, coerced), notices);
    }

    private int normalizePlayerNames(Map<String, Object> values, FileSchema schema, long sourceRow, String file) {
        String position = positionOf(values);
        int normalized = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            ColumnSpec spec = schema.columns().get(entry.getKey());
            if (spec == null || !spec.playerName() || !(entry.getValue() instanceof String name)) {
                continue;
            }
            Optional<String> canonical = coercer.normalizePlayerName(name, position);
            if (canonical.isPresent()) {
                log.debug("Normalised player name file={} row={} column={} from={} to={}", file, sourceRow,
                        entry.getKey(), name, canonical.get());
                entry.setValue(canonical.get());
                normalized++;
            }
        }
        return normalized;
    }

    private static String positionOf(Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String column = entry.getKey();
            if ((column.equalsIgnoreCase("position") || column.equalsIgnoreCase("pos")) && entry.getValue() != null) {
                return entry.getValue().toString();
            }
        }
        return null;
    }

    private void deduplicate(String file, List<String> columns, FileLoadAccumulator accumulator) {
        FileSchema schema = registry.schemaFor(fileNameOf(file)).orElse(null);
        if (schema == null || schema.deduplicationKey().isEmpty()) {
            return;
        }
        List<String> keys = schema.deduplicationKey();
        if (!columns.containsAll(keys)) {
            accumulator.warn(ErrorKind.DUPLICATE_RECORD,
                    "Duplicate detection skipped, key columns %s not all present".formatted(keys));
            return;
        }
        DuplicateDetector.DedupeResult result = duplicateDetector.dedupe(file, accumulator.accepted, keys);
        accumulator.accepted = new ArrayList<>(result.unique());
        accumulator.duplicates = result.duplicates().size();
        for (QuarantinedRecord duplicate : result.duplicates()) {
            accumulator.quarantine(duplicate);
        }
    }

    private FileLoadResult finish(FileLoadAccumulator accumulator, List<String> columns) {
        FileLoadResult result = accumulator.toResult(Instant.now());
        if (sinkWriter != null) {
            result = writeSinks(result, columns, accumulator);
        }
        FileMetadata metadata = result.metadata();
        log.info("Completed load for file={} status={} read={} parsed={} quarantined={} duplicates={} durationMs={}",
                result.file(), result.status(), metadata.rowCount(), metadata.parsedRows(),
                metadata.quarantinedRows(), metadata.duplicateCount(), metadata.durationMillis());
        return result;
    }

    private FileLoadResult writeSinks(FileLoadResult result, List<String> columns, FileLoadAccumulator accumulator) {
        try {
            if (result.isFailed()) {
                sinkWriter.discard(result.file());
                return result;
            }
            sinkWriter.write(result.file(), columns, result.accepted(), result.quarantined());
            return result;
        } catch (FileProcessingException ex) {
            log.error("Failed to write sinks for file={}", result.file(), ex);
            accumulator.fail(ErrorKind.WRITE_FAILURE, ex.getMessage());
            try {
                sinkWriter.discard(result.file());
            } catch (FileProcessingException cleanup) {
                ex.addSuppressed(cleanup);
                log.warn("Could not remove partial sinks for file={}: {}", result.file(), cleanup.getMessage());
            }
            return accumulator.toResult(Instant.now());
        }
    }

    private static String fileNameOf(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }

    private record RowOutcome(TypedRecord accepted, QuarantinedRecord quarantined, List<ValidationIssue> notices) {

        static RowOutcome accepted(TypedRecord record, List<ValidationIssue> notices) {
            return new RowOutcome(record, null, notices);
        }

        static RowOutcome quarantined(QuarantinedRecord record) {
            return new RowOutcome(null, record, List.of());
        }
    }

    private static final class FileLoadAccumulator {
        private final String file;
        private final Instant start;
        private final ProgressListener listener;
        private final long interval;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final List<QuarantinedRecord> quarantined = new ArrayList<>();

        private List<TypedRecord> accepted = new ArrayList<>();
        private long nextReportThreshold;
        private String sha256 = "";
        private String encoding;
        private String delimiter;
        private int columnCount;
        private long read;
        private long coercions;
        private long coercedRecords;
        private long nulls;
        private long duplicates;
        private long normalizations;
        private boolean failed;

        private FileLoadAccumulator(String file, Instant start, ProgressListener listener, long interval) {
            this.file = file;
            this.start = start;
            this.listener = listener;
            this.interval = interval;
            this.nextReportThreshold = interval;
        }

        void incrementRead() {
            read++;
            maybeReport(false);
        }

        void accept(TypedRecord record, List<ValidationIssue> notices) {
            accepted.add(record);
            issues.addAll(notices);
        }

        void quarantine(QuarantinedRecord record) {
            quarantined.add(record);
            issues.addAll(record.issues());
        }

        void warn(ErrorKind kind, String message) {
            issues.add(ValidationIssue.fileWarning(kind, file, message));
        }

        void fail(ErrorKind kind, String message) {
            failed = true;
            issues.add(ValidationIssue.fileLevel(kind, file, message));
        }

        FileLoadResult toResult(Instant end) {
            maybeReport(true);
            long durationMillis = Duration.between(start, end).toMillis();
            if (failed) {
                FileMetadata metadata = new FileMetadata(file, sha256, encoding, delimiter, read, columnCount, 0, 0,
                        0, 0, 0, 0, 0, start, durationMillis, issues);
                return FileLoadResult.failed(file, metadata);
            }
            FileMetadata metadata = new FileMetadata(file, sha256, encoding, delimiter, read, columnCount,
                    accepted.size(), quarantined.size(), coercions, coercedRecords, nulls, duplicates, normalizations,
                    start, durationMillis, issues);
            LoadStatus status = quarantined.isEmpty() ? LoadStatus.SUCCESS : LoadStatus.PARTIAL_SUCCESS;
            return new FileLoadResult(file, status, metadata, accepted, quarantined);
        }

        private void maybeReport(boolean force) {
            if (listener == null) {
                return;
            }
            if (force || read >= nextReportThreshold) {
                listener.onProgress(file, read, accepted.size(), quarantined.size());
                nextReportThreshold = read + interval;
            }
        }
    }
}
