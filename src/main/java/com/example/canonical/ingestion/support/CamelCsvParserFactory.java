package com.example.canonical.ingestion.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    private static final int MAX_CHARS_PER_COLUMN = 16 * 1024;
    private static final int MAX_COLUMNS = 2048;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(false);
        setIgnoreTrailingWhitespaces(false);
        setLazyLoad(true);
        setAsMap(false);
    }

    public CsvParser newParser(char delimiter) {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setMaxColumns(MAX_COLUMNS);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setNullValue(null);
        settings.setEmptyValue("");
        settings.getFormat().setDelimiter(delimiter);
        log.debug("Created CsvParser with delimiter='{}' maxCharsPerColumn={} lazyLoad={}",
            printable(delimiter), settings.getMaxCharsPerColumn(), isLazyLoad());
        return createParser(settings);
    }

    static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
