package com.example.canonical.ingestion.support;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Pure, deterministic encoding and delimiter detection. Neither method throws on odd input.
 * Input that is not valid UTF-8 and has no BOM is decoded as windows-1252, which maps every
 * byte; the delimiter degrades to comma.
 */
@Component
public class FormatDetector {

    public static final char DEFAULT_DELIMITER = ',';
    public static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");
    static final char[] CANDIDATE_DELIMITERS = { ',', ';', '\t', '|' };
    static final int SAMPLE_LINES = 10;

    public DetectedEncoding detectEncoding(byte[] leading) {
        if (startsWith(leading, 0xEF, 0xBB, 0xBF)) {
            return new DetectedEncoding(StandardCharsets.UTF_8, 3, true);
        }
        if (startsWith(leading, 0xFF, 0xFE)) {
            return new DetectedEncoding(StandardCharsets.UTF_16LE, 2, true);
        }
        if (startsWith(leading, 0xFE, 0xFF)) {
            return new DetectedEncoding(StandardCharsets.UTF_16BE, 2, true);
        }
        if (isCleanUtf8(leading)) {
            return new DetectedEncoding(StandardCharsets.UTF_8, 0, true);
        }
        return new DetectedEncoding(FALLBACK_CHARSET, 0, false);
    }

    /**
     * Picks the candidate that splits every sampled line into the same non-zero number of
     * fields. Comma wins whenever it qualifies or when no single candidate does.
     */
    public char sniffDelimiter(String sample) {
        List<String> lines = sampleLines(sample);
        if (lines.isEmpty()) {
            return DEFAULT_DELIMITER;
        }

        Map<Character, Integer> consistent = new LinkedHashMap<>();
        for (char candidate : CANDIDATE_DELIMITERS) {
            int expected = -1;
            boolean uniform = true;
            for (String line : lines) {
                int count = countDelimiters(line, candidate);
                if (count == 0 || (expected >= 0 && count != expected)) {
                    uniform = false;
                    break;
                }
                expected = count;
            }
            if (uniform) {
                consistent.put(candidate, expected);
            }
        }

        if (consistent.isEmpty() || consistent.containsKey(DEFAULT_DELIMITER)) {
            return DEFAULT_DELIMITER;
        }
        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        boolean tie = false;
        for (Map.Entry<Character, Integer> entry : consistent.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
                tie = false;
            } else if (entry.getValue() == bestCount) {
                tie = true;
            }
        }
        return tie ? DEFAULT_DELIMITER : best;
    }

    private static List<String> sampleLines(String sample) {
        List<String> lines = new ArrayList<>();
        if (sample == null || sample.isEmpty()) {
            return lines;
        }
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int end = sample.length();
        for (int i = 0; i < end && lines.size() < SAMPLE_LINES; i++) {
            char c = sample.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            }
            if (!inQuotes && (c == '\n' || c == '\r')) {
                addLine(lines, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        // a lone line without terminator still counts
        if (lines.isEmpty()) {
            addLine(lines, current);
        }
        return lines;
    }

    private static void addLine(List<String> lines, StringBuilder line) {
        if (!line.toString().isBlank()) {
            lines.add(line.toString());
        }
    }

    /**
     * Delimiters outside double-quoted sections of one record.
     */
    public static int countDelimiters(String line, char delimiter) {
        int count = 0;
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == delimiter && !inQuotes) {
                count++;
            }
        }
        return count;
    }

    private static boolean isCleanUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(bytes.length + 1);
        // endOfInput=false so a multi-byte sequence cut by the sample boundary is not an error
        CoderResult result = decoder.decode(ByteBuffer.wrap(bytes), out, false);
        return !result.isError();
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes == null || bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
