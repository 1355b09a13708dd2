package com.example.canonical.ingestion.support;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FormatDetectorTest {

    private final FormatDetector detector = new FormatDetector();

    @Test
    void detectEncoding_shouldRecogniseUtf8Bom() {
        byte[] bytes = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a', ',', 'b' };

        DetectedEncoding encoding = detector.detectEncoding(bytes);

        assertThat(encoding.charset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(encoding.bomLength()).isEqualTo(3);
        assertThat(encoding.determined()).isTrue();
    }

    @Test
    void detectEncoding_shouldRecogniseUtf16Boms() {
        assertThat(detector.detectEncoding(new byte[] { (byte) 0xFF, (byte) 0xFE, 'a', 0 }).charset())
                .isEqualTo(StandardCharsets.UTF_16LE);
        assertThat(detector.detectEncoding(new byte[] { (byte) 0xFE, (byte) 0xFF, 0, 'a' }).charset())
                .isEqualTo(StandardCharsets.UTF_16BE);
    }

    @Test
    void detectEncoding_shouldDefaultToUtf8WithoutBom() {
        DetectedEncoding encoding = detector.detectEncoding("name,team\nJosé,KC\n".getBytes(StandardCharsets.UTF_8));

        assertThat(encoding.charset()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(encoding.bomLength()).isZero();
        assertThat(encoding.determined()).isTrue();
    }

    @Test
    void detectEncoding_shouldFallBackToWindows1252ForInvalidUtf8() {
        byte[] latin1 = "José Señor,KC".getBytes(StandardCharsets.ISO_8859_1);

        DetectedEncoding encoding = detector.detectEncoding(latin1);

        assertThat(encoding.charset()).isEqualTo(FormatDetector.FALLBACK_CHARSET);
        assertThat(encoding.charset().name()).isEqualTo("windows-1252");
        assertThat(encoding.determined()).isFalse();
        assertThat(new String(latin1, encoding.charset())).isEqualTo("José Señor,KC");
    }

    @Test
    void detectEncoding_shouldToleratePartialTrailingSequence() {
        byte[] full = "abé".getBytes(StandardCharsets.UTF_8);
        byte[] cut = new byte[full.length - 1];
        System.arraycopy(full, 0, cut, 0, cut.length);

        assertThat(detector.detectEncoding(cut).determined()).isTrue();
    }

    @Test
    void sniffDelimiter_shouldPickSemicolonWhenConsistent() {
        assertThat(detector.sniffDelimiter("a;b;c\n1;2;3\n4;5;6\n")).isEqualTo(';');
    }

    @Test
    void sniffDelimiter_shouldPickTabAndPipe() {
        assertThat(detector.sniffDelimiter("a\tb\n1\t2\n")).isEqualTo('\t');
        assertThat(detector.sniffDelimiter("a|b|c\n1|2|3\n")).isEqualTo('|');
    }

    @Test
    void sniffDelimiter_shouldPreferCommaWhenItIsConsistent() {
        assertThat(detector.sniffDelimiter("a,b;c\n1,2;3\n")).isEqualTo(',');
    }

    @Test
    void sniffDelimiter_shouldIgnoreDelimitersInsideQuotes() {
        String sample = "name;team\n\"Allen, Josh\";BUF\n\"Lamb, CeeDee\";DAL\n";

        assertThat(detector.sniffDelimiter(sample)).isEqualTo(';');
    }

    @Test
    void sniffDelimiter_shouldFallBackToCommaOnAmbiguityOrEmptyInput() {
        assertThat(detector.sniffDelimiter("")).isEqualTo(',');
        assertThat(detector.sniffDelimiter(null)).isEqualTo(',');
        assertThat(detector.sniffDelimiter("just one column\nanother\n")).isEqualTo(',');
        assertThat(detector.sniffDelimiter("a;b|c\n1;2|3\n")).isEqualTo(',');
    }
}
