package com.example.canonical.ingestion.support;

import java.nio.charset.Charset;

/**
 * Charset chosen for a file, the number of BOM bytes to skip, and whether the choice was
 * backed by evidence (a BOM or a clean UTF-8 sample) rather than taken as the windows-1252 fallback.
 */
public record DetectedEncoding(Charset charset, int bomLength, boolean determined) {
}
