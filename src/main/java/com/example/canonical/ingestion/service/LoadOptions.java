package com.example.canonical.ingestion.service;

import com.example.canonical.ingestion.model.LoadMode;

/**
 * Per-file load parameters: row handling mode and the number of metadata lines that precede
 * the header.
 */
public record LoadOptions(LoadMode mode, int skipLines) {

    public LoadOptions {
        mode = mode == null ? LoadMode.LENIENT : mode;
        if (skipLines < 0) {
            throw new IllegalArgumentException("skipLines must be >= 0");
        }
    }

    public static LoadOptions lenient() {
        return new LoadOptions(LoadMode.LENIENT, 0);
    }

    public static LoadOptions strict() {
        return new LoadOptions(LoadMode.STRICT, 0);
    }

    public LoadOptions withSkipLines(int lines) {
        return new LoadOptions(mode, lines);
    }

    public boolean strictMode() {
        return mode == LoadMode.STRICT;
    }
}
