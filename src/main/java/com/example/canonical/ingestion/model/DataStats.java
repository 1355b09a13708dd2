package com.example.canonical.ingestion.model;

public record DataStats(
        int filesProcessed,
        int successfulLoads,
        int failedLoads,
        long rowsRead,
        long rowsParsed,
        long rowsQuarantined,
        long coercions,
        long nulls,
        long duplicates,
        double quarantineRatio) {

    public static final DataStats EMPTY = new DataStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0.0);
}
