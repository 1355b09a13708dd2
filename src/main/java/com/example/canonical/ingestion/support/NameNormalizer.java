package com.example.canonical.ingestion.support;

/**
 * Domain name/team normalization. Implementations are pure functions with no I/O.
 */
public interface NameNormalizer {

    String normalizeTeamCode(String raw);

    /**
     * Lower-cased canonical spelling; {@code DST} positions map to {@code "<TEAM> DST"}.
     */
    String normalizePlayerName(String raw, String position);
}
