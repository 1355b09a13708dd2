package com.example.canonical.ingestion.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup tables shared by the registry and the coercer. NA tokens are stored
 * lower-cased and matched case-insensitively.
 */
public record ReferenceData(
        Set<String> naTokens,
        Map<String, String> teamAliases,
        Set<String> validTeams,
        Set<String> validPositions) {

    private static final Set<String> DEFAULT_NA_TOKENS = Set.of(
            "", "na", "n/a", "null", "none", "nan", "#n/a", "#na", "#null!", "--", "-", "undefined", "missing");

    private static final Map<String, String> DEFAULT_TEAM_ALIASES = Map.of(
            "BLT", "BAL",
            "ARZ", "ARI",
            "HST", "HOU",
            "LA", "LAR",
            "CLV", "CLE");

    private static final Set<String> DEFAULT_TEAMS = Set.of(
            "ARI", "ATL", "BAL", "BUF", "CAR", "CHI", "CIN", "CLE",
            "DAL", "DEN", "DET", "GB", "HOU", "IND", "JAX", "KC",
            "LAC", "LAR", "LV", "MIA", "MIN", "NE", "NO", "NYG",
            "NYJ", "PHI", "PIT", "SEA", "SF", "TB", "TEN", "WAS", "WSH");

    private static final Set<String> DEFAULT_POSITIONS = Set.of("QB", "RB", "WR", "TE", "DST", "K", "DEF", "PK");

    public ReferenceData {
        Set<String> lowered = new LinkedHashSet<>();
        naTokens.forEach(token -> lowered.add(token.trim().toLowerCase(Locale.ROOT)));
        naTokens = Collections.unmodifiableSet(lowered);
        teamAliases = Collections.unmodifiableMap(new LinkedHashMap<>(teamAliases));
        validTeams = Collections.unmodifiableSet(new LinkedHashSet<>(validTeams));
        validPositions = Collections.unmodifiableSet(new LinkedHashSet<>(validPositions));
    }

    public static ReferenceData defaults() {
        return new ReferenceData(DEFAULT_NA_TOKENS, DEFAULT_TEAM_ALIASES, DEFAULT_TEAMS, DEFAULT_POSITIONS);
    }

    public boolean isNullToken(String raw) {
        return raw == null || naTokens.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
