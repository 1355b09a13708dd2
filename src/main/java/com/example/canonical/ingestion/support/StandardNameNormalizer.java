package com.example.canonical.ingestion.support;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Dictionary-backed normalizer for NFL team codes and player names.
 */
@Component
public class StandardNameNormalizer implements NameNormalizer {

    private static final Pattern DEFENSE_SUFFIX = Pattern.compile("\\s+(dst|defense|def)$");
    private static final Pattern NAME_SUFFIX = Pattern.compile("\\s+(jr\\.?|sr\\.?|iii|ii|iv|v)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^\\w\\s'-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MAX_CODE_LENGTH = 3;

    private static final Map<String, String> TEAM_CODE_ALIASES = Map.ofEntries(
            Map.entry("ARZ", "ARI"),
            Map.entry("BLT", "BAL"),
            Map.entry("CLV", "CLE"),
            Map.entry("HST", "HOU"),
            Map.entry("JAC", "JAX"),
            Map.entry("LA", "LAR"),
            Map.entry("NY", "NYG"),
            Map.entry("SD", "LAC"),
            Map.entry("STL", "LAR"),
            Map.entry("WSH", "WAS"));

    private static final Map<String, String> TEAM_NAMES = buildTeamNames();

    private static final Map<String, List<String>> NAME_VARIATIONS = Map.of(
            "kenneth walker iii", List.of("kenneth walker", "ken walker"),
            "marvin harrison jr", List.of("marvin harrison jr.", "marvin harrison"),
            "michael pittman jr", List.of("michael pittman jr.", "michael pittman"),
            "dj moore", List.of("d.j. moore", "dj moore"),
            "aj brown", List.of("a.j. brown", "aj brown"),
            "dk metcalf", List.of("d.k. metcalf", "dk metcalf"),
            "cd lamb", List.of("ceedee lamb", "c.d. lamb"),
            "jk dobbins", List.of("j.k. dobbins", "jk dobbins"),
            "tj hockenson", List.of("t.j. hockenson", "tj hockenson"));

    private final Map<String, String> variationToCanonical = new HashMap<>();

    public StandardNameNormalizer() {
        NAME_VARIATIONS.forEach((canonical, variations) ->
                variations.forEach(variation -> variationToCanonical.put(variation, canonical)));
    }

    @Override
    public String normalizeTeamCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String team = raw.strip().toUpperCase(Locale.ROOT);
        String alias = TEAM_CODE_ALIASES.get(team);
        if (alias != null) {
            return alias;
        }
        if (team.length() <= MAX_CODE_LENGTH) {
            return team;
        }
        return TEAM_NAMES.getOrDefault(team.toLowerCase(Locale.ROOT), team);
    }

    @Override
    public String normalizePlayerName(String raw, String position) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        if (isDefense(position)) {
            return normalizeDefenseName(raw);
        }

        String name = NAME_SUFFIX.matcher(raw.strip()).replaceAll("");
        name = WHITESPACE.matcher(name).replaceAll(" ").strip();
        String lower = name.toLowerCase(Locale.ROOT);

        String canonical = variationToCanonical.get(lower);
        if (canonical != null) {
            return canonical;
        }
        return NON_NAME_CHARS.matcher(name).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private String normalizeDefenseName(String raw) {
        String lower = raw.strip().toLowerCase(Locale.ROOT);
        String cleaned = DEFENSE_SUFFIX.matcher(lower).replaceAll("").strip();

        String code = TEAM_NAMES.get(cleaned);
        if (code == null) {
            code = TEAM_CODE_ALIASES.get(cleaned.toUpperCase(Locale.ROOT));
        }
        if (code == null && !cleaned.isEmpty() && cleaned.length() <= MAX_CODE_LENGTH) {
            code = normalizeTeamCode(cleaned);
        }
        if (code != null) {
            return code + " DST";
        }
        return lower.endsWith("dst") ? raw.strip() : raw.strip() + " DST";
    }

    private static boolean isDefense(String position) {
        return position != null && "DST".equalsIgnoreCase(position.strip());
    }

    private static Map<String, String> buildTeamNames() {
        Map<String, String> names = new HashMap<>();
        String[][] teams = {
            { "ARI", "arizona cardinals", "cardinals", "arizona" },
            { "ATL", "atlanta falcons", "falcons", "atlanta" },
            { "BAL", "baltimore ravens", "ravens", "baltimore" },
            { "BUF", "buffalo bills", "bills", "buffalo" },
            { "CAR", "carolina panthers", "panthers", "carolina" },
            { "CHI", "chicago bears", "bears", "chicago" },
            { "CIN", "cincinnati bengals", "bengals", "cincinnati" },
            { "CLE", "cleveland browns", "browns", "cleveland" },
            { "DAL", "dallas cowboys", "cowboys", "dallas" },
            { "DEN", "denver broncos", "broncos", "denver" },
            { "DET", "detroit lions", "lions", "detroit" },
            { "GB", "green bay packers", "packers", "green bay" },
            { "HOU", "houston texans", "texans", "houston" },
            { "IND", "indianapolis colts", "colts", "indianapolis" },
            { "JAX", "jacksonville jaguars", "jaguars", "jacksonville" },
            { "KC", "kansas city chiefs", "chiefs", "kansas city" },
            { "LV", "las vegas raiders", "raiders", "las vegas", "oakland" },
            { "LAC", "los angeles chargers", "chargers", "la chargers" },
            { "LAR", "los angeles rams", "rams", "la rams", "los angeles" },
            { "MIA", "miami dolphins", "dolphins", "miami" },
            { "MIN", "minnesota vikings", "vikings", "minnesota" },
            { "NE", "new england patriots", "patriots", "new england" },
            { "NO", "new orleans saints", "saints", "new orleans" },
            { "NYG", "new york giants", "giants", "ny giants", "new york" },
            { "NYJ", "new york jets", "jets", "ny jets" },
            { "PHI", "philadelphia eagles", "eagles", "philadelphia", "philly" },
            { "PIT", "pittsburgh steelers", "steelers", "pittsburgh" },
            { "SF", "san francisco 49ers", "49ers", "niners", "san francisco", "san fran" },
            { "SEA", "seattle seahawks", "seahawks", "seattle" },
            { "TB", "tampa bay buccaneers", "buccaneers", "bucs", "tampa bay", "tampa" },
            { "TEN", "tennessee titans", "titans", "tennessee" },
            { "WAS", "washington commanders", "commanders", "washington", "dc" },
        };
        for (String[] team : teams) {
            for (int i = 1; i < team.length; i++) {
                names.put(team[i], team[0]);
            }
        }
        return Map.copyOf(names);
    }
}
