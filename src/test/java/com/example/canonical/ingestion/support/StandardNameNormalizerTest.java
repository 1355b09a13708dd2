package com.example.canonical.ingestion.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StandardNameNormalizerTest {

    private final StandardNameNormalizer normalizer = new StandardNameNormalizer();

    @Test
    void normalizeTeamCode_shouldResolveAliasesAndNames() {
        assertThat(normalizer.normalizeTeamCode("ARZ")).isEqualTo("ARI");
        assertThat(normalizer.normalizeTeamCode(" jac ")).isEqualTo("JAX");
        assertThat(normalizer.normalizeTeamCode("Kansas City Chiefs")).isEqualTo("KC");
        assertThat(normalizer.normalizeTeamCode("49ers")).isEqualTo("SF");
        assertThat(normalizer.normalizeTeamCode("kc")).isEqualTo("KC");
    }

    @Test
    void normalizeTeamCode_shouldReturnEmptyForBlankInput() {
        assertThat(normalizer.normalizeTeamCode(null)).isEmpty();
        assertThat(normalizer.normalizeTeamCode("  ")).isEmpty();
    }

    @Test
    void normalizePlayerName_shouldStripSuffixesAndPunctuation() {
        assertThat(normalizer.normalizePlayerName("Patrick Mahomes II", "QB")).isEqualTo("patrick mahomes");
        assertThat(normalizer.normalizePlayerName("  Ja'Marr   Chase ", "WR")).isEqualTo("ja'marr chase");
        assertThat(normalizer.normalizePlayerName("Amon-Ra St. Brown", "WR")).isEqualTo("amon-ra st brown");
    }

    @Test
    void normalizePlayerName_shouldMapKnownVariations() {
        assertThat(normalizer.normalizePlayerName("D.J. Moore", "WR")).isEqualTo("dj moore");
        assertThat(normalizer.normalizePlayerName("Marvin Harrison Jr.", "WR")).isEqualTo("marvin harrison jr");
        assertThat(normalizer.normalizePlayerName("Kenneth Walker III", "RB")).isEqualTo("kenneth walker iii");
    }

    @Test
    void normalizePlayerName_shouldBuildDefenseNames() {
        assertThat(normalizer.normalizePlayerName("Ravens", "DST")).isEqualTo("BAL DST");
        assertThat(normalizer.normalizePlayerName("San Francisco 49ers Defense", "DST")).isEqualTo("SF DST");
        assertThat(normalizer.normalizePlayerName("PHI DST", "dst")).isEqualTo("PHI DST");
    }
}
