package com.roster.matching.series;

import com.roster.matching.core.model.LeagueFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesNormalizerTest {

    private SeriesNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = DefaultSeriesRules.createDefaultNormalizer();
    }

    @Nested
    @DisplayName("APTA Chicago")
    class AptaChicago {

        @ParameterizedTest
        @DisplayName("Should map every supported raw form to the dash key")
        @CsvSource({
                "Chicago 19,apta-chicago-prefix",
                "Series 19,apta-series-prefix",
                "Division 19,apta-division-prefix",
                "Div. 19,apta-division-prefix",
                "19,apta-bare-number"
        })
        void testEquivalentForms(String raw, String expectedRule) {
            NormalizedSeries result = normalizer.normalize(raw, "Tennaqua", LeagueFamily.APTA_CHICAGO);

            assertFalse(result.isFailed());
            assertEquals("Tennaqua - 19", result.canonicalKey());
            assertEquals(expectedRule, result.ruleName());
        }

        @Test
        @DisplayName("Should ignore case and extra whitespace in series and club")
        void testWhitespaceAndCase() {
            assertEquals("Tennaqua - 19",
                    normalizer.normalize("  chicago   19 ", "  Tennaqua ", LeagueFamily.APTA_CHICAGO).canonicalKey());
            assertEquals("Lake Forest - 8",
                    normalizer.normalize("Series 8", "Lake   Forest", LeagueFamily.APTA_CHICAGO).canonicalKey());
        }

        @Test
        @DisplayName("Should take the last number from other shapes")
        void testTrailingNumber() {
            NormalizedSeries result = normalizer.normalize("Chicago 7 SW", "Tennaqua", LeagueFamily.APTA_CHICAGO);

            assertEquals("Tennaqua - 7", result.canonicalKey());
            assertEquals("apta-trailing-number", result.ruleName());
        }

        @Test
        @DisplayName("Should drop leading zeros")
        void testLeadingZeros() {
            assertEquals("Tennaqua - 7",
                    normalizer.normalize("Series 07", "Tennaqua", LeagueFamily.APTA_CHICAGO).canonicalKey());
        }

        @Test
        @DisplayName("Should fail for strings without a number")
        void testNoNumber() {
            NormalizedSeries result = normalizer.normalize("Series A", "Tennaqua", LeagueFamily.APTA_CHICAGO);

            assertTrue(result.isFailed());
            assertNull(result.canonicalKey());
            assertEquals("Series A", result.effectiveKey());
        }
    }

    @Nested
    @DisplayName("NSTF")
    class Nstf {

        @ParameterizedTest
        @DisplayName("Should map every supported raw form to the S-code key")
        @CsvSource({
                "Series 2B,nstf-series-prefix",
                "series 2b,nstf-series-prefix",
                "2B,nstf-bare-code",
                "S2B,nstf-s-prefix"
        })
        void testEquivalentForms(String raw, String expectedRule) {
            NormalizedSeries result = normalizer.normalize(raw, "Tennaqua", LeagueFamily.NSTF);

            assertEquals("Tennaqua S2B", result.canonicalKey());
            assertEquals(expectedRule, result.ruleName());
        }

        @Test
        @DisplayName("Should handle numeric-only codes")
        void testNumericCode() {
            assertEquals("Tennaqua S3", normalizer.normalize("Series 3", "Tennaqua", LeagueFamily.NSTF).canonicalKey());
        }

        @Test
        @DisplayName("Should fail for codes without a digit")
        void testNoDigit() {
            assertTrue(normalizer.normalize("Series A", "Tennaqua", LeagueFamily.NSTF).isFailed());
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class Idempotence {

        @ParameterizedTest
        @DisplayName("APTA canonical keys normalize to themselves")
        @ValueSource(strings = {"Chicago 19", "Series 19", "Division 19", "19", "Chicago 7 SW", "Series 3"})
        void testAptaIdempotent(String raw) {
            String key = normalizer.normalize(raw, "Tennaqua", LeagueFamily.APTA_CHICAGO).canonicalKey();
            NormalizedSeries again = normalizer.normalize(key, "Tennaqua", LeagueFamily.APTA_CHICAGO);

            assertEquals(key, again.canonicalKey());
            assertEquals("apta-canonical", again.ruleName());
        }

        @ParameterizedTest
        @DisplayName("NSTF canonical keys normalize to themselves")
        @ValueSource(strings = {"Series 2B", "2B", "S2B", "Series 3", "12"})
        void testNstfIdempotent(String raw) {
            String key = normalizer.normalize(raw, "Tennaqua", LeagueFamily.NSTF).canonicalKey();
            NormalizedSeries again = normalizer.normalize(key, "Tennaqua", LeagueFamily.NSTF);

            assertEquals(key, again.canonicalKey());
            assertEquals("nstf-canonical", again.ruleName());
        }

        @Test
        @DisplayName("Canonical keys for a club with a dash in its name stay intact")
        void testClubWithDash() {
            String club = "Lake Forest - North";
            String key = normalizer.normalize("Chicago 4", club, LeagueFamily.APTA_CHICAGO).canonicalKey();

            assertEquals("Lake Forest - North - 4", key);
            assertEquals(key, normalizer.normalize(key, club, LeagueFamily.APTA_CHICAGO).canonicalKey());
        }
    }

    @Test
    @DisplayName("Blank series or club never normalizes")
    void testBlankInputs() {
        assertTrue(normalizer.normalize("", "Tennaqua", LeagueFamily.APTA_CHICAGO).isFailed());
        assertTrue(normalizer.normalize(null, "Tennaqua", LeagueFamily.APTA_CHICAGO).isFailed());
        assertTrue(normalizer.normalize("Chicago 19", " ", LeagueFamily.APTA_CHICAGO).isFailed());
        assertEquals("Chicago 19", normalizer.normalize("Chicago 19", null, LeagueFamily.APTA_CHICAGO).effectiveKey());
    }

    @Test
    @DisplayName("Rules are kept per family in declaration order")
    void testRuleOrder() {
        List<String> aptaNames = normalizer.getRules(LeagueFamily.APTA_CHICAGO).stream()
                .map(SeriesRule::getName)
                .toList();

        assertEquals(List.of("apta-canonical", "apta-chicago-prefix", "apta-series-prefix",
                "apta-division-prefix", "apta-bare-number", "apta-trailing-number"), aptaNames);
        assertEquals("nstf-canonical", normalizer.getRules(LeagueFamily.NSTF).get(0).getName());
        assertTrue(normalizer.getRules(LeagueFamily.NSTF).stream()
                .allMatch(rule -> rule.getLeagueFamily() == LeagueFamily.NSTF));
        assertTrue(normalizer.getRules(LeagueFamily.APTA_CHICAGO).get(1).getPattern()
                .matcher("chicago 19").matches());
    }

    @Test
    @DisplayName("Families without rules always fail")
    void testMissingFamily() {
        SeriesNormalizer aptaOnly = new SeriesNormalizer(DefaultSeriesRules.getAptaChicagoRules());

        assertTrue(aptaOnly.normalize("Series 2B", "Tennaqua", LeagueFamily.NSTF).isFailed());
        assertTrue(aptaOnly.getRules(LeagueFamily.NSTF).isEmpty());
    }

    @Test
    @DisplayName("Earlier rules take precedence over later ones")
    void testCustomRulePrecedence() {
        SeriesRule sunday = SeriesRule.builder()
                .name("apta-sunday")
                .leagueFamily(LeagueFamily.APTA_CHICAGO)
                .pattern("^Chicago (\\d+) SW$")
                .extractor((m, club) -> java.util.Optional.of(club + " - " + m.group(1) + " SW"))
                .build();
        List<SeriesRule> rules = new java.util.ArrayList<>();
        rules.add(sunday);
        rules.addAll(DefaultSeriesRules.getAptaChicagoRules());

        SeriesNormalizer custom = new SeriesNormalizer(rules);

        assertEquals("Tennaqua - 7 SW",
                custom.normalize("Chicago 7 SW", "Tennaqua", LeagueFamily.APTA_CHICAGO).canonicalKey());
    }

    @Test
    @DisplayName("Rule builder requires every field")
    void testRuleBuilderValidation() {
        assertThrows(NullPointerException.class, () -> SeriesRule.builder()
                .name("incomplete")
                .leagueFamily(LeagueFamily.NSTF)
                .pattern("^x$")
                .build());
    }
}
