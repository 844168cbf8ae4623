package com.roster.matching.series;

import com.roster.matching.core.model.LeagueFamily;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in series rules for the supported league families.
 *
 * <p>APTA Chicago keys look like {@code "Tennaqua - 19"}; NSTF keys look like
 * {@code "Tennaqua S2B"}. Each family starts with a pass-through rule for keys that
 * are already canonical for the given club, so normalization is idempotent.</p>
 */
public final class DefaultSeriesRules {

    private DefaultSeriesRules() {
        // Utility class
    }

    /**
     * Creates a normalizer with the rules of every family.
     */
    public static SeriesNormalizer createDefaultNormalizer() {
        return new SeriesNormalizer(getAllRules());
    }

    public static List<SeriesRule> getAllRules() {
        List<SeriesRule> rules = new ArrayList<>(getAptaChicagoRules());
        rules.addAll(getNstfRules());
        return List.copyOf(rules);
    }

    /**
     * APTA Chicago: "Chicago 19", "Series 19", "Division 19", "19" become "{club} - 19".
     */
    public static List<SeriesRule> getAptaChicagoRules() {
        return List.of(
                SeriesRule.builder()
                        .name("apta-canonical")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^(.+?) - (\\d+)$")
                        .extractor((m, club) -> m.group(1).equalsIgnoreCase(club)
                                ? Optional.of(aptaKey(club, m.group(2)))
                                : Optional.empty())
                        .build(),

                SeriesRule.builder()
                        .name("apta-chicago-prefix")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^Chicago ?(\\d+)$")
                        .extractor((m, club) -> Optional.of(aptaKey(club, m.group(1))))
                        .build(),

                SeriesRule.builder()
                        .name("apta-series-prefix")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^Series ?(\\d+)$")
                        .extractor((m, club) -> Optional.of(aptaKey(club, m.group(1))))
                        .build(),

                SeriesRule.builder()
                        .name("apta-division-prefix")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^Div(?:ision|\\.)? ?(\\d+)$")
                        .extractor((m, club) -> Optional.of(aptaKey(club, m.group(1))))
                        .build(),

                SeriesRule.builder()
                        .name("apta-bare-number")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^(\\d+)$")
                        .extractor((m, club) -> Optional.of(aptaKey(club, m.group(1))))
                        .build(),

                // Last number in the string wins, e.g. "Chicago 7 SW" -> 7
                SeriesRule.builder()
                        .name("apta-trailing-number")
                        .leagueFamily(LeagueFamily.APTA_CHICAGO)
                        .pattern("^.*?(\\d+)\\D*$")
                        .extractor((m, club) -> Optional.of(aptaKey(club, m.group(1))))
                        .build()
        );
    }

    /**
     * NSTF: "Series 2B", "S2B", "2B" become "{club} S2B".
     */
    public static List<SeriesRule> getNstfRules() {
        return List.of(
                SeriesRule.builder()
                        .name("nstf-canonical")
                        .leagueFamily(LeagueFamily.NSTF)
                        .pattern("^(.+?) S(\\d+[A-Z]*)$")
                        .extractor((m, club) -> m.group(1).equalsIgnoreCase(club)
                                ? Optional.of(nstfKey(club, m.group(2)))
                                : Optional.empty())
                        .build(),

                SeriesRule.builder()
                        .name("nstf-series-prefix")
                        .leagueFamily(LeagueFamily.NSTF)
                        .pattern("^Series ?(\\d+[A-Z]*)$")
                        .extractor((m, club) -> Optional.of(nstfKey(club, m.group(1))))
                        .build(),

                SeriesRule.builder()
                        .name("nstf-s-prefix")
                        .leagueFamily(LeagueFamily.NSTF)
                        .pattern("^S(\\d+[A-Z]*)$")
                        .extractor((m, club) -> Optional.of(nstfKey(club, m.group(1))))
                        .build(),

                SeriesRule.builder()
                        .name("nstf-bare-code")
                        .leagueFamily(LeagueFamily.NSTF)
                        .pattern("^(\\d+[A-Z]*)$")
                        .extractor((m, club) -> Optional.of(nstfKey(club, m.group(1))))
                        .build()
        );
    }

    static String aptaKey(String club, String number) {
        return club + " - " + stripLeadingZeros(number);
    }

    static String nstfKey(String club, String code) {
        return club + " S" + stripLeadingZeros(code).toUpperCase(Locale.ROOT);
    }

    private static String stripLeadingZeros(String code) {
        return code.replaceFirst("^0+(?=\\d)", "");
    }
}
