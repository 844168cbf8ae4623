package com.roster.matching.api;

import com.roster.matching.core.model.MatchQuery;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.directory.DirectoryQuery;
import com.roster.matching.directory.PlayerDirectory;
import com.roster.matching.similarity.NameEquivalence;
import com.roster.matching.similarity.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Explains a failed registration by looking up every player in the league with
 * the same last name and reporting the clubs and series of those whose first
 * name is equivalent to the one entered.
 */
public class CorrectionSuggester {
    private static final Logger log = LoggerFactory.getLogger(CorrectionSuggester.class);

    private final PlayerDirectory directory;
    private final NameEquivalence nameEquivalence;

    public CorrectionSuggester(PlayerDirectory directory, NameEquivalence nameEquivalence) {
        this.directory = Objects.requireNonNull(directory, "directory is required");
        this.nameEquivalence = Objects.requireNonNull(nameEquivalence, "nameEquivalence is required");
    }

    public RegistrationSuggestion suggest(MatchQuery query) {
        if (NameNormalizer.normalize(query.lastName()).isEmpty() || query.leagueId().isBlank()) {
            return RegistrationSuggestion.none("A last name and league are required to look up players");
        }

        List<PlayerRecord> sameLastName = directory.query(DirectoryQuery.builder()
                        .lastName(query.lastName().trim())
                        .leagueId(query.leagueId().trim())
                        .build())
                .stream()
                .filter(p -> nameEquivalence.lastNameMatches(p.lastName(), query.lastName()))
                .toList();

        if (sameLastName.isEmpty()) {
            return RegistrationSuggestion.none(
                    "No players found with last name '" + query.lastName().trim() + "' in " + query.leagueId());
        }

        List<PlayerRecord> nameMatches = sameLastName.stream()
                .filter(p -> nameEquivalence.firstNameMatches(p.firstName(), query.firstName()))
                .toList();
        log.debug("suggestion.lookup sameLastName={} nameMatches={}", sameLastName.size(), nameMatches.size());

        if (nameMatches.isEmpty()) {
            return RegistrationSuggestion.none("Found players with last name '" + query.lastName().trim()
                    + "' but different first names. Please verify your first name, club, and series information.");
        }

        Set<String> clubs = new LinkedHashSet<>();
        Set<String> series = new LinkedHashSet<>();
        for (PlayerRecord player : nameMatches) {
            clubs.add(player.club());
            series.add(player.seriesCanonical());
        }

        String message;
        if (nameMatches.size() == 1) {
            PlayerRecord match = nameMatches.get(0);
            message = "Found '" + match.firstName() + " " + match.lastName() + "' at '" + match.club()
                    + "' in '" + match.seriesCanonical() + "'. You registered for '" + query.club()
                    + "' in '" + query.seriesRaw() + "'. Please verify your club and series information.";
        } else {
            message = "Found " + nameMatches.size() + " players with similar names. "
                    + "Please check if your club and series information is correct.";
        }

        return new RegistrationSuggestion(nameMatches,
                Collections.unmodifiableSet(clubs), Collections.unmodifiableSet(series), message);
    }
}
