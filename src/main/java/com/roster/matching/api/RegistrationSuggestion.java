package com.roster.matching.api;

import com.roster.matching.core.model.PlayerRecord;

import java.util.List;
import java.util.Set;

/**
 * Hints for a user whose registration did not resolve to a single player.
 *
 * @param nameMatches       directory players with the same last name and an equivalent first name
 * @param clubSuggestions   clubs of those players, in directory order
 * @param seriesSuggestions series keys of those players, in directory order
 * @param message           caller-facing explanation
 */
public record RegistrationSuggestion(
        List<PlayerRecord> nameMatches,
        Set<String> clubSuggestions,
        Set<String> seriesSuggestions,
        String message
) {
    public RegistrationSuggestion {
        nameMatches = nameMatches != null ? List.copyOf(nameMatches) : List.of();
        clubSuggestions = clubSuggestions != null ? clubSuggestions : Set.of();
        seriesSuggestions = seriesSuggestions != null ? seriesSuggestions : Set.of();
    }

    public static RegistrationSuggestion none(String message) {
        return new RegistrationSuggestion(List.of(), Set.of(), Set.of(), message);
    }

    public boolean hasSuggestions() {
        return !nameMatches.isEmpty();
    }
}
