package com.roster.matching.series;

import com.roster.matching.core.model.LeagueFamily;
import com.roster.matching.similarity.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw series strings ("Chicago 19", "Series 2B", "19") to the canonical
 * per-family key used by the player directory.
 *
 * <p>Rules are tried in list order within the query's family; the first rule that
 * produces a key wins. The rule table is fixed at construction and the normalizer
 * holds no other state, so one instance can be shared across threads.</p>
 */
public class SeriesNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SeriesNormalizer.class);

    private final Map<LeagueFamily, List<SeriesRule>> rulesByFamily;

    public SeriesNormalizer(List<SeriesRule> rules) {
        Map<LeagueFamily, List<SeriesRule>> grouped = new EnumMap<>(LeagueFamily.class);
        for (SeriesRule rule : rules) {
            grouped.computeIfAbsent(rule.getLeagueFamily(), f -> new ArrayList<>()).add(rule);
        }
        Map<LeagueFamily, List<SeriesRule>> frozen = new EnumMap<>(LeagueFamily.class);
        grouped.forEach((family, list) -> frozen.put(family, List.copyOf(list)));
        this.rulesByFamily = Map.copyOf(frozen);
    }

    /**
     * Returns the ordered rules for a family.
     */
    public List<SeriesRule> getRules(LeagueFamily family) {
        return rulesByFamily.getOrDefault(family, List.of());
    }

    /**
     * Normalizes a raw series string for the given club and family.
     * Never throws for bad input: blank values and unmatched shapes return
     * {@link NormalizedSeries#failed(String)}.
     */
    public NormalizedSeries normalize(String raw, String club, LeagueFamily family) {
        String series = NameNormalizer.collapseWhitespace(raw);
        String clubName = NameNormalizer.collapseWhitespace(club);
        if (series.isEmpty() || clubName.isEmpty() || family == null) {
            return NormalizedSeries.failed(raw);
        }

        for (SeriesRule rule : getRules(family)) {
            Optional<String> key = rule.apply(series, clubName);
            if (key.isPresent()) {
                log.debug("Series rule '{}' mapped '{}' -> '{}'", rule.getName(), series, key.get());
                return NormalizedSeries.canonical(raw, key.get(), rule.getName());
            }
        }

        log.debug("series.unmatched raw='{}' club='{}' family={}", series, clubName, family);
        return NormalizedSeries.failed(raw);
    }
}
