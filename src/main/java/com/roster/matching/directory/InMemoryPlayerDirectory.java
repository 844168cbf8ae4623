package com.roster.matching.directory;

import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.similarity.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable in-memory directory snapshot indexed by league and last name.
 * Suitable for tests and for callers that hold a snapshot in memory.
 *
 * <p>League, last name, club and series are compared in {@link NameNormalizer} form.
 * The advisory first name is ignored.</p>
 */
public class InMemoryPlayerDirectory implements PlayerDirectory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPlayerDirectory.class);

    private final Map<IndexKey, List<PlayerRecord>> index;
    private final int size;

    public InMemoryPlayerDirectory(Collection<PlayerRecord> players) {
        Map<IndexKey, List<PlayerRecord>> building = new HashMap<>();
        for (PlayerRecord player : players) {
            building.computeIfAbsent(IndexKey.of(player.leagueId(), player.lastName()), k -> new ArrayList<>())
                    .add(player);
        }
        Map<IndexKey, List<PlayerRecord>> frozen = new HashMap<>();
        building.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.index = Map.copyOf(frozen);
        this.size = players.size();
        log.debug("InMemoryPlayerDirectory loaded: players={}, keys={}", size, index.size());
    }

    public static InMemoryPlayerDirectory of(PlayerRecord... players) {
        return new InMemoryPlayerDirectory(List.of(players));
    }

    @Override
    public List<PlayerRecord> query(DirectoryQuery query) {
        List<PlayerRecord> bucket = index.getOrDefault(IndexKey.of(query.leagueId(), query.lastName()), List.of());
        if (bucket.isEmpty()) {
            return List.of();
        }
        String club = query.getClub().map(NameNormalizer::normalize).orElse(null);
        String series = query.getSeriesCanonical().map(NameNormalizer::normalize).orElse(null);

        return bucket.stream()
                .filter(p -> club == null || club.equals(NameNormalizer.normalize(p.club())))
                .filter(p -> series == null || series.equals(NameNormalizer.normalize(p.seriesCanonical())))
                .toList();
    }

    public int size() {
        return size;
    }

    private record IndexKey(String leagueId, String lastName) {
        static IndexKey of(String leagueId, String lastName) {
            return new IndexKey(NameNormalizer.normalize(leagueId), NameNormalizer.normalize(lastName));
        }
    }
}
