package com.roster.matching.tier;

import com.roster.matching.core.model.MatchQuery;
import com.roster.matching.core.model.MatchResult;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.directory.DirectoryQuery;
import com.roster.matching.directory.PlayerDirectory;
import com.roster.matching.metrics.MetricsService;
import com.roster.matching.metrics.NoOpMetricsService;
import com.roster.matching.series.NormalizedSeries;
import com.roster.matching.series.SeriesNormalizer;
import com.roster.matching.similarity.NameEquivalence;
import com.roster.matching.similarity.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a {@link TierPlan} against a {@link PlayerDirectory}.
 *
 * <p>Tiers are attempted in plan order. A tier with exactly one candidate ends the
 * resolution; a tier with several candidates is remembered and the next tier is
 * tried; {@link AmbiguityPolicy} turns the attempted tiers into the final result.
 * The directory is queried at most once per tier and its exceptions propagate
 * unchanged.</p>
 *
 * <p>Instances hold only immutable collaborators and may be shared between threads.</p>
 */
public class TierResolver {
    private static final Logger log = LoggerFactory.getLogger(TierResolver.class);

    private final PlayerDirectory directory;
    private final SeriesNormalizer seriesNormalizer;
    private final NameEquivalence nameEquivalence;
    private final AmbiguityPolicy ambiguityPolicy;
    private final TierPlan plan;
    private final List<TierAttemptListener> listeners;
    private final MetricsService metricsService;

    public TierResolver(PlayerDirectory directory, SeriesNormalizer seriesNormalizer,
                        NameEquivalence nameEquivalence) {
        this(directory, seriesNormalizer, nameEquivalence, new AmbiguityPolicy(), TierPlan.standard(),
                List.of(new LoggingTierAttemptListener()), new NoOpMetricsService());
    }

    public TierResolver(PlayerDirectory directory, SeriesNormalizer seriesNormalizer,
                        NameEquivalence nameEquivalence, AmbiguityPolicy ambiguityPolicy, TierPlan plan,
                        List<TierAttemptListener> listeners, MetricsService metricsService) {
        this.directory = Objects.requireNonNull(directory, "directory is required");
        this.seriesNormalizer = Objects.requireNonNull(seriesNormalizer, "seriesNormalizer is required");
        this.nameEquivalence = Objects.requireNonNull(nameEquivalence, "nameEquivalence is required");
        this.ambiguityPolicy = Objects.requireNonNull(ambiguityPolicy, "ambiguityPolicy is required");
        this.plan = Objects.requireNonNull(plan, "plan is required");
        this.listeners = List.copyOf(listeners);
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    public MatchResult resolve(MatchQuery query) {
        List<TierOutcome> outcomes = new ArrayList<>(plan.size());
        for (TierConstraints tierConstraints : plan.tiers()) {
            TierOutcome outcome = attempt(tierConstraints, query);
            outcomes.add(outcome);
            publish(query, outcome);
            if (outcome.isUnique()) {
                break;
            }
        }
        return ambiguityPolicy.finalizeOutcome(outcomes);
    }

    TierOutcome attempt(TierConstraints tierConstraints, MatchQuery query) {
        if (!isSatisfiable(tierConstraints, query)) {
            return TierOutcome.skipped(tierConstraints);
        }

        String seriesUsed = null;
        boolean seriesFallback = false;
        if (tierConstraints.uses(Constraint.SERIES)) {
            NormalizedSeries series = seriesNormalizer.normalize(query.seriesRaw(), query.club(),
                    query.leagueFamily());
            seriesFallback = series.isFailed();
            seriesUsed = series.effectiveKey();
        }

        DirectoryQuery directoryQuery = DirectoryQuery.builder()
                .firstName(tierConstraints.uses(Constraint.FIRST_NAME) ? query.firstName().trim() : null)
                .lastName(query.lastName().trim())
                .club(tierConstraints.uses(Constraint.CLUB) ? NameNormalizer.collapseWhitespace(query.club()) : null)
                .seriesCanonical(seriesUsed)
                .leagueId(query.leagueId().trim())
                .build();

        List<PlayerRecord> found = directory.query(directoryQuery);
        List<PlayerRecord> candidates = filterCandidates(found, tierConstraints, query);

        return new TierOutcome(tierConstraints.tier(), tierConstraints.constraints(), candidates,
                seriesUsed, seriesFallback, false);
    }

    private boolean isSatisfiable(TierConstraints tierConstraints, MatchQuery query) {
        if (NameNormalizer.normalize(query.lastName()).isEmpty() || query.leagueId().isBlank()) {
            return false;
        }
        if (tierConstraints.uses(Constraint.FIRST_NAME) && NameNormalizer.normalize(query.firstName()).isEmpty()) {
            return false;
        }
        if (tierConstraints.uses(Constraint.CLUB) && query.club().isBlank()) {
            return false;
        }
        return !tierConstraints.uses(Constraint.SERIES) || !query.seriesRaw().isBlank();
    }

    private List<PlayerRecord> filterCandidates(List<PlayerRecord> found, TierConstraints tierConstraints,
                                                MatchQuery query) {
        boolean checkFirstName = tierConstraints.uses(Constraint.FIRST_NAME);
        Set<String> seenIds = new HashSet<>();
        List<PlayerRecord> candidates = new ArrayList<>();
        for (PlayerRecord player : found) {
            if (!nameEquivalence.lastNameMatches(player.lastName(), query.lastName())) {
                continue;
            }
            if (checkFirstName && !nameEquivalence.firstNameMatches(player.firstName(), query.firstName())) {
                continue;
            }
            if (seenIds.add(player.playerId())) {
                candidates.add(player);
            }
        }
        return candidates;
    }

    private void publish(MatchQuery query, TierOutcome outcome) {
        try {
            metricsService.incrementTierAttempt(outcome.tier(), outcome.resultLabel());
            if (outcome.seriesFallback()) {
                metricsService.incrementSeriesNormalizationFailed(query.leagueFamily());
            }
        } catch (RuntimeException e) {
            log.warn("tier.metrics.failed tier={} error={}", outcome.tier(), e.getMessage(), e);
        }
        for (TierAttemptListener listener : listeners) {
            try {
                listener.onTierAttempt(query, outcome);
            } catch (RuntimeException e) {
                log.warn("tier.listener.failed tier={} listener={} error={}",
                        outcome.tier(), listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
