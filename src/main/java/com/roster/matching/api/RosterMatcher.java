package com.roster.matching.api;

import com.roster.matching.core.model.LeagueFamily;
import com.roster.matching.core.model.MatchQuery;
import com.roster.matching.core.model.MatchResult;
import com.roster.matching.core.model.PlayerRecord;
import com.roster.matching.directory.PlayerDirectory;
import com.roster.matching.logging.LogContext;
import com.roster.matching.metrics.MetricsService;
import com.roster.matching.metrics.NoOpMetricsService;
import com.roster.matching.series.DefaultSeriesRules;
import com.roster.matching.series.NormalizedSeries;
import com.roster.matching.series.SeriesNormalizer;
import com.roster.matching.series.SeriesRule;
import com.roster.matching.similarity.NameEquivalence;
import com.roster.matching.similarity.NicknameTable;
import com.roster.matching.tier.AmbiguityPolicy;
import com.roster.matching.tier.LoggingTierAttemptListener;
import com.roster.matching.tier.TierAttemptListener;
import com.roster.matching.tier.TierPlan;
import com.roster.matching.tier.TierResolver;
import com.roster.matching.tracing.NoOpTracingService;
import com.roster.matching.tracing.Span;
import com.roster.matching.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main entry point: resolves a user-supplied identity to one player in a league
 * directory snapshot.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * RosterMatcher matcher = RosterMatcher.builder()
 *     .directory(playerDirectory)
 *     .build();
 *
 * MatchResult result = matcher.resolve(MatchQuery.builder()
 *     .firstName("Bob").lastName("Smith")
 *     .club("Tennaqua").series("Chicago 19")
 *     .leagueId("APTA_CHICAGO")
 *     .build());
 *
 * result.getPlayerId().ifPresent(id -&gt; ...);
 * </pre>
 *
 * <p>Every resolution is independent: the matcher keeps no state between calls
 * and may be shared between threads. {@link MatchResult#unresolved()} and ambiguous
 * results are ordinary return values; only directory failures are thrown.</p>
 */
public class RosterMatcher {
    private static final Logger log = LoggerFactory.getLogger(RosterMatcher.class);

    private final TierResolver tierResolver;
    private final SeriesNormalizer seriesNormalizer;
    private final NameEquivalence nameEquivalence;
    private final CorrectionSuggester correctionSuggester;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private RosterMatcher(Builder builder) {
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        MatchOptions options = builder.options != null ? builder.options : MatchOptions.defaults();
        NicknameTable nicknames = builder.nicknameTable != null
                ? builder.nicknameTable : NicknameTable.defaults();
        this.nameEquivalence = new NameEquivalence(nicknames, options);

        this.seriesNormalizer = builder.seriesRules != null
                ? new SeriesNormalizer(builder.seriesRules) : DefaultSeriesRules.createDefaultNormalizer();

        TierPlan plan = builder.tierPlan != null ? builder.tierPlan : TierPlan.standard();

        List<TierAttemptListener> listeners = new ArrayList<>();
        listeners.add(new LoggingTierAttemptListener());
        listeners.addAll(builder.listeners);

        this.tierResolver = new TierResolver(builder.directory, seriesNormalizer, nameEquivalence,
                new AmbiguityPolicy(), plan, listeners, metricsService);
        this.correctionSuggester = new CorrectionSuggester(builder.directory, nameEquivalence);

        log.info("RosterMatcher initialized: tiers={}, nicknameGroups={}, fuzzyThreshold={}",
                plan.size(), nicknames.groupCount(), options.getFuzzyThreshold());
    }

    /**
     * Resolves a query to a single player, an ambiguous candidate set, or nothing.
     *
     * @throws RuntimeException whatever the player directory throws, unchanged
     */
    public MatchResult resolve(MatchQuery query) {
        Objects.requireNonNull(query, "query is required");
        long start = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ctx = LogContext.forResolution(correlationId, query.leagueId())
                .with("leagueFamily", query.leagueFamily().name());
             Span span = tracingService.startSpan("roster.resolve", Map.of("leagueId", query.leagueId()))) {
            log.info("Resolving player: '{} {}' (club: '{}', series: '{}', league: {})",
                    query.firstName(), query.lastName(), query.club(), query.seriesRaw(), query.leagueId());
            MatchResult result;
            try {
                result = tierResolver.resolve(query);
            } catch (RuntimeException e) {
                span.setStatus(Span.SpanStatus.ERROR);
                span.recordException(e);
                log.error("player.resolution.failed error={}", e.getMessage());
                throw e;
            }

            span.setAttribute("outcome", result.outcome().name());
            span.setAttribute("candidates", result.candidates().size());
            if (result.tier() != null) {
                span.setAttribute("tier", result.tier().name());
            }
            span.setStatus(Span.SpanStatus.OK);
            recordDuration(query, result, Duration.ofNanos(System.nanoTime() - start));

            log.info("player.resolution outcome={} tier={} playerId={} candidates={} player={}",
                    result.outcome(), result.tier(), result.getPlayerId().orElse(null),
                    result.candidates().size(), result.getPlayer().map(PlayerRecord::displayText).orElse(null));
            return result;
        }
    }

    private void recordDuration(MatchQuery query, MatchResult result, Duration duration) {
        try {
            metricsService.recordResolutionDuration(query.leagueFamily(), result.outcome(), duration);
        } catch (RuntimeException e) {
            log.warn("resolution.metrics.failed outcome={} error={}", result.outcome(), e.getMessage(), e);
        }
    }

    /**
     * Looks up same-last-name players to explain an unresolved or ambiguous registration.
     */
    public RegistrationSuggestion suggestCorrections(MatchQuery query) {
        Objects.requireNonNull(query, "query is required");
        try (LogContext ctx = LogContext.forSuggestion(LogContext.generateCorrelationId(), query.leagueId())) {
            RegistrationSuggestion suggestion = correctionSuggester.suggest(query);
            log.info("registration.suggestions matches={} clubs={} series={}",
                    suggestion.nameMatches().size(), suggestion.clubSuggestions(),
                    suggestion.seriesSuggestions());
            return suggestion;
        }
    }

    /**
     * Converts a user-facing series name to the directory's key for a club and league.
     */
    public NormalizedSeries normalizeSeries(String seriesRaw, String club, String leagueId) {
        return seriesNormalizer.normalize(seriesRaw, club, LeagueFamily.forLeagueId(leagueId));
    }

    public NameEquivalence getNameEquivalence() {
        return nameEquivalence;
    }

    public SeriesNormalizer getSeriesNormalizer() {
        return seriesNormalizer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PlayerDirectory directory;
        private MatchOptions options;
        private NicknameTable nicknameTable;
        private List<SeriesRule> seriesRules;
        private TierPlan tierPlan;
        private final List<TierAttemptListener> listeners = new ArrayList<>();
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder directory(PlayerDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Builder options(MatchOptions options) {
            this.options = options;
            return this;
        }

        public Builder nicknameTable(NicknameTable nicknameTable) {
            this.nicknameTable = nicknameTable;
            return this;
        }

        /**
         * Replaces the built-in series rules. Order within a family is precedence.
         */
        public Builder seriesRules(List<SeriesRule> seriesRules) {
            this.seriesRules = List.copyOf(seriesRules);
            return this;
        }

        public Builder tierPlan(TierPlan tierPlan) {
            this.tierPlan = tierPlan;
            return this;
        }

        /**
         * Adds a tier listener after the built-in logging listener.
         */
        public Builder tierAttemptListener(TierAttemptListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener is required"));
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public RosterMatcher build() {
            Objects.requireNonNull(directory, "directory is required");
            return new RosterMatcher(this);
        }
    }
}
