package com.mediaplatform.decision.engine;

import com.mediaplatform.common.blocklist.BlocklistGate;
import com.mediaplatform.common.blocklist.BlocklistScope;
import com.mediaplatform.common.blocklist.BlocklistVerdict;
import com.mediaplatform.common.decision.DecisionOptions;
import com.mediaplatform.common.decision.DecisionResult;
import com.mediaplatform.common.decision.MajorityBenefitRule;
import com.mediaplatform.common.decision.RejectionType;
import com.mediaplatform.common.decision.UpgradeClassifier;
import com.mediaplatform.common.decision.UpgradeStats;
import com.mediaplatform.common.decision.UpgradeStatsAccumulator;
import com.mediaplatform.common.decision.UpgradeStatus;
import com.mediaplatform.common.exception.CollaboratorException;
import com.mediaplatform.common.model.Episode;
import com.mediaplatform.common.model.ExistingFile;
import com.mediaplatform.common.model.Movie;
import com.mediaplatform.common.model.ReleaseCandidate;
import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.model.Series;
import com.mediaplatform.common.repository.MediaRepository;
import com.mediaplatform.common.scoring.ScoreResult;
import com.mediaplatform.common.scoring.ScoringContext;
import com.mediaplatform.common.scoring.ScoringOracle;
import com.mediaplatform.common.scoring.UpgradeComparison;
import com.mediaplatform.common.scoring.UpgradeOptions;
import com.mediaplatform.common.trace.TraceContextUtil;
import com.mediaplatform.decision.logger.DecisionFlowLogger;
import com.mediaplatform.decision.profile.ProfileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Central release decision engine. Every grab (manual, automatic, RSS) goes through it so
 * upgrade behaviour stays consistent across movies, episodes, seasons and series.
 *
 * <h3>Evaluation template (all entry points)</h3>
 * <ol>
 *   <li>Resolve scope (movie, episode, or a set of episodes of one series)</li>
 *   <li>Blocklist check, unless {@code force} or {@code skipBlocklist}</li>
 *   <li>Resolve the effective profile via {@link ProfileResolver}</li>
 *   <li>Force path: accept without scoring</li>
 *   <li>No existing file: score the candidate alone (ban / size / minimum gates)</li>
 *   <li>Single scopes: same-hash short-circuit, upgrades-disabled gate, score comparison</li>
 *   <li>Aggregate scopes: score the pack once, compare per episode, majority-benefit rule</li>
 * </ol>
 *
 * <p>The engine holds no mutable state and performs no writes. It is safe to call
 * concurrently. Two evaluations racing for the same media both see the same existing-file
 * snapshot and may both accept; serialising actual grabs belongs to the download queue.
 *
 * <p>{@code upgradeUntilScore} is never consulted here. It throttles searching (see the
 * cutoff-unmet specifications); a candidate that was found is judged on its own merits.
 *
 * <p>Every entry point has an overload taking the caller's trace id, so stage logs line up
 * with the caller's own log lines; the shorter overloads mint a fresh id.
 *
 * <p>No entry point throws: any {@link RuntimeException} becomes an
 * {@link RejectionType#ERROR} rejection carrying the exception message.
 */
public class ReleaseDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(ReleaseDecisionEngine.class);

    static final String SEASON_PACK   = "Season pack";
    static final String SERIES_PACK   = "Series pack";
    static final String MULTI_EPISODE = "Multi-episode release";

    private final MediaRepository repository;
    private final ScoringOracle scoringOracle;
    private final BlocklistGate blocklistGate;
    private final ProfileResolver profileResolver;
    private final DecisionFlowLogger flowLogger;
    private final boolean allowSidegradeDefault;

    public ReleaseDecisionEngine(MediaRepository repository, ScoringOracle scoringOracle,
                                 BlocklistGate blocklistGate, ProfileResolver profileResolver,
                                 DecisionFlowLogger flowLogger, boolean allowSidegradeDefault) {
        this.repository = repository;
        this.scoringOracle = scoringOracle;
        this.blocklistGate = blocklistGate;
        this.profileResolver = profileResolver;
        this.flowLogger = flowLogger;
        this.allowSidegradeDefault = allowSidegradeDefault;
    }

    // ── Entry points ─────────────────────────────────────────────────────────

    public DecisionResult evaluateForMovie(String movieId, ReleaseCandidate release) {
        return evaluateForMovie(movieId, release, DecisionOptions.defaults());
    }

    public DecisionResult evaluateForMovie(String movieId, ReleaseCandidate release, DecisionOptions options) {
        return evaluateForMovie(movieId, release, options, TraceContextUtil.newTraceId());
    }

    public DecisionResult evaluateForMovie(String movieId, ReleaseCandidate release, DecisionOptions options,
                                           String traceId) {
        return evaluate(traceId, "movie", movieId, release, options, ctx -> movieDecision(ctx, movieId));
    }

    public DecisionResult evaluateForEpisode(String episodeId, ReleaseCandidate release) {
        return evaluateForEpisode(episodeId, release, DecisionOptions.defaults());
    }

    public DecisionResult evaluateForEpisode(String episodeId, ReleaseCandidate release, DecisionOptions options) {
        return evaluateForEpisode(episodeId, release, options, TraceContextUtil.newTraceId());
    }

    public DecisionResult evaluateForEpisode(String episodeId, ReleaseCandidate release, DecisionOptions options,
                                             String traceId) {
        return evaluate(traceId, "episode", episodeId, release, options, ctx -> episodeDecision(ctx, episodeId));
    }

    public DecisionResult evaluateForSeason(String seriesId, int seasonNumber, ReleaseCandidate release) {
        return evaluateForSeason(seriesId, seasonNumber, release, DecisionOptions.defaults());
    }

    /**
     * Evaluates a season pack against every episode of {@code seasonNumber}.
     */
    public DecisionResult evaluateForSeason(String seriesId, int seasonNumber, ReleaseCandidate release,
                                            DecisionOptions options) {
        return evaluateForSeason(seriesId, seasonNumber, release, options, TraceContextUtil.newTraceId());
    }

    public DecisionResult evaluateForSeason(String seriesId, int seasonNumber, ReleaseCandidate release,
                                            DecisionOptions options, String traceId) {
        return evaluate(traceId, "season", seriesId + ":S" + seasonNumber, release, options,
            ctx -> seriesPackDecision(ctx, seriesId, SEASON_PACK,
                () -> repository.getEpisodesBySeason(seriesId, seasonNumber),
                "No episodes found in season"));
    }

    public DecisionResult evaluateForSeries(String seriesId, ReleaseCandidate release) {
        return evaluateForSeries(seriesId, release, DecisionOptions.defaults());
    }

    /**
     * Evaluates a multi-season or complete-series release against every episode of the series.
     */
    public DecisionResult evaluateForSeries(String seriesId, ReleaseCandidate release, DecisionOptions options) {
        return evaluateForSeries(seriesId, release, options, TraceContextUtil.newTraceId());
    }

    public DecisionResult evaluateForSeries(String seriesId, ReleaseCandidate release, DecisionOptions options,
                                            String traceId) {
        return evaluate(traceId, "series", seriesId, release, options,
            ctx -> seriesPackDecision(ctx, seriesId, SERIES_PACK,
                () -> repository.getEpisodesBySeries(seriesId),
                "No episodes found in series"));
    }

    public DecisionResult evaluateForEpisodes(List<String> episodeIds, ReleaseCandidate release) {
        return evaluateForEpisodes(episodeIds, release, DecisionOptions.defaults());
    }

    /**
     * Evaluates a release covering exactly the given episodes. A single id delegates to
     * {@link #evaluateForEpisode} so the same-hash and sidegrade handling of the
     * single-file path applies.
     */
    public DecisionResult evaluateForEpisodes(List<String> episodeIds, ReleaseCandidate release,
                                              DecisionOptions options) {
        return evaluateForEpisodes(episodeIds, release, options, TraceContextUtil.newTraceId());
    }

    public DecisionResult evaluateForEpisodes(List<String> episodeIds, ReleaseCandidate release,
                                              DecisionOptions options, String traceId) {
        List<String> distinctIds = episodeIds == null
            ? List.of()
            : episodeIds.stream().filter(Objects::nonNull).distinct().toList();
        if (distinctIds.size() == 1) {
            return evaluateForEpisode(distinctIds.get(0), release, options, traceId);
        }
        return evaluate(traceId, "episodes", distinctIds.size() + " ids", release, options,
            ctx -> episodeSetDecision(ctx, distinctIds));
    }

    // ── Boundary ─────────────────────────────────────────────────────────────

    /** Per-call state threaded through one evaluation. */
    private record Evaluation(String traceId, ReleaseCandidate release, DecisionOptions options,
                              boolean allowSidegrade) {}

    private DecisionResult evaluate(String traceId, String scopeKind, String scopeId, ReleaseCandidate release,
                                    DecisionOptions options, Function<Evaluation, DecisionResult> decision) {
        String title = release != null ? release.title() : null;
        try {
            if (release == null) {
                throw new IllegalArgumentException("release must not be null");
            }
            DecisionOptions effective = options != null ? options : DecisionOptions.defaults();
            flowLogger.logStage(DecisionFlowLogger.EVALUATION_STARTED, traceId,
                "scope=" + scopeKind + " id=" + scopeId + " release=\"" + title + "\"");

            Evaluation ctx = new Evaluation(traceId, release, effective,
                effective.allowSidegradeOr(allowSidegradeDefault));
            DecisionResult result = decision.apply(ctx);

            flowLogger.logDecision(scopeKind, scopeId, title, result, traceId);
            return result;
        } catch (CollaboratorException e) {
            log.warn("[ReleaseDecision] Collaborator failed. collaborator={} scope={} id={} traceId={} error={}",
                e.getCollaborator().code(), scopeKind, scopeId, traceId, e.getMessage());
            return DecisionResult.rejected(e.getMessage(), RejectionType.ERROR);
        } catch (RuntimeException e) {
            log.error("[ReleaseDecision] Error evaluating {} release. id={} release=\"{}\" traceId={}",
                scopeKind, scopeId, title, traceId, e);
            return DecisionResult.rejected(e.getMessage() != null ? e.getMessage() : "Unknown error",
                RejectionType.ERROR);
        }
    }

    // ── Scope resolution ─────────────────────────────────────────────────────

    private DecisionResult movieDecision(Evaluation ctx, String movieId) {
        Optional<Movie> movie = repository.getMovieWithProfile(movieId);
        if (movie.isEmpty()) {
            return DecisionResult.rejected("Movie not found", RejectionType.MOVIE_NOT_FOUND);
        }
        flowLogger.logStage(DecisionFlowLogger.SCOPE_RESOLVED, ctx.traceId(), "movieId=" + movieId);

        Optional<DecisionResult> blocked = blocklistRejection(ctx, BlocklistScope.movie(movieId));
        if (blocked.isPresent()) {
            return blocked.get();
        }

        Optional<ScoringProfile> profile = resolveProfile(ctx, movie.get().scoringProfileId());
        if (profile.isEmpty()) {
            return noProfile();
        }

        return singleFileDecision(ctx, profile.get(), repository.getMovieFile(movieId), ScoringContext.movie());
    }

    private DecisionResult episodeDecision(Evaluation ctx, String episodeId) {
        Optional<Episode> episode = repository.getEpisodeWithSeriesAndProfile(episodeId);
        if (episode.isEmpty()) {
            return DecisionResult.rejected("Episode not found", RejectionType.EPISODE_NOT_FOUND);
        }
        String seriesId = episode.get().seriesId();
        Optional<Series> series = repository.getSeriesWithProfile(seriesId);
        if (series.isEmpty()) {
            return DecisionResult.rejected("Episode not found", RejectionType.EPISODE_NOT_FOUND);
        }
        flowLogger.logStage(DecisionFlowLogger.SCOPE_RESOLVED, ctx.traceId(),
            "episodeId=" + episodeId + " seriesId=" + seriesId);

        Optional<DecisionResult> blocked = blocklistRejection(ctx, BlocklistScope.series(seriesId));
        if (blocked.isPresent()) {
            return blocked.get();
        }

        Optional<ScoringProfile> profile = resolveProfile(ctx, series.get().scoringProfileId());
        if (profile.isEmpty()) {
            return noProfile();
        }

        Optional<ExistingFile> existing = repository.getEpisodeFilesBySeries(seriesId).stream()
            .filter(file -> file.covers(episodeId))
            .findFirst();
        return singleFileDecision(ctx, profile.get(), existing, ScoringContext.singleEpisode());
    }

    private DecisionResult seriesPackDecision(Evaluation ctx, String seriesId, String label,
                                              Supplier<List<Episode>> episodes,
                                              String noEpisodesReason) {
        Optional<Series> series = repository.getSeriesWithProfile(seriesId);
        if (series.isEmpty()) {
            return DecisionResult.rejected("Series not found", RejectionType.SERIES_NOT_FOUND);
        }

        Optional<DecisionResult> blocked = blocklistRejection(ctx, BlocklistScope.series(seriesId));
        if (blocked.isPresent()) {
            return blocked.get();
        }

        List<Episode> targets = episodes.get();
        if (targets.isEmpty()) {
            return DecisionResult.rejected(noEpisodesReason, RejectionType.NO_EPISODES);
        }
        flowLogger.logStage(DecisionFlowLogger.SCOPE_RESOLVED, ctx.traceId(),
            "seriesId=" + seriesId + " episodes=" + targets.size());

        Optional<ScoringProfile> profile = resolveProfile(ctx, series.get().scoringProfileId());
        if (profile.isEmpty()) {
            return noProfile();
        }

        EpisodeScope scope = EpisodeScope.of(label, seriesId, profile.get(), targets,
            repository.getEpisodeFilesBySeries(seriesId), true);
        return aggregateDecision(ctx, scope);
    }

    private DecisionResult episodeSetDecision(Evaluation ctx, List<String> episodeIds) {
        if (episodeIds.isEmpty()) {
            return DecisionResult.rejected("No episodes specified", RejectionType.NO_EPISODES);
        }

        List<Episode> resolved = repository.getEpisodesByIds(episodeIds);
        if (resolved.isEmpty()) {
            return DecisionResult.rejected("Episodes not found", RejectionType.EPISODES_NOT_FOUND);
        }

        String seriesId = resolved.get(0).seriesId();
        Optional<Series> series = repository.getSeriesWithProfile(seriesId);
        if (series.isEmpty()) {
            return DecisionResult.rejected("Series not found", RejectionType.SERIES_NOT_FOUND);
        }

        List<Episode> targets = resolved.stream()
            .filter(episode -> seriesId.equals(episode.seriesId()))
            .toList();
        if (targets.size() < resolved.size()) {
            log.warn("[ReleaseDecision] Ignoring episodes outside series. seriesId={} ignored={} traceId={}",
                seriesId, resolved.size() - targets.size(), ctx.traceId());
        }
        flowLogger.logStage(DecisionFlowLogger.SCOPE_RESOLVED, ctx.traceId(),
            "seriesId=" + seriesId + " episodes=" + targets.size());

        Optional<DecisionResult> blocked = blocklistRejection(ctx, BlocklistScope.series(seriesId));
        if (blocked.isPresent()) {
            return blocked.get();
        }

        Optional<ScoringProfile> profile = resolveProfile(ctx, series.get().scoringProfileId());
        if (profile.isEmpty()) {
            return noProfile();
        }

        EpisodeScope scope = EpisodeScope.of(MULTI_EPISODE, seriesId, profile.get(), targets,
            repository.getEpisodeFilesBySeries(seriesId), targets.size() > 1);
        return aggregateDecision(ctx, scope);
    }

    // ── Single file (movie / episode) ────────────────────────────────────────

    private DecisionResult singleFileDecision(Evaluation ctx, ScoringProfile profile,
                                              Optional<ExistingFile> existingFile, ScoringContext scoring) {
        ReleaseCandidate release = ctx.release();

        if (existingFile.isEmpty()) {
            if (ctx.options().force()) {
                return DecisionResult.accepted(UpgradeStatus.NEW, "Force override - new download", false);
            }
            return newDownloadDecision(release, profile, scoring);
        }

        ExistingFile existing = existingFile.get();

        // Force replaces the file without any scoring.
        if (ctx.options().force()) {
            return DecisionResult.accepted(UpgradeStatus.UPGRADE, "Force override - replacing existing file", true);
        }

        if (existing.hasSameHash(release.infoHash())) {
            return DecisionResult.rejected("Same release already downloaded (matching torrent hash)",
                RejectionType.SAME_HASH, UpgradeStatus.REJECTED);
        }

        if (!profile.upgradesAllowed()) {
            return DecisionResult.rejected("Upgrades not allowed by profile",
                RejectionType.UPGRADES_NOT_ALLOWED, UpgradeStatus.REJECTED);
        }

        return upgradeDecision(ctx, existing, profile);
    }

    private DecisionResult newDownloadDecision(ReleaseCandidate release, ScoringProfile profile,
                                               ScoringContext scoring) {
        ScoreResult score = scoringOracle.scoreRelease(release.title(), profile, null, release.size(), scoring);

        Optional<DecisionResult> rejected = candidateRejection(score);
        if (rejected.isPresent()) {
            return rejected.get();
        }
        if (!score.meetsMinimum()) {
            return DecisionResult.rejected("Release below minimum score", RejectionType.BELOW_MINIMUM);
        }
        return DecisionResult.accepted(UpgradeStatus.NEW, "No existing file - new download", false,
            null, score.totalScore());
    }

    private DecisionResult upgradeDecision(Evaluation ctx, ExistingFile existing, ScoringProfile profile) {
        ReleaseCandidate release = ctx.release();
        UpgradeComparison comparison = scoringOracle.isUpgrade(existing.identity(), release.title(), profile,
            new UpgradeOptions(profile.minScoreIncrement(), ctx.allowSidegrade(), release.size()));

        log.debug("[ReleaseDecision] Upgrade comparison. existing=\"{}\" candidate=\"{}\" existingScore={} "
                + "candidateScore={} improvement={} isUpgrade={} minScoreIncrement={} traceId={}",
            existing.identity(), release.title(),
            comparison.existing().totalScore(), comparison.candidate().totalScore(),
            comparison.improvement(), comparison.isUpgrade(), profile.minScoreIncrement(), ctx.traceId());

        Optional<DecisionResult> rejected = candidateRejection(comparison.candidate());
        if (rejected.isPresent()) {
            return rejected.get();
        }

        if (!comparison.isUpgrade()) {
            return UpgradeClassifier.rejectNonUpgrade(comparison.improvement(), profile.minScoreIncrement());
        }

        return DecisionResult.acceptedUpgrade(UpgradeClassifier.statusFor(comparison.improvement()),
            "Release qualifies as upgrade",
            comparison.candidate().totalScore(), comparison.existing().totalScore(), comparison.improvement());
    }

    // ── Aggregate (season / series / episode set) ────────────────────────────

    private DecisionResult aggregateDecision(Evaluation ctx, EpisodeScope scope) {
        if (ctx.options().force()) {
            return forcedAggregateDecision(scope);
        }

        ReleaseCandidate release = ctx.release();
        ScoringProfile profile = scope.profile();

        // The pack is scored exactly once, not per episode.
        ScoreResult packScore = scoringOracle.scoreRelease(release.title(), profile, null, release.size(),
            ScoringContext.pack(scope.isSeasonPack(), scope.episodeCount()));

        Optional<DecisionResult> rejected = candidateRejection(packScore);
        if (rejected.isPresent()) {
            return rejected.get();
        }

        UpgradeStats stats = episodeStats(ctx, scope);
        int netBenefit = MajorityBenefitRule.netBenefit(stats);

        log.debug("[ReleaseDecision] Pack stats. label=\"{}\" seriesId={} improved={} unchanged={} downgraded={} "
                + "new={} total={} netBenefit={} traceId={}",
            scope.label(), scope.seriesId(), stats.improved(), stats.unchanged(), stats.downgraded(),
            stats.newEpisodes(), stats.total(), netBenefit, ctx.traceId());

        return switch (MajorityBenefitRule.evaluate(stats, profile.upgradesAllowed())) {
            case ALL_NEW -> packScore.meetsMinimum()
                ? DecisionResult.accepted(UpgradeStatus.NEW, scope.label() + " - all new episodes", false,
                    stats, packScore.totalScore())
                : DecisionResult.rejected("Release below minimum score", RejectionType.BELOW_MINIMUM);
            case UPGRADES_NOT_ALLOWED -> DecisionResult.rejected("Upgrades not allowed by profile",
                RejectionType.UPGRADES_NOT_ALLOWED, UpgradeStatus.REJECTED, stats);
            case NO_NET_BENEFIT -> DecisionResult.rejected(
                String.format("%s would not improve quality (%d improved, %d downgraded, %d new)",
                    scope.label(), stats.improved(), stats.downgraded(), stats.newEpisodes()),
                RejectionType.NO_NET_BENEFIT, UpgradeStatus.DOWNGRADE, stats);
            case ACCEPT -> DecisionResult.accepted(MajorityBenefitRule.acceptedStatus(stats),
                String.format("%s benefits %d/%d episodes",
                    scope.label(), MajorityBenefitRule.benefited(stats), stats.total()),
                stats.improved() > 0, stats, packScore.totalScore());
        };
    }

    /**
     * Compares every target episode's existing file against the candidate. Episodes sharing
     * a multi-episode file reuse one comparison, which is identical because the scorer is pure.
     */
    private UpgradeStats episodeStats(Evaluation ctx, EpisodeScope scope) {
        ScoringProfile profile = scope.profile();
        // Pack size would distort per-episode size checks, so no size is passed here.
        UpgradeOptions options = new UpgradeOptions(profile.minScoreIncrement(), ctx.allowSidegrade(), null);
        Map<String, UpgradeComparison> byIdentity = new HashMap<>();
        UpgradeStatsAccumulator accumulator = new UpgradeStatsAccumulator();

        for (String episodeId : scope.episodeIds()) {
            Optional<ExistingFile> file = scope.fileFor(episodeId);
            if (file.isEmpty()) {
                accumulator.recordNew();
                continue;
            }
            UpgradeComparison comparison = byIdentity.computeIfAbsent(file.get().identity(),
                identity -> scoringOracle.isUpgrade(identity, ctx.release().title(), profile, options));
            accumulator.recordComparison(comparison);
        }
        return accumulator.toStats();
    }

    /**
     * Force on an aggregate scope counts episodes by file presence only: every episode with a
     * file is "improved", every other one is new. No score is computed.
     */
    private DecisionResult forcedAggregateDecision(EpisodeScope scope) {
        UpgradeStatsAccumulator accumulator = new UpgradeStatsAccumulator();
        for (String episodeId : scope.episodeIds()) {
            if (scope.fileFor(episodeId).isPresent()) {
                accumulator.recordForcedReplacement();
            } else {
                accumulator.recordNew();
            }
        }
        UpgradeStats stats = accumulator.toStats();
        if (stats.improved() > 0) {
            return DecisionResult.accepted(UpgradeStatus.UPGRADE, "Force override - replacing existing files",
                true, stats, null);
        }
        return DecisionResult.accepted(UpgradeStatus.NEW,
            "Force override - new " + scope.label().toLowerCase(Locale.ROOT), false, stats, null);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Optional<DecisionResult> blocklistRejection(Evaluation ctx, BlocklistScope scope) {
        if (!ctx.options().shouldCheckBlocklist()) {
            return Optional.empty();
        }
        BlocklistVerdict verdict = blocklistGate.isSatisfied(ctx.release(), scope);
        flowLogger.logStage(DecisionFlowLogger.BLOCKLIST_CHECKED, ctx.traceId(), "accepted=" + verdict.accepted());
        if (verdict.accepted()) {
            return Optional.empty();
        }
        return Optional.of(DecisionResult.rejected(
            verdict.reason() != null ? verdict.reason() : "Release is blocklisted",
            RejectionType.BLOCKLISTED, UpgradeStatus.BLOCKED));
    }

    private Optional<ScoringProfile> resolveProfile(Evaluation ctx, String assignedProfileId) {
        Optional<ScoringProfile> profile = profileResolver.resolve(assignedProfileId);
        profile.ifPresent(p -> flowLogger.logStage(DecisionFlowLogger.PROFILE_RESOLVED, ctx.traceId(),
            "profileId=" + p.id()));
        return profile;
    }

    /** Ban and size gates shared by every scoring path. */
    private static Optional<DecisionResult> candidateRejection(ScoreResult score) {
        if (score.isBanned()) {
            return Optional.of(DecisionResult.rejected(
                "Release banned: " + String.join(", ", score.bannedReasons()), RejectionType.BANNED));
        }
        if (score.sizeRejected()) {
            return Optional.of(DecisionResult.rejected(
                score.sizeRejectionReason() != null ? score.sizeRejectionReason() : "Size rejected",
                RejectionType.SIZE_REJECTED));
        }
        return Optional.empty();
    }

    private static DecisionResult noProfile() {
        return DecisionResult.rejected("No quality profile configured", RejectionType.NO_PROFILE);
    }
}
