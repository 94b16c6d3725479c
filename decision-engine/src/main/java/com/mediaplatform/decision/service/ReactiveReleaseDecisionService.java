package com.mediaplatform.decision.service;

import com.mediaplatform.common.decision.DecisionOptions;
import com.mediaplatform.common.decision.DecisionResult;
import com.mediaplatform.common.decision.RejectionType;
import com.mediaplatform.common.model.ReleaseCandidate;
import com.mediaplatform.common.trace.TraceContextUtil;
import com.mediaplatform.decision.engine.ReleaseDecisionEngine;
import com.mediaplatform.decision.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.function.Function;

/**
 * Reactive entry point for schedulers and request handlers built on Reactor.
 *
 * <p>The engine performs blocking repository reads, so each call is shifted onto
 * {@code Schedulers.boundedElastic()}. The returned {@link Mono} never errors: a failure
 * becomes an {@code error} rejection, matching the engine's own contract.
 */
@Service
public class ReactiveReleaseDecisionService {

    private static final Logger log = LoggerFactory.getLogger(ReactiveReleaseDecisionService.class);

    private final ReleaseDecisionEngine engine;
    private final DecisionFlowLogger flowLogger;

    public ReactiveReleaseDecisionService(ReleaseDecisionEngine engine, DecisionFlowLogger flowLogger) {
        this.engine = engine;
        this.flowLogger = flowLogger;
    }

    public Mono<DecisionResult> evaluateForMovie(String movieId, ReleaseCandidate release, DecisionOptions options) {
        return dispatch("movie", movieId, traceId -> engine.evaluateForMovie(movieId, release, options, traceId));
    }

    public Mono<DecisionResult> evaluateForEpisode(String episodeId, ReleaseCandidate release, DecisionOptions options) {
        return dispatch("episode", episodeId,
            traceId -> engine.evaluateForEpisode(episodeId, release, options, traceId));
    }

    public Mono<DecisionResult> evaluateForSeason(String seriesId, int seasonNumber, ReleaseCandidate release,
                                                  DecisionOptions options) {
        return dispatch("season", seriesId,
            traceId -> engine.evaluateForSeason(seriesId, seasonNumber, release, options, traceId));
    }

    public Mono<DecisionResult> evaluateForSeries(String seriesId, ReleaseCandidate release, DecisionOptions options) {
        return dispatch("series", seriesId,
            traceId -> engine.evaluateForSeries(seriesId, release, options, traceId));
    }

    public Mono<DecisionResult> evaluateForEpisodes(List<String> episodeIds, ReleaseCandidate release,
                                                    DecisionOptions options) {
        return dispatch("episodes", String.valueOf(episodeIds),
            traceId -> engine.evaluateForEpisodes(episodeIds, release, options, traceId));
    }

    /**
     * Evaluates search results for one movie in parallel, keeping the input order.
     * Used by the automatic search to pick the first accepted release.
     */
    public Flux<DecisionResult> evaluateAllForMovie(String movieId, List<ReleaseCandidate> releases,
                                                    DecisionOptions options) {
        return Flux.fromIterable(releases)
            .flatMapSequential(release -> evaluateForMovie(movieId, release, options));
    }

    /**
     * One trace id per call: handed to the engine and written to the Reactor Context, so the
     * engine's stage lines and the {@code DECISION_MADE} line share it.
     */
    private Mono<DecisionResult> dispatch(String scopeKind, String scopeId, Function<String, DecisionResult> call) {
        String traceId = TraceContextUtil.newTraceId();
        Mono<DecisionResult> pipeline = Mono.fromCallable(() -> call.apply(traceId))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(DecisionFlowLogger.DECISION_MADE))
            .onErrorResume(e -> {
                log.error("[ReactiveReleaseDecision] Evaluation failed. scope={} id={} traceId={}",
                    scopeKind, scopeId, traceId, e);
                return Mono.just(DecisionResult.rejected(
                    e.getMessage() != null ? e.getMessage() : "Unknown error", RejectionType.ERROR));
            });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
