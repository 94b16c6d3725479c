package com.mediaplatform.decision.service;

import com.mediaplatform.common.decision.DecisionOptions;
import com.mediaplatform.common.decision.DecisionResult;
import com.mediaplatform.common.decision.RejectionType;
import com.mediaplatform.common.decision.UpgradeStatus;
import com.mediaplatform.common.model.ReleaseCandidate;
import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.trace.TraceContextUtil;
import com.mediaplatform.decision.engine.ReleaseDecisionEngine;
import com.mediaplatform.decision.logger.DecisionFlowLogger;
import com.mediaplatform.decision.profile.ProfileResolver;
import com.mediaplatform.decision.support.FakeScoringOracle;
import com.mediaplatform.decision.support.InMemoryMediaRepository;
import com.mediaplatform.decision.support.RecordingBlocklistGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Signal;
import reactor.test.StepVerifier;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static com.mediaplatform.decision.support.InMemoryMediaRepository.episodeId;
import static org.junit.jupiter.api.Assertions.*;

class ReactiveReleaseDecisionServiceTest {

    private InMemoryMediaRepository repository;
    private FakeScoringOracle oracle;
    private RecordingBlocklistGate blocklist;
    private ReactiveReleaseDecisionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMediaRepository()
            .profile(ScoringProfile.of("p1", true, 10).asDefault())
            .movie("m1", "p1")
            .series("s1", "p1").season("s1", 1, 3);
        oracle = new FakeScoringOracle();
        blocklist = new RecordingBlocklistGate();
        ReleaseDecisionEngine engine = new ReleaseDecisionEngine(repository, oracle, blocklist,
            new ProfileResolver(repository), new DecisionFlowLogger(), false);
        service = new ReactiveReleaseDecisionService(engine, new DecisionFlowLogger());
    }

    @Test
    @DisplayName("movie evaluation emits the engine result")
    void movie() {
        StepVerifier.create(service.evaluateForMovie("m1", ReleaseCandidate.of("Movie.1080p"),
                DecisionOptions.defaults()))
            .assertNext(result -> {
                assertTrue(result.accepted());
                assertEquals(UpgradeStatus.NEW, result.upgradeStatus());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("season evaluation carries upgrade stats")
    void season() {
        StepVerifier.create(service.evaluateForSeason("s1", 1, ReleaseCandidate.of("Show.S01.1080p"),
                DecisionOptions.defaults()))
            .assertNext(result -> assertEquals(3, result.upgradeStats().total()))
            .verifyComplete();
    }

    @Test
    @DisplayName("episode, series and episode-set entry points all complete")
    void otherScopes() {
        ReleaseCandidate release = ReleaseCandidate.of("Show.S01.1080p");

        StepVerifier.create(service.evaluateForEpisode(episodeId("s1", 1, 1), release, DecisionOptions.defaults()))
            .expectNextMatches(DecisionResult::accepted)
            .verifyComplete();
        StepVerifier.create(service.evaluateForSeries("s1", release, DecisionOptions.defaults()))
            .expectNextMatches(DecisionResult::accepted)
            .verifyComplete();
        StepVerifier.create(service.evaluateForEpisodes(
                List.of(episodeId("s1", 1, 1), episodeId("s1", 1, 2)), release, DecisionOptions.defaults()))
            .expectNextMatches(result -> result.upgradeStats().total() == 2)
            .verifyComplete();
    }

    @Test
    @DisplayName("batch evaluation keeps input order")
    void batchKeepsOrder() {
        blocklist.block("Movie.Blocked");
        List<ReleaseCandidate> releases = List.of(
            ReleaseCandidate.of("Movie.Blocked"),
            ReleaseCandidate.of("Movie.720p"),
            ReleaseCandidate.of("Movie.Blocked"));

        StepVerifier.create(service.evaluateAllForMovie("m1", releases, DecisionOptions.defaults()))
            .expectNextMatches(result -> result.rejectionType() == RejectionType.BLOCKLISTED)
            .expectNextMatches(DecisionResult::accepted)
            .expectNextMatches(result -> result.rejectionType() == RejectionType.BLOCKLISTED)
            .verifyComplete();
    }

    @Test
    @DisplayName("engine failure becomes an error rejection, never an error signal")
    void failureRecovered() {
        ReleaseDecisionEngine failing = new ReleaseDecisionEngine(repository, oracle, blocklist,
            new ProfileResolver(repository), new DecisionFlowLogger(), false) {
            @Override
            public DecisionResult evaluateForMovie(String movieId, ReleaseCandidate release, DecisionOptions options,
                                                   String traceId) {
                throw new IllegalStateException("engine exploded");
            }
        };
        ReactiveReleaseDecisionService failingService =
            new ReactiveReleaseDecisionService(failing, new DecisionFlowLogger());

        StepVerifier.create(failingService.evaluateForMovie("m1", ReleaseCandidate.of("Movie.1080p"),
                DecisionOptions.defaults()))
            .assertNext(result -> {
                assertFalse(result.accepted());
                assertEquals(RejectionType.ERROR, result.rejectionType());
                assertEquals("engine exploded", result.reason());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("engine stages and the reactive decision line share one trace id")
    void traceIdShared() {
        TraceRecordingFlowLogger flowLogger = new TraceRecordingFlowLogger();
        ReleaseDecisionEngine engine = new ReleaseDecisionEngine(repository, oracle, blocklist,
            new ProfileResolver(repository), flowLogger, false);
        ReactiveReleaseDecisionService traced = new ReactiveReleaseDecisionService(engine, flowLogger);

        StepVerifier.create(traced.evaluateForSeason("s1", 1, ReleaseCandidate.of("Show.S01.1080p"),
                DecisionOptions.defaults()))
            .expectNextCount(1)
            .verifyComplete();

        assertEquals(1, flowLogger.reactiveTraceIds.size());
        assertFalse(flowLogger.engineTraceIds.isEmpty());
        assertEquals(Set.copyOf(flowLogger.reactiveTraceIds), new HashSet<>(flowLogger.engineTraceIds));
    }

    /** Captures the trace id of every engine stage and every reactive stage signal. */
    private static final class TraceRecordingFlowLogger extends DecisionFlowLogger {
        private final List<String> engineTraceIds = new CopyOnWriteArrayList<>();
        private final List<String> reactiveTraceIds = new CopyOnWriteArrayList<>();

        @Override
        public void logStage(String stageName, String traceId, String detail) {
            engineTraceIds.add(traceId);
            super.logStage(stageName, traceId, detail);
        }

        @Override
        public Consumer<Signal<DecisionResult>> stage(String stageName) {
            Consumer<Signal<DecisionResult>> delegate = super.stage(stageName);
            return signal -> {
                if (signal.isOnNext()) {
                    reactiveTraceIds.add(TraceContextUtil.getTraceId(signal.getContextView()));
                }
                delegate.accept(signal);
            };
        }
    }
}
