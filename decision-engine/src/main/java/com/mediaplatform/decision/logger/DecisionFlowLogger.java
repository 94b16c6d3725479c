package com.mediaplatform.decision.logger;

import com.mediaplatform.common.decision.DecisionResult;
import com.mediaplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the lifecycle of one release evaluation.
 *
 * <p>Logs each stage without introducing any business logic. All methods are pure
 * side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #EVALUATION_STARTED}: an entry point was called</li>
 *   <li>{@link #SCOPE_RESOLVED}: target movie / episode set found</li>
 *   <li>{@link #BLOCKLIST_CHECKED}: blocklist consulted (absent when skipped)</li>
 *   <li>{@link #PROFILE_RESOLVED}: effective scoring profile chosen</li>
 *   <li>{@link #DECISION_MADE}: result built</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} in the reactive facade (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.DECISION_MADE))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String EVALUATION_STARTED = "EVALUATION_STARTED";
    public static final String SCOPE_RESOLVED     = "SCOPE_RESOLVED";
    public static final String BLOCKLIST_CHECKED  = "BLOCKLIST_CHECKED";
    public static final String PROFILE_RESOLVED   = "PROFILE_RESOLVED";
    public static final String DECISION_MADE      = "DECISION_MADE";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage and the decision outcome.
     * Only fires on {@code onNext} signals.
     */
    public Consumer<Signal<DecisionResult>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            DecisionResult result = signal.get();
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} accepted={} status={} traceId={}",
                    stageName, result.accepted(), result.upgradeStatus(), traceId)
            );
        };
    }

    /**
     * Logs a lifecycle stage with free-form detail.
     *
     * @param stageName one of the stage constants defined in this class
     * @param traceId   the evaluation trace id
     * @param detail    short {@code key=value} detail, may be empty
     */
    public void logStage(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.debug("[DecisionFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }

    /**
     * Logs the final outcome of an evaluation: info for acceptances, debug for rejections
     * (rejections are routine during an indexer search).
     */
    public void logDecision(String scopeKind, String scopeId, String releaseTitle,
                            DecisionResult result, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (result.accepted()) {
                log.info("[DecisionFlow] stage={} scope={} id={} release=\"{}\" status={} isUpgrade={} reason=\"{}\" traceId={}",
                    DECISION_MADE, scopeKind, scopeId, releaseTitle,
                    result.upgradeStatus(), result.isUpgrade(), result.reason(), traceId);
            } else {
                log.debug("[DecisionFlow] stage={} scope={} id={} release=\"{}\" rejected={} status={} reason=\"{}\" traceId={}",
                    DECISION_MADE, scopeKind, scopeId, releaseTitle,
                    result.rejectionType().code(), result.upgradeStatus(), result.reason(), traceId);
            }
        });
    }
}
