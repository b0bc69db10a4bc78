package com.trustplatform.relationship.logger;

import com.trustplatform.core.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for relationship requests. Pure side effects; never changes
 * pipeline behavior.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #RELATIONSHIP_CREATED}: a relationship was registered</li>
 *   <li>{@link #EVENT_RECEIVED}: an event arrived for ingestion</li>
 *   <li>{@link #ANTECEDENTS_APPENDED}: mappings were resolved and appended</li>
 *   <li>{@link #TRUST_RECOMPUTED}: trustworthiness was rebuilt from history</li>
 *   <li>{@link #DECISION_COMPUTED}: a trust decision or prediction was produced</li>
 *   <li>{@link #STATE_MUTATED}: stage, bonds, pattern, risk or a path value changed</li>
 *   <li>{@link #DECAY_APPLIED}: a decay tick ran over the registry</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(TrustFlowLogger.DECISION_COMPUTED))
 * </pre>
 */
@Component
public class TrustFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(TrustFlowLogger.class);

    public static final String RELATIONSHIP_CREATED = "RELATIONSHIP_CREATED";
    public static final String EVENT_RECEIVED       = "EVENT_RECEIVED";
    public static final String ANTECEDENTS_APPENDED = "ANTECEDENTS_APPENDED";
    public static final String TRUST_RECOMPUTED     = "TRUST_RECOMPUTED";
    public static final String DECISION_COMPUTED    = "DECISION_COMPUTED";
    public static final String STATE_MUTATED        = "STATE_MUTATED";
    public static final String DECAY_APPLIED        = "DECAY_APPLIED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on each onNext, reading
     * the trace id from the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[TrustFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** Logs a stage with extra key=value detail when the trace id is already known. */
    public void logWithTraceId(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[TrustFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }
}
