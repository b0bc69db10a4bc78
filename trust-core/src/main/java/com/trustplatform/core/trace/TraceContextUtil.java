package com.trustplatform.core.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace id propagation.
 *
 * <p>Reactor Context carries the trace id through a pipeline. MDC is written only
 * for the duration of a single log statement via {@link #withMdc}.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(service.ingest(event), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end
     * of pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, or {@value #UNKNOWN}. Never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** The supplied header value, or a fresh id when it is absent or blank. */
    public static String resolveTraceId(String header) {
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return header.trim();
    }

    /**
     * Puts {@code traceId} into MDC while {@code logAction} runs, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
