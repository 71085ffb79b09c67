package com.irisplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries a classification request's trace id through reactive host code.
 *
 * <p>The Reactor Context holds the trace id for the lifetime of a request; MDC is
 * written only for the duration of a single log statement so the log pattern can
 * print {@code %X{traceId}} without leaking ThreadLocal state between requests.
 *
 * <pre>
 *     String traceId = TraceContextUtil.resolve(request.traceId());
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Returns {@code candidate} when it is non-blank, otherwise a fresh random id. */
    public static String resolve(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return candidate.trim();
    }

    /** Puts {@code traceId} into the Reactor Context of {@code mono} (applies upstream). */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id stored in {@code ctx}, or {@code "unknown"}; never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} bridged into MDC, then removes it.
     * Only meant for wrapping log statements.
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
