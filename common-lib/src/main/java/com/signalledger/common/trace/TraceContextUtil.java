package com.signalledger.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactor Context carries the trace id of a watcher tick or request; MDC is only
 * written around a single log statement so the Logback pattern can print it.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, TraceContextUtil.newTraceId("tick"));
 *     ...
 *     .doOnEach(s -> TraceContextUtil.withMdc(TraceContextUtil.getTraceId(s.getContextView()),
 *                                             () -> log.info(...)))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newTraceId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /** Call at the end of pipeline assembly; {@code contextWrite} propagates upstream. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never {@code null}; {@code "unknown"} outside a traced pipeline. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
