package com.survivaladvisor.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the advisor request id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id. MDC only sees it for the duration of a single log
 * call made through {@link #withMdc}; nothing is left behind on the thread.
 *
 * <pre>
 *     return TraceContextUtil.withRequestId(answerMono, requestId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String REQUEST_ID_KEY = "requestId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores the id in the Reactor Context of {@code mono}. {@code contextWrite} applies
     * upstream, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withRequestId(Mono<T> mono, String requestId) {
        return mono.contextWrite(ctx -> ctx.put(REQUEST_ID_KEY, requestId));
    }

    /** The request id, or {@value #UNKNOWN} when none was written. Never null. */
    public static String getRequestId(ContextView ctx) {
        return ctx.getOrDefault(REQUEST_ID_KEY, UNKNOWN);
    }

    /** Runs {@code logAction} with the id in MDC, then removes it. */
    public static void withMdc(String requestId, Runnable logAction) {
        MDC.put(REQUEST_ID_KEY, requestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
