package com.survivaladvisor.orchestrator.ai;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps an AI call failure to an {@link AiFailureCategory}.
 *
 * <p>Walks the cause chain. Typed signals (HTTP status, timeout, connect errors) are checked
 * first on each link; message text is the fallback, checked in the order configuration,
 * connectivity, rate limit. Anything else is {@link AiFailureCategory#UNAVAILABLE}.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class AiErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 10;

    private AiErrorClassifier() {}

    public static AiFailureCategory classify(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            AiFailureCategory typed = byType(current);
            if (typed != null) {
                return typed;
            }
            current = current.getCause();
        }

        current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            AiFailureCategory byText = byMessage(current.getMessage());
            if (byText != null) {
                return byText;
            }
            current = current.getCause();
        }
        return AiFailureCategory.UNAVAILABLE;
    }

    /** True when any link of the cause chain is a timeout. */
    public static boolean isTimeout(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static AiFailureCategory byType(Throwable t) {
        if (t instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 401 || status == 403) return AiFailureCategory.CONFIGURATION;
            if (status == 429)                  return AiFailureCategory.RATE_LIMIT;
            if (status >= 500)                  return AiFailureCategory.UNAVAILABLE;
            return null;
        }
        if (t instanceof TimeoutException
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof WebClientRequestException) {
            return AiFailureCategory.CONNECTIVITY;
        }
        return null;
    }

    private static AiFailureCategory byMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("api") || text.contains("key") || text.contains("auth")) {
            return AiFailureCategory.CONFIGURATION;
        }
        if (text.contains("timeout") || text.contains("timed out") || text.contains("connection")) {
            return AiFailureCategory.CONNECTIVITY;
        }
        if (text.contains("rate") || text.contains("limit") || text.contains("cooldown")) {
            return AiFailureCategory.RATE_LIMIT;
        }
        return null;
    }
}
