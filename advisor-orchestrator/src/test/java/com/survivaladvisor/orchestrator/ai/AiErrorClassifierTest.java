package com.survivaladvisor.orchestrator.ai;

import com.survivaladvisor.common.exception.AiServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class AiErrorClassifierTest {

    private static WebClientResponseException status(int code) {
        return WebClientResponseException.create(code, "status " + code, HttpHeaders.EMPTY, new byte[0],
            StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("HTTP 401/403 → CONFIGURATION, 429 → RATE_LIMIT, 5xx → UNAVAILABLE")
    void httpStatus() {
        assertEquals(AiFailureCategory.CONFIGURATION, AiErrorClassifier.classify(status(401)));
        assertEquals(AiFailureCategory.CONFIGURATION, AiErrorClassifier.classify(status(403)));
        assertEquals(AiFailureCategory.RATE_LIMIT, AiErrorClassifier.classify(status(429)));
        assertEquals(AiFailureCategory.UNAVAILABLE, AiErrorClassifier.classify(status(529)));
    }

    @Test
    @DisplayName("timeout or refused connection anywhere in the cause chain → CONNECTIVITY")
    void connectivity() {
        assertEquals(AiFailureCategory.CONNECTIVITY, AiErrorClassifier.classify(new TimeoutException()));
        assertEquals(AiFailureCategory.CONNECTIVITY,
            AiErrorClassifier.classify(new RuntimeException("wrapped", new ConnectException("refused"))));
        assertTrue(AiErrorClassifier.isTimeout(new IllegalStateException("x", new TimeoutException())));
        assertFalse(AiErrorClassifier.isTimeout(new ConnectException("refused")));
    }

    @Test
    @DisplayName("message text: key/auth → CONFIGURATION, rate/limit → RATE_LIMIT")
    void byMessage() {
        assertEquals(AiFailureCategory.CONFIGURATION,
            AiErrorClassifier.classify(new AiServiceException("API key not configured")));
        assertEquals(AiFailureCategory.RATE_LIMIT,
            AiErrorClassifier.classify(new AiServiceException("Rate limit: please wait 12 seconds")));
        assertEquals(AiFailureCategory.CONNECTIVITY,
            AiErrorClassifier.classify(new RuntimeException("Connection reset by peer")));
    }

    @Test
    @DisplayName("unrecognized or null → UNAVAILABLE")
    void fallback() {
        assertEquals(AiFailureCategory.UNAVAILABLE, AiErrorClassifier.classify(new RuntimeException("boom")));
        assertEquals(AiFailureCategory.UNAVAILABLE, AiErrorClassifier.classify(new RuntimeException()));
        assertEquals(AiFailureCategory.UNAVAILABLE, AiErrorClassifier.classify(null));
    }
}
