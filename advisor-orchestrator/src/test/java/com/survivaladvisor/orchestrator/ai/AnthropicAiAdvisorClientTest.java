package com.survivaladvisor.orchestrator.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.common.classifier.RequestClassifier;
import com.survivaladvisor.common.exception.AiServiceException;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.reference.ReferenceDataLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicAiAdvisorClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AnthropicAiAdvisorClient client =
        new AnthropicAiAdvisorClient(WebClient.builder(), mapper, new ReferenceDataLoader(mapper).load());

    private static final ClassifiedRequest HYPOTHETICAL = RequestClassifier.classify("what if I skip gen 3");

    @Test
    @DisplayName("no API key → unavailable, ask fails with a configuration error")
    void noKey() {
        assertFalse(client.isAvailable());
        StepVerifier.create(client.ask(PlayerSnapshot.empty(), "q", HYPOTHETICAL, AiRequestWindow.unrestricted()))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(AiServiceException.class, e);
                assertEquals(AiFailureCategory.CONFIGURATION, AiErrorClassifier.classify(e));
            })
            .verify();
    }

    @Test
    @DisplayName("closed cooldown window → rate-limit error before any HTTP call")
    void cooldown() {
        ReflectionTestUtils.setField(client, "anthropicApiKey", "test-key");
        AiRequestWindow window = new AiRequestWindow(Instant.now(), Duration.ofMinutes(5));
        StepVerifier.create(client.ask(PlayerSnapshot.empty(), "q", HYPOTHETICAL, window))
            .expectErrorSatisfies(e -> assertEquals(AiFailureCategory.RATE_LIMIT, AiErrorClassifier.classify(e)))
            .verify();
    }

    @Test
    @DisplayName("profile summary lists generation, priorities and heroes")
    void profileSummary() {
        PlayerSnapshot snapshot = PlayerSnapshot.builder()
            .stateAgeDays(85)
            .furnaceLevel(18)
            .hero("Jeronimo", HeroState.of(45, 3))
            .build();
        String summary = client.profileSummary(snapshot);
        assertTrue(summary.startsWith("PROFILE: Gen2 (Day 85), Furnace 18"));
        assertTrue(summary.contains("PRIORITIES: SvS=5, Rally=4, Castle=4, PvE=3"));
        assertTrue(summary.contains("- Jeronimo [S+|Inf|Gen1] Lv45 ★★★☆☆"));
        assertTrue(client.profileSummary(PlayerSnapshot.empty()).endsWith("- None added yet"));
    }

    @Test
    @DisplayName("hybrid prompt carries the enhancement instruction")
    void hybridPrompt() {
        String prompt = client.buildPrompt(PlayerSnapshot.empty(), "what to buy", RequestClassifier.classify("what to buy"));
        assertTrue(prompt.contains("QUESTION: what to buy"));
        assertTrue(prompt.endsWith(AnthropicAiAdvisorClient.ENHANCEMENT_INSTRUCTION));
    }

    @Test
    @DisplayName("code fences are stripped from the answer")
    void cleanResponse() {
        assertEquals("Level Molly.", AnthropicAiAdvisorClient.cleanResponse("```text\nLevel Molly.\n```"));
        assertEquals("", AnthropicAiAdvisorClient.cleanResponse(null));
    }
}
