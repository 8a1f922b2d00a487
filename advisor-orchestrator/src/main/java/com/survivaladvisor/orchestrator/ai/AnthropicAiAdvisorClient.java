package com.survivaladvisor.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.analysis.scoring.GenerationTimeline;
import com.survivaladvisor.common.exception.AiServiceException;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.IntentType;
import com.survivaladvisor.common.model.PlayPriorities;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.reference.HeroReference;
import com.survivaladvisor.common.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * {@link AiFallbackClient} backed by the Anthropic Messages API.
 *
 * <p>Fully non-blocking: the HTTP call is a {@code Mono} chain with a hard timeout and no
 * retry. With no API key configured the client reports itself unavailable and the
 * orchestrator never calls it.
 */
@Service
public class AnthropicAiAdvisorClient implements AiFallbackClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAiAdvisorClient.class);

    static final String SYSTEM_PROMPT =
        "You are a Whiteout Survival expert. Answer questions about the player's account "
        + "concisely and specifically.";

    static final String ENHANCEMENT_INSTRUCTION =
        "The rule engine has already listed concrete upgrades. Add only the reasoning or "
        + "comparison it cannot give, in at most three sentences.";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final ReferenceData referenceData;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${advisor.ai.timeout-ms:8000}")
    private long timeoutMs;

    @Value("${advisor.ai.max-tokens:500}")
    private int maxTokens;

    public AnthropicAiAdvisorClient(WebClient.Builder builder, ObjectMapper objectMapper, ReferenceData referenceData) {
        this.anthropicClient = builder
            .baseUrl("https://api.anthropic.com")
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.referenceData = referenceData;
    }

    @Override
    public boolean isAvailable() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    @Override
    public Mono<String> ask(PlayerSnapshot snapshot, String question, ClassifiedRequest classified,
                            AiRequestWindow window) {
        if (!isAvailable()) {
            log.warn("[AIAdvisor] No Anthropic API key configured. category={}", classified.category());
            return Mono.error(new AiServiceException("API key not configured"));
        }
        Instant now = Instant.now();
        if (window != null && !window.isOpen(now)) {
            long waitSeconds = Math.max(1, window.remaining(now).toSeconds());
            log.info("[AIAdvisor] Cooldown active. waitSeconds={}", waitSeconds);
            return Mono.error(new AiServiceException(
                "Rate limit: please wait " + waitSeconds + " seconds before your next request"));
        }

        String model = ModelSelector.selectModel(classified);
        int tokens = ModelSelector.maxTokens(classified, maxTokens);

        return Mono.fromCallable(() -> buildPrompt(snapshot, question, classified))
            .flatMap(prompt -> callAnthropicApi(prompt, model, tokens))
            .map(AnthropicAiAdvisorClient::cleanResponse)
            .flatMap(text -> text.isBlank()
                ? Mono.<String>error(new AiServiceException("Empty response from AI service"))
                : Mono.just(text))
            .doOnNext(text -> log.info("[AIAdvisor] Answer received. model={} chars={} category={}",
                                          ModelSelector.resolveLabel(classified), text.length(),
                                          classified.category()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(PlayerSnapshot snapshot, String question, ClassifiedRequest classified) {
        StringBuilder prompt = new StringBuilder(profileSummary(snapshot));
        prompt.append("\n\nQUESTION: ").append(question == null ? "" : question.trim());
        if (classified.intentType() == IntentType.HYBRID) {
            prompt.append("\n\n").append(ENHANCEMENT_INSTRUCTION);
        }
        return prompt.toString();
    }

    /**
     * Compact account summary, for example:
     * <pre>
     * PROFILE: Gen2 (Day 85), Furnace 18, Spender dolphin
     * PRIORITIES: SvS=5, Rally=4, Castle=4, PvE=3
     *
     * MY HEROES:
     * - Jeronimo [S+|Inf|Gen1] Lv45 ★★★☆☆ Skills: Expl 3 Exped 4
     * </pre>
     */
    String profileSummary(PlayerSnapshot snapshot) {
        int gen = GenerationTimeline.currentGeneration(snapshot.stateAgeDays());
        PlayPriorities p = snapshot.priorities();

        StringBuilder lines = new StringBuilder();
        lines.append(String.format("PROFILE: Gen%d (Day %d), Furnace %d, Spender %s%n",
            gen, snapshot.stateAgeDays(), snapshot.furnaceLevel(), snapshot.spenderTier().key()));
        if (snapshot.fireCrystalLevel() > 0) {
            lines.append("FIRE CRYSTAL: FC").append(snapshot.fireCrystalLevel()).append('\n');
        }
        lines.append(String.format("PRIORITIES: SvS=%d, Rally=%d, Castle=%d, PvE=%d%n%n",
            p.svs(), p.rally(), p.castle(), p.exploration()));

        lines.append("MY HEROES:");
        if (snapshot.heroes().isEmpty()) {
            lines.append("\n- None added yet");
        }
        for (Map.Entry<String, HeroState> entry : snapshot.heroes().entrySet()) {
            HeroReference ref = referenceData.hero(entry.getKey());
            HeroState state = entry.getValue();
            String heroClass = ref.troopClass()
                .map(c -> c.displayName().substring(0, 3))
                .orElse("?");
            int stars = Math.min(HeroState.MAX_STARS, state.stars());
            lines.append(String.format("%n- %s [%s|%s|Gen%d] Lv%d %s Skills: Expl %d Exped %d",
                entry.getKey(), ref.tier().label(), heroClass, ref.generation(), state.level(),
                "★".repeat(stars) + "☆".repeat(HeroState.MAX_STARS - stars),
                state.bestExplorationSkill(), state.bestExpeditionSkill()));
        }
        return lines.toString();
    }

    // ── Anthropic API call (no .block()) ──────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt, String modelName, int tokens) {
        Map<String, Object> requestBody = Map.of(
            "model", modelName,
            "max_tokens", tokens,
            "system", SYSTEM_PROMPT,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(this::extractText);
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            return root.path("content").path(0).path("text").asText("");
        } catch (Exception e) {
            throw new AiServiceException("Failed to extract text from AI response", e);
        }
    }

    static String cleanResponse(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("```[a-zA-Z]*", "").replace("```", "").trim();
    }
}
