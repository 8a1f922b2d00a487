package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of {@code ask}. {@code answer} is never blank. {@code aiEnhancement} is only set
 * for hybrid questions where the AI collaborator added context to a rule answer;
 * {@code lineup} only for lineup questions that matched a game mode.
 */
public record AdvisorAnswer(
    @JsonProperty("answer") String answer,
    @JsonProperty("source") AnswerSource source,
    @JsonProperty("category") String category,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("recommendations") List<RecommendationRecord> recommendations,
    @JsonProperty("aiEnhancement") String aiEnhancement,
    @JsonProperty("lineup") LineupResult lineup
) {
    public AdvisorAnswer {
        if (answer == null || answer.isBlank()) {
            throw new IllegalArgumentException("answer must not be blank");
        }
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static AdvisorAnswer of(String answer, AnswerSource source, String category, double confidence,
                                   List<RecommendationRecord> recommendations) {
        return new AdvisorAnswer(answer, source, category, confidence, recommendations, null, null);
    }

    public AdvisorAnswer withAiEnhancement(String enhancement) {
        return new AdvisorAnswer(answer, source, category, confidence, recommendations, enhancement, lineup);
    }

    public AdvisorAnswer withLineup(LineupResult lineupResult) {
        return new AdvisorAnswer(answer, source, category, confidence, recommendations, aiEnhancement, lineupResult);
    }

    public AdvisorAnswer withSource(AnswerSource newSource) {
        return new AdvisorAnswer(answer, newSource, category, confidence, recommendations, aiEnhancement, lineup);
    }
}
