package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Game entities mentioned in a question: hero names, game-mode ids and gear slots.
 */
public record QuestionEntities(
    @JsonProperty("heroes") List<String> heroes,
    @JsonProperty("gameModes") List<String> gameModes,
    @JsonProperty("gearPieces") List<GearSlot> gearPieces
) {
    public QuestionEntities {
        heroes     = heroes != null ? List.copyOf(heroes) : List.of();
        gameModes  = gameModes != null ? List.copyOf(gameModes) : List.of();
        gearPieces = gearPieces != null ? List.copyOf(gearPieces) : List.of();
    }

    public boolean isEmpty() {
        return heroes.isEmpty() && gameModes.isEmpty() && gearPieces.isEmpty();
    }
}
