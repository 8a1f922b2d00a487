package com.survivaladvisor.common.model;

/**
 * Account progression phases, least advanced first.
 */
public enum GamePhase {

    EARLY_GAME("early_game", "Early Game"),
    MID_GAME("mid_game", "Mid Game"),
    LATE_GAME("late_game", "Late Game (FC Era)"),
    ENDGAME("endgame", "Endgame");

    private final String key;
    private final String displayName;

    GamePhase(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() { return key; }

    public String displayName() { return displayName; }
}
