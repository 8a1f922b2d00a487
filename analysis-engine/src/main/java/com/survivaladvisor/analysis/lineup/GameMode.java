package com.survivaladvisor.analysis.lineup;

import com.survivaladvisor.common.exception.UnknownVocabularyException;
import com.survivaladvisor.common.model.PlayPriorities;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.ToIntFunction;

/**
 * Game modes with a lineup template, each tied to the play priority that makes it matter.
 * Joiner modes carry no priority of their own; joiner advice covers them.
 */
public enum GameMode {

    RALLY_LEADER_INFANTRY("rally_leader_infantry", "Rally Leader (Infantry Focus)", PlayPriorities::rally),
    RALLY_LEADER_MARKSMAN("rally_leader_marksman", "Rally Leader (Marksman Focus)", PlayPriorities::rally),
    RALLY_JOINER_ATTACK("rally_joiner_attack", "Rally Joiner (Attack)", null),
    RALLY_JOINER_DEFENSE("rally_joiner_defense", "Rally Joiner (Garrison/Defense)", null),
    BEAR_TRAP("bear_trap", "Bear Trap Rally", PlayPriorities::rally),
    CRAZY_JOE("crazy_joe", "Crazy Joe Rally", PlayPriorities::rally),
    GARRISON("garrison", "Castle Garrison", PlayPriorities::castle),
    EXPLORATION("exploration", "Exploration/PvE", PlayPriorities::exploration),
    SVS_MARCH("svs_march", "SvS Field March", PlayPriorities::svs);

    private final String key;
    private final String displayName;
    private final ToIntFunction<PlayPriorities> priority;

    GameMode(String key, String displayName, ToIntFunction<PlayPriorities> priority) {
        this.key = key;
        this.displayName = displayName;
        this.priority = priority;
    }

    public String key() { return key; }

    public String displayName() { return displayName; }

    public boolean isJoinerMode() {
        return priority == null;
    }

    /** How much the player cares about this mode, 0 for joiner modes. */
    public int priorityFor(PlayPriorities priorities) {
        return priority == null ? 0 : priority.applyAsInt(priorities);
    }

    public static GameMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (GameMode mode : values()) {
                if (mode.key.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new UnknownVocabularyException("game mode", name,
            Arrays.stream(values()).map(GameMode::key).toList());
    }
}
