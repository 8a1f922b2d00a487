package com.survivaladvisor.analysis.lineup;

import com.survivaladvisor.analysis.lineup.LineupTemplate.Slot;
import com.survivaladvisor.common.model.TroopClass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.survivaladvisor.common.model.TroopClass.INFANTRY;
import static com.survivaladvisor.common.model.TroopClass.LANCER;
import static com.survivaladvisor.common.model.TroopClass.MARKSMAN;

/**
 * Catalog of lineup templates, one per {@link GameMode}.
 */
public final class LineupTemplates {

    private static final Map<GameMode, LineupTemplate> TEMPLATES;

    static {
        Map<GameMode, LineupTemplate> t = new EnumMap<>(GameMode.class);

        t.put(GameMode.RALLY_LEADER_INFANTRY, new LineupTemplate(GameMode.RALLY_LEADER_INFANTRY, List.of(
                Slot.of("Lead", "Tank/Buffer", INFANTRY, "Jeronimo", "Natalia", "Flint"),
                Slot.of("Slot 2", "Support", INFANTRY, "Natalia", "Flint", "Bahiti"),
                Slot.of("Slot 3", "Infantry DPS", INFANTRY, "Flint", "Bahiti", "Sergey")),
            ratio(60, 20, 20),
            "Infantry-heavy for balanced push. Lead hero buffs determine rally effectiveness."));

        t.put(GameMode.RALLY_LEADER_MARKSMAN, new LineupTemplate(GameMode.RALLY_LEADER_MARKSMAN, List.of(
                Slot.of("Lead", "Marksman DPS", MARKSMAN, "Alonso", "Philly", "Logan"),
                Slot.of("Slot 2", "AOE/DPS", MARKSMAN, "Molly", "Philly", "Mia"),
                Slot.of("Slot 3", "Support", MARKSMAN, "Logan", "Mia", "Cloris")),
            ratio(20, 20, 60),
            "Marksman-heavy for max DPS. Good for Bear Trap and Crazy Joe."));

        t.put(GameMode.RALLY_JOINER_ATTACK, new LineupTemplate(GameMode.RALLY_JOINER_ATTACK, List.of(
                Slot.joiner("Slot 1 (Critical)", "Attack Joiner - ONLY this hero's top-right skill matters!",
                    "Jessie", "Jeronimo"),
                Slot.filler("Slot 2", "Filler (doesn't matter for joining)"),
                Slot.filler("Slot 3", "Filler (doesn't matter for joining)")),
            ratio(30, 20, 50),
            "ONLY slot 1 hero matters! If no good attack joiner, remove all heroes and send troops only."));

        t.put(GameMode.RALLY_JOINER_DEFENSE, new LineupTemplate(GameMode.RALLY_JOINER_DEFENSE, List.of(
                Slot.joiner("Slot 1 (Critical)", "Defense Joiner - ONLY this hero's top-right skill matters!",
                    "Sergey", "Natalia"),
                Slot.filler("Slot 2", "Filler"),
                Slot.filler("Slot 3", "Filler")),
            ratio(50, 30, 20),
            "ONLY slot 1 hero matters! Sergey's Defenders' Edge provides -20% damage taken."));

        t.put(GameMode.BEAR_TRAP, new LineupTemplate(GameMode.BEAR_TRAP, List.of(
                Slot.of("Lead", "DPS Lead", MARKSMAN, "Jeronimo", "Alonso", "Philly"),
                Slot.of("Slot 2", "AOE DPS", MARKSMAN, "Molly", "Alonso", "Logan"),
                Slot.of("Slot 3", "DPS Support", MARKSMAN, "Philly", "Logan", "Mia")),
            ratio(0, 10, 90),
            "Bear is slow. Maximize marksman DPS. Infantry not needed."));

        t.put(GameMode.CRAZY_JOE, new LineupTemplate(GameMode.CRAZY_JOE, List.of(
                Slot.of("Lead", "Infantry Lead", INFANTRY, "Jeronimo", "Natalia", "Flint"),
                Slot.of("Slot 2", "Tank/Support", INFANTRY, "Natalia", "Flint", "Bahiti"),
                Slot.of("Slot 3", "Infantry DPS", INFANTRY, "Flint", "Bahiti", "Sergey")),
            ratio(90, 10, 0),
            "Infantry kills before Joe's backline attacks. Minimize marksmen."));

        t.put(GameMode.GARRISON, new LineupTemplate(GameMode.GARRISON, List.of(
                Slot.of("Lead", "Defensive Lead", INFANTRY, "Sergey", "Natalia", "Jeronimo"),
                Slot.of("Slot 2", "Tank/Healer", null, "Natalia", "Bahiti", "Flint"),
                Slot.of("Slot 3", "Support", null, "Bahiti", "Flint", "Zinman")),
            ratio(60, 25, 15),
            "Defense-focused. Infantry absorb damage. Sergey's skill provides damage reduction."));

        t.put(GameMode.EXPLORATION, new LineupTemplate(GameMode.EXPLORATION, List.of(
                Slot.of("Tank", "Tank", INFANTRY, "Zinman", "Natalia", "Sergey"),
                Slot.of("Healer", "Healer/Support", null, "Natalia", "Gina", "Bahiti"),
                Slot.of("DPS", "Damage Dealer", null, "Molly", "Alonso", "Jeronimo")),
            ratio(40, 30, 30),
            "Uses EXPLORATION skills (left side). Tank + Healer + DPS composition."));

        t.put(GameMode.SVS_MARCH, new LineupTemplate(GameMode.SVS_MARCH, List.of(
                Slot.of("Lead", "Primary DPS", null, "Jeronimo", "Alonso", "Molly"),
                Slot.of("Slot 2", "Secondary DPS", null, "Alonso", "Molly", "Philly"),
                Slot.of("Slot 3", "Support/DPS", null, "Natalia", "Philly", "Logan")),
            ratio(40, 20, 40),
            "Balanced for field combat. Match hero class to your strongest troop type."));

        TEMPLATES = Collections.unmodifiableMap(t);
    }

    private LineupTemplates() {}

    public static LineupTemplate forMode(GameMode mode) {
        return TEMPLATES.get(mode);
    }

    private static Map<TroopClass, Integer> ratio(int infantry, int lancer, int marksman) {
        return Map.of(INFANTRY, infantry, LANCER, lancer, MARKSMAN, marksman);
    }
}
