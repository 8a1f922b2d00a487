package com.survivaladvisor.analysis.progression;

import com.survivaladvisor.common.model.GamePhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed per-phase guidance: focus areas, common mistakes and resource bottlenecks, each
 * list in priority order.
 */
public final class PhaseCatalog {

    public record PhaseGuide(List<String> focus, List<String> commonMistakes, List<String> bottlenecks) {}

    private static final Map<GamePhase, PhaseGuide> GUIDES;

    /** Bottleneck id to the resources that relieve it, most useful first. */
    private static final Map<String, List<String>> BOTTLENECK_RESOURCES = Map.of(
        "speedups",         List.of("General Speedups", "Building Speedups", "Research Speedups"),
        "resources",        List.of("Meat", "Wood", "Coal", "Iron"),
        "hero_shards",      List.of("Legendary Shards", "Epic Shards"),
        "charm_materials",  List.of("Charm Designs", "Charm Guides"),
        "fire_crystals",    List.of("Fire Crystals", "Refined Fire Crystals"),
        "fc_speedups",      List.of("FC Speedups", "General Speedups"),
        "essence_stones",   List.of("Essence Stones", "Mithril"),
        "whale_currencies", List.of("Gems", "Frost Stars"),
        "refined_fc",       List.of("Refined Fire Crystals"),
        "time",             List.of("General Speedups")
    );

    static {
        Map<GamePhase, PhaseGuide> g = new EnumMap<>(GamePhase.class);
        g.put(GamePhase.EARLY_GAME, new PhaseGuide(
            List.of("Rush Furnace to L19 for Daybreak Island",
                    "Unlock Research Center (Furnace L9)",
                    "Build troop capacity",
                    "Level main 3 heroes"),
            List.of("Spreading hero investment too thin",
                    "Buying resources with gems",
                    "Upgrading defensive chief gear first",
                    "Ignoring expedition skills"),
            List.of("speedups", "resources")));
        g.put(GamePhase.MID_GAME, new PhaseGuide(
            List.of("Push Furnace to L30 for FC unlock",
                    "Develop pet collection (unlocked at L18 + 55 days)",
                    "Establish charm progression (L25)",
                    "Build Gen 3-5 hero roster"),
            List.of("Ignoring Chief Gear for Hero Gear",
                    "Wrong skill priorities (exploration vs expedition)",
                    "Not preparing for FC transition",
                    "Over-investing in Gen 1 heroes"),
            List.of("speedups", "hero_shards", "charm_materials")));
        g.put(GamePhase.LATE_GAME, new PhaseGuide(
            List.of("FC Furnace progression",
                    "War Academy for troop efficiency",
                    "Hero Gear Mastery leveling",
                    "T10+ troop development"),
            List.of("Still using Gen 1 lineups",
                    "Not adapting to meta shifts",
                    "Ignoring Fire Crystal economy",
                    "Under-investing in War Academy"),
            List.of("fire_crystals", "fc_speedups", "essence_stones")));
        g.put(GamePhase.ENDGAME, new PhaseGuide(
            List.of("Complete FC10 progression",
                    "Max Hero Gear Mastery",
                    "Charm L12-16 (Gen 7+)",
                    "Power efficiency for SvS"),
            List.of("Not optimizing marginal gains",
                    "Ignoring new generation features",
                    "Inefficient resource allocation"),
            List.of("time", "whale_currencies", "refined_fc")));
        GUIDES = Collections.unmodifiableMap(g);
    }

    private PhaseCatalog() {}

    public static PhaseGuide guide(GamePhase phase) {
        return GUIDES.get(phase);
    }

    public static List<String> resourcesFor(String bottleneck) {
        return BOTTLENECK_RESOURCES.getOrDefault(bottleneck, List.of());
    }
}
