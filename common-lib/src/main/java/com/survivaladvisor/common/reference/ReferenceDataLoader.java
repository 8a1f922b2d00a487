package com.survivaladvisor.common.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.common.exception.AdvisorException;
import com.survivaladvisor.common.model.TroopClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the reference tables from classpath JSON and memoizes them per base path.
 *
 * <p>A missing file is not an error: its tables stay empty and a warning is logged, so
 * analyzers degrade to their parametric fallbacks. A file that exists but cannot be parsed
 * raises {@link AdvisorException}.
 *
 * <p>The cache is a process-wide {@link ConcurrentHashMap}. Concurrent first loads of the
 * same path may both parse; either result is identical.
 */
public final class ReferenceDataLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    public static final String DEFAULT_BASE_PATH = "reference";

    static final String HEROES_FILE          = "heroes.json";
    static final String CHIEF_EQUIPMENT_FILE = "chief_equipment_data.json";
    static final String TROOP_FILE           = "troop_data.json";
    static final String WAR_ACADEMY_FILE     = "war_academy_steps.json";
    static final String HERO_POWER_FILE      = "hero_power_data.json";

    private static final Map<String, ReferenceData> CACHE = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;

    public ReferenceDataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReferenceData load() {
        return load(DEFAULT_BASE_PATH);
    }

    public ReferenceData load(String basePath) {
        String normalized = normalizeBasePath(basePath);
        ReferenceData cached = CACHE.get(normalized);
        if (cached != null) {
            return cached;
        }
        ReferenceData loaded = loadUncached(normalized);
        ReferenceData previous = CACHE.putIfAbsent(normalized, loaded);
        return previous != null ? previous : loaded;
    }

    /** Drops memoized tables. Test hook only. */
    static void clearCache() {
        CACHE.clear();
    }

    private ReferenceData loadUncached(String basePath) {
        JsonNode heroesRoot    = readResource(basePath, HEROES_FILE);
        JsonNode equipmentRoot = readResource(basePath, CHIEF_EQUIPMENT_FILE);
        JsonNode troopRoot     = readResource(basePath, TROOP_FILE);
        JsonNode academyRoot   = readResource(basePath, WAR_ACADEMY_FILE);
        JsonNode heroPowerRoot = readResource(basePath, HERO_POWER_FILE);

        ReferenceData data = new ReferenceData(
            parseHeroes(heroesRoot),
            parseGearTiers(equipmentRoot),
            parseCharmLevels(equipmentRoot),
            parseTroopPower(troopRoot),
            parseWarAcademy(academyRoot),
            parseNumberMap(heroPowerRoot.path("hero_xp_requirements").path("levels")),
            parseNumberMap(heroPowerRoot.path("hero_stars").path("shards_required")));

        log.info("[ReferenceData] loaded basePath={} heroes={} gearTiers={} charmLevels={} academyEdges={}",
            basePath, data.heroes().size(), data.maxGearTier(), data.maxCharmLevel(),
            academyRoot.path("edges").size());
        return data;
    }

    private JsonNode readResource(String basePath, String fileName) {
        String resource = basePath + "/" + fileName;
        try (InputStream in = ReferenceDataLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("[ReferenceData] resource missing, using empty table resource={}", resource);
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new AdvisorException("ReferenceData", "Failed to parse " + resource, e);
        }
    }

    // ── parsers ────────────────────────────────────────────────────────────

    private Map<String, HeroReference> parseHeroes(JsonNode root) {
        Map<String, HeroReference> heroes = new LinkedHashMap<>();
        for (JsonNode node : root.path("heroes")) {
            String name = node.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            heroes.put(name, new HeroReference(
                name,
                parseTroopClass(node.path("hero_class").asText(null), name),
                node.path("generation").asInt(1),
                HeroTier.fromLabel(node.path("tier_overall").asText(null)),
                node.path("rarity").asText(null)));
        }
        return heroes;
    }

    private TroopClass parseTroopClass(String raw, String heroName) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TroopClass c : TroopClass.values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        log.warn("[ReferenceData] unknown hero class hero={} class={}", heroName, raw);
        return null;
    }

    private Map<Integer, GearTierStep> parseGearTiers(JsonNode root) {
        Map<Integer, GearTierStep> tiers = new LinkedHashMap<>();
        for (JsonNode node : root.path("chief_gear").path("tier_progression")) {
            int tier = node.path("tier").asInt(0);
            if (tier > 0) {
                tiers.put(tier, new GearTierStep(tier,
                    node.path("name").asText("Tier " + tier),
                    node.path("bonus_percent").asDouble(0.0)));
            }
        }
        return tiers;
    }

    private Map<Integer, CharmLevelStep> parseCharmLevels(JsonNode root) {
        Map<Integer, CharmLevelStep> levels = new LinkedHashMap<>();
        for (JsonNode node : root.path("chief_charms").path("level_progression")) {
            int level = node.path("level").asInt(0);
            if (level > 0) {
                levels.put(level, new CharmLevelStep(level,
                    node.path("bonus_percent").asDouble(0.0),
                    node.path("shape").asText("")));
            }
        }
        return levels;
    }

    private Map<Integer, Map<TroopClass, Long>> parseTroopPower(JsonNode root) {
        Map<Integer, Map<TroopClass, Long>> power = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> tiers = root.path("power_per_unit").path("tiers").fields();
        while (tiers.hasNext()) {
            Map.Entry<String, JsonNode> entry = tiers.next();
            int tier;
            try {
                tier = Integer.parseInt(entry.getKey().replaceFirst("^[Tt]", ""));
            } catch (NumberFormatException e) {
                log.warn("[ReferenceData] skipping troop tier key={}", entry.getKey());
                continue;
            }
            Map<TroopClass, Long> perClass = new LinkedHashMap<>();
            for (TroopClass c : TroopClass.values()) {
                JsonNode value = entry.getValue().path(c.name().toLowerCase(Locale.ROOT));
                if (value.isNumber()) {
                    perClass.put(c, value.asLong());
                }
            }
            power.put(tier, perClass);
        }
        return power;
    }

    private Map<String, ResearchEdge> parseWarAcademy(JsonNode root) {
        Map<String, ResearchEdge> edges = new LinkedHashMap<>();
        for (JsonNode node : root.path("edges")) {
            String from = node.path("from").path("level").asText("");
            if (from.isBlank()) {
                continue;
            }
            Map<String, Long> cost = new LinkedHashMap<>();
            node.path("cost").fields().forEachRemaining(e -> cost.put(e.getKey(), e.getValue().asLong(0)));
            edges.put(from.trim().toUpperCase(Locale.ROOT), new ResearchEdge(
                from.trim().toUpperCase(Locale.ROOT),
                node.path("to").path("level").asText(""),
                node.path("power_gain").asLong(0),
                cost,
                node.path("prereq").path("furnace_fc_level").asText("")));
        }
        return edges;
    }

    /** Reads {@code {"1": {"xp": n}}} or {@code {"1": n}} shaped objects into number maps. */
    private Map<Integer, Long> parseNumberMap(JsonNode node) {
        Map<Integer, Long> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            try {
                int key = Integer.parseInt(e.getKey());
                JsonNode v = e.getValue();
                long amount = v.isNumber() ? v.asLong() : v.path("xp").asLong(0);
                values.put(key, amount);
            } catch (NumberFormatException ex) {
                log.warn("[ReferenceData] skipping non-numeric key={}", e.getKey());
            }
        });
        return values;
    }

    private static String normalizeBasePath(String basePath) {
        if (basePath == null || basePath.isBlank()) {
            return DEFAULT_BASE_PATH;
        }
        String p = basePath.trim();
        if (p.startsWith("classpath:")) {
            p = p.substring("classpath:".length());
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p.isEmpty() ? DEFAULT_BASE_PATH : p;
    }
}
