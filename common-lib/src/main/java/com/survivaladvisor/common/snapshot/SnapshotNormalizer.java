package com.survivaladvisor.common.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survivaladvisor.common.exception.UnknownVocabularyException;
import com.survivaladvisor.common.model.CharmSlot;
import com.survivaladvisor.common.model.CharmType;
import com.survivaladvisor.common.model.ChiefEquipment;
import com.survivaladvisor.common.model.GearPiece;
import com.survivaladvisor.common.model.GearSlot;
import com.survivaladvisor.common.model.HeroGearSlot;
import com.survivaladvisor.common.model.HeroState;
import com.survivaladvisor.common.model.PlayPriorities;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.SpenderTier;
import com.survivaladvisor.common.reference.ReferenceData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw profile data (a Jackson tree or a plain map, as supplied by the snapshot
 * provider) into a canonical {@link PlayerSnapshot}.
 *
 * <p>Field names are accepted in snake_case, camelCase and the legacy profile spellings
 * ({@code server_age_days}, {@code spending_profile}, {@code helmet_quality}, ...). Missing
 * or malformed values fall back to their defaults with a warning; the normalizer never
 * rejects a snapshot. Hero names are mapped to their catalogue spelling ({@code jessie}
 * becomes {@code Jessie}) so analyzers can look heroes up by canonical name. Fire Crystal
 * levels are read from the first digit run ({@code "FC5"}, {@code "FC2-0"}).
 */
public final class SnapshotNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SnapshotNormalizer.class);

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final ObjectMapper objectMapper;
    private final ReferenceData referenceData;

    public SnapshotNormalizer(ObjectMapper objectMapper) {
        this(objectMapper, ReferenceData.empty());
    }

    public SnapshotNormalizer(ObjectMapper objectMapper, ReferenceData referenceData) {
        this.objectMapper  = objectMapper;
        this.referenceData = referenceData != null ? referenceData : ReferenceData.empty();
    }

    public PlayerSnapshot normalize(Map<String, ?> raw) {
        JsonNode root = raw == null ? null : objectMapper.valueToTree(raw);
        return normalize(root);
    }

    public PlayerSnapshot normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("[SnapshotNormalizer] snapshot missing or not an object, using defaults");
            return PlayerSnapshot.empty();
        }

        PlayerSnapshot.Builder builder = PlayerSnapshot.builder()
            .furnaceLevel(intField(root, 1, "furnace_level", "furnaceLevel"))
            .fireCrystalLevel(levelField(root, 0, "fire_crystal_level", "fireCrystalLevel", "furnace_fc_level"))
            .stateAgeDays(intField(root, 0, "state_age_days", "stateAgeDays", "server_age_days"))
            .spenderTier(spenderTier(root))
            .troopTier(intField(root, 1, "troop_tier", "troopTier"))
            .warAcademyLevel(textField(root, PlayerSnapshot.DEFAULT_WAR_ACADEMY_LEVEL,
                "war_academy_level", "warAcademyLevel"))
            .farmAccount(boolField(root, "farm_account", "farmAccount", "is_farm_account"))
            .priorities(priorities(root))
            .heroes(heroes(root))
            .chiefEquipment(chiefEquipment(root));

        return builder.build();
    }

    // ── progression / profile ──────────────────────────────────────────────

    private SpenderTier spenderTier(JsonNode root) {
        String raw = textField(root, null, "spender_tier", "spenderTier", "spending_profile");
        if (raw == null) {
            return SpenderTier.F2P;
        }
        return SpenderTier.parse(raw).orElseGet(() -> {
            log.warn("[SnapshotNormalizer] unknown spender tier value={}, defaulting to f2p", raw);
            return SpenderTier.F2P;
        });
    }

    private PlayPriorities priorities(JsonNode root) {
        JsonNode nested = root.path("priorities");
        JsonNode source = nested.isObject() ? nested : root;
        PlayPriorities d = PlayPriorities.DEFAULT;
        return new PlayPriorities(
            intField(source, d.svs(), "svs", "priority_svs"),
            intField(source, d.rally(), "rally", "priority_rally"),
            intField(source, d.castle(), "castle", "castle_battle", "priority_castle_battle"),
            intField(source, d.exploration(), "exploration", "priority_exploration"));
    }

    // ── heroes ─────────────────────────────────────────────────────────────

    private Map<String, HeroState> heroes(JsonNode root) {
        JsonNode node = first(root, "heroes", "user_heroes");
        Map<String, HeroState> heroes = new LinkedHashMap<>();
        if (node.isArray()) {
            for (JsonNode hero : node) {
                String name = textField(hero, null, "name", "hero", "hero_name");
                if (name == null || name.isBlank()) {
                    log.warn("[SnapshotNormalizer] skipping hero entry without a name");
                    continue;
                }
                heroes.put(canonicalHeroName(name), heroState(hero));
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                heroes.put(canonicalHeroName(e.getKey()), heroState(e.getValue()));
            }
        }
        return heroes;
    }

    private String canonicalHeroName(String raw) {
        String name = raw.trim();
        if (referenceData.heroes().isEmpty()) {
            return name;
        }
        return referenceData.canonicalHeroName(name).orElseGet(() -> {
            log.warn("[SnapshotNormalizer] hero not in reference catalogue name={}", name);
            return name;
        });
    }

    private HeroState heroState(JsonNode hero) {
        List<Integer> expedition  = skills(hero, "expedition");
        List<Integer> exploration = skills(hero, "exploration");
        return new HeroState(
            intField(hero, 1, "level"),
            intField(hero, 0, "stars", "star_rank", "ascension"),
            expedition,
            exploration,
            heroGear(hero));
    }

    private List<Integer> skills(JsonNode hero, String kind) {
        JsonNode list = first(hero, kind + "_skills", kind + "Skills");
        List<Integer> levels = new ArrayList<>();
        if (list.isArray()) {
            list.forEach(v -> levels.add(v.asInt(1)));
            return levels;
        }
        for (int i = 1; i <= 3; i++) {
            int fallback = i == 1 ? intField(hero, 1, kind + "_skill") : 1;
            levels.add(intField(hero, fallback, kind + "_skill_" + i));
        }
        return levels;
    }

    private Map<HeroGearSlot, GearPiece> heroGear(JsonNode hero) {
        Map<HeroGearSlot, GearPiece> gear = new EnumMap<>(HeroGearSlot.class);
        JsonNode nested = hero.path("gear");
        if (nested.isObject()) {
            nested.fields().forEachRemaining(e -> {
                try {
                    gear.put(HeroGearSlot.fromName(e.getKey()), piece(e.getValue()));
                } catch (UnknownVocabularyException ex) {
                    log.warn("[SnapshotNormalizer] skipping hero gear slot={} reason={}", e.getKey(), ex.getMessage());
                }
            });
            return gear;
        }
        for (HeroGearSlot slot : HeroGearSlot.values()) {
            String prefix = "gear_slot" + (slot.ordinal() + 1);
            if (hero.has(prefix + "_quality") || hero.has(prefix + "_level")) {
                gear.put(slot, GearPiece.of(intField(hero, 1, prefix + "_quality"),
                                            intField(hero, 1, prefix + "_level")));
            }
        }
        return gear;
    }

    // ── chief equipment ────────────────────────────────────────────────────

    private ChiefEquipment chiefEquipment(JsonNode root) {
        Map<GearSlot, GearPiece> gear = new EnumMap<>(GearSlot.class);
        JsonNode gearNode = first(root, "chief_gear", "chiefGear", "user_gear");
        if (gearNode.isArray()) {
            for (JsonNode entry : gearNode) {
                putGear(gear, textField(entry, null, "slot"), entry);
            }
        } else if (gearNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = gearNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String key = e.getKey();
                if (e.getValue().isObject()) {
                    putGear(gear, key, e.getValue());
                } else if (key.endsWith("_quality")) {
                    String slot = key.substring(0, key.length() - "_quality".length());
                    JsonNode synthetic = objectMapper.createObjectNode()
                        .put("quality", e.getValue().asInt(1))
                        .put("level", gearNode.path(slot + "_level").asInt(1));
                    putGear(gear, slot, synthetic);
                }
            }
        }

        Map<CharmSlot, Integer> charms = new LinkedHashMap<>();
        JsonNode charmNode = first(root, "chief_charms", "chiefCharms", "user_charms");
        if (charmNode.isArray()) {
            for (JsonNode entry : charmNode) {
                putCharm(charms, textField(entry, null, "gear_slot", "slot"),
                    textField(entry, null, "charm_type", "type"), entry.path("level").asInt(1));
            }
        } else if (charmNode.isObject()) {
            charmNode.fields().forEachRemaining(e -> {
                String key = e.getKey();
                int sep = key.lastIndexOf('_');
                if (sep <= 0) {
                    log.warn("[SnapshotNormalizer] skipping charm key={}", key);
                    return;
                }
                putCharm(charms, key.substring(0, sep), key.substring(sep + 1), e.getValue().asInt(1));
            });
        }
        return new ChiefEquipment(gear, charms);
    }

    private void putGear(Map<GearSlot, GearPiece> gear, String slotName, JsonNode entry) {
        if (slotName == null) {
            log.warn("[SnapshotNormalizer] skipping chief gear entry without a slot");
            return;
        }
        try {
            gear.put(GearSlot.fromName(slotName), piece(entry));
        } catch (UnknownVocabularyException e) {
            log.warn("[SnapshotNormalizer] skipping chief gear slot={} reason={}", slotName, e.getMessage());
        }
    }

    private void putCharm(Map<CharmSlot, Integer> charms, String slotName, String typeName, int level) {
        try {
            charms.put(CharmSlot.of(GearSlot.fromName(slotName), CharmType.fromName(typeName)), level);
        } catch (UnknownVocabularyException e) {
            log.warn("[SnapshotNormalizer] skipping charm slot={} type={} reason={}", slotName, typeName, e.getMessage());
        }
    }

    private GearPiece piece(JsonNode node) {
        if (node.isNumber()) {
            return GearPiece.of(node.asInt(1), 1);
        }
        return GearPiece.of(intField(node, 1, "quality", "tier"), intField(node, 1, "level"));
    }

    // ── field helpers ──────────────────────────────────────────────────────

    private static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && !v.isNull()) {
                return v;
            }
        }
        return node.path(names[0]);
    }

    private static int intField(JsonNode node, int fallback, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v == null || v.isNull()) {
                continue;
            }
            if (v.isNumber()) {
                return Math.max(0, v.asInt());
            }
            if (v.isTextual()) {
                try {
                    return Math.max(0, Integer.parseInt(v.asText().trim()));
                } catch (NumberFormatException e) {
                    log.warn("[SnapshotNormalizer] non-numeric field={} value={}, using default={}",
                        name, v.asText(), fallback);
                    return fallback;
                }
            }
        }
        return fallback;
    }

    /** Like {@link #intField} but reads the first digit run of text values such as {@code "FC2-0"}. */
    private static int levelField(JsonNode node, int fallback, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v == null || v.isNull()) {
                continue;
            }
            if (v.isNumber()) {
                return Math.max(0, v.asInt());
            }
            Matcher m = DIGITS.matcher(v.asText());
            if (m.find()) {
                try {
                    return Integer.parseInt(m.group());
                } catch (NumberFormatException e) {
                    log.warn("[SnapshotNormalizer] level out of range field={} value={}", name, v.asText());
                    return fallback;
                }
            }
            log.warn("[SnapshotNormalizer] no level in field={} value={}, using default={}",
                name, v.asText(), fallback);
            return fallback;
        }
        return fallback;
    }

    private static String textField(JsonNode node, String fallback, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && !v.isNull() && !v.asText().isBlank()) {
                return v.asText();
            }
        }
        return fallback;
    }

    private static boolean boolField(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && !v.isNull()) {
                return v.isBoolean() ? v.asBoolean() : v.asInt(0) != 0 || "true".equalsIgnoreCase(v.asText());
            }
        }
        return false;
    }
}
