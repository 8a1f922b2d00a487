package com.survivaladvisor.common.classifier;

import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.GearSlot;
import com.survivaladvisor.common.model.IntentType;
import com.survivaladvisor.common.model.QuestionEntities;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure stateless classifier that routes a free-text question to the rule engine or the
 * AI fallback.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>explicit AI phrase ("ai", "claude", "gpt", ...) → {@link IntentType#AI}, confidence 1.0</li>
 *   <li>first contextual-reasoning match (comparisons, hypotheticals, opinions, ...) → {@link IntentType#AI}</li>
 *   <li>highest-confidence deterministic match, earlier rule on ties →
 *       {@link IntentType#RULES}, or {@link IntentType#HYBRID} below 0.8</li>
 *   <li>otherwise → {@link IntentType#AI}, category {@code general}, confidence 0.5</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class RequestClassifier {

    public static final double HYBRID_THRESHOLD = 0.8;
    public static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern EXPLICIT_AI =
        Pattern.compile("\\bai\\b|\\bclaude\\b|\\bgpt\\b|\\bchatgpt\\b|help me think");

    private static final List<ContextualRule> CONTEXTUAL_RULES = List.of(
        contextual("\\bwhat if\\b", "hypothetical", 0.95),
        contextual("\\bshould i (buy|spend|invest)\\b", "spending_decision", 0.85),
        contextual("\\bcompare\\b.*\\bvs\\b", "comparison", 0.9),
        contextual("\\bvs\\.?(\\s|$)|\\bversus\\b", "comparison", 0.9),
        contextual("\\bexplain\\b|\\bwhy\\b", "explanation", 0.8),
        contextual("\\bis it worth\\b", "value_judgment", 0.85),
        contextual("\\b(worth|good) (to )?(invest|upgrading|leveling|promoting)\\b", "value_judgment", 0.85),
        contextual("\\bbetter\\b|\\bworse\\b", "comparison", 0.8),
        contextual("\\bmore important\\b", "comparison", 0.9),
        contextual("\\bwhich (is|should|do)\\b.*\\b(more|first|better)\\b", "comparison", 0.85),
        contextual("\\b(hero power|chief gear|troop).*\\bor\\b.*\\bsame\\b", "comparison", 0.85),
        contextual("\\bor should i\\b", "comparison", 0.85),
        contextual("\\bstick with\\b|\\bswitch to\\b|\\breplace\\b", "strategic_decision", 0.8),
        contextual("\\bmistake\\b|\\bwrong\\b", "advice", 0.75),
        contextual("\\b(your|what do you) (think|recommend)\\b", "opinion", 0.7),
        contextual("\\bstrategy\\b|\\bplan\\b|\\bapproach\\b", "strategic", 0.7),
        contextual("\\b(is|are)\\b.*\\b(good|worth|viable)\\b", "hero_opinion", 0.8),
        contextual("\\bwhat is\\b.*\\bgood (for|at)\\b", "hero_opinion", 0.8),
        contextual("\\bhow (good|useful) is\\b", "hero_opinion", 0.8),
        contextual("\\btell me about\\b", "hero_info_ai", 0.75),
        contextual("\\balliance (tech|research|gift)", "alliance", 0.9),
        contextual("\\br4\\b|\\br5\\b|\\brally lead", "alliance_role", 0.85),
        contextual("\\balliance\\b", "alliance", 0.75)
    );

    private static final List<DeterministicRule> DETERMINISTIC_RULES = indexed(List.of(
        deterministic("\\bwhat should i (upgrade|level|focus)\\b", "upgrade", RuleHandler.HERO_ANALYZER, 0.9),
        deterministic("\\b(upgrade|level)\\b.*\\b(first|next)\\b", "upgrade", RuleHandler.HERO_ANALYZER, 0.85),
        deterministic("\\bpriorit(y|ies|ize)\\b", "priority", RuleHandler.COMBINED, 0.8),
        deterministic("\\bwhat to (upgrade|do) next\\b", "upgrade", RuleHandler.HERO_ANALYZER, 0.85),
        deterministic("\\bhow (should|do) i (upgrade|improve|progress)\\b", "upgrade", RuleHandler.PROGRESSION_TRACKER, 0.8),
        deterministic("\\bbest (lineup|team|composition|heroes)\\b", "lineup", RuleHandler.LINEUP_BUILDER, 0.9),
        deterministic("\\bbear trap\\b|\\bcrazy joe\\b|\\brally\\b", "lineup", RuleHandler.LINEUP_BUILDER, 0.85),
        deterministic("\\bwho should i use\\b", "lineup", RuleHandler.LINEUP_BUILDER, 0.8),
        deterministic("\\bgarrison\\b|\\bdefen[cs]e\\b|\\breinforce", "lineup", RuleHandler.LINEUP_BUILDER, 0.85),
        deterministic("\\bjoiner\\b|\\bjoining\\b", "lineup", RuleHandler.LINEUP_BUILDER, 0.9),
        deterministic("\\bexploration\\b|\\bfrozen\\b|\\bpve\\b", "lineup", RuleHandler.LINEUP_BUILDER, 0.8),
        deterministic("\\b(chief|hero) gear\\b", "gear", RuleHandler.GEAR_ADVISOR, 0.9),
        deterministic("\\b(ring|amulet|gloves|boots|helmet|armor)\\b", "gear", RuleHandler.GEAR_ADVISOR, 0.85),
        deterministic("\\bupgrade\\b.*\\bgear\\b", "gear", RuleHandler.GEAR_ADVISOR, 0.85),
        deterministic("\\bwhat gear\\b", "gear", RuleHandler.GEAR_ADVISOR, 0.8),
        deterministic("\\bjessie\\b|\\bsergey\\b", "joiner_heroes", RuleHandler.HERO_ANALYZER, 0.9),
        deterministic("\\b(expedition|exploration) skills?\\b", "skills", RuleHandler.HERO_ANALYZER, 0.85),
        deterministic("\\bheroes? to invest\\b", "invest", RuleHandler.HERO_ANALYZER, 0.8),
        deterministic("\\bwhat to buy\\b", "shop", RuleHandler.COMBINED, 0.7),
        deterministic("\\b(early|mid|late) game\\b", "phase", RuleHandler.PROGRESSION_TRACKER, 0.8),
        deterministic("\\bfurnace\\b|\\bfc\\d*\\b", "progression", RuleHandler.PROGRESSION_TRACKER, 0.75)
    ));

    /** Highest confidence first, then earliest declared rule. */
    private static final Comparator<DeterministicRule> BEST_MATCH =
        Comparator.comparingDouble(DeterministicRule::confidence).reversed()
            .thenComparingInt(DeterministicRule::index);

    private static final Pattern EXPLANATION_WORDS =
        Pattern.compile("\\bwhy\\b|\\bexplain\\b|\\bhow come\\b|\\breason\\b");
    private static final Pattern COMPARISON_MARKERS = Pattern.compile("\\bvs\\b| or ");

    private static final List<String> KNOWN_HEROES = List.of(
        "jessie", "sergey", "jeronimo", "natalia", "molly", "zinman", "bahiti", "gina",
        "flint", "philly", "alonso", "logan", "mia", "greg", "ahmose", "reina", "lynn",
        "hector", "wu ming", "patrick", "charlie", "cloris", "gordon", "renee", "eugene");

    private static final Map<String, String> MODE_KEYWORDS = modeKeywords();

    private static final Map<String, GearSlot> GEAR_KEYWORDS = gearKeywords();

    private RequestClassifier() {}

    /**
     * Classify a question. Total: any input, including null or blank, yields exactly one
     * request and never throws.
     *
     * @param question raw user text
     * @return routing decision; {@code ruleHandler} is null unless the intent routes to rules
     */
    public static ClassifiedRequest classify(String question) {
        String text = normalize(question);

        // ── explicit AI request ────────────────────────────────────────────
        if (EXPLICIT_AI.matcher(text).find()) {
            return ClassifiedRequest.ai("explicit_ai", 1.0, "User explicitly asked for AI");
        }

        // ── contextual reasoning: first match wins ─────────────────────────
        for (ContextualRule rule : CONTEXTUAL_RULES) {
            if (rule.pattern().matcher(text).find()) {
                return ClassifiedRequest.ai(rule.category(), rule.confidence(),
                    "Needs contextual reasoning: " + rule.category());
            }
        }

        // ── deterministic rules: best confidence wins ──────────────────────
        Optional<DeterministicRule> best = DETERMINISTIC_RULES.stream()
            .filter(rule -> rule.pattern().matcher(text).find())
            .min(BEST_MATCH);
        if (best.isPresent()) {
            DeterministicRule rule = best.get();
            if (rule.confidence() < HYBRID_THRESHOLD) {
                return ClassifiedRequest.rules(IntentType.HYBRID, rule.category(), rule.confidence(),
                    rule.handler(), "Rule match with AI enrichment: " + rule.category());
            }
            return ClassifiedRequest.rules(IntentType.RULES, rule.category(), rule.confidence(),
                rule.handler(), "Matched rule pattern: " + rule.category());
        }

        return ClassifiedRequest.ai("general", DEFAULT_CONFIDENCE, "No rule pattern matched");
    }

    /**
     * Whether a rule answer should be enriched by the AI collaborator: no rule output, or the
     * question asks for an explanation or a comparison the rules cannot give.
     */
    public static boolean needsAiFallback(List<RecommendationRecord> ruleResults, String question) {
        if (ruleResults == null || ruleResults.isEmpty()) {
            return true;
        }
        String text = normalize(question);
        return EXPLANATION_WORDS.matcher(text).find() || COMPARISON_MARKERS.matcher(text).find();
    }

    /**
     * Hero names, game-mode ids and gear slots mentioned in the question, each in order of
     * first appearance in the vocabulary and without duplicates.
     */
    public static QuestionEntities extractEntities(String question) {
        String text = normalize(question);

        List<String> heroes = new ArrayList<>();
        for (String hero : KNOWN_HEROES) {
            if (containsWord(text, hero)) {
                heroes.add(titleCase(hero));
            }
        }

        Set<String> modes = new LinkedHashSet<>();
        MODE_KEYWORDS.forEach((keyword, mode) -> {
            if (containsWord(text, keyword)) {
                modes.add(mode);
            }
        });

        Set<GearSlot> gear = new LinkedHashSet<>();
        GEAR_KEYWORDS.forEach((keyword, slot) -> {
            if (containsWord(text, keyword)) {
                gear.add(slot);
            }
        });

        return new QuestionEntities(heroes, new ArrayList<>(modes), new ArrayList<>(gear));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String normalize(String question) {
        return question == null ? "" : question.toLowerCase(Locale.ROOT).trim();
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text).find();
    }

    private static String titleCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = true;
        for (char c : name.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return sb.toString();
    }

    private static Map<String, String> modeKeywords() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("bear trap", "bear_trap");
        m.put("crazy joe", "crazy_joe");
        m.put("garrison", "garrison");
        m.put("rally", "rally");
        m.put("svs", "svs");
        m.put("exploration", "exploration");
        m.put("pve", "exploration");
        return m;
    }

    private static Map<String, GearSlot> gearKeywords() {
        Map<String, GearSlot> m = new LinkedHashMap<>();
        for (GearSlot slot : GearSlot.values()) {
            m.put(slot.key(), slot);
        }
        m.put("helmet", GearSlot.CAP);
        m.put("armor", GearSlot.COAT);
        m.put("gloves", GearSlot.PANTS);
        m.put("boots", GearSlot.WATCH);
        m.put("ring", GearSlot.BELT);
        m.put("amulet", GearSlot.WEAPON);
        return m;
    }

    private static ContextualRule contextual(String regex, String category, double confidence) {
        return new ContextualRule(Pattern.compile(regex), category, confidence);
    }

    private static DeterministicRule deterministic(String regex, String category, RuleHandler handler,
                                                   double confidence) {
        return new DeterministicRule(Pattern.compile(regex), category, handler, confidence, -1);
    }

    private static List<DeterministicRule> indexed(List<DeterministicRule> rules) {
        List<DeterministicRule> out = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            DeterministicRule r = rules.get(i);
            out.add(new DeterministicRule(r.pattern(), r.category(), r.handler(), r.confidence(), i));
        }
        return List.copyOf(out);
    }

    private record ContextualRule(Pattern pattern, String category, double confidence) {}

    private record DeterministicRule(Pattern pattern, String category, RuleHandler handler,
                                     double confidence, int index) {}
}
