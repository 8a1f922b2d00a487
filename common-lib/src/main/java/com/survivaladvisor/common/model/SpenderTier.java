package com.survivaladvisor.common.model;

import com.survivaladvisor.common.exception.UnknownVocabularyException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered monetization classification, lightest spender first.
 *
 * <p>Each tier caps how many heroes may carry hero-gear investment and how many heroes are
 * worth a full investment plan. The legacy profile names {@code low_spender} and
 * {@code medium_spender} resolve to {@link #MINNOW} and {@link #DOLPHIN}.
 */
public enum SpenderTier {

    F2P("f2p", 1, 3),
    MINNOW("minnow", 2, 4),
    DOLPHIN("dolphin", 4, 6),
    ORCA("orca", 6, 10),
    WHALE("whale", Integer.MAX_VALUE, Integer.MAX_VALUE);

    private final String key;
    private final int heroGearCap;
    private final int heroInvestmentCap;

    SpenderTier(String key, int heroGearCap, int heroInvestmentCap) {
        this.key = key;
        this.heroGearCap = heroGearCap;
        this.heroInvestmentCap = heroInvestmentCap;
    }

    public String key() { return key; }

    /** Maximum number of heroes that should simultaneously carry hero gear. */
    public int heroGearCap() { return heroGearCap; }

    /** Maximum number of heroes worth a long-term level/star investment plan. */
    public int heroInvestmentCap() { return heroInvestmentCap; }

    public boolean isAtLeast(SpenderTier other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Lenient lookup used at the snapshot boundary, where the tier is player data.
     *
     * @return the tier, or empty when the name is blank or unrecognised
     */
    public static Optional<SpenderTier> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        switch (normalized) {
            case "low_spender":    return Optional.of(MINNOW);
            case "medium_spender": return Optional.of(DOLPHIN);
            default:
                return Arrays.stream(values())
                    .filter(t -> t.key.equals(normalized))
                    .findFirst();
        }
    }

    /**
     * Strict lookup for caller-supplied names.
     *
     * @throws UnknownVocabularyException when the name is not a known tier
     */
    public static SpenderTier fromName(String name) {
        return parse(name).orElseThrow(() -> new UnknownVocabularyException("spender tier", name,
            Arrays.stream(values()).map(SpenderTier::key).toList()));
    }
}
