package com.survivaladvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One equipment piece: quality on the 1..7 ladder plus its enhancement level.
 */
public record GearPiece(
    @JsonProperty("quality") int quality,
    @JsonProperty("level") int level
) {
    public static final GearPiece BASELINE = new GearPiece(1, 1);

    public GearPiece {
        quality = Math.max(1, Math.min(7, quality));
        level   = Math.max(1, level);
    }

    public static GearPiece of(int quality, int level) {
        return new GearPiece(quality, level);
    }

    public GearQuality gearQuality() {
        return GearQuality.of(quality);
    }

    /** True once the piece has been upgraded past its starting state. */
    public boolean isInvested() {
        return quality > 1 || level > 1;
    }
}
