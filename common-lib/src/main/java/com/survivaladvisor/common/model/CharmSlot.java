package com.survivaladvisor.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One of the eighteen charm sockets: an equipment piece crossed with a charm type.
 */
public record CharmSlot(GearSlot piece, CharmType type) {

    /** All eighteen sockets in equipment order, then charm order. */
    public static final List<CharmSlot> ALL;

    static {
        List<CharmSlot> all = new ArrayList<>();
        for (GearSlot piece : GearSlot.values()) {
            for (CharmType type : CharmType.values()) {
                all.add(new CharmSlot(piece, type));
            }
        }
        ALL = Collections.unmodifiableList(all);
    }

    public CharmSlot {
        Objects.requireNonNull(piece, "piece");
        Objects.requireNonNull(type, "type");
    }

    public static CharmSlot of(GearSlot piece, CharmType type) {
        return new CharmSlot(piece, type);
    }

    /** Stored key form, e.g. {@code cap_protection}. */
    public String key() {
        return piece.key() + "_" + type.key();
    }

    public String displayName() {
        return piece.displayName() + " " + type.displayName();
    }
}
