package com.survivaladvisor.analysis.lineup;

import com.survivaladvisor.common.model.TroopClass;

import java.util.List;
import java.util.Map;

/**
 * Ideal composition for one game mode.
 */
public record LineupTemplate(
    GameMode mode,
    List<Slot> slots,
    Map<TroopClass, Integer> troopRatio,
    String notes
) {
    public LineupTemplate {
        slots      = List.copyOf(slots);
        troopRatio = Map.copyOf(troopRatio);
    }

    /** Slots with named preferred heroes; these decide lineup confidence. */
    public List<Slot> criticalSlots() {
        return slots.stream().filter(s -> !s.isFiller()).toList();
    }

    /**
     * One lineup position. {@code troopClass} is null when any class fits; {@code preferred}
     * is empty for filler positions. In a joiner slot only the listed heroes' joiner skill
     * counts, so preference dominates hero value.
     */
    public record Slot(String position, String role, TroopClass troopClass, List<String> preferred,
                       boolean joinerSlot) {
        public Slot {
            preferred = List.copyOf(preferred);
        }

        public static Slot of(String position, String role, TroopClass troopClass, String... preferred) {
            return new Slot(position, role, troopClass, List.of(preferred), false);
        }

        public static Slot joiner(String position, String role, String... preferred) {
            return new Slot(position, role, null, List.of(preferred), true);
        }

        public static Slot filler(String position, String role) {
            return new Slot(position, role, null, List.of(), false);
        }

        public boolean isFiller() {
            return preferred.isEmpty();
        }
    }
}
