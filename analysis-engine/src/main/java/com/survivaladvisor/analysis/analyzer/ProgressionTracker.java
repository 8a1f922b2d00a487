package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.analysis.progression.PhaseCatalog;
import com.survivaladvisor.common.model.GamePhase;
import com.survivaladvisor.common.model.Milestone;
import com.survivaladvisor.common.model.PhaseInfo;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationCategory;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects the account's progression phase and emits that phase's focus tips and warnings.
 *
 * <p>Phase rules are checked most advanced first:
 * <ul>
 *   <li>ENDGAME: fire-crystal level 5 or more</li>
 *   <li>LATE_GAME: furnace 30 or any fire-crystal level</li>
 *   <li>MID_GAME: furnace 19 or state age of 55 days</li>
 *   <li>EARLY_GAME: otherwise</li>
 * </ul>
 */
@Component
@Order(4)
public class ProgressionTracker implements RuleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProgressionTracker.class);

    private static final int FOCUS_TIPS = 3;
    private static final int WARNING_TIPS = 2;

    private record FurnaceStep(int level, String name, String benefit) {}

    private static final List<FurnaceStep> FURNACE_MILESTONES = List.of(
        new FurnaceStep(9,  "Research Center",  "Unlock research tree"),
        new FurnaceStep(18, "Pets Prep",        "Pets unlock at L18 + 55 days state age"),
        new FurnaceStep(19, "Daybreak Island",  "Major progression system"),
        new FurnaceStep(25, "Chief Charms",     "New stat boost system"),
        new FurnaceStep(30, "Fire Crystal Era", "FC progression begins")
    );

    private static final List<FurnaceStep> FIRE_CRYSTAL_MILESTONES = List.of(
        new FurnaceStep(1, "FC1 Complete", "T9 troops available"),
        new FurnaceStep(3, "FC3 Complete", "T10 troops, War Academy expands"),
        new FurnaceStep(5, "FC5 Complete", "T11 troops, endgame progression")
    );

    @Override
    public List<RecommendationRecord> analyze(PlayerSnapshot snapshot) {
        GamePhase phase = detectPhase(snapshot);
        PhaseCatalog.PhaseGuide guide = PhaseCatalog.guide(phase);
        String id = phase.key();

        log.info("[ProgressionTracker] Detected phase={} furnace={} fireCrystal={}",
            id, snapshot.furnaceLevel(), snapshot.fireCrystalLevel());

        List<RecommendationRecord> records = new ArrayList<>();
        List<String> focus = guide.focus();
        for (int i = 0; i < Math.min(FOCUS_TIPS, focus.size()); i++) {
            records.add(RecommendationRecord.rule(i + 2, RecommendationCategory.PROGRESSION,
                focus.get(i), null, "Key focus for " + phase.displayName() + " players", "",
                "phase_" + id + "_focus_" + i, "progression", id));
        }
        for (String mistake : guide.commonMistakes().subList(0, Math.min(WARNING_TIPS, guide.commonMistakes().size()))) {
            records.add(RecommendationRecord.rule(4, RecommendationCategory.PROGRESSION,
                "Avoid: " + mistake, null, "Common mistake in " + phase.displayName(), "",
                "phase_" + id + "_warning", "warning", id));
        }
        return records;
    }

    @Override
    public String analyzerName() {
        return "ProgressionTracker";
    }

    @Override
    public RuleHandler handler() {
        return RuleHandler.PROGRESSION_TRACKER;
    }

    public GamePhase detectPhase(PlayerSnapshot snapshot) {
        int fc = snapshot.fireCrystalLevel();
        if (fc >= 5) {
            return GamePhase.ENDGAME;
        }
        if (snapshot.furnaceLevel() >= 30 || fc > 0) {
            return GamePhase.LATE_GAME;
        }
        if (snapshot.furnaceLevel() >= 19 || snapshot.stateAgeDays() >= 55) {
            return GamePhase.MID_GAME;
        }
        return GamePhase.EARLY_GAME;
    }

    /** Next furnace unlock, then fire-crystal unlock once furnace 30 is reached. */
    public Milestone nextMilestone(PlayerSnapshot snapshot) {
        int furnace = snapshot.furnaceLevel();
        for (FurnaceStep step : FURNACE_MILESTONES) {
            if (furnace < step.level()) {
                return new Milestone("furnace", "Furnace L" + step.level(), step.name(), step.benefit(),
                    step.level() - furnace);
            }
        }
        int fc = snapshot.fireCrystalLevel();
        for (FurnaceStep step : FIRE_CRYSTAL_MILESTONES) {
            if (fc < step.level()) {
                return new Milestone("fc", "FC" + step.level(), step.name(), step.benefit(), step.level() - fc);
            }
        }
        return new Milestone("endgame", "Optimization", "Endgame Optimization",
            "Focus on power efficiency and SvS dominance", 0);
    }

    /** Resources that relieve the current phase's bottlenecks, first occurrence wins. */
    public List<String> resourcePriorities(PlayerSnapshot snapshot) {
        Set<String> resources = new LinkedHashSet<>();
        for (String bottleneck : PhaseCatalog.guide(detectPhase(snapshot)).bottlenecks()) {
            resources.addAll(PhaseCatalog.resourcesFor(bottleneck));
        }
        return List.copyOf(resources);
    }

    public PhaseInfo phaseInfo(PlayerSnapshot snapshot) {
        GamePhase phase = detectPhase(snapshot);
        PhaseCatalog.PhaseGuide guide = PhaseCatalog.guide(phase);
        return new PhaseInfo(phase, phase.displayName(), guide.focus(), guide.commonMistakes(),
            guide.bottlenecks(), nextMilestone(snapshot), resourcePriorities(snapshot));
    }
}
