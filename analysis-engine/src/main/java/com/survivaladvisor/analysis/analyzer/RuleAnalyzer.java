package com.survivaladvisor.analysis.analyzer;

import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.model.RuleHandler;

import java.util.List;

public interface RuleAnalyzer {
    List<RecommendationRecord> analyze(PlayerSnapshot snapshot);
    String analyzerName();
    RuleHandler handler();
}
