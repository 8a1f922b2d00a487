package com.survivaladvisor.orchestrator.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.survivaladvisor.common.model.AdvisorAnswer;
import com.survivaladvisor.common.model.ClassifiedRequest;
import com.survivaladvisor.common.model.GearPriorityEntry;
import com.survivaladvisor.common.model.HeroInvestment;
import com.survivaladvisor.common.model.LineupResult;
import com.survivaladvisor.common.model.PhaseInfo;
import com.survivaladvisor.common.model.PlayerSnapshot;
import com.survivaladvisor.common.model.PowerUpgrade;
import com.survivaladvisor.common.model.RecommendationRecord;
import com.survivaladvisor.common.snapshot.SnapshotNormalizer;
import com.survivaladvisor.orchestrator.ai.AiRequestWindow;
import com.survivaladvisor.orchestrator.service.RecommendationOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/advisor")
public class AdvisorController {

    private final RecommendationOrchestrator orchestrator;
    private final SnapshotNormalizer snapshotNormalizer;
    private final Duration aiCooldown;

    public AdvisorController(RecommendationOrchestrator orchestrator,
                             SnapshotNormalizer snapshotNormalizer,
                             Duration aiCooldown) {
        this.orchestrator = orchestrator;
        this.snapshotNormalizer = snapshotNormalizer;
        this.aiCooldown = aiCooldown;
    }

    @PostMapping("/recommendations")
    public Mono<ResponseEntity<List<RecommendationRecord>>> recommendations(
            @RequestBody(required = false) JsonNode snapshot,
            @RequestParam(defaultValue = "10") int limit) {
        return orchestrator.getRecommendations(normalize(snapshot), limit).map(ResponseEntity::ok);
    }

    @PostMapping("/power")
    public Mono<ResponseEntity<List<PowerUpgrade>>> power(
            @RequestBody(required = false) JsonNode snapshot,
            @RequestParam(defaultValue = "10") int limit) {
        return Mono.fromCallable(() -> orchestrator.getPowerRecommendations(normalize(snapshot), limit))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/ask")
    public Mono<ResponseEntity<AdvisorAnswer>> ask(@RequestBody AskRequest request) {
        AiRequestWindow window = new AiRequestWindow(request.lastAiRequestAt(), aiCooldown);
        return Mono.fromCallable(() -> normalize(request.snapshot()))
            .flatMap(snapshot -> orchestrator.ask(snapshot, request.question(), request.forceAi(), window))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/lineup/{modeId}")
    public Mono<ResponseEntity<LineupResult>> lineup(@PathVariable String modeId,
                                                     @RequestBody(required = false) JsonNode snapshot) {
        return Mono.fromCallable(() -> orchestrator.getLineup(modeId, normalize(snapshot)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/phase")
    public Mono<ResponseEntity<PhaseInfo>> phase(@RequestBody(required = false) JsonNode snapshot) {
        return Mono.fromCallable(() -> orchestrator.getPhaseInfo(normalize(snapshot)))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/investments")
    public Mono<ResponseEntity<List<HeroInvestment>>> investments(
            @RequestBody(required = false) JsonNode snapshot,
            @RequestParam(defaultValue = "6") int limit) {
        return Mono.fromCallable(() -> orchestrator.getHeroInvestments(normalize(snapshot), limit))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/gear-priority/{tier}")
    public Mono<ResponseEntity<List<GearPriorityEntry>>> gearPriority(@PathVariable String tier) {
        return Mono.fromCallable(() -> orchestrator.getGearPriority(tier)).map(ResponseEntity::ok);
    }

    @GetMapping("/classify")
    public ResponseEntity<ClassifiedRequest> classify(@RequestParam(name = "q", defaultValue = "") String question) {
        return ResponseEntity.ok(orchestrator.classify(question));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private PlayerSnapshot normalize(JsonNode raw) {
        return raw == null ? PlayerSnapshot.empty() : snapshotNormalizer.normalize(raw);
    }
}
