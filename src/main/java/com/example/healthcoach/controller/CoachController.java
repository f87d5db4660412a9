package com.example.healthcoach.controller;

import com.example.healthcoach.jobs.Alert;
import com.example.healthcoach.jobs.Briefing;
import com.example.healthcoach.jobs.GoalProgress;
import com.example.healthcoach.jobs.WeeklyReport;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.request.AskRequest;
import com.example.healthcoach.request.ScenarioRunRequest;
import com.example.healthcoach.response.ErrorResponse;
import com.example.healthcoach.service.HealthCoachService;
import com.example.healthcoach.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/v1/coach")
@Tag(name = "Health Coach API", description = "Questions, what-if scenarios and the callable jobs")
@RequiredArgsConstructor
public class CoachController {

    private final HealthCoachService coachService;
    private final Clock clock;

    @PostMapping("/ask")
    @Operation(summary = "Answer a question about the user's health data",
            description = "Classifies, retrieves evidence, routes to a backend and persists the turn.")
    public Mono<ResponseEntity<?>> ask(@RequestBody AskRequest req) {
        return coachService.answerQuery(req.getQuery(), req.getSessionId())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(new ErrorResponse(ex.getReasons()))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while answering", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(ErrorResponse.of("Unexpected error occurred.")));
                });
    }

    @GetMapping("/sessions/{sessionId}/turns")
    @Operation(summary = "Persisted turns of a session, oldest first")
    public Mono<List<ConversationTurn>> history(@PathVariable String sessionId,
                                                @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return coachService.history(sessionId, limit);
    }

    @PostMapping("/scenario")
    @Operation(summary = "Run a what-if scenario",
            description = "Predicts the BP change for the given VO2 max, sleep and step deltas.")
    public Mono<ScenarioResult> scenario(@RequestBody ScenarioRunRequest req) {
        return coachService.runScenario(req.getVo2Delta(), req.getSleepDelta(), req.getStepsDelta());
    }

    @PostMapping("/scenario/compare")
    @Operation(summary = "Compare what-if scenarios",
            description = "Runs each scenario with the same profile and seed; results keep the request order.")
    public Mono<ResponseEntity<?>> compareScenarios(@RequestBody List<ScenarioRunRequest> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorResponse.of("At least one scenario is required.")));
        }
        return coachService.compareScenarios(scenarios).<ResponseEntity<?>>map(ResponseEntity::ok);
    }

    @PostMapping("/briefing")
    @Operation(summary = "Generate the morning briefing", description = "Defaults to today.")
    public Mono<Briefing> briefing(@RequestParam(value = "date", required = false)
                                   @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return coachService.generateBriefing(orToday(date));
    }

    @PostMapping("/weekly-report")
    @Operation(summary = "Generate the weekly report", description = "Defaults to the week ending yesterday.")
    public Mono<WeeklyReport> weeklyReport(@RequestParam(value = "weekEnd", required = false)
                                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekEnd) {
        return coachService.weeklyReport(weekEnd == null ? LocalDate.now(clock).minusDays(1) : weekEnd);
    }

    @PostMapping("/alerts/scan")
    @Operation(summary = "Run the alert rules for a day")
    public Mono<List<Alert>> scanAlerts(@RequestParam(value = "date", required = false)
                                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return coachService.scanAlerts(orToday(date));
    }

    @PostMapping("/goals/track")
    @Operation(summary = "Snapshot progress toward every goal")
    public Mono<List<GoalProgress>> trackGoals(@RequestParam(value = "date", required = false)
                                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return coachService.trackGoals(orToday(date));
    }

    @PostMapping("/index")
    @Operation(summary = "Re-embed daily summaries for similar-day search")
    public Mono<Map<String, Integer>> index(@RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
                                            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        return coachService.indexSummaries(start, end).map(n -> Map.of("indexed", n));
    }

    @PostMapping("/profile/refresh")
    @Operation(summary = "Drop the cached profile so baselines are reloaded")
    public Mono<ResponseEntity<Void>> refreshProfile() {
        coachService.refreshProfile();
        return Mono.just(ResponseEntity.noContent().build());
    }

    private LocalDate orToday(LocalDate date) {
        return date == null ? LocalDate.now(clock) : date;
    }
}
