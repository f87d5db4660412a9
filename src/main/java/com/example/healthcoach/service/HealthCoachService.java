package com.example.healthcoach.service;

import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.jobs.Alert;
import com.example.healthcoach.jobs.AlertScanJob;
import com.example.healthcoach.jobs.Briefing;
import com.example.healthcoach.jobs.DailyBriefingJob;
import com.example.healthcoach.jobs.GoalProgress;
import com.example.healthcoach.jobs.GoalTracker;
import com.example.healthcoach.jobs.WeeklyReport;
import com.example.healthcoach.jobs.WeeklyReportJob;
import com.example.healthcoach.model.AssistantResponse;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.model.UserProfile;
import com.example.healthcoach.request.ScenarioRunRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry points of the coach: interactive questions, what-if scenarios and the callable jobs.
 * Blocking work is moved to the bounded elastic scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCoachService {

    private final ConversationManager conversationManager;
    private final ScenarioService scenarioService;
    private final UserProfileCache profileCache;
    private final DailyBriefingJob dailyBriefingJob;
    private final WeeklyReportJob weeklyReportJob;
    private final AlertScanJob alertScanJob;
    private final GoalTracker goalTracker;
    private final HealthRecordDao healthRecordDao;
    private final DailySummaryIndex summaryIndex;

    public Mono<AssistantResponse> answerQuery(String text, String sessionId) {
        return conversationManager.handle(text, sessionId);
    }

    public Mono<Briefing> generateBriefing(LocalDate date) {
        return blocking(() -> dailyBriefingJob.generate(date));
    }

    /** Null deltas leave the factor unchanged. */
    public Mono<ScenarioResult> runScenario(Double vo2Delta, Double sleepDelta, Double stepsDelta) {
        return blocking(() -> scenarioService.predict(
                scenarioService.requestFor(vo2Delta, sleepDelta, stepsDelta, profileCache.get())));
    }

    /**
     * Runs several what-if scenarios against the same profile snapshot, trial count and seed,
     * so their results differ only by the proposed changes. Results keep the input order.
     */
    public Mono<List<ScenarioResult>> compareScenarios(List<ScenarioRunRequest> scenarios) {
        return blocking(() -> {
            UserProfile profile = profileCache.get();
            List<ScenarioRequest> requests = scenarios.stream()
                    .map(s -> scenarioService.requestFor(s.getVo2Delta(), s.getSleepDelta(), s.getStepsDelta(), profile))
                    .toList();
            return scenarioService.compare(requests);
        });
    }

    public Mono<WeeklyReport> weeklyReport(LocalDate weekEnd) {
        return blocking(() -> weeklyReportJob.generate(weekEnd));
    }

    public Mono<List<Alert>> scanAlerts(LocalDate date) {
        return blocking(() -> alertScanJob.scan(date));
    }

    public Mono<List<GoalProgress>> trackGoals(LocalDate date) {
        return blocking(() -> goalTracker.track(date));
    }

    public Mono<List<ConversationTurn>> history(String sessionId, int limit) {
        return conversationManager.history(sessionId, limit);
    }

    /** Re-embeds the daily summaries of a date range into the similar-day index. */
    public Mono<Integer> indexSummaries(LocalDate start, LocalDate end) {
        return blocking(() -> {
            int indexed = summaryIndex.index(healthRecordDao.findRange(start, end));
            log.info("Indexed {} daily summaries for {}..{}", indexed, start, end);
            return indexed;
        });
    }

    /** Drops the cached profile; the next query reloads baselines. */
    public void refreshProfile() {
        profileCache.invalidate();
    }

    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
