package com.example.healthcoach.jobs;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.GoalSnapshotRepository;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.entity.GoalSnapshotEntity;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the last seven days against the long-run baseline for every configured goal and
 * appends a snapshot per goal.
 */
@Slf4j
@Service
public class GoalTracker {

    public static final String JOB_NAME = "goal-tracking";

    static final int CURRENT_WINDOW_DAYS = 7;

    private static final Map<HealthMetric, Double> FALLBACK_BASELINES = Map.of(
            HealthMetric.SYSTOLIC, 142.0,
            HealthMetric.VO2_MAX, 37.0,
            HealthMetric.SLEEP_HOURS, 6.5,
            HealthMetric.STEPS, 9000.0);

    private final HealthRecordDao dao;
    private final GoalSnapshotRepository snapshotRepository;
    private final JobHistoryService jobHistory;
    private final CoachProperties.Profile profile;
    private final Clock clock;

    public GoalTracker(HealthRecordDao dao, GoalSnapshotRepository snapshotRepository, JobHistoryService jobHistory,
                       CoachProperties properties, Clock clock) {
        this.dao = dao;
        this.snapshotRepository = snapshotRepository;
        this.jobHistory = jobHistory;
        this.profile = properties.getProfile();
        this.clock = clock;
    }

    public List<GoalProgress> track(LocalDate date) {
        return jobHistory.run(JOB_NAME, date, () -> {
            List<GoalProgress> progress = evaluate(date);
            progress.forEach(p -> snapshotRepository.save(new GoalSnapshotEntity()
                    .setSnapshotDate(date)
                    .setMetric(p.metric())
                    .setTargetValue(p.target())
                    .setBaselineValue(p.baseline())
                    .setCurrentValue(p.current())
                    .setProgressPct(p.progressPct())
                    .setStatus(p.status())
                    .setCreatedAt(clock.instant())));
            return progress;
        }, progress -> {
            Map<String, Object> details = new LinkedHashMap<>();
            progress.forEach(p -> details.put(p.metric().name(), p.status().name()));
            return details;
        });
    }

    List<GoalProgress> evaluate(LocalDate date) {
        Map<HealthMetric, Double> baselines = dao.averages(date.minusDays(profile.getBaselineDays()), date);
        List<DailyHealthRecord> recent = dao.findRange(date.minusDays(CURRENT_WINDOW_DAYS - 1), date);
        Map<HealthMetric, Double> current = currentValues(recent);

        List<GoalProgress> out = new ArrayList<>();
        for (Map.Entry<HealthMetric, Double> goal : new EnumMap<>(profile.getGoals()).entrySet()) {
            HealthMetric metric = goal.getKey();
            Double fallback = FALLBACK_BASELINES.get(metric);
            Double baseline = Optional.ofNullable(baselines.get(metric)).orElse(fallback);
            if (baseline == null) {
                log.debug("Skipping goal {} without baseline", metric);
                continue;
            }
            double now = current.getOrDefault(metric, baseline);
            out.add(progress(metric, baseline, now, goal.getValue()));
        }
        return out;
    }

    static GoalProgress progress(HealthMetric metric, double baseline, double current, double target) {
        double gap = Math.abs(current - target);
        double pct;
        if (current == target || metric.isBetter(current, target)) {
            pct = 100.0;
        } else if (!metric.isBetter(current, baseline)) {
            pct = 0.0;
        } else {
            pct = Math.abs(current - baseline) / Math.abs(target - baseline) * 100.0;
            pct = Math.min(100.0, Math.max(0.0, pct));
        }
        pct = Math.round(pct * 10.0) / 10.0;
        GoalStatus status = pct >= 100.0 ? GoalStatus.ACHIEVED
                : pct > 0.0 ? GoalStatus.ON_TRACK
                : GoalStatus.NOT_STARTED;
        return new GoalProgress(metric, baseline, current, target, pct, Math.round(gap * 100.0) / 100.0, status);
    }

    /** Seven-day means, except VO2 max which uses the latest reading. */
    static Map<HealthMetric, Double> currentValues(List<DailyHealthRecord> recent) {
        Map<HealthMetric, Double> values = new EnumMap<>(HealthMetric.class);
        for (HealthMetric metric : HealthMetric.values()) {
            if (metric == HealthMetric.VO2_MAX) {
                recent.stream()
                        .filter(r -> r.has(metric))
                        .max(Comparator.comparing(DailyHealthRecord::date))
                        .flatMap(r -> r.value(metric))
                        .ifPresent(v -> values.put(metric, v));
                continue;
            }
            recent.stream()
                    .map(r -> r.value(metric))
                    .flatMap(Optional::stream)
                    .mapToDouble(Double::doubleValue)
                    .average()
                    .ifPresent(v -> values.put(metric, v));
        }
        return values;
    }
}
