package com.example.healthcoach.jobs;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Seven-day report ending at {@code weekEnd}, compared with the week before.
 */
@Slf4j
@Service
public class WeeklyReportJob {

    public static final String JOB_NAME = "weekly-report";

    static final int MAX_ACTIONS = 5;
    static final double TREND_SPLIT_MMHG = 2.0;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("MMMM d", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_YEAR = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final String RULE = "=".repeat(50);

    private final HealthRecordDao dao;
    private final JobHistoryService jobHistory;
    private final CoachProperties.Profile profile;

    public WeeklyReportJob(HealthRecordDao dao, JobHistoryService jobHistory, CoachProperties properties) {
        this.dao = dao;
        this.jobHistory = jobHistory;
        this.profile = properties.getProfile();
    }

    public WeeklyReport generate(LocalDate weekEnd) {
        return jobHistory.run(JOB_NAME, weekEnd, () -> compose(weekEnd), r -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("daysRecorded", r.stats().daysRecorded());
            details.put("trend", r.trend());
            details.put("actions", r.actionPlan().size());
            return details;
        });
    }

    WeeklyReport compose(LocalDate weekEnd) {
        LocalDate weekStart = weekEnd.minusDays(6);
        List<DailyHealthRecord> week = dao.findRange(weekStart, weekEnd);
        List<DailyHealthRecord> prev = dao.findRange(weekStart.minusDays(7), weekStart.minusDays(1));
        WeekStats stats = WeekStats.of(week);
        WeekStats prevStats = WeekStats.of(prev);

        StringBuilder text = new StringBuilder("WEEKLY HEALTH REPORT: ")
                .append(DAY.format(weekStart)).append(" - ").append(DAY_YEAR.format(weekEnd)).append('\n');
        if (stats.isEmpty()) {
            log.info("No records for week ending {}", weekEnd);
            text.append("\nNo health data available for this week. Please make sure your health data is synced.");
            return new WeeklyReport(weekStart, weekEnd, stats, prevStats, null, null, null, List.of(), null, text.toString());
        }

        List<DailyHealthRecord> bpDays = week.stream().filter(r -> r.has(HealthMetric.SYSTOLIC))
                .sorted(Comparator.comparing((DailyHealthRecord r) -> r.value(HealthMetric.SYSTOLIC).orElseThrow()))
                .toList();
        DailyHealthRecord best = bpDays.isEmpty() ? null : bpDays.get(0);
        DailyHealthRecord worst = bpDays.isEmpty() ? null : bpDays.get(bpDays.size() - 1);
        String trend = trend(week);
        List<String> observations = observations(best, worst);
        double bpGoal = profile.getGoals().getOrDefault(HealthMetric.SYSTOLIC, 130.0);
        Double vo2Goal = profile.getGoals().get(HealthMetric.VO2_MAX);

        section(text, "1. BLOOD PRESSURE SUMMARY");
        if (stats.systolicAvg() != null) {
            text.append(String.format(Locale.ROOT, "Average: %.0f%s mmHg\n", stats.systolicAvg(),
                    stats.diastolicAvg() == null ? "" : String.format(Locale.ROOT, "/%.0f", stats.diastolicAvg())));
            text.append(String.format(Locale.ROOT, "Range: %.0f - %.0f mmHg (systolic)\n", stats.systolicMin(), stats.systolicMax()));
            text.append(String.format(Locale.ROOT, "Variability: ±%.1f mmHg\n", stats.systolicStd()));
            text.append("Days with readings: ").append(stats.systolicDays()).append("/7\n");
            if (prevStats.systolicAvg() != null) {
                text.append(String.format(Locale.ROOT, "vs previous week: %+.1f mmHg\n", stats.systolicAvg() - prevStats.systolicAvg()));
            }
            text.append(stats.systolicAvg() < bpGoal
                    ? String.format(Locale.ROOT, "Status: below your %.0f mmHg goal. Excellent!\n", bpGoal)
                    : String.format(Locale.ROOT, "Status: %.0f mmHg above your %.0f mmHg goal\n", stats.systolicAvg() - bpGoal, bpGoal));
        } else {
            text.append("No BP readings this week.\n");
        }

        section(text, "2. SLEEP");
        if (stats.sleepAvg() != null) {
            text.append(String.format(Locale.ROOT, "Average: %.1f hours/night\n", stats.sleepAvg()));
            text.append("Nights under 7 hours: ").append(stats.sleepDaysUnder7()).append('\n');
            if (prevStats.sleepAvg() != null) {
                text.append(String.format(Locale.ROOT, "vs previous week: %+.1f hours\n", stats.sleepAvg() - prevStats.sleepAvg()));
            }
        } else {
            text.append("No sleep data recorded this week.\n");
        }

        section(text, "3. ACTIVITY");
        if (stats.stepsAvg() != null) {
            text.append(String.format(Locale.ROOT, "Daily average: %,d steps\n", Math.round(stats.stepsAvg())));
            text.append(String.format(Locale.ROOT, "Weekly total: %,d steps\n", stats.stepsTotal()));
            text.append("Days over 10,000: ").append(stats.stepsDaysOver10k()).append('\n');
            if (prevStats.stepsAvg() != null && prevStats.stepsAvg() > 0) {
                double change = stats.stepsAvg() - prevStats.stepsAvg();
                text.append(String.format(Locale.ROOT, "vs previous week: %+,d steps (%+.0f%%)\n",
                        Math.round(change), change / prevStats.stepsAvg() * 100.0));
            }
        } else {
            text.append("No step data recorded this week.\n");
        }

        if (stats.vo2Latest() != null) {
            section(text, "4. FITNESS (VO2 MAX)");
            text.append(String.format(Locale.ROOT, "Current: %.1f mL/kg/min\n", stats.vo2Latest()));
            if (vo2Goal != null) {
                double gap = vo2Goal - stats.vo2Latest();
                text.append(gap > 0
                        ? String.format(Locale.ROOT, "Gap to %.0f goal: %.1f mL/kg/min\n", vo2Goal, gap)
                        : "Status: goal achieved!\n");
            }
        }

        section(text, "5. KEY INSIGHTS");
        if (best != null) {
            text.append("Best day: ").append(best.date()).append(String.format(Locale.ROOT, " (%.0f mmHg)\n",
                    best.value(HealthMetric.SYSTOLIC).orElseThrow()));
            text.append("Challenging day: ").append(worst.date()).append(String.format(Locale.ROOT, " (%.0f mmHg)\n",
                    worst.value(HealthMetric.SYSTOLIC).orElseThrow()));
        }
        observations.forEach(o -> text.append("- ").append(o).append('\n'));
        if (trend != null) {
            text.append("Trend: BP ").append(trend).append(" through the week\n");
        }

        List<String> actions = actionPlan(stats, bpGoal, vo2Goal, best != null && !observations.isEmpty());
        section(text, "6. ACTION PLAN FOR NEXT WEEK");
        for (int i = 0; i < actions.size(); i++) {
            text.append(i + 1).append(". ").append(actions.get(i)).append('\n');
        }

        Double projected = null;
        if (stats.systolicAvg() != null) {
            projected = stats.systolicAvg() + ("improving".equals(trend) ? -2.0 : "worsening".equals(trend) ? 2.0 : 0.0);
            projected = Math.round(projected * 10.0) / 10.0;
            section(text, "7. NEXT WEEK FORECAST");
            text.append(String.format(Locale.ROOT, "If current habits continue: expected BP %.0f mmHg (±5)\n", projected));
        }

        return new WeeklyReport(weekStart, weekEnd, stats, prevStats,
                best == null ? null : best.date(), worst == null ? null : worst.date(),
                trend, actions, projected, text.toString().strip());
    }

    /** Compares the first and second half of the week's BP readings in date order. */
    static String trend(List<DailyHealthRecord> week) {
        List<Double> bp = week.stream()
                .sorted(Comparator.comparing(DailyHealthRecord::date))
                .map(r -> r.value(HealthMetric.SYSTOLIC))
                .flatMap(Optional::stream)
                .toList();
        if (bp.size() < 3) {
            return null;
        }
        int half = bp.size() / 2;
        double first = bp.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double second = bp.subList(bp.size() - half, bp.size()).stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        if (second < first - TREND_SPLIT_MMHG) {
            return "improving";
        }
        if (second > first + TREND_SPLIT_MMHG) {
            return "worsening";
        }
        return "stable";
    }

    private static List<String> observations(DailyHealthRecord best, DailyHealthRecord worst) {
        List<String> out = new ArrayList<>();
        if (best == null || worst == null || best == worst) {
            return out;
        }
        Optional<Double> bs = best.value(HealthMetric.SLEEP_HOURS);
        Optional<Double> ws = worst.value(HealthMetric.SLEEP_HOURS);
        if (bs.isPresent() && ws.isPresent() && Math.abs(bs.get() - ws.get()) > 1) {
            out.add(String.format(Locale.ROOT, "Best day had %+.1f hrs of sleep compared with the challenging day",
                    bs.get() - ws.get()));
        }
        Optional<Double> bst = best.value(HealthMetric.STEPS);
        Optional<Double> wst = worst.value(HealthMetric.STEPS);
        if (bst.isPresent() && wst.isPresent() && Math.abs(bst.get() - wst.get()) > 2000) {
            out.add(String.format(Locale.ROOT, "Best day had %+,d steps compared with the challenging day",
                    Math.round(bst.get() - wst.get())));
        }
        return out;
    }

    static List<String> actionPlan(WeekStats stats, double bpGoal, Double vo2Goal, boolean hasBestDayPattern) {
        List<String> actions = new ArrayList<>();
        if (stats.sleepAvg() != null && stats.sleepDaysUnder7() >= 3) {
            actions.add("Prioritize sleep: " + stats.sleepDaysUnder7() + " nights were under 7 hours. Target 7+ hours every night.");
        }
        if (stats.stepsAvg() != null && stats.stepsDaysOver10k() < 4) {
            actions.add("Increase daily activity: only " + stats.stepsDaysOver10k()
                    + " days hit 10k steps. Target 10,000 steps at least 5 days.");
        }
        if (stats.systolicAvg() != null && stats.systolicAvg() > bpGoal) {
            double gap = stats.systolicAvg() - bpGoal;
            actions.add(String.format(Locale.ROOT, "Focus on BP reduction: average is %.0f mmHg above goal. "
                    + "Target a %.0f mmHg lower average.", gap, Math.min(gap, 5.0)));
        }
        if (vo2Goal != null && stats.vo2Latest() != null && stats.vo2Latest() < vo2Goal) {
            actions.add("Add cardio sessions: VO2 max is your strongest BP factor. Target 3-4 sessions of 30+ minutes.");
        }
        if (hasBestDayPattern) {
            actions.add("Replicate your best day: follow the same sleep and activity pattern 4+ days.");
        }
        return actions.size() > MAX_ACTIONS ? actions.subList(0, MAX_ACTIONS) : actions;
    }

    private static void section(StringBuilder text, String title) {
        text.append('\n').append(RULE).append('\n').append(title).append('\n').append(RULE).append('\n');
    }
}
