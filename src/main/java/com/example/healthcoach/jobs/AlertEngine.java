package com.example.healthcoach.jobs;

import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Rule checks over the recent daily records. Streaks count consecutive calendar days ending
 * at the scan date; a day without a record ends the streak.
 */
public class AlertEngine {

    static final double POOR_SLEEP_HOURS = 6.0;
    static final int POOR_SLEEP_STREAK = 3;
    static final double MMHG_PER_POOR_NIGHT = 2.0;
    static final double FALLBACK_SYSTOLIC = 140.0;
    static final int ANOMALY_WINDOW_DAYS = 14;
    static final int MIN_HISTORY = 3;
    static final double SPIKE_FLOOR = 140.0;
    static final double LOW_CEILING = 130.0;
    static final double STEPS_TARGET = 10000.0;
    static final double TREND_THRESHOLD = 5.0;

    private final HealthRecordDao dao;

    public AlertEngine(HealthRecordDao dao) {
        this.dao = dao;
    }

    /**
     * @param baselineSystolic average systolic used for the sleep streak forecast, may be null
     * @param systolicGoal     the user's systolic goal
     */
    public List<Alert> checkAll(LocalDate date, Double baselineSystolic, double systolicGoal) {
        List<Alert> alerts = new ArrayList<>();
        checkSleepStreak(date, baselineSystolic).ifPresent(alerts::add);
        checkBpAnomaly(date).ifPresent(alerts::add);
        checkBpGoalStreak(date, systolicGoal).ifPresent(alerts::add);
        checkStepsWeek(date).ifPresent(alerts::add);
        checkTrend(date).ifPresent(alerts::add);
        checkElevatedDespiteHabits(date, systolicGoal).ifPresent(alerts::add);
        return alerts;
    }

    Optional<Alert> checkSleepStreak(LocalDate date, Double baselineSystolic) {
        List<DailyHealthRecord> week = dao.findRange(date.minusDays(6), date);
        int nights = streak(week, date, r -> r.value(HealthMetric.SLEEP_HOURS)
                .map(h -> h < POOR_SLEEP_HOURS).orElse(false));
        if (nights < POOR_SLEEP_STREAK) {
            return Optional.empty();
        }
        double base = baselineSystolic == null ? FALLBACK_SYSTOLIC : baselineSystolic;
        double increase = nights * MMHG_PER_POOR_NIGHT;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("consecutiveNights", nights);
        details.put("predictedIncrease", increase);
        return Optional.of(new Alert(date, AlertType.POOR_SLEEP_STREAK, AlertPriority.WARNING,
                "Poor sleep streak",
                String.format(Locale.ROOT, "%d consecutive nights under 6 hours of sleep. "
                                + "Tomorrow's BP is predicted at %.0f-%.0f mmHg. Prioritize 7+ hours tonight.",
                        nights, base + increase, base + increase + 4),
                details));
    }

    Optional<Alert> checkBpAnomaly(LocalDate date) {
        List<DailyHealthRecord> window = dao.findRange(date.minusDays(ANOMALY_WINDOW_DAYS), date);
        Optional<Double> today = window.stream()
                .filter(r -> r.date().equals(date))
                .findFirst()
                .flatMap(r -> r.value(HealthMetric.SYSTOLIC));
        List<Double> history = window.stream()
                .filter(r -> r.date().isBefore(date))
                .map(r -> r.value(HealthMetric.SYSTOLIC))
                .flatMap(Optional::stream)
                .toList();
        if (today.isEmpty() || history.size() < MIN_HISTORY) {
            return Optional.empty();
        }
        double bp = today.get();
        double avg = mean(history);
        double sd = stdev(history, avg);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("todaySystolic", bp);
        details.put("averageSystolic", round1(avg));
        details.put("standardDeviation", round1(sd));
        if (bp > avg + 2 * sd && bp > SPIKE_FLOOR) {
            return Optional.of(new Alert(date, AlertType.BP_SPIKE, AlertPriority.WARNING, "Elevated BP detected",
                    String.format(Locale.ROOT, "Today's BP (%.0f mmHg) is well above your recent average "
                            + "(%.0f mmHg). Check stress, sleep and activity levels.", bp, avg),
                    details));
        }
        if (bp < avg - 2 * sd && bp < LOW_CEILING) {
            return Optional.of(new Alert(date, AlertType.BP_LOW, AlertPriority.CELEBRATION, "Excellent BP reading",
                    String.format(Locale.ROOT, "Today's BP (%.0f mmHg) is %.0f mmHg below your average. "
                            + "Note what you did differently!", bp, avg - bp),
                    details));
        }
        return Optional.empty();
    }

    Optional<Alert> checkBpGoalStreak(LocalDate date, double goal) {
        List<DailyHealthRecord> window = dao.findRange(date.minusDays(13), date);
        int days = streak(window, date, r -> r.value(HealthMetric.SYSTOLIC).map(s -> s < goal).orElse(false));
        if (days != 7 && days != 14) {
            return Optional.empty();
        }
        String title = days == 7 ? "7-day BP streak" : "2-week BP streak";
        return Optional.of(new Alert(date, AlertType.BP_GOAL_STREAK, AlertPriority.CELEBRATION, title,
                String.format(Locale.ROOT, "%d consecutive days with BP under %.0f mmHg. Keep it going!", days, goal),
                Map.of("streakDays", days, "goal", goal)));
    }

    Optional<Alert> checkStepsWeek(LocalDate date) {
        List<DailyHealthRecord> week = dao.findRange(date.minusDays(6), date);
        int days = streak(week, date, r -> r.value(HealthMetric.STEPS).map(s -> s >= STEPS_TARGET).orElse(false));
        if (days != 7) {
            return Optional.empty();
        }
        return Optional.of(new Alert(date, AlertType.STEPS_WEEK, AlertPriority.CELEBRATION, "Perfect activity week",
                "7 consecutive days with 10,000+ steps. This is excellent for your BP.",
                Map.of("streakDays", days, "goal", STEPS_TARGET)));
    }

    Optional<Alert> checkTrend(LocalDate date) {
        List<DailyHealthRecord> thisWeek = dao.findRange(date.minusDays(6), date);
        List<DailyHealthRecord> lastWeek = dao.findRange(date.minusDays(13), date.minusDays(7));
        List<Double> thisBp = values(thisWeek, HealthMetric.SYSTOLIC);
        List<Double> lastBp = values(lastWeek, HealthMetric.SYSTOLIC);
        if (thisBp.size() < MIN_HISTORY || lastBp.size() < MIN_HISTORY) {
            return Optional.empty();
        }
        double thisAvg = mean(thisBp);
        double lastAvg = mean(lastBp);
        double change = thisAvg - lastAvg;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("thisWeekAverage", round1(thisAvg));
        details.put("lastWeekAverage", round1(lastAvg));
        details.put("change", round1(change));
        if (change >= TREND_THRESHOLD) {
            List<Double> thisSleep = values(thisWeek, HealthMetric.SLEEP_HOURS);
            List<Double> lastSleep = values(lastWeek, HealthMetric.SLEEP_HOURS);
            boolean sleepWorse = !thisSleep.isEmpty() && !lastSleep.isEmpty()
                    && mean(thisSleep) < mean(lastSleep) - 0.5;
            details.put("sleepFactor", sleepWorse);
            return Optional.of(new Alert(date, AlertType.BP_TREND_UP, AlertPriority.WARNING, "BP trending up",
                    String.format(Locale.ROOT, "Your BP rose by %.0f mmHg this week (from %.0f to %.0f mmHg). %s",
                            change, lastAvg, thisAvg, sleepWorse
                                    ? "Sleep decreased, which may be a factor."
                                    : "Review stress and activity levels."),
                    details));
        }
        if (change <= -TREND_THRESHOLD) {
            return Optional.of(new Alert(date, AlertType.BP_TREND_DOWN, AlertPriority.CELEBRATION, "BP trending down",
                    String.format(Locale.ROOT, "Your BP improved by %.0f mmHg this week (from %.0f to %.0f mmHg). "
                            + "Your habits are paying off!", -change, lastAvg, thisAvg),
                    details));
        }
        return Optional.empty();
    }

    Optional<Alert> checkElevatedDespiteHabits(LocalDate date, double goal) {
        List<DailyHealthRecord> days = dao.findRange(date.minusDays(3), date);
        if (days.size() < 4) {
            return Optional.empty();
        }
        long affected = days.stream().filter(r -> {
            Optional<Double> bp = r.value(HealthMetric.SYSTOLIC);
            Optional<Double> sleep = r.value(HealthMetric.SLEEP_HOURS);
            Optional<Double> steps = r.value(HealthMetric.STEPS);
            return bp.isPresent() && sleep.isPresent() && steps.isPresent()
                    && sleep.get() >= 7 && steps.get() >= 8000 && bp.get() > goal + 5;
        }).count();
        if (affected < 3) {
            return Optional.empty();
        }
        return Optional.of(new Alert(date, AlertType.BP_DESPITE_HABITS, AlertPriority.WARNING, "Unusual BP pattern",
                String.format(Locale.ROOT, "BP was elevated on %d days despite good sleep and activity. "
                        + "Possible factors include stress, diet and medication timing. "
                        + "Consider consulting your doctor if this persists.", affected),
                Map.of("daysAffected", affected)));
    }

    /** Consecutive days ending at {@code end} whose record satisfies {@code test}. */
    static int streak(List<DailyHealthRecord> records, LocalDate end, Predicate<DailyHealthRecord> test) {
        List<DailyHealthRecord> newestFirst = new ArrayList<>(records);
        newestFirst.sort(Comparator.comparing(DailyHealthRecord::date).reversed());
        int count = 0;
        LocalDate expected = end;
        for (DailyHealthRecord r : newestFirst) {
            if (r.date().isAfter(end)) {
                continue;
            }
            if (!r.date().equals(expected) || !test.test(r)) {
                break;
            }
            count++;
            expected = expected.minusDays(1);
        }
        return count;
    }

    private static List<Double> values(List<DailyHealthRecord> records, HealthMetric metric) {
        return records.stream().map(r -> r.value(metric)).flatMap(Optional::stream).toList();
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double stdev(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 5.0;
        }
        double ss = 0.0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (values.size() - 1));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
