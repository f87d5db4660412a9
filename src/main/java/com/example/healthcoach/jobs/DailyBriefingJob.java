package com.example.healthcoach.jobs;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.model.UserProfile;
import com.example.healthcoach.scenario.ImpactCoefficientTable;
import com.example.healthcoach.service.ScenarioService;
import com.example.healthcoach.util.HealthFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Morning briefing from yesterday's record, the last seven days and the long-run baselines.
 *
 * <p>Today's expected systolic is the baseline moved by the impact coefficients of yesterday's
 * deviation from the baseline habits. Without a record for yesterday the baseline itself is the
 * expectation, with a wider range.
 */
@Slf4j
@Service
public class DailyBriefingJob {

    public static final String JOB_NAME = "daily-briefing";

    static final double NO_DATA_UNCERTAINTY = 10.0;
    static final double MIN_UNCERTAINTY = 3.0;
    static final double FALLBACK_SYSTOLIC = 140.0;

    private static final DateTimeFormatter HEADER = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);

    private final HealthRecordDao dao;
    private final ScenarioService scenarioService;
    private final ImpactCoefficientTable coefficients;
    private final JobHistoryService jobHistory;
    private final CoachProperties.Profile profile;

    public DailyBriefingJob(HealthRecordDao dao, ScenarioService scenarioService, ImpactCoefficientTable coefficients,
                            JobHistoryService jobHistory, CoachProperties properties) {
        this.dao = dao;
        this.scenarioService = scenarioService;
        this.coefficients = coefficients;
        this.jobHistory = jobHistory;
        this.profile = properties.getProfile();
    }

    public Briefing generate(LocalDate date) {
        return jobHistory.run(JOB_NAME, date, () -> compose(date), b -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("yesterdayRecorded", b.yesterdayRecorded());
            details.put("predictedSystolic", b.predictedSystolic());
            details.put("recommendations", b.recommendations().size());
            return details;
        });
    }

    Briefing compose(LocalDate date) {
        LocalDate yesterday = date.minusDays(1);
        Map<HealthMetric, Double> baselines = dao.averages(date.minusDays(profile.getBaselineDays()), yesterday);
        Optional<DailyHealthRecord> record = dao.findRecord(yesterday);
        List<DailyHealthRecord> week = dao.findRange(date.minusDays(7), yesterday);
        double baselineSystolic = baselines.getOrDefault(HealthMetric.SYSTOLIC, FALLBACK_SYSTOLIC);

        StringBuilder text = new StringBuilder("MORNING BRIEFING: ").append(HEADER.format(date)).append("\n\n");

        if (record.isEmpty()) {
            log.info("No record for {}, briefing from historical averages", yesterday);
            text.append("No data available for yesterday. Please make sure your health data is synced.\n\n")
                    .append("Today's prediction is based on your historical averages.\n")
                    .append(String.format(Locale.ROOT, "Expected BP: %.0f mmHg (±%.0f)\n", baselineSystolic, NO_DATA_UNCERTAINTY));
            appendWeek(text, week);
            return new Briefing(date, text.toString().strip(), round1(baselineSystolic), NO_DATA_UNCERTAINTY,
                    LifestyleFactor.VO2_MAX, List.of(), false);
        }

        DailyHealthRecord y = record.get();
        Map<LifestyleFactor, Double> deltas = new LinkedHashMap<>();
        for (LifestyleFactor f : LifestyleFactor.values()) {
            Optional<Double> value = y.value(f.metric());
            Double base = baselines.get(f.metric());
            if (value.isPresent() && base != null) {
                deltas.put(f, value.get() - base);
            }
        }
        UserProfile baselineProfile = UserProfile.builder().baselines(baselines).goals(profile.getGoals()).build();
        ScenarioResult prediction = scenarioService.predict(scenarioService.requestFor(
                deltas.get(LifestyleFactor.VO2_MAX), deltas.get(LifestyleFactor.SLEEP_HOURS),
                deltas.get(LifestyleFactor.STEPS), baselineProfile));
        double uncertainty = Math.max(MIN_UNCERTAINTY, prediction.getSystolicChangeInterval().width() / 2.0);
        LifestyleFactor keyFactor = keyFactor(deltas);
        List<String> recommendations = recommendations(y);

        text.append("YESTERDAY'S SUMMARY:\n");
        text.append("- BP: ").append(HealthFormat.bp(y)
                .map(bp -> bp + " (" + HealthFormat.bpCategory(y.value(HealthMetric.SYSTOLIC).orElseThrow()) + ")")
                .orElse("not recorded")).append('\n');
        text.append("- Sleep: ").append(y.value(HealthMetric.SLEEP_HOURS)
                .map(h -> HealthFormat.num1(h) + " hrs" + y.value(HealthMetric.SLEEP_EFFICIENCY)
                        .map(e -> String.format(Locale.ROOT, " (%.0f%% efficiency)", e)).orElse("")
                        + " - " + HealthFormat.sleepQuality(h))
                .orElse("not recorded")).append('\n');
        text.append("- Activity: ").append(y.value(HealthMetric.STEPS)
                .map(s -> String.format(Locale.ROOT, "%,d steps - %s", Math.round(s), HealthFormat.activityLevel(s)))
                .orElse("not recorded")).append("\n\n");

        text.append("TODAY'S PREDICTION:\n")
                .append(String.format(Locale.ROOT, "Expected BP: %.0f mmHg (±%.0f)\n",
                        prediction.getPredictedSystolic(), uncertainty))
                .append("Key factor: ").append(keyFactor.label()).append("\n\n");

        text.append("RECOMMENDATIONS:\n");
        for (int i = 0; i < recommendations.size(); i++) {
            text.append(i + 1).append(". ").append(recommendations.get(i)).append('\n');
        }
        appendWeek(text.append('\n'), week);
        text.append('\n').append(motivation(y, baselineSystolic));

        return new Briefing(date, text.toString().strip(), prediction.getPredictedSystolic(), round1(uncertainty),
                keyFactor, recommendations, true);
    }

    /** Largest absolute estimated contribution; VO2 max when nothing deviates. */
    LifestyleFactor keyFactor(Map<LifestyleFactor, Double> deltas) {
        LifestyleFactor key = LifestyleFactor.VO2_MAX;
        double best = 0.0;
        for (Map.Entry<LifestyleFactor, Double> e : deltas.entrySet()) {
            double contribution = Math.abs(coefficients.coefficient(e.getKey()).mmHgPerUnit() * e.getValue());
            if (contribution > best) {
                best = contribution;
                key = e.getKey();
            }
        }
        return key;
    }

    List<String> recommendations(DailyHealthRecord y) {
        List<String> recs = new ArrayList<>();
        double sleepGoal = profile.getGoals().getOrDefault(HealthMetric.SLEEP_HOURS, 7.0);
        double stepsGoal = profile.getGoals().getOrDefault(HealthMetric.STEPS, 10000.0);
        y.value(HealthMetric.SLEEP_HOURS).filter(h -> h < sleepGoal).ifPresent(h -> recs.add(String.format(Locale.ROOT,
                "Prioritize sleep tonight and aim for %s+ hours (you got %s hrs)", HealthFormat.num(sleepGoal), HealthFormat.num1(h))));
        y.value(HealthMetric.STEPS).filter(s -> s < stepsGoal).ifPresent(s -> recs.add(String.format(Locale.ROOT,
                "Add %,d more steps today to hit your goal", Math.round(stepsGoal - s))));
        Double vo2Goal = profile.getGoals().get(HealthMetric.VO2_MAX);
        if (vo2Goal != null && y.value(HealthMetric.VO2_MAX).map(v -> v < vo2Goal).orElse(false)) {
            recs.add("Include cardio exercise to improve VO2 max, your strongest BP factor");
        }
        if (recs.isEmpty()) {
            recs.add("Maintain your current healthy habits!");
        }
        return recs.size() > 3 ? recs.subList(0, 3) : recs;
    }

    static String motivation(DailyHealthRecord y, double baselineSystolic) {
        Optional<Double> sys = y.value(HealthMetric.SYSTOLIC);
        if (sys.isPresent() && sys.get() < baselineSystolic - 5) {
            return "Great job! Your BP was below your average yesterday. Keep up the good work!";
        }
        if (sys.isPresent() && sys.get() > baselineSystolic + 5) {
            return "Yesterday was a tougher day for BP. Today is a fresh start!";
        }
        return "Consistency is key. Every healthy choice adds up over time.";
    }

    private static void appendWeek(StringBuilder text, List<DailyHealthRecord> week) {
        if (week.isEmpty()) {
            return;
        }
        text.append("LAST 7 DAYS (").append(week.size()).append(" days recorded):\n");
        average(week, HealthMetric.SYSTOLIC).ifPresent(v -> text.append("- Average BP: ").append(HealthFormat.num1(v)).append(" mmHg\n"));
        average(week, HealthMetric.SLEEP_HOURS).ifPresent(v -> text.append("- Average sleep: ").append(HealthFormat.num1(v)).append(" hrs\n"));
        average(week, HealthMetric.STEPS).ifPresent(v -> text.append("- Average steps: ")
                .append(String.format(Locale.ROOT, "%,d", Math.round(v))).append('\n'));
    }

    private static Optional<Double> average(List<DailyHealthRecord> records, HealthMetric metric) {
        double[] values = records.stream().map(r -> r.value(metric)).flatMap(Optional::stream)
                .mapToDouble(Double::doubleValue).toArray();
        if (values.length == 0) {
            return Optional.empty();
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return Optional.of(sum / values.length);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
