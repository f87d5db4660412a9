package com.example.healthcoach.service;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.util.HealthFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a daily record as one line of natural language. The same text is embedded for
 * similarity search and shown to the backends, so only recorded metrics appear.
 */
public final class DailySummaryRenderer {

    private DailySummaryRenderer() {}

    public static String render(DailyHealthRecord r) {
        List<String> parts = new ArrayList<>();
        HealthFormat.bp(r).ifPresent(bp -> parts.add("BP " + bp + " ("
                + HealthFormat.bpCategory(r.value(HealthMetric.SYSTOLIC).orElseThrow()) + ")"));
        r.value(HealthMetric.HEART_RATE).ifPresent(v -> parts.add("Heart rate " + HealthFormat.num(v) + " bpm"));
        r.value(HealthMetric.SLEEP_HOURS).ifPresent(h -> {
            String eff = r.value(HealthMetric.SLEEP_EFFICIENCY)
                    .map(e -> ", " + String.format(Locale.ROOT, "%.0f", e) + "% efficiency")
                    .orElse("");
            parts.add("Sleep " + HealthFormat.num(h) + " hrs" + eff + " - " + HealthFormat.sleepQuality(h));
        });
        r.value(HealthMetric.STEPS).ifPresent(s -> parts.add("Activity " + HealthFormat.num(s) + " steps"));
        r.value(HealthMetric.EXERCISE_MINUTES).ifPresent(m -> parts.add("Exercise " + HealthFormat.num(m) + " min"));
        r.value(HealthMetric.VO2_MAX).ifPresent(v -> parts.add("VO2 Max " + HealthFormat.num(v)));
        r.value(HealthMetric.HRV).ifPresent(v -> parts.add("HRV " + HealthFormat.num(v) + " ms"));
        r.value(HealthMetric.RESPIRATORY_RATE).ifPresent(v -> parts.add("Respiratory rate " + HealthFormat.num(v)));
        r.value(HealthMetric.ACTIVE_CALORIES).ifPresent(v -> parts.add("Active calories " + HealthFormat.num(v) + " kcal"));
        if (parts.isEmpty()) {
            return r.date() + ": no metrics recorded.";
        }
        return r.date() + ": " + String.join(". ", parts) + ".";
    }

    public static String renderAll(List<DailyHealthRecord> records) {
        if (records == null || records.isEmpty()) {
            return "(no records for this period)";
        }
        StringBuilder sb = new StringBuilder();
        for (DailyHealthRecord r : records) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(render(r));
        }
        return sb.toString();
    }
}
