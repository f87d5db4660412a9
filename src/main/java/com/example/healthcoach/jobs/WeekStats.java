package com.example.healthcoach.jobs;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Summary statistics over up to seven daily records. Absent values mean the week had no
 * reading for that metric.
 */
public record WeekStats(int daysRecorded,
                        Double systolicAvg,
                        Double systolicMin,
                        Double systolicMax,
                        Double systolicStd,
                        int systolicDays,
                        Double diastolicAvg,
                        Double sleepAvg,
                        int sleepDaysUnder7,
                        Double stepsAvg,
                        long stepsTotal,
                        int stepsDaysOver10k,
                        Double vo2Avg,
                        Double vo2Latest) {

    public static WeekStats of(List<DailyHealthRecord> records) {
        List<Double> sys = values(records, HealthMetric.SYSTOLIC);
        List<Double> dia = values(records, HealthMetric.DIASTOLIC);
        List<Double> sleep = values(records, HealthMetric.SLEEP_HOURS);
        List<Double> steps = values(records, HealthMetric.STEPS);
        List<Double> vo2 = values(records, HealthMetric.VO2_MAX);
        Double sysAvg = avg(sys);
        Double vo2Latest = records.stream()
                .filter(r -> r.has(HealthMetric.VO2_MAX))
                .max(Comparator.comparing(DailyHealthRecord::date))
                .flatMap(r -> r.value(HealthMetric.VO2_MAX))
                .orElse(null);
        return new WeekStats(
                records.size(),
                sysAvg,
                sys.stream().min(Double::compare).orElse(null),
                sys.stream().max(Double::compare).orElse(null),
                sys.isEmpty() ? null : sys.size() < 2 ? 0.0 : AlertEngine.stdev(sys, sysAvg),
                sys.size(),
                avg(dia),
                avg(sleep),
                (int) sleep.stream().filter(h -> h < 7).count(),
                avg(steps),
                Math.round(steps.stream().mapToDouble(Double::doubleValue).sum()),
                (int) steps.stream().filter(s -> s >= 10000).count(),
                avg(vo2),
                vo2Latest);
    }

    public boolean isEmpty() {
        return daysRecorded == 0;
    }

    private static List<Double> values(List<DailyHealthRecord> records, HealthMetric metric) {
        return records.stream().map(r -> r.value(metric)).flatMap(Optional::stream).toList();
    }

    private static Double avg(List<Double> values) {
        return values.isEmpty() ? null : values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }
}
