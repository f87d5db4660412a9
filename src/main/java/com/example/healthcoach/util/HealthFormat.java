package com.example.healthcoach.util;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Shared wording for BP categories, sleep quality and activity levels, plus number formatting.
 */
public final class HealthFormat {

    private HealthFormat() {}

    public static String bpCategory(double systolic) {
        if (systolic < 120) return "normal";
        if (systolic < 130) return "elevated";
        if (systolic < 140) return "stage 1 hypertension";
        return "stage 2 hypertension";
    }

    public static String sleepQuality(double hours) {
        if (hours >= 7) return "good";
        if (hours >= 6) return "fair";
        return "poor";
    }

    public static String activityLevel(double steps) {
        if (steps >= 10000) return "active";
        if (steps >= 5000) return "moderate";
        return "sedentary";
    }

    /** Up to two decimals, trailing zeros dropped: 138.5, 12453, 9.07. */
    public static String num(double value) {
        BigDecimal bd = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.scale() < 0) {
            bd = bd.setScale(0, RoundingMode.UNNECESSARY);
        }
        return bd.toPlainString();
    }

    public static String num1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /** "138.5/88 mmHg", "138.5 mmHg" or empty when no systolic value is recorded. */
    public static Optional<String> bp(DailyHealthRecord r) {
        Optional<Double> sys = r.value(HealthMetric.SYSTOLIC);
        if (sys.isEmpty()) {
            return Optional.empty();
        }
        Optional<Double> dia = r.value(HealthMetric.DIASTOLIC);
        return Optional.of(dia.map(d -> num(sys.get()) + "/" + num(d)).orElse(num(sys.get())) + " mmHg");
    }
}
