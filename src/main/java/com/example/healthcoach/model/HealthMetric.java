package com.example.healthcoach.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Metrics stored per calendar day, keyed by their column in {@code daily_health_data}.
 */
public enum HealthMetric {
    SYSTOLIC("systolic_mean", "Systolic BP", "mmHg", Direction.LOWER_IS_BETTER),
    DIASTOLIC("diastolic_mean", "Diastolic BP", "mmHg", Direction.LOWER_IS_BETTER),
    HEART_RATE("heart_rate_mean", "Heart rate", "bpm", Direction.LOWER_IS_BETTER),
    STEPS("steps", "Steps", "steps", Direction.HIGHER_IS_BETTER),
    SLEEP_HOURS("sleep_hours", "Sleep", "hours", Direction.HIGHER_IS_BETTER),
    SLEEP_EFFICIENCY("sleep_efficiency_pct", "Sleep efficiency", "%", Direction.HIGHER_IS_BETTER),
    VO2_MAX("vo2_max", "VO2 max", "mL/kg/min", Direction.HIGHER_IS_BETTER),
    HRV("hrv_mean", "HRV", "ms", Direction.HIGHER_IS_BETTER),
    RESPIRATORY_RATE("respiratory_rate", "Respiratory rate", "breaths/min", Direction.LOWER_IS_BETTER),
    ACTIVE_CALORIES("active_calories", "Active calories", "kcal", Direction.HIGHER_IS_BETTER),
    EXERCISE_MINUTES("exercise_minutes", "Exercise", "min", Direction.HIGHER_IS_BETTER);

    public enum Direction {
        LOWER_IS_BETTER,
        HIGHER_IS_BETTER
    }

    private final String column;
    private final String label;
    private final String unit;
    private final Direction direction;

    HealthMetric(String column, String label, String unit, Direction direction) {
        this.column = column;
        this.label = label;
        this.unit = unit;
        this.direction = direction;
    }

    public String column() {
        return column;
    }

    public String label() {
        return label;
    }

    public String unit() {
        return unit;
    }

    public Direction direction() {
        return direction;
    }

    /** True when {@code candidate} is an improvement over {@code reference}. */
    public boolean isBetter(double candidate, double reference) {
        return direction == Direction.LOWER_IS_BETTER ? candidate < reference : candidate > reference;
    }

    public static Optional<HealthMetric> fromColumn(String column) {
        if (column == null) {
            return Optional.empty();
        }
        String c = column.trim().toLowerCase(Locale.ROOT);
        for (HealthMetric m : values()) {
            if (m.column.equals(c)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
