package com.example.healthcoach.model;

/**
 * Modifiable factors the scenario engine can reason about.
 */
public enum LifestyleFactor {
    VO2_MAX(HealthMetric.VO2_MAX, "VO2 max", "points"),
    SLEEP_HOURS(HealthMetric.SLEEP_HOURS, "Sleep", "hours"),
    STEPS(HealthMetric.STEPS, "Daily steps", "steps");

    private final HealthMetric metric;
    private final String label;
    private final String unit;

    LifestyleFactor(HealthMetric metric, String label, String unit) {
        this.metric = metric;
        this.label = label;
        this.unit = unit;
    }

    public HealthMetric metric() {
        return metric;
    }

    public String label() {
        return label;
    }

    public String unit() {
        return unit;
    }
}
