package com.example.healthcoach.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Singleton profile: configured goals plus baselines averaged from recent history.
 */
@Value
@Builder(toBuilder = true)
public class UserProfile {

    String name;

    @Singular
    Map<HealthMetric, Double> baselines;

    @Singular
    Map<HealthMetric, Double> goals;

    /** Monotonic cache version this snapshot was loaded under. */
    long version;

    Instant loadedAt;

    public Optional<Double> baseline(HealthMetric metric) {
        return Optional.ofNullable(baselines.get(metric));
    }

    public Optional<Double> goal(HealthMetric metric) {
        return Optional.ofNullable(goals.get(metric));
    }

    public HealthMetric.Direction direction(HealthMetric metric) {
        return metric.direction();
    }
}
