package com.example.healthcoach.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One calendar day of imported metrics. Sparse: a metric that was not recorded is absent,
 * never zero.
 */
public record DailyHealthRecord(LocalDate date, Map<HealthMetric, Double> metrics) {

    public DailyHealthRecord {
        Objects.requireNonNull(date, "date");
        EnumMap<HealthMetric, Double> copy = new EnumMap<>(HealthMetric.class);
        if (metrics != null) {
            metrics.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        metrics = Collections.unmodifiableMap(copy);
    }

    public Optional<Double> value(HealthMetric metric) {
        return Optional.ofNullable(metrics.get(metric));
    }

    public boolean has(HealthMetric metric) {
        return metrics.containsKey(metric);
    }

    public static Builder builder(LocalDate date) {
        return new Builder(date);
    }

    public static final class Builder {
        private final LocalDate date;
        private final Map<HealthMetric, Double> metrics = new EnumMap<>(HealthMetric.class);

        private Builder(LocalDate date) {
            this.date = date;
        }

        public Builder with(HealthMetric metric, Double value) {
            if (value != null) {
                metrics.put(metric, value);
            }
            return this;
        }

        public DailyHealthRecord build() {
            return new DailyHealthRecord(date, metrics);
        }
    }
}
