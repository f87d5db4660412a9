package com.example.healthcoach.model;

import lombok.Builder;
import lombok.Singular;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Baseline values plus proposed per-factor deltas.
 *
 * @param baselineSystolic  current systolic BP
 * @param baselineDiastolic current diastolic BP, may be {@code null}
 * @param deltas            proposed change per factor, in the factor's own unit
 * @param horizonDays       time frame the change should happen in
 * @param diastolicRatio    per-user diastolic/systolic scaling, {@code null} to use the coefficient table
 */
@Builder
public record ScenarioRequest(double baselineSystolic,
                              Double baselineDiastolic,
                              @Singular Map<LifestyleFactor, Double> deltas,
                              int horizonDays,
                              Double diastolicRatio) {

    public static final int DEFAULT_HORIZON_DAYS = 90;

    public ScenarioRequest {
        EnumMap<LifestyleFactor, Double> copy = new EnumMap<>(LifestyleFactor.class);
        if (deltas != null) {
            deltas.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        deltas = Collections.unmodifiableMap(copy);
        if (horizonDays <= 0) {
            horizonDays = DEFAULT_HORIZON_DAYS;
        }
    }

    public double delta(LifestyleFactor factor) {
        return deltas.getOrDefault(factor, 0.0);
    }

    public long nonZeroDeltas() {
        return deltas.values().stream().filter(v -> v != 0.0).count();
    }
}
