package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Coarse per-turn cost in USD from a flat per-1k-token rate. The local backend is free.
 */
public class CostEstimator {

    private final Map<BackendId, Double> ratePer1k;

    public CostEstimator(Map<BackendId, Double> ratePer1k) {
        Map<BackendId, Double> copy = new EnumMap<>(BackendId.class);
        copy.putAll(ratePer1k);
        copy.put(BackendId.LOCAL, 0.0);
        this.ratePer1k = Collections.unmodifiableMap(copy);
    }

    public double estimate(BackendId backend, int tokens) {
        if (backend == null || tokens <= 0) {
            return 0.0;
        }
        double rate = ratePer1k.getOrDefault(backend, 0.0);
        return Math.round(tokens / 1000.0 * rate * 1_000_000d) / 1_000_000d;
    }
}
