package com.example.healthcoach.model;

import java.util.Map;

/**
 * @param lagDays   days before any effect shows (max over factors)
 * @param rampDays  days to reach the full delta once effects start (max over factors)
 * @param perFactor total days per factor
 */
public record TimelineEstimate(int lagDays, int rampDays, Map<LifestyleFactor, Integer> perFactor) {

    public TimelineEstimate {
        perFactor = perFactor == null ? Map.of() : Map.copyOf(perFactor);
    }

    public int totalDays() {
        return perFactor.values().stream().mapToInt(Integer::intValue).max().orElse(lagDays + rampDays);
    }

    public int totalWeeks() {
        return (int) Math.ceil(totalDays() / 7.0);
    }
}
