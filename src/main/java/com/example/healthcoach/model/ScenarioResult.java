package com.example.healthcoach.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ScenarioResult {

    ScenarioRequest request;

    double systolicChange;
    double diastolicChange;
    double predictedSystolic;
    Double predictedDiastolic;

    /** Percentile band of the systolic change. */
    ConfidenceInterval systolicChangeInterval;

    FeasibilityTier feasibility;
    Map<LifestyleFactor, FeasibilityTier> feasibilityByFactor;

    TimelineEstimate timeline;

    List<String> recommendations;

    int trials;
    long seed;

    public boolean isInfeasible() {
        return feasibility == FeasibilityTier.INFEASIBLE;
    }
}
