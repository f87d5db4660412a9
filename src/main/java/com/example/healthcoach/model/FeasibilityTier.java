package com.example.healthcoach.model;

/**
 * Ordered from most to least realistic; {@link #INFEASIBLE} is reported, never clipped.
 */
public enum FeasibilityTier {
    HIGH,
    MODERATE,
    LOW,
    INFEASIBLE;

    public FeasibilityTier worst(FeasibilityTier other) {
        return other == null || other.ordinal() < ordinal() ? this : other;
    }
}
