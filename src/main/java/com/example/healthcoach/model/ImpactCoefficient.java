package com.example.healthcoach.model;

/**
 * Linear effect of one lifestyle factor on systolic BP.
 *
 * @param mmHgPerUnit   systolic change per unit of the factor (negative lowers BP)
 * @param standardError empirical standard error of {@code mmHgPerUnit}
 * @param diastolicRatio diastolic change as a fraction of the systolic change
 */
public record ImpactCoefficient(LifestyleFactor factor,
                                double mmHgPerUnit,
                                double standardError,
                                double diastolicRatio) {
}
