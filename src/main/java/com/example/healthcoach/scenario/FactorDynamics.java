package com.example.healthcoach.scenario;

import com.example.healthcoach.model.LifestyleFactor;

/**
 * How fast a factor can realistically change and how long before BP responds.
 *
 * @param maxMonthlyRate largest sustainable change per 30 days, in the factor's unit
 * @param lagDays        days of consistent change before any BP effect shows
 */
public record FactorDynamics(LifestyleFactor factor, double maxMonthlyRate, int lagDays) {
}
