package com.example.healthcoach.scenario;

import com.example.healthcoach.model.ImpactCoefficient;
import com.example.healthcoach.model.LifestyleFactor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static lookup of effect sizes and change dynamics per lifestyle factor. Not fitted per user.
 */
public final class ImpactCoefficientTable {

    public static final double DEFAULT_DIASTOLIC_RATIO = 0.5;

    private final Map<LifestyleFactor, ImpactCoefficient> coefficients;
    private final Map<LifestyleFactor, FactorDynamics> dynamics;

    public ImpactCoefficientTable(Map<LifestyleFactor, ImpactCoefficient> coefficients,
                                  Map<LifestyleFactor, FactorDynamics> dynamics) {
        for (LifestyleFactor f : LifestyleFactor.values()) {
            if (!coefficients.containsKey(f) || !dynamics.containsKey(f)) {
                throw new IllegalArgumentException("Missing table entry for " + f);
            }
        }
        this.coefficients = Collections.unmodifiableMap(new EnumMap<>(coefficients));
        this.dynamics = Collections.unmodifiableMap(new EnumMap<>(dynamics));
    }

    public static ImpactCoefficientTable defaults() {
        return defaults(DEFAULT_DIASTOLIC_RATIO);
    }

    public static ImpactCoefficientTable defaults(double diastolicRatio) {
        Map<LifestyleFactor, ImpactCoefficient> c = new EnumMap<>(LifestyleFactor.class);
        c.put(LifestyleFactor.VO2_MAX, new ImpactCoefficient(LifestyleFactor.VO2_MAX, -1.96, 0.45, diastolicRatio));
        c.put(LifestyleFactor.SLEEP_HOURS, new ImpactCoefficient(LifestyleFactor.SLEEP_HOURS, -3.1, 1.1, diastolicRatio));
        c.put(LifestyleFactor.STEPS, new ImpactCoefficient(LifestyleFactor.STEPS, -0.0003, 0.0001, diastolicRatio));

        Map<LifestyleFactor, FactorDynamics> d = new EnumMap<>(LifestyleFactor.class);
        d.put(LifestyleFactor.VO2_MAX, new FactorDynamics(LifestyleFactor.VO2_MAX, 1.0, 14));
        d.put(LifestyleFactor.SLEEP_HOURS, new FactorDynamics(LifestyleFactor.SLEEP_HOURS, 1.0, 3));
        d.put(LifestyleFactor.STEPS, new FactorDynamics(LifestyleFactor.STEPS, 3000.0, 7));
        return new ImpactCoefficientTable(c, d);
    }

    public ImpactCoefficient coefficient(LifestyleFactor factor) {
        return coefficients.get(factor);
    }

    public FactorDynamics dynamics(LifestyleFactor factor) {
        return dynamics.get(factor);
    }
}
