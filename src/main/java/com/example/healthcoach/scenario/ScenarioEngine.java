package com.example.healthcoach.scenario;

import com.example.healthcoach.model.ConfidenceInterval;
import com.example.healthcoach.model.FeasibilityTier;
import com.example.healthcoach.model.ImpactCoefficient;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.model.TimelineEstimate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Counterfactual BP prediction from a linear impact model.
 *
 * <p>Pure: the result depends only on the request, the coefficient table, the trial count and
 * the seed. Factors are always visited in {@link LifestyleFactor} declaration order and every
 * trial draws one Gaussian per factor, so a given seed replays the same draws whichever deltas
 * are set.
 */
public class ScenarioEngine {

    public static final int DEFAULT_TRIALS = 1000;

    private static final double LOWER_PERCENTILE = 2.5;
    private static final double UPPER_PERCENTILE = 97.5;

    private final ImpactCoefficientTable table;

    public ScenarioEngine(ImpactCoefficientTable table) {
        this.table = table;
    }

    public ScenarioResult predict(ScenarioRequest request, int trials, long seed) {
        if (trials <= 0) {
            throw new IllegalArgumentException("trials must be positive, was " + trials);
        }
        double systolicChange = 0.0;
        double diastolicChange = 0.0;
        for (LifestyleFactor f : LifestyleFactor.values()) {
            double delta = request.delta(f);
            if (delta == 0.0) {
                continue;
            }
            ImpactCoefficient c = table.coefficient(f);
            double change = c.mmHgPerUnit() * delta;
            systolicChange += change;
            double ratio = request.diastolicRatio() != null ? request.diastolicRatio() : c.diastolicRatio();
            diastolicChange += ratio * change;
        }

        Map<LifestyleFactor, FeasibilityTier> perFactor = new EnumMap<>(LifestyleFactor.class);
        FeasibilityTier overall = FeasibilityTier.HIGH;
        for (LifestyleFactor f : LifestyleFactor.values()) {
            double delta = request.delta(f);
            if (delta == 0.0) {
                continue;
            }
            FeasibilityTier tier = feasibility(f, delta, request.horizonDays());
            perFactor.put(f, tier);
            overall = overall.worst(tier);
        }

        return ScenarioResult.builder()
                .request(request)
                .systolicChange(round1(systolicChange))
                .diastolicChange(round1(diastolicChange))
                .predictedSystolic(round1(request.baselineSystolic() + systolicChange))
                .predictedDiastolic(request.baselineDiastolic() == null ? null
                        : round1(request.baselineDiastolic() + diastolicChange))
                .systolicChangeInterval(interval(request, trials, seed))
                .feasibility(overall)
                .feasibilityByFactor(perFactor)
                .timeline(timeline(request))
                .recommendations(recommendations(request, perFactor))
                .trials(trials)
                .seed(seed)
                .build();
    }

    /** Runs each request with the same trial count and seed so the intervals are comparable. */
    public List<ScenarioResult> compare(List<ScenarioRequest> requests, int trials, long seed) {
        List<ScenarioResult> out = new ArrayList<>(requests.size());
        for (ScenarioRequest r : requests) {
            out.add(predict(r, trials, seed));
        }
        return out;
    }

    ConfidenceInterval interval(ScenarioRequest request, int trials, long seed) {
        LifestyleFactor[] factors = LifestyleFactor.values();
        SplittableRandom rng = new SplittableRandom(seed);
        double[] samples = new double[trials];
        for (int t = 0; t < trials; t++) {
            double sum = 0.0;
            for (LifestyleFactor f : factors) {
                double z = rng.nextGaussian();
                double delta = request.delta(f);
                if (delta == 0.0) {
                    continue;
                }
                ImpactCoefficient c = table.coefficient(f);
                sum += (c.mmHgPerUnit() + z * c.standardError()) * delta;
            }
            samples[t] = sum;
        }
        Arrays.sort(samples);
        return new ConfidenceInterval(percentile(samples, LOWER_PERCENTILE), percentile(samples, UPPER_PERCENTILE));
    }

    FeasibilityTier feasibility(LifestyleFactor factor, double delta, int horizonDays) {
        double months = horizonDays / 30.0;
        double achievable = table.dynamics(factor).maxMonthlyRate() * months;
        double ratio = Math.abs(delta) / achievable;
        if (ratio <= 0.5) {
            return FeasibilityTier.HIGH;
        }
        if (ratio <= 1.0) {
            return FeasibilityTier.MODERATE;
        }
        if (ratio <= 2.0) {
            return FeasibilityTier.LOW;
        }
        return FeasibilityTier.INFEASIBLE;
    }

    TimelineEstimate timeline(ScenarioRequest request) {
        Map<LifestyleFactor, Integer> perFactor = new EnumMap<>(LifestyleFactor.class);
        int lag = 0;
        int ramp = 0;
        for (LifestyleFactor f : LifestyleFactor.values()) {
            double delta = request.delta(f);
            if (delta == 0.0) {
                continue;
            }
            FactorDynamics d = table.dynamics(f);
            int rampDays = (int) Math.ceil(Math.abs(delta) / d.maxMonthlyRate() * 30.0);
            perFactor.put(f, d.lagDays() + rampDays);
            lag = Math.max(lag, d.lagDays());
            ramp = Math.max(ramp, rampDays);
        }
        return new TimelineEstimate(lag, ramp, perFactor);
    }

    private List<String> recommendations(ScenarioRequest request, Map<LifestyleFactor, FeasibilityTier> tiers) {
        List<String> recs = new ArrayList<>();
        double vo2 = request.delta(LifestyleFactor.VO2_MAX);
        if (vo2 > 0) {
            recs.add("Increase cardio frequency to 4-5x per week");
            recs.add("Include 2 high-intensity interval sessions weekly");
        }
        double sleep = request.delta(LifestyleFactor.SLEEP_HOURS);
        if (sleep > 0) {
            recs.add(String.format(Locale.ROOT, "Add %.1f hours of sleep nightly with a fixed bedtime", sleep));
        }
        double steps = request.delta(LifestyleFactor.STEPS);
        if (steps > 0) {
            recs.add(String.format(Locale.ROOT, "Add %,d daily steps through walking breaks", Math.round(steps)));
        }
        tiers.forEach((f, tier) -> {
            if (tier == FeasibilityTier.INFEASIBLE) {
                recs.add(String.format(Locale.ROOT,
                        "The %s change is beyond a realistic pace for %d days; consider a longer horizon",
                        f.label(), request.horizonDays()));
            }
        });
        return recs;
    }

    /** Linear interpolation between closest ranks; {@code sorted} must be ascending. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        double frac = rank - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
