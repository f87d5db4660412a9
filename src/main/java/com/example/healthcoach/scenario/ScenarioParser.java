package com.example.healthcoach.scenario;

import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.UserProfile;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads lifestyle changes out of a what-if question.
 *
 * <p>Signed numbers, "by" and "more/extra" are read as changes ("vo2 +5", "sleep 1 more hour").
 * Bare numbers and "to" are targets ("sleep 8 hours", "10k steps", "vo2 max to 42") and are
 * turned into changes against the profile baseline.
 */
public class ScenarioParser {

    private static final String NUM = "([+-]?\\d+(?:\\.\\d+)?)";

    private static final Pattern VO2 = Pattern.compile(
            "\\bvo2(?:\\s*max)?\\s*(?:(by|to|of|at)\\s*)?" + NUM + "(\\s*(?:more|extra))?");
    private static final Pattern SLEEP = Pattern.compile(
            "\\bsle(?:ep|pt)(?:ing)?\\s*(?:(by|to|for)\\s*)?" + NUM + "\\s*(more\\s*|extra\\s*)?(?:hours?|hrs?|h)\\b");
    private static final Pattern STEPS_BEFORE = Pattern.compile(
            NUM + "\\s*(k)?\\s*(more\\s+|extra\\s+|additional\\s+)?(?:daily\\s+)?steps\\b");
    private static final Pattern STEPS_AFTER = Pattern.compile(
            "\\bsteps\\s*(?:(by|to)\\s*)" + NUM + "\\s*(k)?");

    /** Used for targets when the profile has no baseline for the factor. */
    private static final Map<LifestyleFactor, Double> FALLBACK_CURRENT = Map.of(
            LifestyleFactor.VO2_MAX, 37.0,
            LifestyleFactor.SLEEP_HOURS, 6.5,
            LifestyleFactor.STEPS, 9000.0);

    public static final double FALLBACK_SYSTOLIC = 142.0;

    /** A parsed value for one factor. */
    public record Change(double value, boolean relative) {
    }

    public Map<LifestyleFactor, Change> parse(String text) {
        Map<LifestyleFactor, Change> out = new EnumMap<>(LifestyleFactor.class);
        if (text == null || text.isBlank()) {
            return out;
        }
        String t = text.toLowerCase(Locale.ROOT);

        Matcher vo2 = VO2.matcher(t);
        if (vo2.find()) {
            out.put(LifestyleFactor.VO2_MAX, change(vo2.group(2), vo2.group(1), vo2.group(3) != null, 1));
        }
        Matcher sleep = SLEEP.matcher(t);
        if (sleep.find()) {
            out.put(LifestyleFactor.SLEEP_HOURS, change(sleep.group(2), sleep.group(1), sleep.group(3) != null, 1));
        }
        Matcher before = STEPS_BEFORE.matcher(t);
        Matcher after = STEPS_AFTER.matcher(t);
        if (before.find()) {
            out.put(LifestyleFactor.STEPS, change(before.group(1), null, before.group(3) != null,
                    stepsScale(before.group(1), before.group(2))));
        } else if (after.find()) {
            out.put(LifestyleFactor.STEPS, change(after.group(2), after.group(1), false,
                    stepsScale(after.group(2), after.group(3))));
        }
        return out;
    }

    /**
     * Builds an engine request from parsed changes and the profile baselines.
     */
    public ScenarioRequest toRequest(Map<LifestyleFactor, Change> changes, UserProfile profile,
                                     int horizonDays, Double diastolicRatio) {
        Map<LifestyleFactor, Double> deltas = new EnumMap<>(LifestyleFactor.class);
        changes.forEach((factor, change) -> {
            double delta = change.relative()
                    ? change.value()
                    : change.value() - current(profile, factor);
            deltas.put(factor, delta);
        });
        return new ScenarioRequest(
                baselineSystolic(profile),
                profile == null ? null : profile.baseline(HealthMetric.DIASTOLIC).orElse(null),
                Collections.unmodifiableMap(deltas),
                horizonDays,
                diastolicRatio);
    }

    public static double baselineSystolic(UserProfile profile) {
        return profile == null ? FALLBACK_SYSTOLIC : profile.baseline(HealthMetric.SYSTOLIC).orElse(FALLBACK_SYSTOLIC);
    }

    private static double current(UserProfile profile, LifestyleFactor factor) {
        Optional<Double> baseline = profile == null ? Optional.empty() : profile.baseline(factor.metric());
        return baseline.orElse(FALLBACK_CURRENT.get(factor));
    }

    private static Change change(String number, String preposition, boolean more, double scale) {
        double value = Double.parseDouble(number) * scale;
        boolean signed = number.startsWith("+") || number.startsWith("-");
        boolean relative = signed || more || "by".equals(preposition);
        return new Change(value, relative);
    }

    /** "10k" and bare numbers under 100 mean thousands of steps. */
    private static double stepsScale(String number, String k) {
        if (k != null) {
            return 1000;
        }
        return Math.abs(Double.parseDouble(number)) < 100 ? 1000 : 1;
    }
}
