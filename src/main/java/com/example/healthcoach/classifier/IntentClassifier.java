package com.example.healthcoach.classifier;

import com.example.healthcoach.model.ClassifiedQuery;
import com.example.healthcoach.model.DateScope;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.PrivacySensitivity;
import com.example.healthcoach.model.QueryComplexity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw query text to an intent, date scope, complexity and privacy flag.
 * Pure and deterministic for a fixed clock; never throws on any input.
 */
public class IntentClassifier {

    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])(\\d+(?:\\.\\d+)?)(k\\b)?", Pattern.CASE_INSENSITIVE);

    // first match wins, so the more specific wording comes first
    private static final Map<Pattern, HealthMetric> METRIC_WORDS = new LinkedHashMap<>();

    static {
        METRIC_WORDS.put(Pattern.compile("\\bdiastolic\\b"), HealthMetric.DIASTOLIC);
        METRIC_WORDS.put(Pattern.compile("\\b(bp|blood pressure|systolic)\\b"), HealthMetric.SYSTOLIC);
        METRIC_WORDS.put(Pattern.compile("\\bsleep efficiency\\b"), HealthMetric.SLEEP_EFFICIENCY);
        METRIC_WORDS.put(Pattern.compile("\\b(sleep|slept)\\b"), HealthMetric.SLEEP_HOURS);
        METRIC_WORDS.put(Pattern.compile("\\b(steps?|walk(ing|ed)?)\\b"), HealthMetric.STEPS);
        METRIC_WORDS.put(Pattern.compile("\\bvo2\\b"), HealthMetric.VO2_MAX);
        METRIC_WORDS.put(Pattern.compile("\\bhrv\\b"), HealthMetric.HRV);
        METRIC_WORDS.put(Pattern.compile("\\b(heart rate|pulse)\\b"), HealthMetric.HEART_RATE);
        METRIC_WORDS.put(Pattern.compile("\\brespiratory\\b"), HealthMetric.RESPIRATORY_RATE);
        METRIC_WORDS.put(Pattern.compile("\\bcalories\\b"), HealthMetric.ACTIVE_CALORIES);
        METRIC_WORDS.put(Pattern.compile("\\bexercise minutes\\b"), HealthMetric.EXERCISE_MINUTES);
    }

    private final IntentRuleTable rules;
    private final DateScopeResolver dates;

    public IntentClassifier(IntentRuleTable rules, DateScopeResolver dates) {
        this.rules = rules;
        this.dates = dates;
    }

    public ClassifiedQuery classify(String text) {
        if (text == null || text.isBlank()) {
            return ClassifiedQuery.general();
        }
        String normalized = text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);

        Intent intent = Intent.GENERAL;
        String matchedRule = null;
        for (IntentRule rule : rules.rules()) {
            if (rule.matches(normalized)) {
                intent = rule.intent();
                matchedRule = rule.name();
                break;
            }
        }

        Intent matchedIntent = intent;
        DateScope scope = dates.resolve(normalized).orElseGet(() -> defaultScope(matchedIntent));
        boolean multiFactor = rules.isMultiFactor(normalized);

        return new ClassifiedQuery(
                intent,
                scope,
                complexity(intent, scope, multiFactor),
                rules.isSensitive(normalized) ? PrivacySensitivity.SENSITIVE : PrivacySensitivity.NORMAL,
                rules.requiresStructuredOutput(normalized),
                matchedRule,
                firstMetric(normalized),
                numbers(normalized));
    }

    private DateScope defaultScope(Intent intent) {
        return switch (intent) {
            case DATA_LOOKUP, EXPLANATION -> dates.yesterday().asDefault();
            case TREND -> dates.lastDays(7, "last 7 days").asDefault();
            default -> null;
        };
    }

    static QueryComplexity complexity(Intent intent, DateScope scope, boolean multiFactor) {
        if (intent == Intent.GENERAL) {
            return QueryComplexity.LOW;
        }
        if (multiFactor) {
            return QueryComplexity.HIGH;
        }
        return switch (intent) {
            case EXPLANATION, SCENARIO, PREDICTION -> QueryComplexity.HIGH;
            case TREND, COMPARISON, RECOMMENDATION -> QueryComplexity.MEDIUM;
            case DATA_LOOKUP -> scope == null || scope.isSingleDay() ? QueryComplexity.LOW : QueryComplexity.MEDIUM;
            default -> QueryComplexity.LOW;
        };
    }

    private static HealthMetric firstMetric(String normalized) {
        HealthMetric best = null;
        int bestAt = Integer.MAX_VALUE;
        for (Map.Entry<Pattern, HealthMetric> e : METRIC_WORDS.entrySet()) {
            Matcher m = e.getKey().matcher(normalized);
            if (m.find() && m.start() < bestAt) {
                best = e.getValue();
                bestAt = m.start();
            }
        }
        return best;
    }

    /** Numbers in order of appearance, ignoring the digits of explicit ISO dates; "10k" reads as 10000. */
    private static List<Double> numbers(String normalized) {
        String withoutDates = DateScopeResolver.ISO_DATE.matcher(normalized).replaceAll(" ");
        List<Double> out = new ArrayList<>();
        Matcher m = NUMBER.matcher(withoutDates);
        while (m.find()) {
            double v = Double.parseDouble(m.group(1));
            out.add(m.group(2) != null ? v * 1000 : v);
        }
        return out;
    }
}
