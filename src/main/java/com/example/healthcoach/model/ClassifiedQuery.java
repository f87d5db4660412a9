package com.example.healthcoach.model;

import java.util.List;
import java.util.Optional;

/**
 * Output of intent classification. Complexity and privacy only feed routing and are never
 * stored next to query text.
 *
 * @param matchedRule debug name of the rule that fired, {@code null} for the catch-all
 * @param metric      first metric mentioned, if any
 * @param numbers     numbers mentioned, in order of appearance
 */
public record ClassifiedQuery(Intent intent,
                              DateScope dateScope,
                              QueryComplexity complexity,
                              PrivacySensitivity privacy,
                              boolean requiresStructuredOutput,
                              String matchedRule,
                              HealthMetric metric,
                              List<Double> numbers) {

    public ClassifiedQuery {
        numbers = numbers == null ? List.of() : List.copyOf(numbers);
    }

    public Optional<DateScope> scope() {
        return Optional.ofNullable(dateScope);
    }

    public static ClassifiedQuery general() {
        return new ClassifiedQuery(Intent.GENERAL, null, QueryComplexity.LOW,
                PrivacySensitivity.NORMAL, false, null, null, List.of());
    }
}
