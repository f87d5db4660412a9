package com.example.healthcoach.model;

import java.util.Objects;

public record RoutingMetadata(QueryComplexity complexity,
                              PrivacySensitivity privacy,
                              boolean requiresStructuredOutput) {

    public RoutingMetadata {
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(privacy, "privacy");
    }

    public static RoutingMetadata of(ClassifiedQuery classified) {
        return new RoutingMetadata(classified.complexity(), classified.privacy(),
                classified.requiresStructuredOutput());
    }

    public boolean isSensitive() {
        return privacy == PrivacySensitivity.SENSITIVE;
    }
}
