package com.example.healthcoach.model;

/**
 * Classified purpose of a user query.
 */
public enum Intent {
    DATA_LOOKUP,     // "What was my BP yesterday?"
    EXPLANATION,     // "Why was my BP high?"
    PREDICTION,      // "What will my BP be tomorrow?"
    SCENARIO,        // "What if I sleep 8 hours?"
    RECOMMENDATION,  // "How can I lower my BP?"
    TREND,           // "How has my BP changed this month?"
    COMPARISON,      // "Compare my weekday vs weekend BP"
    GENERAL;

    /** Intents whose answers lean on similar historical days. */
    public boolean wantsSimilarDays() {
        return this == EXPLANATION || this == SCENARIO || this == RECOMMENDATION;
    }
}
