package com.example.healthcoach.classifier;

import com.example.healthcoach.model.Intent;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of the ordered rule table: the first rule with any matching pattern decides the intent.
 */
public record IntentRule(String name, Intent intent, List<Pattern> patterns) {

    public IntentRule {
        patterns = List.copyOf(patterns);
    }

    public boolean matches(String normalizedText) {
        for (Pattern p : patterns) {
            if (p.matcher(normalizedText).find()) {
                return true;
            }
        }
        return false;
    }
}
