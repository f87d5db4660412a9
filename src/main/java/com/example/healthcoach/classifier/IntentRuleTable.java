package com.example.healthcoach.classifier;

import com.example.healthcoach.model.Intent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered (predicate, intent) table plus the vocabularies that drive privacy and routing flags.
 * Loaded from {@code intent_rules.json} so rules can be edited without touching the classifier.
 */
@Slf4j
public final class IntentRuleTable {

    public static final String DEFAULT_RESOURCE = "intent_rules.json";

    private final List<IntentRule> rules;
    private final Pattern sensitive;
    private final Pattern structuredOutput;
    private final Pattern multiFactor;

    public IntentRuleTable(List<IntentRule> rules,
                           List<String> sensitiveTerms,
                           List<String> structuredOutputTerms,
                           List<String> multiFactorTerms) {
        this.rules = List.copyOf(rules);
        this.sensitive = alternation(sensitiveTerms);
        this.structuredOutput = alternation(structuredOutputTerms);
        this.multiFactor = alternation(multiFactorTerms);
    }

    public static IntentRuleTable fromClasspath(ObjectMapper mapper) {
        return fromClasspath(mapper, DEFAULT_RESOURCE);
    }

    public static IntentRuleTable fromClasspath(ObjectMapper mapper, String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            RuleBundle bundle = mapper.readValue(in, RuleBundle.class);
            IntentRuleTable table = fromBundle(bundle);
            log.info("[intent-classifier] Loaded {} intent rules from {}", table.rules.size(), resource);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load intent rules from " + resource, e);
        }
    }

    static IntentRuleTable fromBundle(RuleBundle bundle) {
        List<IntentRule> compiled = new ArrayList<>();
        if (bundle != null && bundle.rules != null) {
            for (RuleJson rj : bundle.rules) {
                if (rj == null || rj.intent == null || rj.patterns == null || rj.patterns.isEmpty()) {
                    continue;
                }
                Intent intent;
                try {
                    intent = Intent.valueOf(rj.intent.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException ex) {
                    log.warn("[intent-classifier] Skipping rule '{}' with unknown intent {}", rj.name, rj.intent);
                    continue;
                }
                List<Pattern> patterns = rj.patterns.stream()
                        .filter(p -> p != null && !p.isBlank())
                        .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                        .toList();
                String name = (rj.name == null || rj.name.isBlank()) ? intent.name().toLowerCase(Locale.ROOT) : rj.name;
                compiled.add(new IntentRule(name, intent, patterns));
            }
        }
        return new IntentRuleTable(
                compiled,
                bundle == null ? List.of() : nullToEmpty(bundle.sensitiveTerms),
                bundle == null ? List.of() : nullToEmpty(bundle.structuredOutputTerms),
                bundle == null ? List.of() : nullToEmpty(bundle.multiFactorTerms));
    }

    public List<IntentRule> rules() {
        return rules;
    }

    public boolean isSensitive(String normalizedText) {
        return sensitive != null && sensitive.matcher(normalizedText).find();
    }

    public boolean requiresStructuredOutput(String normalizedText) {
        return structuredOutput != null && structuredOutput.matcher(normalizedText).find();
    }

    public boolean isMultiFactor(String normalizedText) {
        return multiFactor != null && multiFactor.matcher(normalizedText).find();
    }

    private static Pattern alternation(List<String> terms) {
        List<String> clean = terms.stream().filter(t -> t != null && !t.isBlank()).map(String::trim).toList();
        if (clean.isEmpty()) {
            return null;
        }
        return Pattern.compile("\\b(?:" + String.join("|", clean) + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    private static List<String> nullToEmpty(List<String> in) {
        return in == null ? List.of() : in;
    }

    // ---------------- JSON mapping ----------------
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleBundle {
        public List<RuleJson> rules;
        public List<String> sensitiveTerms;
        public List<String> structuredOutputTerms;
        public List<String> multiFactorTerms;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleJson {
        public String name;       // debug name, optional
        public String intent;     // e.g. "TREND"
        public List<String> patterns;
    }
}
