package com.example.healthcoach.prompt;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    @Test
    void fillsPlaceholders() {
        assertThat(TemplateRenderer.render("BP for {{ name }}: {{value}} mmHg", Map.of("name", "Sam", "value", 138.5)))
                .isEqualTo("BP for Sam: 138.5 mmHg");
    }

    @Test
    void blankValueUsesFallback() {
        Map<String, Object> vars = new HashMap<>();
        vars.put("scope", null);

        assertThat(TemplateRenderer.render("DATA FOR {{scope|the requested period}}:", vars))
                .isEqualTo("DATA FOR the requested period:");
        assertThat(TemplateRenderer.render("DATA FOR {{scope|the requested period}}:", Map.of("scope", "2026-01-05")))
                .isEqualTo("DATA FOR 2026-01-05:");
    }

    @Test
    void emptyPlaceholderLineIsDropped() {
        String template = "INSTRUCTIONS:\n1. Be concise.\n{{degradation}}\nQuestion: {{question}}";

        assertThat(TemplateRenderer.render(template, Map.of("degradation", "", "question", "why?")))
                .isEqualTo("INSTRUCTIONS:\n1. Be concise.\nQuestion: why?");
        assertThat(TemplateRenderer.render("a\n\nb", Map.of())).isEqualTo("a\n\nb");
    }

    @Test
    void replacementTextIsLiteral() {
        assertThat(TemplateRenderer.render("cost {{v}}", Map.of("v", "$5 \\ day"))).isEqualTo("cost $5 \\ day");
    }

    @Test
    void reportsUnknownPlaceholders() {
        assertThat(TemplateRenderer.unresolved("{{a}} {{b|x}} {{a}} {{c}}", Map.of("a", 1)))
                .containsExactly("b", "c");
        assertThat(TemplateRenderer.render(null, Map.of())).isEmpty();
    }
}
