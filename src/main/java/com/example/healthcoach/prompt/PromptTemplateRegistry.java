package com.example.healthcoach.prompt;

import com.example.healthcoach.model.Intent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Per-intent prompt templates from {@code prompt_templates.json}. Every system prompt is the
 * shared base followed by the intent specific instructions.
 */
@Slf4j
@Component
public class PromptTemplateRegistry {

    static final String GENERAL = "general";

    private final String baseSystem;
    private final Map<String, TemplateDefinition> templates;

    public PromptTemplateRegistry(ObjectMapper objectMapper) throws IOException {
        TemplateFile loaded;
        try (InputStream inputStream = new ClassPathResource("prompt_templates.json").getInputStream()) {
            loaded = objectMapper.readValue(inputStream, TemplateFile.class);
        }
        this.baseSystem = loaded != null && loaded.base != null && loaded.base.system() != null
                ? loaded.base.system() : "";
        this.templates = loaded != null && loaded.intents != null ? loaded.intents : Collections.emptyMap();
        log.info("Loaded {} prompt templates", templates.size());
    }

    public static String keyOf(Intent intent) {
        return intent == null ? GENERAL : intent.name().toLowerCase(Locale.ROOT);
    }

    public TemplateDefinition resolveTemplate(Intent intent) {
        TemplateDefinition definition = templates.get(keyOf(intent));
        if (definition == null) {
            definition = templates.getOrDefault(GENERAL, TemplateDefinition.defaultTemplate());
        }
        String system = baseSystem.isBlank()
                ? definition.system()
                : baseSystem + "\n\n" + (definition.system() == null ? "" : definition.system());
        return new TemplateDefinition(system, definition.user());
    }

    /** Key actually used for an intent, after the general fallback. */
    public String resolveKey(Intent intent) {
        String key = keyOf(intent);
        return templates.containsKey(key) ? key : GENERAL;
    }

    public record TemplateDefinition(String system, String user) {
        public static TemplateDefinition defaultTemplate() {
            return new TemplateDefinition("You are a health coach.", "Question: {{question}}\nAnswer succinctly.");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TemplateFile {
        public TemplateDefinition base;
        public Map<String, TemplateDefinition> intents;
    }
}
