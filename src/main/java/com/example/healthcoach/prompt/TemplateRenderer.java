package com.example.healthcoach.prompt;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{name}}} and {@code {{name|fallback}}} placeholders in prompt templates.
 * <p>
 * A placeholder whose value is null or blank renders its fallback, or nothing. A line that
 * consisted only of placeholders and rendered empty is dropped, so optional sections such as
 * degradation notes leave no blank line behind.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.]+)\\s*(?:\\|([^}]*))?}}");

    private TemplateRenderer() {}

    public static String render(String template, Map<String, ?> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Map<String, ?> vars = variables == null ? Map.of() : variables;
        String[] lines = template.split("\n", -1);
        StringBuilder out = new StringBuilder(template.length() + 256);
        boolean first = true;
        for (String line : lines) {
            String rendered = renderLine(line, vars);
            if (rendered.isBlank() && !line.isBlank() && PLACEHOLDER.matcher(line).replaceAll("").isBlank()) {
                continue;
            }
            if (!first) {
                out.append('\n');
            }
            out.append(rendered);
            first = false;
        }
        return out.toString();
    }

    /** Placeholder names in {@code template} that have no entry in {@code variables}. */
    public static Set<String> unresolved(String template, Map<String, ?> variables) {
        Set<String> missing = new LinkedHashSet<>();
        if (template == null) {
            return missing;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            String name = m.group(1);
            if (variables == null || !variables.containsKey(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static String renderLine(String line, Map<String, ?> vars) {
        Matcher m = PLACEHOLDER.matcher(line);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object value = vars.get(m.group(1));
            String text = value == null ? "" : String.valueOf(value);
            if (text.isBlank() && m.group(2) != null) {
                text = m.group(2).strip();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(text));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
