package com.example.healthcoach.processor;

import com.example.healthcoach.model.ContextBundle;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.SimilarDay;
import com.example.healthcoach.model.TurnStatus;
import com.example.healthcoach.model.UserProfile;
import com.example.healthcoach.prompt.PromptTemplateRegistry;
import com.example.healthcoach.prompt.TemplateRenderer;
import com.example.healthcoach.scenario.ScenarioNarrator;
import com.example.healthcoach.service.DailySummaryRenderer;
import com.example.healthcoach.util.HealthFormat;
import com.example.healthcoach.validation.ValidationContext;
import com.example.healthcoach.validation.ValidationService;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Renders the intent template against the evidence bundle. Only evidence in the bundle reaches
 * the prompt; missing records stay missing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptBuildProcessor implements QueryProcessor {

    private static final String NAME = "prompt-build";
    private static final int HISTORY_ANSWER_CHARS = 400;

    private final PromptTemplateRegistry registry;
    private final ValidationService validationService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.BUILD_PROMPT);
        PromptTemplateRegistry.TemplateDefinition template = registry.resolveTemplate(ctx.intent());
        ValidationContext checked = validationService.validateTemplate(ctx.getRawInput(), template.user());
        ctx.getValidationNotices().addAll(checked.getNotices());

        Map<String, Object> vars = variables(ctx);
        Set<String> missing = TemplateRenderer.unresolved(template.system() + "\n" + checked.getUserTemplate(), vars);
        if (!missing.isEmpty()) {
            log.warn("[{}] template {} has unknown placeholders {}", NAME, registry.resolveKey(ctx.intent()), missing);
        }
        ctx.setTemplateKey(registry.resolveKey(ctx.intent()));
        ctx.setSystemPrompt(TemplateRenderer.render(template.system(), vars));
        ctx.setUserPrompt(TemplateRenderer.render(checked.getUserTemplate(), vars));
        log.debug("[{}] template={} systemChars={} userChars={}", NAME, ctx.getTemplateKey(),
                ctx.getSystemPrompt().length(), ctx.getUserPrompt().length());
        return Mono.just(ctx.addStep(NAME, "template=" + ctx.getTemplateKey()));
    }

    static Map<String, Object> variables(QueryContext ctx) {
        ContextBundle bundle = ctx.getBundle() == null ? ContextBundle.builder().build() : ctx.getBundle();
        Map<String, Object> vars = new HashMap<>();
        UserProfile profile = bundle.getProfile();
        vars.put("name", profile == null || profile.getName() == null ? "the user" : profile.getName());
        vars.put("profile", profile(profile));
        vars.put("degradation", bundle.isDegraded()
                ? "5. Some context is unavailable (" + String.join("; ", bundle.getDegradationNotes())
                + "). Mention this if it limits the answer."
                : "");
        vars.put("scope", ctx.getClassified().scope().map(Object::toString).orElse(null));
        vars.put("records", DailySummaryRenderer.renderAll(bundle.getRecords()));
        vars.put("supporting", DailySummaryRenderer.renderAll(bundle.getSupportingRecords()));
        vars.put("similarDays", similarDays(bundle.getSimilarDays()));
        vars.put("history", history(bundle.getRecentTurns()));
        vars.put("scenario", ctx.getScenario() == null
                ? "(no lifestyle change could be read from the question)"
                : ScenarioNarrator.factSheet(ctx.getScenario()));
        vars.put("question", ctx.getRawInput());
        return vars;
    }

    static String profile(UserProfile profile) {
        if (profile == null) {
            return "(profile unavailable)";
        }
        StringBuilder sb = new StringBuilder();
        for (HealthMetric m : HealthMetric.values()) {
            Double baseline = profile.getBaselines().get(m);
            Double goal = profile.getGoals().get(m);
            if (baseline == null && goal == null) {
                continue;
            }
            sb.append("- ").append(m.label()).append(": ");
            sb.append(baseline == null ? "no baseline" : "baseline " + HealthFormat.num(baseline) + " " + m.unit());
            if (goal != null) {
                sb.append(", goal ").append(HealthFormat.num(goal)).append(' ').append(m.unit());
            }
            sb.append('\n');
        }
        return sb.length() == 0 ? "(no baselines yet)" : sb.toString().strip();
    }

    static String similarDays(List<SimilarDay> days) {
        if (days == null || days.isEmpty()) {
            return "(none found)";
        }
        StringBuilder sb = new StringBuilder();
        for (SimilarDay d : days) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(d.summary()).append(" (similarity ").append(HealthFormat.num(d.score())).append(')');
        }
        return sb.toString();
    }

    static String history(List<ConversationTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "(new conversation)";
        }
        StringBuilder sb = new StringBuilder();
        for (ConversationTurn t : turns) {
            if (t.status() != TurnStatus.DELIVERED) {
                continue;
            }
            String answer = t.responseText() == null ? "" : t.responseText();
            if (answer.length() > HISTORY_ANSWER_CHARS) {
                answer = answer.substring(0, HISTORY_ANSWER_CHARS) + "...";
            }
            sb.append("User: ").append(t.queryText()).append('\n');
            sb.append("Coach: ").append(answer).append('\n');
        }
        return sb.length() == 0 ? "(new conversation)" : sb.toString().strip();
    }
}
