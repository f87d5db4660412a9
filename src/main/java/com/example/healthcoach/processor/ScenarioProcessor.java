package com.example.healthcoach.processor;

import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.scenario.ScenarioParser;
import com.example.healthcoach.service.ScenarioService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Runs the scenario engine for what-if questions whose changes can be read from the text.
 * The numeric result joins the evidence bundle so the backend only narrates it.
 */
@Component
@RequiredArgsConstructor
public class ScenarioProcessor implements QueryProcessor {

    private static final String NAME = "scenario-engine";

    private final ScenarioParser parser;
    private final ScenarioService scenarioService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        if (ctx.intent() != Intent.SCENARIO) {
            return Mono.just(ctx);
        }
        Map<LifestyleFactor, ScenarioParser.Change> changes = parser.parse(ctx.getRawInput());
        if (changes.isEmpty()) {
            return Mono.just(ctx.addStep(NAME, "no lifestyle change found in question"));
        }
        ScenarioRequest request = scenarioService.requestFor(changes,
                ctx.getBundle() == null ? null : ctx.getBundle().getProfile());
        ScenarioResult result = scenarioService.predict(request);
        ctx.setScenario(result);
        if (ctx.getBundle() != null) {
            ctx.getBundle().setScenario(result);
        }
        return Mono.just(ctx.addStep(NAME, "deltas=" + request.deltas()
                + ", systolicChange=" + result.getSystolicChange()
                + ", feasibility=" + result.getFeasibility()));
    }
}
