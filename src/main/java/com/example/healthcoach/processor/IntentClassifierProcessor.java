package com.example.healthcoach.processor;

import com.example.healthcoach.classifier.IntentClassifier;
import com.example.healthcoach.model.ClassifiedQuery;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class IntentClassifierProcessor implements QueryProcessor {

    private static final String NAME = "intent-classifier";

    private final IntentClassifier classifier;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.CLASSIFY);
        ClassifiedQuery classified = classifier.classify(ctx.getRawInput());
        ctx.setClassified(classified);

        String note = "intent=" + classified.intent()
                + (classified.matchedRule() != null ? ", rule=" + classified.matchedRule() : "")
                + ", scope=" + classified.scope().map(s -> s + (s.defaulted() ? " (default)" : "")).orElse("none")
                + (classified.metric() != null ? ", metric=" + classified.metric() : "");
        return Mono.just(ctx.addStep(NAME, note));
    }
}
