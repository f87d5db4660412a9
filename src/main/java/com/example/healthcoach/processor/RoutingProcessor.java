package com.example.healthcoach.processor;

import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.RoutingMetadata;
import com.example.healthcoach.router.ModelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;

@Slf4j
@Component
@RequiredArgsConstructor
public class RoutingProcessor implements QueryProcessor {

    private static final String NAME = "model-router";

    private final ModelRouter router;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.ROUTE);
        RoutingMetadata metadata = RoutingMetadata.of(ctx.getClassified());
        ctx.setRouting(metadata);
        ctx.setSelectedBackend(router.select(metadata));
        ctx.setFallbackChain(new ArrayList<>(router.fallbackChain(metadata)));
        // metadata only, never the question text
        log.info("[{}] session={} complexity={} privacy={} structured={} -> {}", NAME, ctx.getSessionId(),
                metadata.complexity(), metadata.privacy(), metadata.requiresStructuredOutput(), ctx.getFallbackChain());
        return Mono.just(ctx.addStep(NAME, "selected=" + ctx.getSelectedBackend() + ", chain=" + ctx.getFallbackChain()));
    }
}
