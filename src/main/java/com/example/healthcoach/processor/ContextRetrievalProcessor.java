package com.example.healthcoach.processor;

import com.example.healthcoach.model.ContextBundle;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.service.ContextRetriever;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component
@RequiredArgsConstructor
public class ContextRetrievalProcessor implements QueryProcessor {

    private static final String NAME = "context-retrieval";

    private final ContextRetriever retriever;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.RETRIEVE_CONTEXT);
        // store reads block; keep them off the event loop
        return Mono.fromCallable(() -> retriever.retrieve(ctx.getClassified(), ctx.getRawInput(), ctx.getSessionId()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(bundle -> {
                    ctx.setBundle(bundle);
                    return ctx.addStep(NAME, describe(bundle));
                });
    }

    private static String describe(ContextBundle b) {
        return "records=" + b.getRecords().size()
                + ", supporting=" + b.getSupportingRecords().size()
                + ", similarDays=" + b.getSimilarDays().size()
                + ", turns=" + b.getRecentTurns().size()
                + (b.isDegraded() ? ", degraded=" + b.getDegradationNotes() : "");
    }
}
