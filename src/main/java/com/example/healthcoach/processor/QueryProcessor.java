package com.example.healthcoach.processor;

import com.example.healthcoach.model.QueryContext;
import reactor.core.publisher.Mono;

public interface QueryProcessor {
    String name();
    Mono<QueryContext> process(QueryContext ctx);
}
