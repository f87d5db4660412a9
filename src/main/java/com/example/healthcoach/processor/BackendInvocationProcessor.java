package com.example.healthcoach.processor;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.llm.CompletionBackend;
import com.example.healthcoach.llm.CompletionResult;
import com.example.healthcoach.llm.CostEstimator;
import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.RoutingMetadata;
import com.example.healthcoach.scenario.ScenarioNarrator;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Calls the backends of the fallback chain in order until one answers.
 *
 * <p>When the chain is exhausted: sensitive questions fail closed, scenario questions with a
 * computed result fall back to a deterministic narrative, everything else fails with a
 * temporarily-unavailable reply.
 */
@Slf4j
@Component
public class BackendInvocationProcessor implements QueryProcessor {

    private static final String NAME = "backend-invocation";

    static final String PRIVACY_UNAVAILABLE = "The private on-device assistant is temporarily unavailable, so your "
            + "question was not answered. Because it contains privacy-protected information it was not sent to "
            + "any external service. Please try again later.";
    static final String UNAVAILABLE = "The coaching assistant is temporarily unavailable. Please try again in a few minutes.";

    static final double SCENARIO_FALLBACK_CONFIDENCE = 0.7;

    private final BackendRegistry registry;
    private final CostEstimator costEstimator;
    private final CoachProperties.Backends backendProps;

    public BackendInvocationProcessor(BackendRegistry registry, CostEstimator costEstimator, CoachProperties properties) {
        this.registry = registry;
        this.costEstimator = costEstimator;
        this.backendProps = properties.getBackends();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.INVOKE_BACKEND);
        return invoke(ctx, ctx.getFallbackChain(), 0);
    }

    private Mono<QueryContext> invoke(QueryContext ctx, List<BackendId> chain, int index) {
        if (index >= chain.size()) {
            return Mono.just(exhausted(ctx));
        }
        BackendId id = chain.get(index);
        CompletionBackend backend = registry.find(id).orElse(null);
        if (backend == null || !backend.isAvailable()) {
            ctx.addStep(NAME, id + " skipped: not configured");
            return invoke(ctx, chain, index + 1);
        }
        ctx.getAttemptedBackends().add(id);
        Duration timeout = timeoutFor(id);
        return Mono.fromCallable(() -> backend.complete(ctx.getSystemPrompt(), ctx.getUserPrompt()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(result -> answered(ctx, result))
                .onErrorResume(e -> {
                    String reason = e instanceof TimeoutException ? "timed out after " + timeout.toMillis() + "ms"
                            : e.getMessage();
                    log.warn("[{}] session={} backend={} failed: {}", NAME, ctx.getSessionId(), id, reason);
                    ctx.setErrorClass(e.getClass().getSimpleName());
                    ctx.addStep(NAME, id + " failed: " + reason);
                    return invoke(ctx, chain, index + 1);
                });
    }

    private QueryContext answered(QueryContext ctx, CompletionResult result) {
        ctx.setAnswer(result.text());
        ctx.setAnsweredBy(result.backend());
        ctx.setTokensUsed(ctx.getTokensUsed() + result.tokensUsed());
        ctx.setCostUsd(ctx.getCostUsd() + costEstimator.estimate(result.backend(), result.tokensUsed()));
        return ctx.addStep(NAME, "answered by " + result.backend() + ", tokens=" + result.tokensUsed());
    }

    private QueryContext exhausted(QueryContext ctx) {
        RoutingMetadata routing = ctx.getRouting();
        if (routing != null && routing.isSensitive()) {
            ctx.setAnswer(PRIVACY_UNAVAILABLE);
            ctx.addStep(NAME, "local backend unavailable; sensitive question not forwarded");
            return ctx.fail("local backend unavailable for privacy-sensitive question");
        }
        if (ctx.getScenario() != null) {
            ctx.setAnswer(ScenarioNarrator.narrative(ctx.getScenario()));
            ctx.setConfidence(Math.min(ctx.getConfidence(), SCENARIO_FALLBACK_CONFIDENCE));
            return ctx.addStep(NAME, "all backends unavailable; deterministic scenario narrative");
        }
        ctx.setAnswer(UNAVAILABLE);
        ctx.addStep(NAME, "all backends unavailable: " + ctx.getAttemptedBackends());
        return ctx.fail("all backends unavailable");
    }

    private Duration timeoutFor(BackendId id) {
        CoachProperties.Backend b = switch (id) {
            case REASONING -> backendProps.getReasoning();
            case VALIDATION -> backendProps.getValidation();
            case LOCAL -> backendProps.getLocal();
        };
        return b.getTimeout() == null ? Duration.ofSeconds(30) : b.getTimeout();
    }
}
