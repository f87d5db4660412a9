package com.example.healthcoach.processor;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.llm.BackendUnavailableException;
import com.example.healthcoach.llm.CompletionBackend;
import com.example.healthcoach.llm.CompletionResult;
import com.example.healthcoach.llm.CostEstimator;
import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.PrivacySensitivity;
import com.example.healthcoach.model.QueryComplexity;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.RoutingMetadata;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.scenario.ImpactCoefficientTable;
import com.example.healthcoach.scenario.ScenarioEngine;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BackendInvocationProcessorTest {

    private static final RoutingMetadata NORMAL_HIGH =
            new RoutingMetadata(QueryComplexity.HIGH, PrivacySensitivity.NORMAL, false);
    private static final RoutingMetadata SENSITIVE =
            new RoutingMetadata(QueryComplexity.HIGH, PrivacySensitivity.SENSITIVE, false);

    /** Scripted backend that counts its calls. */
    private static final class FakeBackend implements CompletionBackend {
        private final BackendId id;
        private final boolean available;
        private final String answer;
        private final long delayMs;
        final AtomicInteger calls = new AtomicInteger();

        FakeBackend(BackendId id, boolean available, String answer, long delayMs) {
            this.id = id;
            this.available = available;
            this.answer = answer;
            this.delayMs = delayMs;
        }

        static FakeBackend answering(BackendId id, String answer) {
            return new FakeBackend(id, true, answer, 0);
        }

        static FakeBackend failing(BackendId id) {
            return new FakeBackend(id, true, null, 0);
        }

        @Override
        public BackendId id() {
            return id;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public CompletionResult complete(String systemPrompt, String userPrompt) {
            calls.incrementAndGet();
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BackendUnavailableException(id, "interrupted", e);
                }
            }
            if (answer == null) {
                throw new BackendUnavailableException(id, id + " backend call failed: 503");
            }
            return new CompletionResult(id, answer, 1000);
        }
    }

    private static BackendInvocationProcessor processor(CoachProperties props, CompletionBackend... backends) {
        return new BackendInvocationProcessor(new BackendRegistry(List.of(backends)),
                new CostEstimator(Map.of(BackendId.REASONING, 0.015, BackendId.VALIDATION, 0.03)), props);
    }

    private static BackendInvocationProcessor processor(CompletionBackend... backends) {
        return processor(new CoachProperties(), backends);
    }

    private static QueryContext ctx(RoutingMetadata routing, BackendId... chain) {
        return new QueryContext()
                .setSessionId("s-1")
                .setRouting(routing)
                .setUserPrompt("question")
                .setFallbackChain(new ArrayList<>(List.of(chain)));
    }

    private static ScenarioResult scenario() {
        return new ScenarioEngine(ImpactCoefficientTable.defaults()).predict(
                new ScenarioRequest(142.0, null, Map.of(LifestyleFactor.VO2_MAX, 5.0), 90, null), 200, 42L);
    }

    @Test
    void firstBackendAnswers() {
        FakeBackend reasoning = FakeBackend.answering(BackendId.REASONING, "Your BP was fine.");

        QueryContext out = processor(reasoning).process(ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION)).block();

        assertThat(out.getAnswer()).isEqualTo("Your BP was fine.");
        assertThat(out.getAnsweredBy()).isEqualTo(BackendId.REASONING);
        assertThat(out.getAttemptedBackends()).containsExactly(BackendId.REASONING);
        assertThat(out.getTokensUsed()).isEqualTo(1000);
        assertThat(out.getCostUsd()).isEqualTo(0.015);
        assertThat(out.getState()).isEqualTo(QueryState.INVOKE_BACKEND);
    }

    @Test
    void failureFallsBackToNextBackend() {
        FakeBackend reasoning = FakeBackend.failing(BackendId.REASONING);
        FakeBackend validation = FakeBackend.answering(BackendId.VALIDATION, "fallback answer");

        QueryContext out = processor(reasoning, validation)
                .process(ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION)).block();

        assertThat(out.getAnswer()).isEqualTo("fallback answer");
        assertThat(out.getAnsweredBy()).isEqualTo(BackendId.VALIDATION);
        assertThat(out.getAttemptedBackends()).containsExactly(BackendId.REASONING, BackendId.VALIDATION);
        assertThat(out.getErrorClass()).isEqualTo("BackendUnavailableException");
        assertThat(out.isFailed()).isFalse();
    }

    @Test
    void slowBackendTimesOut() {
        CoachProperties props = new CoachProperties();
        props.getBackends().getReasoning().setTimeout(Duration.ofMillis(50));
        FakeBackend slow = new FakeBackend(BackendId.REASONING, true, "too late", 2000);
        FakeBackend validation = FakeBackend.answering(BackendId.VALIDATION, "on time");

        QueryContext out = processor(props, slow, validation)
                .process(ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION)).block(Duration.ofSeconds(5));

        assertThat(out.getAnswer()).isEqualTo("on time");
        assertThat(out.getErrorClass()).isEqualTo("TimeoutException");
        assertThat(out.getSteps()).anyMatch(s -> s.getNote().contains("timed out after 50ms"));
    }

    @Test
    void unconfiguredBackendIsSkippedWithoutAnAttempt() {
        FakeBackend reasoning = new FakeBackend(BackendId.REASONING, false, "never", 0);
        FakeBackend validation = FakeBackend.answering(BackendId.VALIDATION, "answer");

        QueryContext out = processor(reasoning, validation)
                .process(ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION)).block();

        assertThat(reasoning.calls).hasValue(0);
        assertThat(out.getAttemptedBackends()).containsExactly(BackendId.VALIDATION);
        assertThat(out.getSteps()).anyMatch(s -> s.getNote().equals("REASONING skipped: not configured"));
    }

    @Test
    void sensitiveQuestionFailsClosedWhenLocalIsDown() {
        FakeBackend local = FakeBackend.failing(BackendId.LOCAL);
        FakeBackend reasoning = FakeBackend.answering(BackendId.REASONING, "remote answer");
        QueryContext ctx = ctx(SENSITIVE, BackendId.LOCAL).setScenario(scenario());

        QueryContext out = processor(local, reasoning).process(ctx).block();

        assertThat(reasoning.calls).hasValue(0);
        assertThat(out.isFailed()).isTrue();
        assertThat(out.getAnswer()).isEqualTo(BackendInvocationProcessor.PRIVACY_UNAVAILABLE);
        assertThat(out.getFailureReason()).contains("privacy-sensitive");
        assertThat(out.getAttemptedBackends()).containsExactly(BackendId.LOCAL);
    }

    @Test
    void scenarioFallsBackToNarrative() {
        QueryContext ctx = ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION).setScenario(scenario());

        QueryContext out = processor(FakeBackend.failing(BackendId.REASONING), FakeBackend.failing(BackendId.VALIDATION))
                .process(ctx).block();

        assertThat(out.isFailed()).isFalse();
        assertThat(out.getAnswer()).contains("-9.8 mmHg").contains("132.2");
        assertThat(out.getConfidence()).isEqualTo(BackendInvocationProcessor.SCENARIO_FALLBACK_CONFIDENCE);
        assertThat(out.getAnsweredBy()).isNull();
    }

    @Test
    void exhaustedChainFailsWithReadableMessage() {
        QueryContext out = processor(FakeBackend.failing(BackendId.REASONING))
                .process(ctx(NORMAL_HIGH, BackendId.REASONING, BackendId.VALIDATION)).block();

        assertThat(out.isFailed()).isTrue();
        assertThat(out.getAnswer()).isEqualTo(BackendInvocationProcessor.UNAVAILABLE);
        assertThat(out.getFailureReason()).isEqualTo("all backends unavailable");
        assertThat(out.getAttemptedBackends()).containsExactly(BackendId.REASONING);
    }
}
