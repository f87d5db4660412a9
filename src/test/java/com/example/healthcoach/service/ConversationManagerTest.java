package com.example.healthcoach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.healthcoach.classifier.DateScopeResolver;
import com.example.healthcoach.classifier.IntentClassifier;
import com.example.healthcoach.classifier.IntentRuleTable;
import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.InMemoryHealthRecordDao;
import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.llm.BackendUnavailableException;
import com.example.healthcoach.llm.CompletionBackend;
import com.example.healthcoach.llm.CompletionResult;
import com.example.healthcoach.llm.CostEstimator;
import com.example.healthcoach.model.AssistantResponse;
import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.TurnStatus;
import com.example.healthcoach.model.UserProfile;
import com.example.healthcoach.processor.BackendInvocationProcessor;
import com.example.healthcoach.processor.ClaimCheckProcessor;
import com.example.healthcoach.processor.ContextRetrievalProcessor;
import com.example.healthcoach.processor.IntentClassifierProcessor;
import com.example.healthcoach.processor.PromptBuildProcessor;
import com.example.healthcoach.processor.QueryProcessor;
import com.example.healthcoach.processor.RoutingProcessor;
import com.example.healthcoach.processor.ScenarioProcessor;
import com.example.healthcoach.prompt.PromptTemplateRegistry;
import com.example.healthcoach.router.ModelRouter;
import com.example.healthcoach.scenario.ImpactCoefficientTable;
import com.example.healthcoach.scenario.ScenarioEngine;
import com.example.healthcoach.scenario.ScenarioParser;
import com.example.healthcoach.validation.MaxCharsValidator;
import com.example.healthcoach.validation.NotBlankInputValidator;
import com.example.healthcoach.validation.QuestionPlaceholderValidator;
import com.example.healthcoach.validation.ValidationException;
import com.example.healthcoach.validation.ValidationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

class ConversationManagerTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T09:00:00Z"), ZoneOffset.UTC);

  private final AtomicReference<String> lastUserPrompt = new AtomicReference<>();

  private InMemoryHealthRecordDao records;
  private ConversationHistoryService historyService;
  private ValidationService validationService;
  private List<QueryProcessor> processors;

  @BeforeEach
  void setUp() throws Exception {
    records = new InMemoryHealthRecordDao()
        .add(LocalDate.of(2026, 1, 5), 138.5, 9.07, 12453.0)
        .add(LocalDate.of(2026, 1, 6), 141.0, 6.2, 7000.0);
    historyService = mock(ConversationHistoryService.class);
    when(historyService.appendTurn(any(), any(), any())).thenAnswer(inv -> inv.getArgument(0));
    validationService = new ValidationService(List.of(
        new NotBlankInputValidator(), new MaxCharsValidator(), new QuestionPlaceholderValidator()));
  }

  private ConversationManager manager(CompletionBackend... backends) throws Exception {
    CoachProperties props = new CoachProperties();
    UserProfile profile = UserProfile.builder()
        .name("Alex")
        .baseline(HealthMetric.SYSTOLIC, 142.0)
        .goal(HealthMetric.SYSTOLIC, 130.0)
        .build();
    UserProfileCache profileCache = new UserProfileCache(v -> profile, Duration.ofHours(1), CLOCK);
    DailySummaryIndex index = mock(DailySummaryIndex.class);
    ContextRetriever retriever = new ContextRetriever(profileCache, records, index, historyService,
        props.getRetrieval(), CLOCK);
    ScenarioParser parser = new ScenarioParser();
    ScenarioService scenarioService = new ScenarioService(
        new ScenarioEngine(ImpactCoefficientTable.defaults()), parser, props.getScenario());

    processors = new ArrayList<>(List.of(
        new ClaimCheckProcessor(CLOCK),
        new IntentClassifierProcessor(new IntentClassifier(
            IntentRuleTable.fromClasspath(new ObjectMapper()), new DateScopeResolver(CLOCK))),
        new ContextRetrievalProcessor(retriever),
        new ScenarioProcessor(parser, scenarioService),
        new RoutingProcessor(new ModelRouter(false)),
        new PromptBuildProcessor(new PromptTemplateRegistry(new ObjectMapper()), validationService),
        new BackendInvocationProcessor(new BackendRegistry(List.of(backends)),
            new CostEstimator(Map.of()), props)));
    return new ConversationManager(processors, validationService, historyService, new SessionGate());
  }

  private CompletionBackend backend(BackendId id, String answer) {
    return new CompletionBackend() {
      @Override
      public BackendId id() {
        return id;
      }

      @Override
      public CompletionResult complete(String systemPrompt, String userPrompt) {
        lastUserPrompt.set(userPrompt);
        if (answer == null) {
          throw new BackendUnavailableException(id, "connection refused");
        }
        return new CompletionResult(id, answer, 120);
      }

      @Override
      public boolean isAvailable() {
        return true;
      }
    };
  }

  private ConversationTurn persistedTurn() {
    ArgumentCaptor<ConversationTurn> captor = ArgumentCaptor.forClass(ConversationTurn.class);
    verify(historyService, times(1)).appendTurn(captor.capture(), any(), any());
    return captor.getValue();
  }

  @Test
  void answersDataLookupFromTheRecordedDay() throws Exception {
    ConversationManager manager = manager(
        backend(BackendId.LOCAL, "On 2026-01-05 your BP was 138.5 mmHg."));

    AssistantResponse response = manager.handle("What was my BP on 2026-01-05?", "s-1").block();

    assertThat(response.getIntent()).isEqualTo(Intent.DATA_LOOKUP);
    assertThat(response.getStatus()).isEqualTo(TurnStatus.DELIVERED);
    assertThat(response.getBackend()).isEqualTo(BackendId.LOCAL);
    assertThat(response.getText()).contains("138.5");
    assertThat(response.getConfidence()).isEqualTo(1.0);
    assertThat(response.unsupportedClaims()).isEmpty();
    assertThat(lastUserPrompt.get())
        .contains("2026-01-05: BP 138.5 mmHg")
        .contains("Sleep 9.07 hrs")
        .doesNotContain("2026-01-06");

    ConversationTurn turn = persistedTurn();
    assertThat(turn.sessionId()).isEqualTo("s-1");
    assertThat(turn.status()).isEqualTo(TurnStatus.DELIVERED);
    assertThat(turn.backend()).isEqualTo(BackendId.LOCAL);
    assertThat(turn.attemptedBackends()).containsExactly(BackendId.LOCAL);
  }

  @Test
  void failedTurnIsPersistedWithReason() throws Exception {
    ConversationManager manager = manager(
        backend(BackendId.LOCAL, null), backend(BackendId.REASONING, null));

    AssistantResponse response = manager.handle("What was my BP on 2026-01-05?", "s-2").block();

    assertThat(response.getStatus()).isEqualTo(TurnStatus.FAILED);
    assertThat(response.getFailureReason()).isEqualTo("all backends unavailable");
    assertThat(response.getText()).contains("temporarily unavailable");

    ConversationTurn turn = persistedTurn();
    assertThat(turn.status()).isEqualTo(TurnStatus.FAILED);
    assertThat(turn.attemptedBackends()).containsExactly(BackendId.LOCAL, BackendId.REASONING);
  }

  @Test
  void sensitiveQuestionNeverLeavesTheLocalBackend() throws Exception {
    CompletionBackend remote = mock(CompletionBackend.class);
    when(remote.id()).thenReturn(BackendId.REASONING);
    when(remote.isAvailable()).thenReturn(true);
    ConversationManager manager = manager(backend(BackendId.LOCAL, null), remote);

    AssistantResponse response = manager
        .handle("Why was my BP high while I was on my medication?", "s-3").block();

    verify(remote, never()).complete(any(), any());
    assertThat(response.getStatus()).isEqualTo(TurnStatus.FAILED);
    assertThat(response.getText()).contains("not sent to any external service");
    assertThat(persistedTurn().attemptedBackends()).containsExactly(BackendId.LOCAL);
  }

  @Test
  void scenarioFallsBackToComputedNarrative() throws Exception {
    ConversationManager manager = manager();

    AssistantResponse response = manager.handle("What if I raised my VO2 max by 5?", "s-4").block();

    assertThat(response.getIntent()).isEqualTo(Intent.SCENARIO);
    assertThat(response.getStatus()).isEqualTo(TurnStatus.DELIVERED);
    assertThat(response.getText()).contains("-9.8 mmHg").contains("132.2");
    assertThat(response.getConfidence()).isEqualTo(0.7);
    assertThat(response.getBackend()).isNull();
    assertThat(persistedTurn().status()).isEqualTo(TurnStatus.DELIVERED);
  }

  @Test
  void blankQuestionIsRejectedWithoutATurn() throws Exception {
    ConversationManager manager = manager(backend(BackendId.LOCAL, "unused"));

    assertThatThrownBy(() -> manager.handle("   ", "s-5").block())
        .isInstanceOf(ValidationException.class);
    verify(historyService, never()).appendTurn(any(), any(), any());
  }

  @Test
  void unexpectedErrorStillPersistsOneTurn() throws Exception {
    manager(backend(BackendId.LOCAL, "fine"));
    processors.add(new QueryProcessor() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public Mono<QueryContext> process(QueryContext ctx) {
        return Mono.error(new IllegalStateException("boom"));
      }
    });
    ConversationManager manager = new ConversationManager(processors, validationService, historyService,
        new SessionGate());

    AssistantResponse response = manager.handle("hello", null).block();

    assertThat(response.getStatus()).isEqualTo(TurnStatus.FAILED);
    assertThat(response.getFailureReason()).startsWith("internal error in");
    assertThat(response.getSessionId()).isNotBlank();
    assertThat(persistedTurn().status()).isEqualTo(TurnStatus.FAILED);
  }

  @Test
  void persistenceFailureStillReturnsTheAnswer() throws Exception {
    when(historyService.appendTurn(any(), any(), any())).thenThrow(new IllegalStateException("db down"));
    ConversationManager manager = manager(backend(BackendId.LOCAL, "hi there"));

    AssistantResponse response = manager.handle("hello", "s-6").block();

    assertThat(response.getStatus()).isEqualTo(TurnStatus.DELIVERED);
    assertThat(response.getText()).isEqualTo("hi there");
  }
}
