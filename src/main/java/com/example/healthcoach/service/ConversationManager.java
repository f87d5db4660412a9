package com.example.healthcoach.service;

import com.example.healthcoach.model.AssistantResponse;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.TurnStatus;
import com.example.healthcoach.processor.BackendInvocationProcessor;
import com.example.healthcoach.processor.ClaimCheckProcessor;
import com.example.healthcoach.processor.ContextRetrievalProcessor;
import com.example.healthcoach.processor.IntentClassifierProcessor;
import com.example.healthcoach.processor.PromptBuildProcessor;
import com.example.healthcoach.processor.QueryProcessor;
import com.example.healthcoach.processor.RoutingProcessor;
import com.example.healthcoach.processor.ScenarioProcessor;
import com.example.healthcoach.validation.ValidationContext;
import com.example.healthcoach.validation.ValidationException;
import com.example.healthcoach.validation.ValidationService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one question through the processor chain and persists exactly one turn for it, whatever
 * the outcome. Turns of the same session are serialized by the {@link SessionGate}.
 */
@Slf4j
@Service
public class ConversationManager {

  private static final List<Class<? extends QueryProcessor>> DEFAULT_ORDER = List.of(
      IntentClassifierProcessor.class,
      ContextRetrievalProcessor.class,
      ScenarioProcessor.class,
      RoutingProcessor.class,
      PromptBuildProcessor.class,
      BackendInvocationProcessor.class,
      ClaimCheckProcessor.class
  );

  static final String INTERNAL_ERROR =
      "Something went wrong while answering. Please try again in a few minutes.";

  private final Map<Class<? extends QueryProcessor>, QueryProcessor> processorsByType;
  private final ValidationService validationService;
  private final ConversationHistoryService historyService;
  private final SessionGate sessionGate;

  public ConversationManager(List<QueryProcessor> processors,
                             ValidationService validationService,
                             ConversationHistoryService historyService,
                             SessionGate sessionGate) {
    this.processorsByType = processors.stream()
        .collect(Collectors.toMap(
            ConversationManager::getConcreteType,
            Function.identity(),
            (left, right) -> left,
            LinkedHashMap::new
        ));
    this.validationService = validationService;
    this.historyService = historyService;
    this.sessionGate = sessionGate;
  }

  /**
   * Answers a question. Fails with {@link ValidationException} only when the question cannot
   * enter the pipeline; every other outcome is a response with status DELIVERED or FAILED.
   */
  public Mono<AssistantResponse> handle(String query, String sessionId) {
    QueryContext ctx;
    try {
      ctx = initializeContext(query, sessionId);
    } catch (ValidationException ex) {
      return Mono.error(ex);
    }
    final QueryContext initial = ctx;
    return sessionGate.run(initial.getSessionId(), () -> runChain(initial)
        .onErrorResume(e -> Mono.just(onUnexpectedError(initial, e)))
        .flatMap(this::persist)
        .map(ConversationManager::toResponse));
  }

  /** Persisted turns of a session, oldest first. */
  public Mono<List<ConversationTurn>> history(String sessionId, int limit) {
    return Mono.fromCallable(() -> historyService.recentTurns(sessionId, limit))
        .subscribeOn(Schedulers.boundedElastic());
  }

  private Mono<QueryContext> runChain(QueryContext ctx) {
    Mono<QueryContext> pipeline = Mono.just(ctx);
    for (QueryProcessor processor : buildOrderedChain()) {
      final QueryProcessor stage = processor;
      pipeline = pipeline.flatMap(current -> {
        if (current.isFailed()) {
          return Mono.just(current);
        }
        return stage.process(current);
      });
    }
    return pipeline;
  }

  private QueryContext onUnexpectedError(QueryContext ctx, Throwable e) {
    log.error("Query pipeline failed in state {} for session {}", ctx.getState(), ctx.getSessionId(), e);
    ctx.setErrorClass(e.getClass().getSimpleName());
    ctx.setAnswer(INTERNAL_ERROR);
    ctx.addStep("pipeline", "error in " + ctx.getState() + ": " + e.getMessage());
    return ctx.fail("internal error in " + ctx.getState());
  }

  private Mono<QueryContext> persist(QueryContext ctx) {
    boolean failed = ctx.isFailed();
    if (!failed) {
      ctx.enter(QueryState.PERSIST_TURN);
    }
    ConversationTurn turn = ConversationTurn.builder()
        .sessionId(ctx.getSessionId())
        .queryText(ctx.getRawInput())
        .intent(ctx.intent())
        .backend(ctx.getAnsweredBy())
        .responseText(ctx.getAnswer())
        .status(failed ? TurnStatus.FAILED : TurnStatus.DELIVERED)
        .failureReason(ctx.getFailureReason())
        .attemptedBackends(ctx.getAttemptedBackends())
        .tokensUsed(ctx.getTokensUsed())
        .costUsd(ctx.getCostUsd())
        .confidence(ctx.getConfidence())
        .createdAt(ctx.getSubmittedAt())
        .build();
    ctx.addStep("persist-turn", "status=" + turn.status());
    return Mono.fromCallable(() -> historyService.appendTurn(turn, ctx.getErrorClass(), ctx.getSteps()))
        .subscribeOn(Schedulers.boundedElastic())
        .map(saved -> {
          if (!failed) {
            ctx.enter(QueryState.DELIVERED);
          }
          return ctx;
        })
        .onErrorResume(e -> {
          // the answer is still returned; the turn is lost
          log.error("Could not persist turn for session {}", ctx.getSessionId(), e);
          if (!failed) {
            ctx.enter(QueryState.DELIVERED);
          }
          return Mono.just(ctx.addStep("persist-turn", "failed: " + e.getClass().getSimpleName()));
        });
  }

  private QueryContext initializeContext(String query, String sessionId) throws ValidationException {
    ValidationContext validation = validationService.validateInput(query);
    return new QueryContext()
        .setSessionId(sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId)
        .setRawInput(validation.getProcessedInput())
        .setValidationNotices(new ArrayList<>(validation.getNotices()));
  }

  static AssistantResponse toResponse(QueryContext ctx) {
    return AssistantResponse.builder()
        .sessionId(ctx.getSessionId())
        .text(ctx.getAnswer())
        .intent(ctx.intent())
        .confidence(ctx.getConfidence())
        .citations(List.copyOf(ctx.getCitations()))
        .backend(ctx.getAnsweredBy())
        .status(ctx.isFailed() ? TurnStatus.FAILED : TurnStatus.DELIVERED)
        .failureReason(ctx.getFailureReason())
        .steps(List.copyOf(ctx.getSteps()))
        .build();
  }

  private List<QueryProcessor> buildOrderedChain() {
    Set<QueryProcessor> seen = new LinkedHashSet<>();
    List<QueryProcessor> ordered = new ArrayList<>();
    for (Class<? extends QueryProcessor> type : DEFAULT_ORDER) {
      QueryProcessor processor = processorsByType.get(type);
      if (processor != null && seen.add(processor)) {
        ordered.add(processor);
      }
    }
    for (QueryProcessor processor : processorsByType.values()) {
      if (seen.add(processor)) {
        ordered.add(processor);
      }
    }
    return ordered;
  }

  @SuppressWarnings("unchecked")
  private static Class<? extends QueryProcessor> getConcreteType(QueryProcessor p) {
    Class<?> target = AopUtils.getTargetClass(p);
    if (target == null || !QueryProcessor.class.isAssignableFrom(target)) {
      target = p.getClass();
    }
    return (Class<? extends QueryProcessor>) target;
  }
}
