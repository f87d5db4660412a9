package com.example.healthcoach.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one query as it moves through the processor chain.
 */
@Data
@NoArgsConstructor
@Accessors(chain = true, fluent = false)
public class QueryContext {
  // input
  private String sessionId;
  private String rawInput;
  private Instant submittedAt = Instant.now();

  // classification + evidence
  private ClassifiedQuery classified = ClassifiedQuery.general();
  private ContextBundle bundle;
  private ScenarioResult scenario;

  // routing
  private RoutingMetadata routing;
  private BackendId selectedBackend;
  private List<BackendId> fallbackChain = new ArrayList<>();

  // prompt
  private String templateKey;
  private String systemPrompt;
  private String userPrompt;

  // invocation
  private String answer;
  private BackendId answeredBy;
  private List<BackendId> attemptedBackends = new ArrayList<>();
  private int tokensUsed;
  private double costUsd;
  private String errorClass;

  // post-processing
  private double confidence = 1.0;
  private List<Citation> citations = new ArrayList<>();

  // lifecycle
  private QueryState state = QueryState.CLASSIFY;
  private String failureReason;
  private List<String> validationNotices = new ArrayList<>();
  private List<StepLog> steps = new ArrayList<>();

  public QueryContext addStep(String name, String note) {
    Instant now = Instant.now();
    steps.add(new StepLog()
        .setName(name)
        .setState(state)
        .setNote(note)
        .setAt(now)
        .setElapsedMs(Duration.between(submittedAt, now).toMillis()));
    return this;
  }

  public QueryContext enter(QueryState next) {
    this.state = next;
    return this;
  }

  public QueryContext fail(String reason) {
    this.state = QueryState.FAILED;
    this.failureReason = reason;
    return this;
  }

  public boolean isFailed() {
    return state == QueryState.FAILED;
  }

  public Intent intent() {
    return classified == null ? Intent.GENERAL : classified.intent();
  }
}
