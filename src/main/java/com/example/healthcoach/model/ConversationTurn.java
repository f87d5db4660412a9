package com.example.healthcoach.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * One persisted question/answer exchange of a session.
 */
@Builder
public record ConversationTurn(Long id,
                               String sessionId,
                               String queryText,
                               Intent intent,
                               BackendId backend,
                               String responseText,
                               TurnStatus status,
                               String failureReason,
                               List<BackendId> attemptedBackends,
                               int tokensUsed,
                               double costUsd,
                               double confidence,
                               Instant createdAt) {

    public ConversationTurn {
        attemptedBackends = attemptedBackends == null ? List.of() : List.copyOf(attemptedBackends);
    }
}
