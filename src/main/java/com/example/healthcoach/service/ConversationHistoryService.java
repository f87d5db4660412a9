package com.example.healthcoach.service;

import com.example.healthcoach.dao.ConversationTurnRepository;
import com.example.healthcoach.dao.SessionRepository;
import com.example.healthcoach.entity.ConversationTurnEntity;
import com.example.healthcoach.entity.SessionEntity;
import com.example.healthcoach.entity.TurnStepLogEntity;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.StepLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only store of conversation turns. Sessions are created implicitly by the first turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationHistoryService {

    private final SessionRepository sessionRepository;
    private final ConversationTurnRepository turnRepository;

    @Transactional
    public SessionEntity ensureSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseGet(() -> sessionRepository.save(new SessionEntity()
                        .setId(sessionId)
                        .setCreatedAt(Instant.now())));
    }

    @Transactional
    public ConversationTurn appendTurn(ConversationTurn turn, String errorClass, List<StepLog> steps) {
        SessionEntity session = ensureSession(turn.sessionId());
        Instant createdAt = turn.createdAt() == null ? Instant.now() : turn.createdAt();
        session.setLastTurnAt(createdAt);

        ConversationTurnEntity entity = new ConversationTurnEntity()
                .setSession(session)
                .setQueryText(turn.queryText())
                .setIntent(turn.intent())
                .setBackend(turn.backend())
                .setAttemptedBackends(new ArrayList<>(turn.attemptedBackends()))
                .setResponseText(turn.responseText() == null ? "" : turn.responseText())
                .setStatus(turn.status())
                .setFailureReason(turn.failureReason())
                .setErrorClass(errorClass)
                .setTokensUsed(turn.tokensUsed())
                .setCostUsd(turn.costUsd())
                .setConfidence(turn.confidence())
                .setCreatedAt(createdAt);
        entity.setSteps(buildStepEntities(steps, entity));

        ConversationTurnEntity saved = turnRepository.save(entity);
        log.debug("Appended turn {} to session {}", saved.getId(), turn.sessionId());
        return toModel(saved);
    }

    /** The last {@code limit} turns of a session, oldest first. */
    @Transactional(readOnly = true)
    public List<ConversationTurn> recentTurns(String sessionId, int limit) {
        if (sessionId == null || limit <= 0) {
            return List.of();
        }
        List<ConversationTurn> newestFirst = turnRepository
                .findBySessionIdOrderByIdDesc(sessionId, PageRequest.of(0, limit))
                .stream()
                .map(ConversationHistoryService::toModel)
                .toList();
        List<ConversationTurn> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    static ConversationTurn toModel(ConversationTurnEntity e) {
        return ConversationTurn.builder()
                .id(e.getId())
                .sessionId(e.getSession().getId())
                .queryText(e.getQueryText())
                .intent(e.getIntent())
                .backend(e.getBackend())
                .responseText(e.getResponseText())
                .status(e.getStatus())
                .failureReason(e.getFailureReason())
                .attemptedBackends(e.getAttemptedBackends())
                .tokensUsed(e.getTokensUsed())
                .costUsd(e.getCostUsd())
                .confidence(e.getConfidence())
                .createdAt(e.getCreatedAt())
                .build();
    }

    private static List<TurnStepLogEntity> buildStepEntities(List<StepLog> steps, ConversationTurnEntity parent) {
        if (steps == null || steps.isEmpty()) {
            return new ArrayList<>();
        }
        List<TurnStepLogEntity> entities = new ArrayList<>(steps.size());
        AtomicInteger order = new AtomicInteger(1);
        for (StepLog step : steps) {
            if (step == null || step.getName() == null) {
                continue;
            }
            entities.add(new TurnStepLogEntity()
                    .setTurn(parent)
                    .setStepOrder(order.getAndIncrement())
                    .setName(step.getName())
                    .setState(step.getState() == null ? null : step.getState().name())
                    .setNote(step.getNote())
                    .setAt(Objects.requireNonNullElse(step.getAt(), Instant.now()))
                    .setElapsedMs(step.getElapsedMs()));
        }
        return entities;
    }
}
