package com.example.healthcoach.service;

import com.example.healthcoach.dao.ConversationTurnRepository;
import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.ConversationTurn;
import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.QueryState;
import com.example.healthcoach.model.StepLog;
import com.example.healthcoach.model.TurnStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(ConversationHistoryService.class)
class ConversationHistoryServiceTest {

    @Autowired
    private ConversationHistoryService service;

    @Autowired
    private ConversationTurnRepository turnRepository;

    private static ConversationTurn turn(String session, String query, String answer, TurnStatus status) {
        return ConversationTurn.builder()
                .sessionId(session)
                .queryText(query)
                .intent(Intent.DATA_LOOKUP)
                .backend(status == TurnStatus.DELIVERED ? BackendId.LOCAL : null)
                .responseText(answer)
                .status(status)
                .failureReason(status == TurnStatus.FAILED ? "all backends unavailable" : null)
                .attemptedBackends(List.of(BackendId.LOCAL, BackendId.REASONING))
                .tokensUsed(42)
                .costUsd(0.0012)
                .confidence(0.85)
                .createdAt(Instant.parse("2026-01-10T09:00:00Z"))
                .build();
    }

    @Test
    void appendedTurnReadsBackUnchanged() {
        ConversationTurn written = turn("s-1", "What was my BP on 2026-01-05?", "It was 138.5 mmHg.", TurnStatus.DELIVERED);
        List<StepLog> steps = List.of(new StepLog().setName("intent-classifier").setState(QueryState.CLASSIFY)
                .setNote("intent=DATA_LOOKUP").setAt(Instant.now()).setElapsedMs(3L));

        service.appendTurn(written, null, steps);
        ConversationTurn read = service.recentTurns("s-1", 10).get(0);

        assertThat(read.id()).isNotNull();
        assertThat(read)
                .usingRecursiveComparison()
                .ignoringFields("id")
                .isEqualTo(written);
    }

    @Test
    void recentTurnsAreOldestFirstAndLimited() {
        service.appendTurn(turn("s-2", "q1", "a1", TurnStatus.DELIVERED), null, List.of());
        service.appendTurn(turn("s-2", "q2", "a2", TurnStatus.FAILED), "TimeoutException", List.of());
        service.appendTurn(turn("s-2", "q3", "a3", TurnStatus.DELIVERED), null, List.of());
        service.appendTurn(turn("other", "x", "y", TurnStatus.DELIVERED), null, List.of());

        assertThat(service.recentTurns("s-2", 2)).extracting(ConversationTurn::queryText).containsExactly("q2", "q3");
        assertThat(service.recentTurns("s-2", 10)).extracting(ConversationTurn::status)
                .containsExactly(TurnStatus.DELIVERED, TurnStatus.FAILED, TurnStatus.DELIVERED);
        assertThat(turnRepository.countBySessionId("s-2")).isEqualTo(3);
    }

    @Test
    void unknownSessionHasNoTurns() {
        assertThat(service.recentTurns("nope", 5)).isEmpty();
        assertThat(service.recentTurns(null, 5)).isEmpty();
    }
}
