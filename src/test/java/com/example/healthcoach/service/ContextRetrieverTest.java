package com.example.healthcoach.service;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.dao.InMemoryHealthRecordDao;
import com.example.healthcoach.model.ClassifiedQuery;
import com.example.healthcoach.model.ContextBundle;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.DateScope;
import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.PrivacySensitivity;
import com.example.healthcoach.model.QueryComplexity;
import com.example.healthcoach.model.SimilarDay;
import com.example.healthcoach.model.UserProfile;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContextRetrieverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate JAN_5 = LocalDate.of(2026, 1, 5);

    private final InMemoryHealthRecordDao dao = new InMemoryHealthRecordDao()
            .add(LocalDate.of(2026, 1, 3), 140.0, 7.0, 8000.0)
            .add(JAN_5, 138.5, 9.07, 12453.0)
            .add(LocalDate.of(2026, 1, 8), 135.0, 7.5, 11000.0);
    private final DailySummaryIndex index = mock(DailySummaryIndex.class);
    private final ConversationHistoryService history = mock(ConversationHistoryService.class);
    private final CoachProperties.Retrieval settings = new CoachProperties.Retrieval();

    private ContextRetriever retriever(HealthRecordDao recordDao, UserProfileCache cache) {
        return new ContextRetriever(cache, recordDao, index, history, settings, CLOCK);
    }

    private static UserProfileCache profileCache() {
        return new UserProfileCache(v -> UserProfile.builder().name("Alex").version(v).build(),
                Duration.ofHours(1), CLOCK);
    }

    private static ClassifiedQuery query(Intent intent, DateScope scope) {
        return new ClassifiedQuery(intent, scope, QueryComplexity.LOW, PrivacySensitivity.NORMAL,
                false, null, null, List.of());
    }

    @Test
    void rangeContainsOnlyRecordedDays() {
        DateScope scope = DateScope.range(LocalDate.of(2026, 1, 3), LocalDate.of(2026, 1, 9), "last week");

        ContextBundle bundle = retriever(dao, profileCache()).retrieve(query(Intent.DATA_LOOKUP, scope), "q", "s");

        assertThat(bundle.getRecords()).extracting(DailyHealthRecord::date)
                .containsExactly(LocalDate.of(2026, 1, 3), JAN_5, LocalDate.of(2026, 1, 8));
        assertThat(bundle.getProfile().getName()).isEqualTo("Alex");
        assertThat(bundle.isDegraded()).isFalse();
    }

    @Test
    void missingDayYieldsEmptyRecords() {
        DateScope scope = DateScope.single(LocalDate.of(2026, 1, 4), "2026-01-04");

        ContextBundle bundle = retriever(dao, profileCache()).retrieve(query(Intent.DATA_LOOKUP, scope), "q", "s");

        assertThat(bundle.getRecords()).isEmpty();
    }

    @Test
    void singleRecordedDayAnchorsSimilaritySearch() {
        SimilarDay similar = new SimilarDay(LocalDate.of(2025, 12, 1), 0.91, "2025-12-01: BP 137 mmHg.");
        when(index.querySimilar(anyString(), anyInt(), anyDouble(), eq(JAN_5))).thenReturn(List.of(similar));
        DateScope scope = DateScope.single(JAN_5, "2026-01-05");

        ContextBundle bundle = retriever(dao, profileCache()).retrieve(query(Intent.EXPLANATION, scope), "why", "s");

        assertThat(bundle.getSimilarDays()).containsExactly(similar);
    }

    @Test
    void storeFailuresDegradeInsteadOfFailing() {
        HealthRecordDao broken = mock(HealthRecordDao.class);
        when(broken.findRange(any(), any())).thenThrow(new IllegalStateException("connection refused"));
        UserProfileCache brokenCache = new UserProfileCache(v -> {
            throw new IllegalStateException("no profile");
        }, Duration.ZERO, CLOCK);
        when(history.recentTurns(anyString(), anyInt())).thenThrow(new IllegalStateException("db down"));

        ContextBundle bundle = retriever(broken, brokenCache)
                .retrieve(query(Intent.TREND, DateScope.single(JAN_5, "x")), "q", "s");

        assertThat(bundle.isDegraded()).isTrue();
        assertThat(bundle.getDegradationNotes()).containsExactly(
                "profile unavailable",
                "records unavailable",
                "supporting records unavailable",
                "conversation history unavailable");
        assertThat(bundle.getProfile()).isNull();
        assertThat(bundle.getRecords()).isEmpty();
    }

    @Test
    void supportingWindowDependsOnIntent() {
        ContextRetriever r = retriever(dao, profileCache());

        assertThat(r.supportingWindow(Intent.PREDICTION, null)).get()
                .extracting(DateScope::start, DateScope::end)
                .containsExactly(LocalDate.of(2025, 12, 27), LocalDate.of(2026, 1, 9));
        assertThat(r.supportingWindow(Intent.COMPARISON, null)).get()
                .extracting(DateScope::days).isEqualTo(30L);
        assertThat(r.supportingWindow(Intent.DATA_LOOKUP, null)).isEmpty();
        assertThat(r.supportingWindow(Intent.TREND,
                DateScope.range(LocalDate.of(2025, 11, 1), LocalDate.of(2026, 1, 9), "long"))).isEmpty();
    }
}
