package com.example.healthcoach.service;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.model.ClassifiedQuery;
import com.example.healthcoach.model.ContextBundle;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.DateScope;
import com.example.healthcoach.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the evidence bundle for one query. Read-only; every store failure degrades the
 * bundle instead of failing the query.
 */
@Slf4j
@RequiredArgsConstructor
public class ContextRetriever {

    private final UserProfileCache profileCache;
    private final HealthRecordDao healthRecordDao;
    private final DailySummaryIndex summaryIndex;
    private final ConversationHistoryService historyService;
    private final CoachProperties.Retrieval settings;
    private final Clock clock;

    public ContextBundle retrieve(ClassifiedQuery classified, String queryText, String sessionId) {
        ContextBundle bundle = ContextBundle.builder().build();

        try {
            bundle.setProfile(profileCache.get());
        } catch (RuntimeException e) {
            degrade(bundle, "profile", e);
        }

        Optional<DateScope> scope = classified.scope();
        if (scope.isPresent()) {
            try {
                bundle.setRecords(healthRecordDao.findRange(scope.get().start(), scope.get().end()));
            } catch (RuntimeException e) {
                degrade(bundle, "records", e);
            }
        }

        supportingWindow(classified.intent(), scope.orElse(null)).ifPresent(window -> {
            try {
                bundle.setSupportingRecords(healthRecordDao.findRange(window.start(), window.end()));
            } catch (RuntimeException e) {
                degrade(bundle, "supporting records", e);
            }
        });

        if (classified.intent().wantsSimilarDays()) {
            try {
                AnchorText anchor = anchorText(bundle.getRecords(), scope.orElse(null), queryText);
                bundle.setSimilarDays(summaryIndex.querySimilar(anchor.text(), similarDays(),
                        settings.getMinSimilarity(), anchor.date()));
            } catch (RuntimeException e) {
                degrade(bundle, "similar days", e);
            }
        }

        try {
            bundle.setRecentTurns(historyService.recentTurns(sessionId, settings.getHistoryTurns()));
        } catch (RuntimeException e) {
            degrade(bundle, "conversation history", e);
        }

        return bundle;
    }

    /** Extra window for trend, comparison and prediction questions; empty for other intents. */
    Optional<DateScope> supportingWindow(Intent intent, DateScope scope) {
        LocalDate today = LocalDate.now(clock);
        return switch (intent) {
            case TREND -> scope != null && scope.days() >= settings.getSupportingDays()
                    ? Optional.empty()
                    : Optional.of(lastDays(scope == null ? today : scope.end().plusDays(1), settings.getSupportingDays()));
            case COMPARISON -> Optional.of(lastDays(today, settings.getSupportingDays()));
            case PREDICTION -> Optional.of(lastDays(today, settings.getPredictionDays()));
            default -> Optional.empty();
        };
    }

    private int similarDays() {
        return Math.max(3, Math.min(5, settings.getSimilarDays()));
    }

    private static DateScope lastDays(LocalDate endExclusive, int days) {
        return DateScope.range(endExclusive.minusDays(days), endExclusive.minusDays(1), "last " + days + " days");
    }

    /** The anchor day's own summary when the question is about a single recorded day. */
    static AnchorText anchorText(List<DailyHealthRecord> records, DateScope scope, String queryText) {
        if (scope != null && scope.isSingleDay() && records != null && records.size() == 1) {
            DailyHealthRecord r = records.get(0);
            return new AnchorText(DailySummaryRenderer.render(r), r.date());
        }
        return new AnchorText(queryText, null);
    }

    record AnchorText(String text, LocalDate date) {
    }

    private static void degrade(ContextBundle bundle, String what, RuntimeException e) {
        log.warn("Context degraded, {} unavailable: {}", what, e.toString());
        bundle.degrade(what + " unavailable");
    }
}
