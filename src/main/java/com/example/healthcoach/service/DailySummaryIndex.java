package com.example.healthcoach.service;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.SimilarDay;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Vector index of rendered daily summaries, one entry per date.
 */
@Slf4j
@RequiredArgsConstructor
public class DailySummaryIndex {

    static final String DATE_KEY = "date";

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> store;

    /**
     * Top-k days closest to {@code text}, best first. {@code exclude} (the anchor day itself)
     * never appears in the result.
     */
    public List<SimilarDay> querySimilar(String text, int k, double minScore, LocalDate exclude) {
        Embedding query = embeddingModel.embed(text).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(query)
                .maxResults(exclude == null ? k : k + 1)
                .minScore(minScore)
                .build();
        List<SimilarDay> out = new ArrayList<>(k);
        for (EmbeddingMatch<TextSegment> match : store.search(request).matches()) {
            TextSegment segment = match.embedded();
            if (segment == null) {
                continue;
            }
            LocalDate date = dateOf(segment);
            if (date == null || date.equals(exclude)) {
                continue;
            }
            out.add(new SimilarDay(date, match.score(), segment.text()));
            if (out.size() == k) {
                break;
            }
        }
        return out;
    }

    /** Replaces the entry for {@code date}. */
    public void upsert(LocalDate date, String text) {
        String id = idFor(date);
        store.remove(id);
        TextSegment segment = TextSegment.from(text, new Metadata().put(DATE_KEY, date.toString()));
        Embedding embedding = embeddingModel.embed(segment).content();
        store.addAll(List.of(id), List.of(embedding), List.of(segment));
    }

    public int index(List<DailyHealthRecord> records) {
        for (DailyHealthRecord r : records) {
            upsert(r.date(), DailySummaryRenderer.render(r));
        }
        log.info("Indexed {} daily summaries", records.size());
        return records.size();
    }

    static String idFor(LocalDate date) {
        return UUID.nameUUIDFromBytes(("daily-summary:" + date).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static LocalDate dateOf(TextSegment segment) {
        String raw = segment.metadata().getString(DATE_KEY);
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Skipping similar-day match with bad date metadata '{}'", raw);
            return null;
        }
    }
}
