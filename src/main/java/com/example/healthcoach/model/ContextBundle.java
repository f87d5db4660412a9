package com.example.healthcoach.model;

import lombok.Builder;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-query evidence handed to the prompt builder. Built fresh for every query.
 */
@Data
@Builder
@Accessors(chain = true)
public class ContextBundle {

    private UserProfile profile;

    /** Records inside the date scope, ascending by date. Only records that exist. */
    @Builder.Default
    private List<DailyHealthRecord> records = new ArrayList<>();

    /** Wider window used for trend, comparison and prediction questions. */
    @Builder.Default
    private List<DailyHealthRecord> supportingRecords = new ArrayList<>();

    @Builder.Default
    private List<SimilarDay> similarDays = new ArrayList<>();

    /** Oldest first. */
    @Builder.Default
    private List<ConversationTurn> recentTurns = new ArrayList<>();

    private ScenarioResult scenario;

    private boolean degraded;

    @Builder.Default
    private List<String> degradationNotes = new ArrayList<>();

    public ContextBundle degrade(String note) {
        this.degraded = true;
        this.degradationNotes.add(note);
        return this;
    }

    /** Every date the bundle carries evidence for. */
    public Set<LocalDate> knownDates() {
        Set<LocalDate> dates = new LinkedHashSet<>();
        records.forEach(r -> dates.add(r.date()));
        supportingRecords.forEach(r -> dates.add(r.date()));
        similarDays.forEach(d -> dates.add(d.date()));
        return dates;
    }

    public List<DailyHealthRecord> allRecords() {
        List<DailyHealthRecord> all = new ArrayList<>(records);
        for (DailyHealthRecord r : supportingRecords) {
            if (all.stream().noneMatch(x -> x.date().equals(r.date()))) {
                all.add(r);
            }
        }
        return all;
    }
}
