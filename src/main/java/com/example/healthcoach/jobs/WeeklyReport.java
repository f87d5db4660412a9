package com.example.healthcoach.jobs;

import java.time.LocalDate;
import java.util.List;

/**
 * @param trend             "improving", "worsening", "stable" or {@code null} with fewer than three BP days
 * @param projectedSystolic next week's expected average if habits continue, {@code null} without BP data
 */
public record WeeklyReport(LocalDate weekStart,
                           LocalDate weekEnd,
                           WeekStats stats,
                           WeekStats previous,
                           LocalDate bestDay,
                           LocalDate worstDay,
                           String trend,
                           List<String> actionPlan,
                           Double projectedSystolic,
                           String text) {

    public WeeklyReport {
        actionPlan = actionPlan == null ? List.of() : List.copyOf(actionPlan);
    }
}
