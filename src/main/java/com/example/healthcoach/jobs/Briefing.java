package com.example.healthcoach.jobs;

import com.example.healthcoach.model.LifestyleFactor;

import java.time.LocalDate;
import java.util.List;

/**
 * @param predictedSystolic today's expected systolic, from yesterday's habits or the baseline
 * @param uncertainty       half-width of the expected range in mmHg
 * @param keyFactor         factor with the largest estimated effect today
 * @param yesterdayRecorded false when the briefing had to fall back to historical averages
 */
public record Briefing(LocalDate date,
                       String text,
                       double predictedSystolic,
                       double uncertainty,
                       LifestyleFactor keyFactor,
                       List<String> recommendations,
                       boolean yesterdayRecorded) {

    public Briefing {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
