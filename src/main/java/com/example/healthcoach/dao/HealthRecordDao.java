package com.example.healthcoach.dao;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to imported daily records. The import pipeline owns the writes.
 */
public interface HealthRecordDao {

    Optional<DailyHealthRecord> findRecord(LocalDate date);

    /**
     * Records with {@code start <= date <= end}, ascending. Dates without a record are absent,
     * never zero filled.
     */
    List<DailyHealthRecord> findRange(LocalDate start, LocalDate end);

    /** Per-metric averages over the window; metrics with no data are absent. */
    Map<HealthMetric, Double> averages(LocalDate start, LocalDate end);

    /** Per-metric sample standard deviation over the window. */
    Map<HealthMetric, Double> standardDeviations(LocalDate start, LocalDate end);
}
