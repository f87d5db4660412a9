package com.example.healthcoach.jobs;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.AlertRepository;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.entity.AlertEntity;
import com.example.healthcoach.model.HealthMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the alert rules for a day and appends what they find to the alert store.
 */
@Slf4j
@Service
public class AlertScanJob {

    public static final String JOB_NAME = "alert-scan";

    private final AlertEngine engine;
    private final HealthRecordDao dao;
    private final AlertRepository alertRepository;
    private final JobHistoryService jobHistory;
    private final CoachProperties.Profile profile;
    private final Clock clock;

    public AlertScanJob(HealthRecordDao dao, AlertRepository alertRepository, JobHistoryService jobHistory,
                        CoachProperties properties, Clock clock) {
        this.engine = new AlertEngine(dao);
        this.dao = dao;
        this.alertRepository = alertRepository;
        this.jobHistory = jobHistory;
        this.profile = properties.getProfile();
        this.clock = clock;
    }

    public List<Alert> scan(LocalDate date) {
        return jobHistory.run(JOB_NAME, date, () -> {
            Double baseline = dao.averages(date.minusDays(profile.getBaselineDays()), date).get(HealthMetric.SYSTOLIC);
            double goal = profile.getGoals().getOrDefault(HealthMetric.SYSTOLIC, 130.0);
            List<Alert> alerts = engine.checkAll(date, baseline, goal);
            alerts.forEach(this::save);
            log.info("Alert scan for {} raised {} alerts", date, alerts.size());
            return alerts;
        }, alerts -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("alerts", alerts.size());
            details.put("types", alerts.stream().map(a -> a.type().name()).toList());
            return details;
        });
    }

    /** Unacknowledged alerts, most urgent first, newest first within a priority. */
    public List<AlertEntity> openAlerts() {
        return alertRepository.findByAcknowledgedFalseOrderByIdDesc().stream()
                .sorted(Comparator.comparing(AlertEntity::getPriority))
                .toList();
    }

    public boolean acknowledge(long alertId) {
        return alertRepository.findById(alertId)
                .map(a -> alertRepository.save(a.setAcknowledged(true)) != null)
                .orElse(false);
    }

    private void save(Alert alert) {
        alertRepository.save(new AlertEntity()
                .setAlertDate(alert.date())
                .setType(alert.type())
                .setPriority(alert.priority())
                .setTitle(alert.title())
                .setMessage(alert.message())
                .setDetails(new LinkedHashMap<>(alert.details()))
                .setCreatedAt(clock.instant()));
    }
}
