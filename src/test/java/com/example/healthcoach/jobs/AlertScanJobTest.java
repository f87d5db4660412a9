package com.example.healthcoach.jobs;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.AlertRepository;
import com.example.healthcoach.dao.InMemoryHealthRecordDao;
import com.example.healthcoach.dao.JobRunRepository;
import com.example.healthcoach.entity.AlertEntity;
import com.example.healthcoach.entity.JobRunEntity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AlertScanJobTest {

    private static final LocalDate DAY = LocalDate.of(2026, 1, 10);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T07:00:00Z"), ZoneOffset.UTC);

    private final InMemoryHealthRecordDao dao = new InMemoryHealthRecordDao();
    private final AlertRepository alerts = mock(AlertRepository.class);
    private final JobRunRepository runs = mock(JobRunRepository.class);
    private final AlertScanJob job = new AlertScanJob(dao, alerts, new JobHistoryService(runs, CLOCK),
            new CoachProperties(), CLOCK);

    @Test
    void scanSavesAlertsAndRecordsRun() {
        for (int i = 0; i < 3; i++) {
            dao.add(DAY.minusDays(i), 138.0, 5.0, null);
        }

        List<Alert> raised = job.scan(DAY);

        assertThat(raised).extracting(Alert::type).containsExactly(AlertType.POOR_SLEEP_STREAK);
        ArgumentCaptor<AlertEntity> saved = ArgumentCaptor.forClass(AlertEntity.class);
        verify(alerts).save(saved.capture());
        assertThat(saved.getValue().getType()).isEqualTo(AlertType.POOR_SLEEP_STREAK);
        assertThat(saved.getValue().getAlertDate()).isEqualTo(DAY);
        // baseline 138 from the same three days, plus 3 nights * 2 mmHg
        assertThat(saved.getValue().getMessage()).contains("144-148 mmHg");

        ArgumentCaptor<JobRunEntity> run = ArgumentCaptor.forClass(JobRunEntity.class);
        verify(runs).save(run.capture());
        assertThat(run.getValue().getDetails()).containsEntry("alerts", 1);
    }

    @Test
    void quietDaySavesNothing() {
        dao.add(DAY, 128.0, 7.5, 9000.0);

        assertThat(job.scan(DAY)).isEmpty();
        verify(alerts, never()).save(any());
    }

    @Test
    void openAlertsPutWarningsBeforeCelebrations() {
        AlertEntity celebration = new AlertEntity().setId(2L).setPriority(AlertPriority.CELEBRATION);
        AlertEntity warning = new AlertEntity().setId(1L).setPriority(AlertPriority.WARNING);
        when(alerts.findByAcknowledgedFalseOrderByIdDesc()).thenReturn(List.of(celebration, warning));

        assertThat(job.openAlerts()).containsExactly(warning, celebration);
    }

    @Test
    void acknowledgeMarksOnlyExistingAlerts() {
        AlertEntity open = new AlertEntity().setId(5L).setPriority(AlertPriority.WARNING);
        when(alerts.findById(5L)).thenReturn(Optional.of(open));
        when(alerts.findById(6L)).thenReturn(Optional.empty());
        when(alerts.save(any(AlertEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(job.acknowledge(5L)).isTrue();
        assertThat(open.isAcknowledged()).isTrue();
        assertThat(job.acknowledge(6L)).isFalse();
    }
}
