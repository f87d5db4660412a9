package com.example.healthcoach.dao;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@JdbcTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JdbcHealthRecordDao.class)
class JdbcHealthRecordDaoTest {

    @Autowired
    private JdbcHealthRecordDao dao;

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void seed() {
        jdbc.update("delete from daily_health_data");
        insert(LocalDate.of(2026, 1, 3), 140.0, 7.0, 8000.0);
        insert(LocalDate.of(2026, 1, 5), 138.5, 9.07, 12453.0);
        insert(LocalDate.of(2026, 1, 6), 135.0, null, 6000.0);
    }

    private void insert(LocalDate date, Double systolic, Double sleep, Double steps) {
        jdbc.update("insert into daily_health_data (date, systolic_mean, sleep_hours, steps) values (?, ?, ?, ?)",
                Date.valueOf(date), systolic, sleep, steps);
    }

    @Test
    void rangeSkipsDaysWithoutRecords() {
        List<DailyHealthRecord> records = dao.findRange(LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 6));

        assertThat(records).extracting(DailyHealthRecord::date).containsExactly(
                LocalDate.of(2026, 1, 3), LocalDate.of(2026, 1, 5), LocalDate.of(2026, 1, 6));
    }

    @Test
    void unrecordedMetricIsAbsentNotZero() {
        DailyHealthRecord jan6 = dao.findRecord(LocalDate.of(2026, 1, 6)).orElseThrow();

        assertThat(jan6.has(HealthMetric.SLEEP_HOURS)).isFalse();
        assertThat(jan6.has(HealthMetric.VO2_MAX)).isFalse();
        assertThat(jan6.value(HealthMetric.STEPS)).contains(6000.0);
    }

    @Test
    void singleDayLookup() {
        DailyHealthRecord jan5 = dao.findRecord(LocalDate.of(2026, 1, 5)).orElseThrow();

        assertThat(jan5.value(HealthMetric.SYSTOLIC)).contains(138.5);
        assertThat(jan5.value(HealthMetric.SLEEP_HOURS)).contains(9.07);
        assertThat(dao.findRecord(LocalDate.of(2026, 1, 4))).isEmpty();
    }

    @Test
    void averagesIgnoreMissingValues() {
        Map<HealthMetric, Double> avg = dao.averages(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));

        assertThat(avg.get(HealthMetric.SYSTOLIC)).isCloseTo(137.83, within(0.01));
        assertThat(avg.get(HealthMetric.SLEEP_HOURS)).isCloseTo(8.035, within(0.001));
        assertThat(avg).doesNotContainKey(HealthMetric.VO2_MAX);
    }

    @Test
    void standardDeviationNeedsTwoValues() {
        Map<HealthMetric, Double> sd = dao.standardDeviations(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31));

        assertThat(sd.get(HealthMetric.SYSTOLIC)).isCloseTo(2.57, within(0.01));
        assertThat(sd).doesNotContainKey(HealthMetric.VO2_MAX);
    }
}
