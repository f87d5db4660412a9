package com.example.healthcoach.dao;

import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcHealthRecordDao implements HealthRecordDao {

    private static final String COLUMNS = Arrays.stream(HealthMetric.values())
            .map(HealthMetric::column)
            .collect(Collectors.joining(", "));

    private static final RowMapper<DailyHealthRecord> ROW_MAPPER = JdbcHealthRecordDao::mapRow;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<DailyHealthRecord> findRecord(LocalDate date) {
        final String sql = "select date, " + COLUMNS + " from daily_health_data where date = :date";
        List<DailyHealthRecord> rows = jdbc.query(sql, new MapSqlParameterSource("date", Date.valueOf(date)), ROW_MAPPER);
        return rows.stream().findFirst();
    }

    @Override
    public List<DailyHealthRecord> findRange(LocalDate start, LocalDate end) {
        final String sql = "select date, " + COLUMNS + """
                 from daily_health_data
                where date between :start and :end
                order by date
                """;
        return jdbc.query(sql, range(start, end), ROW_MAPPER);
    }

    @Override
    public Map<HealthMetric, Double> averages(LocalDate start, LocalDate end) {
        return aggregate("avg", start, end);
    }

    @Override
    public Map<HealthMetric, Double> standardDeviations(LocalDate start, LocalDate end) {
        return aggregate("stddev_samp", start, end);
    }

    private Map<HealthMetric, Double> aggregate(String fn, LocalDate start, LocalDate end) {
        String select = Arrays.stream(HealthMetric.values())
                .map(m -> fn + "(" + m.column() + ") as " + m.column())
                .collect(Collectors.joining(", "));
        final String sql = "select " + select + " from daily_health_data where date between :start and :end";
        Map<HealthMetric, Double> out = new EnumMap<>(HealthMetric.class);
        jdbc.query(sql, range(start, end), rs -> {
            for (HealthMetric m : HealthMetric.values()) {
                Double v = readDouble(rs, m.column());
                if (v != null) {
                    out.put(m, v);
                }
            }
        });
        return out;
    }

    private static MapSqlParameterSource range(LocalDate start, LocalDate end) {
        return new MapSqlParameterSource()
                .addValue("start", Date.valueOf(start))
                .addValue("end", Date.valueOf(end));
    }

    private static DailyHealthRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        DailyHealthRecord.Builder b = DailyHealthRecord.builder(rs.getDate("date").toLocalDate());
        for (HealthMetric m : HealthMetric.values()) {
            b.with(m, readDouble(rs, m.column()));
        }
        return b.build();
    }

    private static Double readDouble(ResultSet rs, String column) throws SQLException {
        Object raw = rs.getObject(column);
        return raw instanceof Number n ? n.doubleValue() : null;
    }
}
