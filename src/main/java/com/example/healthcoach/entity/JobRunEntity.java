package com.example.healthcoach.entity;

import com.example.healthcoach.jobs.JobStatus;
import com.example.healthcoach.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "job_runs")
public class JobRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", nullable = false, length = 64)
    private String jobName;

    @Column(name = "run_date", nullable = false)
    private LocalDate runDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "details", columnDefinition = "text")
    private Map<String, Object> details = new LinkedHashMap<>();

    @Column(name = "error_class")
    private String errorClass;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;
}
