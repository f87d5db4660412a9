package com.example.healthcoach.entity;

import com.example.healthcoach.jobs.GoalStatus;
import com.example.healthcoach.model.HealthMetric;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "goal_snapshots")
public class GoalSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate snapshotDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric", nullable = false, length = 32)
    private HealthMetric metric;

    @Column(name = "target_value", nullable = false)
    private double targetValue;

    @Column(name = "baseline_value")
    private Double baselineValue;

    @Column(name = "current_value")
    private Double currentValue;

    @Column(name = "progress_pct")
    private Double progressPct;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private GoalStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
