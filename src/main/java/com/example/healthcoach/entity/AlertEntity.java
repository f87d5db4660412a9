package com.example.healthcoach.entity;

import com.example.healthcoach.jobs.AlertPriority;
import com.example.healthcoach.jobs.AlertType;
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
@Table(name = "alerts")
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_date", nullable = false)
    private LocalDate alertDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 48)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private AlertPriority priority;

    @Column(name = "title", nullable = false, length = 128)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String message;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "details", columnDefinition = "text")
    private Map<String, Object> details = new LinkedHashMap<>();

    @Column(name = "acknowledged", nullable = false)
    private boolean acknowledged;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
