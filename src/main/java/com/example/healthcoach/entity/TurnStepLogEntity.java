package com.example.healthcoach.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "turn_step_logs")
public class TurnStepLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "turn_id", nullable = false)
    private ConversationTurnEntity turn;

    @Column(name = "step_order")
    private Integer stepOrder;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "state", length = 32)
    private String state;

    @Column(name = "note", columnDefinition = "text")
    private String note;

    @Column(name = "logged_at", nullable = false)
    private Instant at;

    @Column(name = "elapsed_ms")
    private Long elapsedMs;
}
