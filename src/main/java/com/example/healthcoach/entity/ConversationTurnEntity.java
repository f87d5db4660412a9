package com.example.healthcoach.entity;

import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.Intent;
import com.example.healthcoach.model.TurnStatus;
import com.example.healthcoach.persistence.converter.BackendListConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Accessors(chain = true)
@Entity
@Table(name = "conversation_turns", indexes = @Index(name = "idx_turns_session", columnList = "session_id"))
public class ConversationTurnEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private SessionEntity session;

    @Column(name = "query_text", nullable = false, columnDefinition = "text")
    private String queryText;

    @Enumerated(EnumType.STRING)
    @Column(name = "intent", nullable = false, length = 32)
    private Intent intent = Intent.GENERAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "backend", length = 32)
    private BackendId backend;

    @Convert(converter = BackendListConverter.class)
    @Column(name = "attempted_backends", length = 128)
    private List<BackendId> attemptedBackends = new ArrayList<>();

    @Column(name = "response_text", nullable = false, columnDefinition = "text")
    private String responseText;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TurnStatus status;

    @Column(name = "failure_reason", columnDefinition = "text")
    private String failureReason;

    @Column(name = "error_class")
    private String errorClass;

    @Column(name = "tokens_used", nullable = false)
    private int tokensUsed;

    @Column(name = "cost_usd", nullable = false)
    private double costUsd;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @OneToMany(mappedBy = "turn", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("stepOrder ASC")
    private List<TurnStepLogEntity> steps = new ArrayList<>();

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
