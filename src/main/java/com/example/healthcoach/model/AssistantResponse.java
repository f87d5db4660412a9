package com.example.healthcoach.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AssistantResponse {
    String sessionId;
    String text;
    Intent intent;
    double confidence;
    List<Citation> citations;
    BackendId backend;
    TurnStatus status;
    String failureReason;
    List<StepLog> steps;

    public List<Citation> unsupportedClaims() {
        return citations == null ? List.of() : citations.stream().filter(c -> !c.supported()).toList();
    }
}
