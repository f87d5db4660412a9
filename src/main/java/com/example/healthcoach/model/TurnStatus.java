package com.example.healthcoach.model;

public enum TurnStatus {
    DELIVERED,
    FAILED
}
