package com.example.healthcoach.model;

public enum QueryComplexity {
    LOW,
    MEDIUM,
    HIGH
}
