package com.example.healthcoach.jobs;

/** Ordered from most to least urgent. */
public enum AlertPriority {
    CRITICAL,
    WARNING,
    INFO,
    CELEBRATION
}
