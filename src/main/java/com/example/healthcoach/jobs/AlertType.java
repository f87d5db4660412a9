package com.example.healthcoach.jobs;

public enum AlertType {
    POOR_SLEEP_STREAK,
    BP_SPIKE,
    BP_LOW,
    BP_GOAL_STREAK,
    STEPS_WEEK,
    BP_TREND_UP,
    BP_TREND_DOWN,
    BP_DESPITE_HABITS
}
