package com.example.healthcoach.jobs;

public enum GoalStatus {
    ACHIEVED,
    ON_TRACK,
    NOT_STARTED
}
