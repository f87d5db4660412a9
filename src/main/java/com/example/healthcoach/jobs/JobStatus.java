package com.example.healthcoach.jobs;

public enum JobStatus {
    SUCCEEDED,
    FAILED
}
