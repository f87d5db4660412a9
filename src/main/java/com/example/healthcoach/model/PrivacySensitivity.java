package com.example.healthcoach.model;

public enum PrivacySensitivity {
    NORMAL,
    SENSITIVE
}
