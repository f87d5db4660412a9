package com.example.healthcoach.model;

public record ConfidenceInterval(double lower, double upper) {

    public double width() {
        return upper - lower;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
