package com.example.healthcoach.model;

import java.time.LocalDate;

/**
 * A historical day returned by similarity search; higher score means closer.
 */
public record SimilarDay(LocalDate date, double score, String summary) {
}
