package com.example.healthcoach.model;

import java.time.LocalDate;

/**
 * A claim found in a reply together with whether the context bundle backs it.
 *
 * @param claim     the text fragment, e.g. "2026-01-05" or "138.5 mmHg"
 * @param date      the date the claim refers to, when it is a date
 * @param supported true when the bundle contains matching evidence
 */
public record Citation(String claim, LocalDate date, boolean supported) {
}
