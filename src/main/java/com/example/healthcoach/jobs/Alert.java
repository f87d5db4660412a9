package com.example.healthcoach.jobs;

import java.time.LocalDate;
import java.util.Map;

/**
 * A pattern, anomaly or achievement found in the daily records.
 *
 * @param date    the day the scan ran for
 * @param details the numbers behind the message
 */
public record Alert(LocalDate date,
                    AlertType type,
                    AlertPriority priority,
                    String title,
                    String message,
                    Map<String, Object> details) {

    public Alert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
