package com.example.healthcoach.jobs;

import com.example.healthcoach.model.HealthMetric;

/**
 * Progress of one goal from its baseline toward the target.
 *
 * @param progressPct 0 to 100, zero when moving the wrong way
 * @param gap         absolute distance between current value and target
 */
public record GoalProgress(HealthMetric metric,
                           double baseline,
                           double current,
                           double target,
                           double progressPct,
                           double gap,
                           GoalStatus status) {
}
