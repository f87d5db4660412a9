package com.example.healthcoach.service;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.dao.HealthRecordDao;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.UserProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * Builds the profile from configured goals and baselines averaged over recent history.
 */
@Slf4j
@RequiredArgsConstructor
public class UserProfileService {

    private final HealthRecordDao healthRecordDao;
    private final CoachProperties properties;
    private final Clock clock;

    public UserProfile load(long version) {
        LocalDate today = LocalDate.now(clock);
        int days = properties.getProfile().getBaselineDays();
        Map<HealthMetric, Double> baselines = healthRecordDao.averages(today.minusDays(days), today);
        log.info("Loaded baselines for {} metrics over {} days", baselines.size(), days);
        return UserProfile.builder()
                .name(properties.getProfile().getName())
                .baselines(baselines)
                .goals(properties.getProfile().getGoals())
                .version(version)
                .loadedAt(clock.instant())
                .build();
    }
}
