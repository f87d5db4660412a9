package com.example.healthcoach.jobs;

import com.example.healthcoach.dao.JobRunRepository;
import com.example.healthcoach.entity.JobRunEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Records one {@link JobRunEntity} per job execution, succeeded or failed. Failures are
 * recorded and then rethrown to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobHistoryService {

    private final JobRunRepository repository;
    private final Clock clock;

    /**
     * Runs {@code work} and records the outcome. Only a failure of {@code work} marks the run
     * FAILED; a failure to build or save the success record propagates as is.
     */
    public <T> T run(String jobName, LocalDate runDate, Supplier<T> work, Function<T, Map<String, Object>> details) {
        JobRunEntity run = new JobRunEntity()
                .setJobName(jobName)
                .setRunDate(runDate)
                .setStartedAt(clock.instant());
        log.info("Job {} started for {}", jobName, runDate);
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            run.setStatus(JobStatus.FAILED)
                    .setErrorClass(e.getClass().getName())
                    .setErrorMessage(e.getMessage())
                    .setFinishedAt(clock.instant());
            try {
                repository.save(run);
            } catch (RuntimeException saveError) {
                e.addSuppressed(saveError);
            }
            log.error("Job {} failed for {}", jobName, runDate, e);
            throw e;
        }
        run.setStatus(JobStatus.SUCCEEDED)
                .setDetails(new LinkedHashMap<>(details.apply(result)))
                .setFinishedAt(clock.instant());
        repository.save(run);
        log.info("Job {} succeeded for {}", jobName, runDate);
        return result;
    }
}
