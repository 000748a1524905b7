package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.NextRunCalculator;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.exception.InvalidJobSpecException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JobSpecValidator {

    private final NextRunCalculator nextRunCalculator;

    /**
     * Validates a job definition coming from a client and returns a copy with its id and defaults filled in
     * and all runtime bookkeeping reset.
     */
    public JobSpec prepareNewJob(JobSpec request, Instant now) {
        if (request == null) {
            throw new InvalidJobSpecException("Job definition is required");
        }
        validate(request);

        JobSpec job = request.toBuilder()
                .status(null)
                .createdAt(now)
                .updatedAt(now)
                .lastRunAt(null)
                .nextRunAt(null)
                .scheduleAnchor(null)
                .currentAttempt(0)
                .runCount(0)
                .failureCount(0)
                .pid(null)
                .lastExecution(null)
                .build();
        if (isBlank(job.getId())) {
            job.setId(Constants.JOB_ID_PREFIX + UUID.randomUUID());
        }
        if (isBlank(job.getName())) {
            job.setName(job.getCommand());
        }
        if (job.getPriority() == null) {
            job.setPriority(Constants.DEFAULT_PRIORITY);
        }
        if (job.getEnabled() == null) {
            job.setEnabled(true);
        }
        if (job.getMaxRetries() == null) {
            job.setMaxRetries(0);
        }
        if (job.getTimeout() == null) {
            job.setTimeout(0L);
        }
        job.setEnvironment(job.getEnvironment() != null ? new HashMap<>(job.getEnvironment()) : new HashMap<>());
        job.setTags(job.getTags() != null ? new ArrayList<>(job.getTags()) : new ArrayList<>());
        return job;
    }

    public void validate(JobSpec job) {
        if (isBlank(job.getCommand())) {
            throw new InvalidJobSpecException("Job command is required");
        }
        if (job.getMaxRetries() != null && job.getMaxRetries() < 0) {
            throw new InvalidJobSpecException("maxRetries must not be negative, got " + job.getMaxRetries());
        }
        if (job.getTimeout() != null && job.getTimeout() < 0) {
            throw new InvalidJobSpecException("timeout must not be negative, got " + job.getTimeout());
        }
        if (job.getPriority() != null && (job.getPriority() < 0 || job.getPriority() > Constants.MAX_PRIORITY)) {
            throw new InvalidJobSpecException(
                    "priority must be between 0 and " + Constants.MAX_PRIORITY + ", got " + job.getPriority());
        }
        nextRunCalculator.validate(job.getSchedule());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
