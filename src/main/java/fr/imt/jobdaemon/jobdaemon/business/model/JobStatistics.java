package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregates over the retained execution history of one job.
 * {@code successRate} is a percentage, {@code averageDuration} is in milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatistics {

    private String jobId;

    private String jobName;

    private int totalExecutions;

    private int successful;

    private int failed;

    private int stopped;

    private int timedOut;

    private double successRate;

    private long averageDuration;

    private Instant lastExecution;

    private Instant lastSuccess;

    private Instant lastFailure;
}
