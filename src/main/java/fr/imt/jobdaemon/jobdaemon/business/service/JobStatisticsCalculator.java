package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatistics;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

@UtilityClass
public class JobStatisticsCalculator {

    /**
     * Aggregates the finished executions of {@code history}; a run still in progress is not counted.
     */
    public static JobStatistics compute(JobSpec job, List<JobExecution> history) {
        List<JobExecution> finished = history.stream()
                .filter(execution -> execution.getStatus() != ExecutionStatus.RUNNING)
                .toList();

        int successful = count(finished, ExecutionStatus.COMPLETED);
        int failed = count(finished, ExecutionStatus.FAILED);
        int timedOut = count(finished, ExecutionStatus.TIMEOUT);
        int stopped = count(finished, ExecutionStatus.STOPPED);
        long averageDuration = Math.round(finished.stream()
                .map(JobExecution::getDuration)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0));

        return JobStatistics.builder()
                .jobId(job.getId())
                .jobName(job.getName())
                .totalExecutions(finished.size())
                .successful(successful)
                .failed(failed + timedOut)
                .timedOut(timedOut)
                .stopped(stopped)
                .successRate(finished.isEmpty() ? 0.0 : successful * 100.0 / finished.size())
                .averageDuration(averageDuration)
                .lastExecution(latest(finished, null))
                .lastSuccess(latest(finished, ExecutionStatus.COMPLETED))
                .lastFailure(finished.stream()
                        .filter(e -> e.getStatus() == ExecutionStatus.FAILED || e.getStatus() == ExecutionStatus.TIMEOUT)
                        .map(JobExecution::getStartedAt)
                        .filter(Objects::nonNull)
                        .max(Instant::compareTo)
                        .orElse(null))
                .build();
    }

    private static int count(List<JobExecution> executions, ExecutionStatus status) {
        return (int) executions.stream().filter(e -> e.getStatus() == status).count();
    }

    private static Instant latest(List<JobExecution> executions, ExecutionStatus status) {
        return executions.stream()
                .filter(e -> status == null || e.getStatus() == status)
                .map(JobExecution::getStartedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(null);
    }
}
