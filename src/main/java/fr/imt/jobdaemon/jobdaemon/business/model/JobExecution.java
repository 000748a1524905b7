package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One run of a job, from spawn to exit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobExecution {

    private String executionId;

    private String jobId;

    private String jobName;

    private String command;

    private int attempt;

    private ExecutionTrigger trigger;

    private ExecutionStatus status;

    private Long pid;

    private Instant startedAt;

    private Instant completedAt;

    private Long duration;

    private Integer exitCode;

    private String stdout;

    private String stderr;

    private String error;

    public ExecutionSummary toSummary() {
        return ExecutionSummary.builder()
                .executionId(executionId)
                .status(status)
                .exitCode(exitCode)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .duration(duration)
                .build();
    }
}
