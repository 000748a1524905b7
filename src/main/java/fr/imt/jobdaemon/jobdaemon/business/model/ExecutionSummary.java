package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionSummary {

    private String executionId;

    private ExecutionStatus status;

    private Integer exitCode;

    private Instant startedAt;

    private Instant completedAt;

    private Long duration;
}
