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
public class JobEvent {

    private JobEventType type;

    private String jobId;

    private String jobName;

    private JobStatus status;

    private String executionId;

    private Integer exitCode;

    private Instant timestamp;

    private String message;
}
