package fr.imt.jobdaemon.jobdaemon.presentation.web.dto;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionSummary;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Job as exposed over HTTP. Environment values are left out.
 */
@Data
public class JobResponse {
    private String id;
    private String name;
    private String description;
    private String command;
    private JobSchedule schedule;
    private JobStatus status;
    private Integer priority;
    private Boolean enabled;
    private Integer maxRetries;
    private Long timeout;
    private String workingDirectory;
    private List<String> tags;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private int currentAttempt;
    private long runCount;
    private long failureCount;
    private Long pid;
    private ExecutionSummary lastExecution;
}
