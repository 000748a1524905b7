package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionSummary;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Document(collection = "jobs")
@Data
public class JobDocument {

    @Id
    private String id;

    private String name;

    private String description;

    private String command;

    // EMBEDDED: schedule and last execution live inside the job document.
    private JobSchedule schedule;

    @Indexed
    private JobStatus status;

    private Integer priority;

    private Boolean enabled;

    private Integer maxRetries;

    private Long timeout;

    private String workingDirectory;

    private Map<String, String> environment;

    @Indexed
    private List<String> tags;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant lastRunAt;

    private Instant nextRunAt;

    private Instant scheduleAnchor;

    private int currentAttempt;

    private long runCount;

    private long failureCount;

    private Long pid;

    private ExecutionSummary lastExecution;
}
