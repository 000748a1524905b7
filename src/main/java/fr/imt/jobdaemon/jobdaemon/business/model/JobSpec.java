package fr.imt.jobdaemon.jobdaemon.business.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A job definition together with its runtime bookkeeping.
 * <p>
 * Optional settings are boxed so that a request can leave them out; the daemon fills the
 * defaults in when the job is added. Timeouts and durations are milliseconds.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobSpec {

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

    private Map<String, String> environment;

    private List<String> tags;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant lastRunAt;

    private Instant nextRunAt;

    /**
     * Nominal time of the current occurrence of an interval job. Later occurrences are
     * computed from it so that a slow run does not shift the whole series.
     */
    private Instant scheduleAnchor;

    private int currentAttempt;

    private long runCount;

    private long failureCount;

    private Long pid;

    private ExecutionSummary lastExecution;

    @JsonIgnore
    public boolean isRecurring() {
        return schedule != null && schedule.repeats();
    }

    @JsonIgnore
    public boolean isActive() {
        return !Boolean.FALSE.equals(enabled);
    }

    @JsonIgnore
    public int effectivePriority() {
        return priority != null ? priority : 5;
    }
}
