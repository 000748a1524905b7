package fr.imt.jobdaemon.jobdaemon.business.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a job definition. Null fields are left untouched and the environment
 * is merged into the existing one instead of replacing it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobUpdate {

    private String name;

    private String description;

    private String command;

    private JobSchedule schedule;

    private Integer priority;

    private Boolean enabled;

    private Integer maxRetries;

    private Long timeout;

    private String workingDirectory;

    private Map<String, String> environment;

    private List<String> tags;

    @JsonIgnore
    public boolean changesSchedule() {
        return schedule != null || enabled != null;
    }

    /**
     * Applies this update to {@code job} in place. Collections are copied, never shared.
     */
    public void applyTo(JobSpec job) {
        if (name != null) {
            job.setName(name);
        }
        if (description != null) {
            job.setDescription(description);
        }
        if (command != null) {
            job.setCommand(command);
        }
        if (schedule != null) {
            job.setSchedule(schedule);
        }
        if (priority != null) {
            job.setPriority(priority);
        }
        if (enabled != null) {
            job.setEnabled(enabled);
        }
        if (maxRetries != null) {
            job.setMaxRetries(maxRetries);
        }
        if (timeout != null) {
            job.setTimeout(timeout);
        }
        if (workingDirectory != null) {
            job.setWorkingDirectory(workingDirectory);
        }
        if (environment != null) {
            Map<String, String> merged = job.getEnvironment() != null
                    ? new HashMap<>(job.getEnvironment())
                    : new HashMap<>();
            merged.putAll(environment);
            job.setEnvironment(merged);
        }
        if (tags != null) {
            job.setTags(new ArrayList<>(tags));
        }
    }
}
