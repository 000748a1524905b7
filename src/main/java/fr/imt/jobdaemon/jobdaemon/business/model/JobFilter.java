package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Criteria for listing jobs. Every criterion left null matches all jobs;
 * tags match when the job carries at least one of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobFilter {

    public static final int DEFAULT_LIMIT = 100;

    private List<JobStatus> status;

    private List<String> tags;

    private String namePattern;

    private Boolean enabled;

    private Integer limit;

    public static JobFilter all() {
        return new JobFilter();
    }

    public int effectiveLimit() {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }

    public boolean matches(JobSpec job) {
        if (status != null && !status.isEmpty() && !status.contains(job.getStatus())) {
            return false;
        }
        if (tags != null && !tags.isEmpty()
                && (job.getTags() == null || job.getTags().stream().noneMatch(tags::contains))) {
            return false;
        }
        if (enabled != null && enabled != job.isActive()) {
            return false;
        }
        if (namePattern != null && !namePattern.isBlank()) {
            String name = job.getName() != null ? job.getName() : "";
            return Pattern.compile(namePattern, Pattern.CASE_INSENSITIVE).matcher(name).find();
        }
        return true;
    }
}
