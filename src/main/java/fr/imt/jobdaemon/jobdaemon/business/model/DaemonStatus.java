package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Answer of the {@code status} command.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DaemonStatus {

    private boolean running;

    private long pid;

    private Instant startedAt;

    private long uptimeSeconds;

    private String socketPath;

    private String storeType;

    private int totalJobs;

    private int runningJobs;

    private Map<JobStatus, Long> jobsByStatus;

    private SchedulerMetrics scheduler;

    private List<JobEvent> recentEvents;
}
