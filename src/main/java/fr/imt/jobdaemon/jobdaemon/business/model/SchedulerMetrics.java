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
public class SchedulerMetrics {

    private String strategy;

    private int scheduledJobs;

    private long ticks;

    private long dueJobs;

    private Instant lastTickAt;

    private long lastTickMicros;

    private Instant nextDueAt;
}
