package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import fr.imt.jobdaemon.jobdaemon.business.model.SchedulerMetrics;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Decides when jobs are due. Holds at most one pending entry per job and never runs jobs itself:
 * due entries are removed and handed to the {@link DueJobHandler}.
 * <p>
 * All methods are expected to be called from the thread of the executor passed to {@link #start}.
 */
public interface JobScheduler {

    String name();

    void start(ScheduledExecutorService executor, DueJobHandler handler);

    void stop();

    /**
     * Adds or replaces the pending entry of a job.
     *
     * @param cron the job's cron expression, or null for interval occurrences and retries
     */
    void schedule(String jobId, Instant nextRunAt, int priority, String cron);

    boolean unschedule(String jobId);

    boolean isScheduled(String jobId);

    /**
     * Drops every pending entry.
     */
    void clear();

    /**
     * Removes and returns the ids of all entries due at {@code now}.
     */
    List<String> pollDue(Instant now);

    Optional<Instant> nextDueAt();

    int size();

    SchedulerMetrics metrics();
}
