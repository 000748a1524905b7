package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import java.util.Comparator;

/**
 * A pending occurrence of a job. Earlier time wins, then lower priority value, then insertion order.
 *
 * @param cron the cron expression of the job, or null for interval occurrences and retries
 */
public record ScheduleEntry(String jobId, long nextRunAt, int priority, long sequence, String cron) {

    public static final Comparator<ScheduleEntry> ORDER = Comparator
            .comparingLong(ScheduleEntry::nextRunAt)
            .thenComparingInt(ScheduleEntry::priority)
            .thenComparingLong(ScheduleEntry::sequence);
}
