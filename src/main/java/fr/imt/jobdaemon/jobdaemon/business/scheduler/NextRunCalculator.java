package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import fr.imt.jobdaemon.jobdaemon.business.cron.CronExpression;
import fr.imt.jobdaemon.jobdaemon.business.cron.CronMatcher;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.exception.InvalidScheduleException;

import java.time.Clock;
import java.time.Instant;

/**
 * Computes the occurrences of recurring jobs.
 */
public class NextRunCalculator {

    private final Clock clock;
    private final CronMatcher cronMatcher;

    public NextRunCalculator(Clock clock) {
        this(clock, new CronMatcher());
    }

    public NextRunCalculator(Clock clock, CronMatcher cronMatcher) {
        this.clock = clock;
        this.cronMatcher = cronMatcher;
    }

    /**
     * @throws InvalidScheduleException if the schedule can never be used
     */
    public void validate(JobSchedule schedule) {
        if (schedule == null) {
            return;
        }
        boolean hasCron = schedule.getCron() != null;
        boolean hasInterval = schedule.getInterval() != null && schedule.getInterval() != 0;
        if (hasCron && hasInterval) {
            throw new InvalidScheduleException("A schedule takes either a cron expression or an interval, not both");
        }
        if (hasCron) {
            CronExpression expression = cronMatcher.compile(schedule.getCron());
            if (expression.nextAfter(clock.instant().atZone(clock.getZone())).isEmpty()) {
                throw new InvalidScheduleException("Cron expression never fires: '" + schedule.getCron() + "'");
            }
        }
        if (schedule.getInterval() != null && schedule.getInterval() < 0) {
            throw new InvalidScheduleException("Interval must be positive, got " + schedule.getInterval());
        }
    }

    /**
     * First occurrence of a freshly added or rescheduled job: one interval from now,
     * or the next matching minute.
     */
    public Instant firstRun(JobSchedule schedule, Instant now) {
        if (schedule.hasCron()) {
            return nextCron(schedule, now);
        }
        return now.plusMillis(schedule.getInterval());
    }

    /**
     * Next occurrence after a run finished. Interval jobs stay aligned on {@code anchor}:
     * the result is the first {@code anchor + k * interval} strictly after {@code now}.
     */
    public Instant nextRun(JobSchedule schedule, Instant anchor, Instant now) {
        if (schedule.hasCron()) {
            return nextCron(schedule, now);
        }
        long interval = schedule.getInterval();
        if (anchor == null) {
            return now.plusMillis(interval);
        }
        if (anchor.isAfter(now)) {
            return anchor;
        }
        long elapsed = now.toEpochMilli() - anchor.toEpochMilli();
        long periods = elapsed / interval + 1;
        return anchor.plusMillis(periods * interval);
    }

    private Instant nextCron(JobSchedule schedule, Instant now) {
        return cronMatcher.nextAfter(schedule.getCron(), now, clock.getZone())
                .orElseThrow(() -> new InvalidScheduleException(
                        "Cron expression never fires: '" + schedule.getCron() + "'"));
    }
}
