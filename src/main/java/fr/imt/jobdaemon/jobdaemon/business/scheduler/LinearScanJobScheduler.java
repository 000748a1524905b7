package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import fr.imt.jobdaemon.jobdaemon.business.cron.CronMatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-interval scan over every pending entry.
 * <p>
 * A cron entry fires only during a minute its expression matches, and at most once per minute.
 * Interval entries and retries fire as soon as their time has passed.
 */
public class LinearScanJobScheduler extends AbstractJobScheduler {

    public static final String NAME = "legacy";

    private static final long MINUTE_MILLIS = 60_000L;

    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();
    private final Map<String, Long> lastFiredMinute = new HashMap<>();
    private final CronMatcher cronMatcher = new CronMatcher();
    private final Duration checkInterval;

    public LinearScanJobScheduler(Clock clock, Duration checkInterval) {
        super(clock);
        this.checkInterval = checkInterval;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void onStart() {
        long period = checkInterval.toMillis();
        timer = executor.scheduleWithFixedDelay(this::tick, period, period, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void schedule(String jobId, Instant nextRunAt, int priority, String cron) {
        entries.put(jobId, new ScheduleEntry(jobId, nextRunAt.toEpochMilli(), priority, nextSequence(), cron));
    }

    @Override
    public synchronized boolean unschedule(String jobId) {
        lastFiredMinute.remove(jobId);
        return entries.remove(jobId) != null;
    }

    @Override
    public synchronized boolean isScheduled(String jobId) {
        return entries.containsKey(jobId);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        lastFiredMinute.clear();
    }

    @Override
    public synchronized List<String> pollDue(Instant now) {
        long nowMillis = now.toEpochMilli();
        long minute = Math.floorDiv(nowMillis, MINUTE_MILLIS);
        List<ScheduleEntry> due = new ArrayList<>();

        Iterator<ScheduleEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            ScheduleEntry entry = iterator.next();
            if (entry.nextRunAt() > nowMillis) {
                continue;
            }
            if (entry.cron() != null) {
                Long fired = lastFiredMinute.get(entry.jobId());
                if ((fired != null && fired == minute) || !cronMatcher.matches(entry.cron(), now, clock.getZone())) {
                    continue;
                }
                lastFiredMinute.put(entry.jobId(), minute);
            }
            iterator.remove();
            due.add(entry);
        }
        due.sort(ScheduleEntry.ORDER);
        return due.stream().map(ScheduleEntry::jobId).toList();
    }

    @Override
    public synchronized Optional<Instant> nextDueAt() {
        return entries.values().stream()
                .min(ScheduleEntry.ORDER)
                .map(entry -> Instant.ofEpochMilli(entry.nextRunAt()));
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }
}
