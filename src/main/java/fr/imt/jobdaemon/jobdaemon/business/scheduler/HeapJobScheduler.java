package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Keeps pending entries in an indexed min-heap and arms a single timer for the earliest one.
 * The timer never sleeps longer than {@code maxSleep} so that clock jumps are picked up.
 */
@Slf4j
public class HeapJobScheduler extends AbstractJobScheduler {

    public static final String NAME = "optimized";

    private final IndexedMinHeap<ScheduleEntry> heap =
            new IndexedMinHeap<>(ScheduleEntry::jobId, ScheduleEntry.ORDER);
    private final Duration maxSleep;
    private long armedFor = Long.MAX_VALUE;

    public HeapJobScheduler(Clock clock, Duration maxSleep) {
        super(clock);
        this.maxSleep = maxSleep;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void onStart() {
        arm();
    }

    @Override
    public synchronized void stop() {
        super.stop();
        armedFor = Long.MAX_VALUE;
    }

    @Override
    public synchronized void schedule(String jobId, Instant nextRunAt, int priority, String cron) {
        heap.offer(new ScheduleEntry(jobId, nextRunAt.toEpochMilli(), priority, nextSequence(), cron));
        if (running && nextRunAt.toEpochMilli() < armedFor) {
            arm();
        }
    }

    @Override
    public synchronized boolean unschedule(String jobId) {
        return heap.remove(jobId) != null;
    }

    @Override
    public synchronized boolean isScheduled(String jobId) {
        return heap.contains(jobId);
    }

    @Override
    public synchronized void clear() {
        heap.clear();
    }

    @Override
    public synchronized List<String> pollDue(Instant now) {
        List<String> due = new ArrayList<>();
        long nowMillis = now.toEpochMilli();
        while (!heap.isEmpty() && heap.peek().nextRunAt() <= nowMillis) {
            due.add(heap.poll().jobId());
        }
        return due;
    }

    @Override
    public synchronized Optional<Instant> nextDueAt() {
        ScheduleEntry first = heap.peek();
        return first == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(first.nextRunAt()));
    }

    @Override
    public synchronized int size() {
        return heap.size();
    }

    @Override
    protected void afterTick() {
        arm();
    }

    private void arm() {
        if (!running) {
            return;
        }
        cancelTimer();
        long now = clock.millis();
        long delay = maxSleep.toMillis();
        ScheduleEntry first = heap.peek();
        if (first != null) {
            delay = Math.max(0, Math.min(delay, first.nextRunAt() - now));
        }
        armedFor = now + delay;
        timer = executor.schedule(this::tick, delay, TimeUnit.MILLISECONDS);
    }
}
