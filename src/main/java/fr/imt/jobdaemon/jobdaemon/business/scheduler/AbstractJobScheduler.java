package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import fr.imt.jobdaemon.jobdaemon.business.model.SchedulerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

/**
 * Timer bookkeeping and metrics shared by the scheduling strategies.
 */
@Slf4j
public abstract class AbstractJobScheduler implements JobScheduler {

    protected final Clock clock;

    protected ScheduledExecutorService executor;
    protected ScheduledFuture<?> timer;
    protected boolean running;

    private DueJobHandler handler;
    private long sequence;
    private long ticks;
    private long dueJobs;
    private Instant lastTickAt;
    private long lastTickMicros;

    protected AbstractJobScheduler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void start(ScheduledExecutorService executor, DueJobHandler handler) {
        if (running) {
            throw new IllegalStateException("Scheduler already started");
        }
        this.executor = executor;
        this.handler = handler;
        this.running = true;
        log.info("Starting {} scheduler with {} pending job(s)", name(), size());
        onStart();
    }

    @Override
    public synchronized void stop() {
        running = false;
        cancelTimer();
        log.info("Stopped {} scheduler", name());
    }

    protected abstract void onStart();

    protected long nextSequence() {
        return sequence++;
    }

    protected void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    /**
     * Polls the due entries and hands them to the handler. A failing handler never breaks the timer.
     */
    protected synchronized void tick() {
        if (!running) {
            return;
        }
        long started = System.nanoTime();
        Instant now = clock.instant();
        List<String> due = pollDue(now);
        ticks++;
        dueJobs += due.size();
        lastTickAt = now;
        lastTickMicros = (System.nanoTime() - started) / 1_000;

        if (!due.isEmpty()) {
            log.debug("{} job(s) due at {}: {}", due.size(), now, due);
            try {
                handler.onDue(due);
            } catch (RuntimeException e) {
                log.error("Due job handler failed for {}", due, e);
            }
        }
        afterTick();
    }

    protected void afterTick() {
    }

    @Override
    public synchronized SchedulerMetrics metrics() {
        return SchedulerMetrics.builder()
                .strategy(name())
                .scheduledJobs(size())
                .ticks(ticks)
                .dueJobs(dueJobs)
                .lastTickAt(lastTickAt)
                .lastTickMicros(lastTickMicros)
                .nextDueAt(nextDueAt().orElse(null))
                .build();
    }
}
