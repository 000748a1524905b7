package fr.imt.jobdaemon.jobdaemon.business.event;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import fr.imt.jobdaemon.jobdaemon.business.port.JobEventPublisherPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue of job events drained by one dispatcher thread, so that slow listeners never hold up the core.
 * A failing listener is logged and skipped.
 */
@Slf4j
@Component
public class JobEventBus implements JobEventPublisherPort {

    private static final int CAPACITY = 10_000;

    private final List<JobEventListener> listeners;
    private final BlockingQueue<JobEvent> queue = new LinkedBlockingQueue<>(CAPACITY);
    private volatile Thread dispatcher;

    public JobEventBus(List<JobEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @PostConstruct
    public synchronized void start() {
        if (dispatcher != null) {
            return;
        }
        Thread thread = new Thread(this::dispatchLoop, "job-events");
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
        log.debug("Job event bus started with {} listener(s)", listeners.size());
    }

    @PreDestroy
    public synchronized void stop() {
        Thread thread = dispatcher;
        dispatcher = null;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        drain();
    }

    @Override
    public void publish(JobEvent event) {
        if (!queue.offer(event)) {
            log.warn("Job event queue full, dropping {} for job {}", event.getType(), event.getJobId());
        }
    }

    private void dispatchLoop() {
        while (dispatcher == Thread.currentThread()) {
            try {
                deliver(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void drain() {
        JobEvent event;
        while ((event = queue.poll()) != null) {
            deliver(event);
        }
    }

    private void deliver(JobEvent event) {
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Job event listener {} failed on {}", listener.getClass().getSimpleName(), event.getType(), e);
            }
        }
    }
}
