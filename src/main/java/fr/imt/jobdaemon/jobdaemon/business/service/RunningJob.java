package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Core-thread bookkeeping for one execution in flight.
 */
@Getter
@Setter
@RequiredArgsConstructor
class RunningJob {

    private final JobExecution execution;
    private final RunningProcess process;

    /**
     * Completes once the exit of this execution has been recorded.
     */
    private final CompletableFuture<Void> settled = new CompletableFuture<>();

    private ScheduledFuture<?> timeoutTask;
    private ScheduledFuture<?> forceKillTask;
    private boolean stopRequested;
    private boolean timedOut;

    boolean matches(String executionId) {
        return execution.getExecutionId().equals(executionId);
    }

    void cancelTimers() {
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }
        if (forceKillTask != null) {
            forceKillTask.cancel(false);
        }
    }
}
