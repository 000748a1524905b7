package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.DaemonStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionTrigger;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEventType;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatistics;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.model.ProcessResult;
import fr.imt.jobdaemon.jobdaemon.business.port.JobEventPublisherPort;
import fr.imt.jobdaemon.jobdaemon.business.port.JobSnapshotPort;
import fr.imt.jobdaemon.jobdaemon.business.port.JobStorePort;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.JobScheduler;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.NextRunCalculator;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonNotRunningException;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonStartupException;
import fr.imt.jobdaemon.jobdaemon.exception.InvalidJobSpecException;
import fr.imt.jobdaemon.jobdaemon.exception.JobDaemonException;
import fr.imt.jobdaemon.jobdaemon.exception.JobExecutionException;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.exception.JobStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Authoritative job table of the daemon.
 * <p>
 * Every read and write of the table, every scheduler call and every persistence write happens on the
 * single {@code job-core} thread. Public operations submit to it and wait, and either apply fully
 * or throw before anything was mutated. Process exits, timeouts and scheduler ticks are delivered to
 * the same thread, so none of the state below needs locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDaemonService {


    private final DaemonProperties properties;
    private final JobStorePort jobStore;
    private final JobSnapshotPort jobSnapshot;
    private final JobScheduler scheduler;
    private final NextRunCalculator nextRunCalculator;
    private final JobSpecValidator validator;
    private final ProcessExecutor processExecutor;
    private final RetryBackoff retryBackoff;
    private final JobEventPublisherPort eventPublisher;
    private final Clock clock;

    // core thread only
    private final Map<String, JobSpec> jobs = new LinkedHashMap<>();
    private final Map<String, RunningJob> running = new HashMap<>();
    private ScheduledFuture<?> housekeeping;

    private volatile ScheduledExecutorService core;
    private volatile Thread coreThread;
    private volatile Instant startedAt;

    // ===== Lifecycle =====

    /**
     * Loads the persisted jobs, then starts the scheduler and the housekeeping timer.
     */
    public synchronized void start() {
        if (core != null) {
            throw new IllegalStateException("Job daemon core already started");
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("job-core-") {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = super.newThread(runnable);
                coreThread = thread;
                return thread;
            }
        };
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        core = executor;
        startedAt = clock.instant();

        try {
            onCore(() -> {
                recover();
                scheduler.start(executor, this::onDue);
                long period = properties.getScheduler().getCheckInterval().toMillis();
                housekeeping = executor.scheduleWithFixedDelay(this::housekeep, period, period, TimeUnit.MILLISECONDS);
                return null;
            });
        } catch (RuntimeException e) {
            core = null;
            coreThread = null;
            executor.shutdownNow();
            throw new DaemonStartupException("Failed to start job daemon core: " + e.getMessage(), e);
        }
        publish(JobEvent.builder().type(JobEventType.DAEMON_STARTED).timestamp(startedAt)
                .message(jobCount() + " job(s) loaded").build());
    }

    /**
     * Stops the scheduler, terminates running jobs (SIGTERM, then SIGKILL after the grace period),
     * and persists the job table.
     */
    public synchronized void stop() {
        ScheduledExecutorService executor = core;
        if (executor == null) {
            return;
        }
        log.info("Stopping job daemon core");

        List<CompletableFuture<Void>> exits = onCore(() -> {
            scheduler.stop();
            if (housekeeping != null) {
                housekeeping.cancel(false);
            }
            List<CompletableFuture<Void>> settled = new ArrayList<>();
            for (RunningJob handle : running.values()) {
                handle.setStopRequested(true);
                terminate(handle, "TERM");
                settled.add(handle.getSettled());
            }
            return settled;
        });
        if (!exits.isEmpty()) {
            log.info("Waiting for {} running job(s) to exit", exits.size());
            await(CompletableFuture.allOf(exits.toArray(new CompletableFuture[0])), shutdownWait());
        }

        onCore(() -> {
            for (RunningJob handle : running.values()) {
                log.warn("Job {} did not exit in time, killing it", handle.getExecution().getJobId());
                processExecutor.kill(handle.getProcess().process());
            }
            persist();
            try {
                jobStore.cleanup();
            } catch (RuntimeException e) {
                log.error("Job store cleanup failed during shutdown", e);
            }
            return null;
        });
        publish(JobEvent.builder().type(JobEventType.DAEMON_STOPPED).timestamp(clock.instant()).build());

        core = null;
        coreThread = null;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Core thread did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Job daemon core stopped");
    }

    public boolean isRunning() {
        return core != null;
    }

    // ===== Operations =====

    public JobSpec addJob(JobSpec request) {
        return onCore(() -> {
            Instant now = clock.instant();
            JobSpec job = validator.prepareNewJob(request, now);
            if (jobs.containsKey(job.getId())) {
                throw new InvalidJobSpecException("Job already exists: " + job.getId());
            }
            if (job.isRecurring() && job.isActive()) {
                Instant first = nextRunCalculator.firstRun(job.getSchedule(), now);
                job.setScheduleAnchor(first);
                job.setNextRunAt(first);
                job.setStatus(JobStatus.SCHEDULED);
            } else {
                job.setStatus(JobStatus.IDLE);
            }

            jobStore.save(job);
            jobs.put(job.getId(), job);
            if (job.getStatus() == JobStatus.SCHEDULED) {
                enqueue(job);
            }
            persist();
            log.info("Added job {} ({}), status {}", job.getId(), job.getName(), job.getStatus());
            publish(event(JobEventType.JOB_ADDED, job, null));
            return copy(job);
        });
    }

    /**
     * Runs an idle job now.
     */
    public JobSpec startJob(String jobId) {
        return onCore(() -> {
            JobSpec job = require(jobId);
            if (running.containsKey(jobId)) {
                throw JobStateException.alreadyRunning(jobId);
            }
            if (job.getStatus() == JobStatus.SCHEDULED || job.getStatus() == JobStatus.RETRYING) {
                throw JobStateException.notIdle(jobId, job.getStatus());
            }
            if (!job.isActive()) {
                throw JobStateException.disabled(jobId);
            }
            beginCycle(job, ExecutionTrigger.START);
            return copy(job);
        });
    }

    /**
     * Runs a job now whatever its schedule, dropping any pending occurrence or retry.
     */
    public JobSpec triggerJob(String jobId) {
        return onCore(() -> {
            JobSpec job = require(jobId);
            if (running.containsKey(jobId)) {
                throw JobStateException.alreadyRunning(jobId);
            }
            scheduler.unschedule(jobId);
            beginCycle(job, ExecutionTrigger.TRIGGER);
            return copy(job);
        });
    }

    /**
     * Signals a running job and waits (at most grace period + 1s) for its exit to be recorded.
     */
    public JobSpec stopJob(String jobId, String signal) {
        String name = ProcessExecutor.normalizeSignal(signal);
        CompletableFuture<Void> settled = onCore(() -> {
            require(jobId);
            RunningJob handle = running.get(jobId);
            if (handle == null) {
                throw JobStateException.notRunning(jobId);
            }
            handle.setStopRequested(true);
            log.info("Stopping job {} (pid {}) with SIG{}", jobId, handle.getProcess().pid(), name);
            terminate(handle, name);
            return handle.getSettled();
        });
        await(settled, shutdownWait());
        return getJob(jobId);
    }

    public boolean removeJob(String jobId, boolean force) {
        return onCore(() -> {
            JobSpec job = require(jobId);
            RunningJob handle = running.get(jobId);
            if (handle != null && !force) {
                throw new JobStateException(ErrorCodes.JOB_ALREADY_RUNNING,
                        "Job " + jobId + " is running, use force to remove it");
            }
            jobStore.delete(jobId);
            if (handle != null) {
                handle.setStopRequested(true);
                processExecutor.kill(handle.getProcess().process());
            }
            scheduler.unschedule(jobId);
            jobs.remove(jobId);
            persist();
            log.info("Removed job {}{}", jobId, handle != null ? " (killed running process)" : "");
            publish(event(JobEventType.JOB_REMOVED, job, null));
            return true;
        });
    }

    public JobSpec updateJob(String jobId, JobUpdate update) {
        if (update == null) {
            throw new IllegalArgumentException("update is required");
        }
        return onCore(() -> {
            JobSpec job = require(jobId);
            JobSpec candidate = copy(job);
            update.applyTo(candidate);
            validator.validate(candidate);

            jobStore.update(jobId, update);
            boolean wasActive = job.isActive();
            boolean scheduleChanged = !Objects.equals(job.getSchedule(), candidate.getSchedule());
            update.applyTo(job);
            job.setUpdatedAt(clock.instant());

            if (!running.containsKey(jobId)) {
                if (scheduleChanged || wasActive != job.isActive()) {
                    reschedule(job);
                } else if (update.getPriority() != null && scheduler.isScheduled(jobId)) {
                    enqueue(job);
                }
            }
            saveJob(job);
            persist();
            publish(event(JobEventType.JOB_UPDATED, job, null));
            return copy(job);
        });
    }

    public JobSpec enableJob(String jobId) {
        return updateJob(jobId, JobUpdate.builder().enabled(true).build());
    }

    public JobSpec disableJob(String jobId) {
        return updateJob(jobId, JobUpdate.builder().enabled(false).build());
    }

    public List<JobSpec> listJobs(JobFilter filter) {
        JobFilter effective = filter != null ? filter : JobFilter.all();
        return onCore(() -> jobs.values().stream()
                .filter(effective::matches)
                .limit(effective.effectiveLimit())
                .map(this::copy)
                .toList());
    }

    public JobSpec getJob(String jobId) {
        return onCore(() -> copy(require(jobId)));
    }

    /**
     * Most recent executions first.
     */
    public List<JobExecution> getJobHistory(String jobId, Integer limit) {
        getJob(jobId);
        int effective = limit != null && limit > 0 ? limit : properties.getExecution().getMaxHistory();
        return jobStore.getExecutions(jobId, effective);
    }

    public JobStatistics getJobStatistics(String jobId) {
        JobSpec job = getJob(jobId);
        List<JobExecution> history = jobStore.getExecutions(jobId, properties.getExecution().getMaxHistory());
        return JobStatisticsCalculator.compute(job, history);
    }

    public DaemonStatus status() {
        if (core == null) {
            return DaemonStatus.builder().running(false).build();
        }
        return onCore(() -> {
            Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
            jobs.values().forEach(job -> byStatus.merge(job.getStatus(), 1L, Long::sum));
            Instant now = clock.instant();
            return DaemonStatus.builder()
                    .running(true)
                    .startedAt(startedAt)
                    .uptimeSeconds(Duration.between(startedAt, now).toSeconds())
                    .storeType(jobStore.type())
                    .totalJobs(jobs.size())
                    .runningJobs(running.size())
                    .jobsByStatus(byStatus)
                    .scheduler(scheduler.metrics())
                    .build();
        });
    }

    // ===== Execution =====

    private void onDue(List<String> jobIds) {
        for (String jobId : jobIds) {
            try {
                fire(jobId);
            } catch (RuntimeException e) {
                log.error("Failed to run due job {}", jobId, e);
            }
        }
    }

    private void fire(String jobId) {
        JobSpec job = jobs.get(jobId);
        if (job == null) {
            log.debug("Ignoring due entry of removed job {}", jobId);
            return;
        }
        if (running.containsKey(jobId)) {
            log.warn("Job {} is still running, skipping this occurrence", jobId);
            return;
        }
        if (!job.isActive()) {
            return;
        }
        if (job.getStatus() == JobStatus.RETRYING) {
            launch(job, ExecutionTrigger.RETRY);
        } else {
            beginCycle(job, ExecutionTrigger.SCHEDULE);
        }
    }

    private void beginCycle(JobSpec job, ExecutionTrigger trigger) {
        job.setCurrentAttempt(0);
        launch(job, trigger);
    }

    private void launch(JobSpec job, ExecutionTrigger trigger) {
        Instant now = clock.instant();
        JobExecution execution = JobExecution.builder()
                .executionId(Constants.EXECUTION_ID_PREFIX + UUID.randomUUID())
                .jobId(job.getId())
                .jobName(job.getName())
                .command(job.getCommand())
                .attempt(job.getCurrentAttempt())
                .trigger(trigger)
                .status(ExecutionStatus.RUNNING)
                .startedAt(now)
                .build();
        job.setLastRunAt(now);
        job.setRunCount(job.getRunCount() + 1);
        job.setNextRunAt(null);

        RunningProcess process;
        try {
            process = processExecutor.start(job);
        } catch (JobExecutionException e) {
            log.warn("Could not spawn job {}: {}", job.getId(), e.getMessage());
            execution.setError(e.getMessage());
            finish(job, execution, ExecutionStatus.FAILED, -1, null);
            return;
        }

        String jobId = job.getId();
        String executionId = execution.getExecutionId();
        execution.setPid(process.pid());
        RunningJob handle = new RunningJob(execution, process);
        running.put(jobId, handle);
        job.setStatus(JobStatus.RUNNING);
        job.setPid(process.pid());

        long timeout = job.getTimeout() != null ? job.getTimeout() : 0;
        if (timeout > 0) {
            handle.setTimeoutTask(core.schedule(() -> onTimeout(jobId, executionId), timeout, TimeUnit.MILLISECONDS));
        }
        process.completion().whenCompleteAsync((result, error) -> onExit(jobId, executionId, result, error), core);

        log.info("Started job {} (attempt {}, {}) as pid {}", jobId, execution.getAttempt(), trigger, process.pid());
        saveJob(job);
        persist();
        publish(event(JobEventType.JOB_STARTED, job, execution));
    }

    private void onTimeout(String jobId, String executionId) {
        RunningJob handle = running.get(jobId);
        if (handle == null || !handle.matches(executionId)) {
            return;
        }
        log.warn("Job {} exceeded its timeout, terminating pid {}", jobId, handle.getProcess().pid());
        handle.setTimedOut(true);
        terminate(handle, "TERM");
    }

    private void terminate(RunningJob handle, String signal) {
        Process process = handle.getProcess().process();
        try {
            processExecutor.signal(process, signal);
        } catch (JobExecutionException e) {
            log.warn("{}, killing pid {} instead", e.getMessage(), process.pid());
            processExecutor.kill(process);
            return;
        }
        if (!"KILL".equals(signal) && handle.getForceKillTask() == null) {
            long grace = properties.getExecution().getGracePeriod().toMillis();
            handle.setForceKillTask(core.schedule(() -> {
                if (process.isAlive()) {
                    log.warn("Pid {} still alive after the grace period, sending SIGKILL", process.pid());
                    processExecutor.kill(process);
                }
            }, grace, TimeUnit.MILLISECONDS));
        }
    }

    private void onExit(String jobId, String executionId, ProcessResult result, Throwable error) {
        RunningJob handle = running.get(jobId);
        if (handle == null || !handle.matches(executionId)) {
            return;
        }
        try {
            running.remove(jobId);
            handle.cancelTimers();
            JobExecution execution = handle.getExecution();

            ExecutionStatus status;
            int exitCode;
            if (error != null) {
                status = ExecutionStatus.FAILED;
                exitCode = -1;
                execution.setError("Lost track of the process: " + error.getMessage());
            } else {
                exitCode = result.exitCode();
                if (handle.isStopRequested()) {
                    status = ExecutionStatus.STOPPED;
                } else if (handle.isTimedOut()) {
                    status = ExecutionStatus.TIMEOUT;
                } else {
                    status = result.isSuccess() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
                }
            }

            JobSpec job = jobs.get(jobId);
            if (job == null) {
                log.info("Job {} was removed while running, discarding execution {}", jobId, executionId);
                return;
            }
            if (status == ExecutionStatus.TIMEOUT) {
                execution.setError("Timed out after " + job.getTimeout() + " ms");
            }
            finish(job, execution, status, exitCode, result);
        } catch (RuntimeException e) {
            log.error("Failed to record exit of job {}", jobId, e);
        } finally {
            handle.getSettled().complete(null);
        }
    }

    /**
     * Records a finished execution and applies the resulting transition: retry, reschedule or terminal status.
     */
    private void finish(JobSpec job, JobExecution execution, ExecutionStatus status, int exitCode, ProcessResult result) {
        Instant now = clock.instant();
        execution.setStatus(status);
        execution.setExitCode(exitCode);
        execution.setCompletedAt(now);
        execution.setDuration(Duration.between(execution.getStartedAt(), now).toMillis());
        if (result != null) {
            execution.setStdout(result.stdout());
            execution.setStderr(result.stderr());
        }
        try {
            jobStore.saveExecution(execution);
        } catch (RuntimeException e) {
            log.error("Failed to store execution {} of job {}", execution.getExecutionId(), job.getId(), e);
        }
        job.setLastExecution(execution.toSummary());
        job.setPid(null);

        switch (status) {
            case COMPLETED -> {
                settle(job, JobStatus.COMPLETED, now);
                publish(event(JobEventType.JOB_COMPLETED, job, execution));
            }
            case STOPPED -> {
                settle(job, JobStatus.STOPPED, now);
                publish(event(JobEventType.JOB_STOPPED, job, execution));
            }
            default -> {
                job.setFailureCount(job.getFailureCount() + 1);
                int maxRetries = job.getMaxRetries() != null ? job.getMaxRetries() : 0;
                if (job.getCurrentAttempt() < maxRetries) {
                    Duration delay = retryBackoff.delayFor(job.getCurrentAttempt());
                    job.setCurrentAttempt(job.getCurrentAttempt() + 1);
                    job.setStatus(JobStatus.RETRYING);
                    job.setNextRunAt(now.plus(delay));
                    enqueue(job);
                    log.info("Job {} failed with exit code {}, retry {}/{} in {} ms",
                            job.getId(), exitCode, job.getCurrentAttempt(), maxRetries, delay.toMillis());
                } else {
                    settle(job, JobStatus.FAILED, now);
                    log.info("Job {} failed with exit code {}", job.getId(), exitCode);
                }
                JobEventType type = status == ExecutionStatus.TIMEOUT ? JobEventType.JOB_TIMED_OUT : JobEventType.JOB_FAILED;
                publish(event(type, job, execution));
                if (job.getStatus() == JobStatus.RETRYING) {
                    publish(event(JobEventType.JOB_RETRYING, job, execution));
                }
            }
        }
        saveJob(job);
        persist();
    }

    /**
     * End of a run cycle: recurring jobs go back to the scheduler, one-shot jobs keep the outcome.
     */
    private void settle(JobSpec job, JobStatus outcome, Instant now) {
        if (job.isRecurring() && job.isActive()) {
            Instant next = nextRunCalculator.nextRun(job.getSchedule(), job.getScheduleAnchor(), now);
            job.setScheduleAnchor(next);
            job.setNextRunAt(next);
            job.setStatus(JobStatus.SCHEDULED);
            enqueue(job);
        } else {
            job.setStatus(outcome);
            job.setNextRunAt(null);
        }
    }

    private void reschedule(JobSpec job) {
        scheduler.unschedule(job.getId());
        if (job.isRecurring() && job.isActive()) {
            Instant first = nextRunCalculator.firstRun(job.getSchedule(), clock.instant());
            job.setScheduleAnchor(first);
            job.setNextRunAt(first);
            job.setStatus(JobStatus.SCHEDULED);
            enqueue(job);
        } else {
            job.setNextRunAt(null);
            job.setScheduleAnchor(null);
            if (job.getStatus() == JobStatus.SCHEDULED || job.getStatus() == JobStatus.RETRYING) {
                job.setStatus(JobStatus.IDLE);
            }
        }
    }

    private void enqueue(JobSpec job) {
        String cron = job.getStatus() != JobStatus.RETRYING && job.getSchedule() != null && job.getSchedule().hasCron()
                ? job.getSchedule().getCron()
                : null;
        scheduler.schedule(job.getId(), job.getNextRunAt(), job.effectivePriority(), cron);
    }

    // ===== Recovery & housekeeping =====

    private void recover() {
        jobs.clear();
        running.clear();
        scheduler.clear();

        List<JobSpec> loaded = jobSnapshot.load()
                .orElseGet(() -> jobStore.list(JobFilter.builder().limit(Integer.MAX_VALUE).build()));
        Instant now = clock.instant();
        int scheduled = 0;
        for (JobSpec job : loaded) {
            if (job == null) {
                continue;
            }
            if (job.getId() == null || job.getCommand() == null) {
                log.warn("Skipping persisted job without id or command: {}", job);
                continue;
            }
            try {
                recoverJob(job, now);
            } catch (RuntimeException e) {
                log.error("Could not reschedule recovered job {}, leaving it idle", job.getId(), e);
                job.setStatus(JobStatus.IDLE);
                job.setNextRunAt(null);
            }
            jobs.put(job.getId(), job);
            saveJob(job);
            if (job.getStatus() == JobStatus.SCHEDULED || job.getStatus() == JobStatus.RETRYING) {
                enqueue(job);
                scheduled++;
            }
        }
        log.info("Recovered {} job(s), {} scheduled", jobs.size(), scheduled);
        persist();
    }

    private void recoverJob(JobSpec job, Instant now) {
        JobStatus status = job.getStatus() != null ? job.getStatus() : JobStatus.IDLE;
        job.setPid(null);

        if (!job.isActive()) {
            job.setStatus(status == JobStatus.RUNNING ? JobStatus.STOPPED
                    : status == JobStatus.SCHEDULED || status == JobStatus.RETRYING ? JobStatus.IDLE : status);
            job.setNextRunAt(null);
            return;
        }
        if (status == JobStatus.RETRYING && job.getNextRunAt() != null) {
            job.setStatus(JobStatus.RETRYING);
            return;
        }
        if (job.isRecurring()) {
            Instant next;
            if (job.getSchedule().hasCron()) {
                next = nextRunCalculator.nextRun(job.getSchedule(), null, now);
            } else if (job.getScheduleAnchor() != null) {
                next = job.getScheduleAnchor();
            } else if (job.getNextRunAt() != null) {
                next = job.getNextRunAt();
            } else {
                next = nextRunCalculator.firstRun(job.getSchedule(), now);
            }
            job.setScheduleAnchor(next);
            job.setNextRunAt(next);
            job.setStatus(JobStatus.SCHEDULED);
            return;
        }
        switch (status) {
            case RUNNING -> job.setStatus(JobStatus.STOPPED);
            case RETRYING -> job.setStatus(JobStatus.FAILED);
            case SCHEDULED -> job.setStatus(JobStatus.IDLE);
            default -> job.setStatus(status);
        }
        job.setNextRunAt(null);
    }

    private void housekeep() {
        try {
            Instant cutoff = clock.instant().minus(properties.getCleanup().getRetention());
            List<String> expired = jobs.values().stream()
                    .filter(job -> !job.isRecurring())
                    .filter(job -> job.getStatus() != null && job.getStatus().isTerminal())
                    .filter(job -> !running.containsKey(job.getId()))
                    .filter(job -> {
                        Instant finishedAt = job.getLastExecution() != null && job.getLastExecution().getCompletedAt() != null
                                ? job.getLastExecution().getCompletedAt()
                                : job.getUpdatedAt();
                        return finishedAt != null && finishedAt.isBefore(cutoff);
                    })
                    .map(JobSpec::getId)
                    .toList();
            for (String jobId : expired) {
                jobStore.delete(jobId);
                jobs.remove(jobId);
                log.info("Purged finished job {} (older than {})", jobId, properties.getCleanup().getRetention());
            }
            if (!expired.isEmpty()) {
                persist();
            }
            jobStore.cleanup();
        } catch (RuntimeException e) {
            log.error("Housekeeping failed", e);
        }
    }

    // ===== Helpers =====

    private JobSpec require(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        JobSpec job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private JobSpec copy(JobSpec job) {
        return job.toBuilder().build();
    }

    private int jobCount() {
        return onCore(jobs::size);
    }

    private void saveJob(JobSpec job) {
        try {
            jobStore.save(job);
        } catch (RuntimeException e) {
            log.error("Failed to store job {}", job.getId(), e);
        }
    }

    private void persist() {
        try {
            jobSnapshot.save(new ArrayList<>(jobs.values()));
        } catch (RuntimeException e) {
            log.error("Failed to write the job snapshot", e);
        }
    }

    private void publish(JobEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("Dropped job event {}: {}", event.getType(), e.getMessage());
        }
    }

    private JobEvent event(JobEventType type, JobSpec job, JobExecution execution) {
        return JobEvent.builder()
                .type(type)
                .jobId(job.getId())
                .jobName(job.getName())
                .status(job.getStatus())
                .executionId(execution != null ? execution.getExecutionId() : null)
                .exitCode(execution != null ? execution.getExitCode() : null)
                .timestamp(clock.instant())
                .message(execution != null ? execution.getError() : null)
                .build();
    }

    private Duration shutdownWait() {
        return properties.getExecution().getGracePeriod().plusSeconds(1);
    }

    private static void await(CompletableFuture<?> future, Duration timeout) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Gave up waiting for job exit after {} ms", timeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Job exit completed abnormally: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobDaemonException(ErrorCodes.INTERNAL_ERROR, "Interrupted while waiting for a job to exit", e);
        }
    }

    /**
     * Runs {@code action} on the core thread and waits for its result. Runs inline when already on it.
     */
    private <T> T onCore(Callable<T> action) {
        ScheduledExecutorService executor = core;
        if (executor == null) {
            throw new JobDaemonException(ErrorCodes.DAEMON_NOT_RUNNING, "Job daemon is not running");
        }
        if (Thread.currentThread() == coreThread) {
            return call(action);
        }
        Future<T> future;
        try {
            future = executor.submit(action);
        } catch (RejectedExecutionException e) {
            throw new JobDaemonException(ErrorCodes.DAEMON_NOT_RUNNING, "Job daemon is shutting down", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobDaemonException(ErrorCodes.INTERNAL_ERROR, "Interrupted while waiting for the job daemon", e);
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    private static <T> T call(Callable<T> action) {
        try {
            return action.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new JobDaemonException(ErrorCodes.INTERNAL_ERROR, e.getMessage(), e);
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new JobDaemonException(ErrorCodes.INTERNAL_ERROR, cause.getMessage(), cause);
    }
}
