package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.DaemonStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionTrigger;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEventType;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatistics;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.port.JobEventPublisherPort;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.HeapJobScheduler;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.NextRunCalculator;
import fr.imt.jobdaemon.jobdaemon.business.utils.JsonMappers;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.InvalidJobSpecException;
import fr.imt.jobdaemon.jobdaemon.exception.InvalidScheduleException;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.exception.JobStateException;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.InMemoryJobStore;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JsonJobSnapshotFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Runs the core against real {@code /bin/sh} children.
 */
@ExtendWith(MockitoExtension.class)
class JobDaemonServiceTest {

    private static final Duration WAIT = Duration.ofSeconds(15);

    @TempDir
    Path runtimeDir;

    @Mock
    private JobEventPublisherPort eventPublisher;

    private DaemonProperties properties;
    private InMemoryJobStore jobStore;
    private final List<JobDaemonService> started = new ArrayList<>();
    private final List<ProcessExecutor> executors = new ArrayList<>();

    private JobDaemonService service;

    @BeforeEach
    void setUp() {
        properties = new DaemonProperties();
        properties.getExecution().setGracePeriod(Duration.ofMillis(500));
        properties.getScheduler().setCheckInterval(Duration.ofSeconds(1));
        properties.getScheduler().setMaxSleep(Duration.ofSeconds(1));
        jobStore = new InMemoryJobStore(100);
        service = newService(jobStore);
        service.start();
    }

    @AfterEach
    void tearDown() {
        started.forEach(JobDaemonService::stop);
        executors.forEach(ProcessExecutor::shutdown);
    }

    private JobDaemonService newService(InMemoryJobStore store) {
        Clock clock = Clock.systemUTC();
        NextRunCalculator calculator = new NextRunCalculator(clock);
        ProcessExecutor executor = new ProcessExecutor("/bin/sh", 64 * 1024);
        executors.add(executor);
        JobDaemonService created = new JobDaemonService(
                properties,
                store,
                new JsonJobSnapshotFile(runtimeDir.resolve("jobs.json"), JsonMappers.create()),
                new HeapJobScheduler(clock, properties.getScheduler().getMaxSleep()),
                calculator,
                new JobSpecValidator(calculator),
                executor,
                new RetryBackoff(Duration.ofMillis(50), 2.0, Duration.ofMillis(200)),
                eventPublisher,
                clock);
        started.add(created);
        return created;
    }

    private static JobSpec oneShot(String command) {
        return JobSpec.builder().name("test").command(command).build();
    }

    private static void waitUntil(Supplier<Boolean> condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.get()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + WAIT);
            }
            Thread.sleep(20);
        }
    }

    private JobStatus statusOf(String jobId) {
        return service.getJob(jobId).getStatus();
    }

    @Test
    void addJobFillsDefaults() {
        JobSpec job = service.addJob(oneShot("echo hi").toBuilder().name(null).build());

        assertTrue(job.getId().startsWith("job_"));
        assertEquals("echo hi", job.getName());
        assertEquals(JobStatus.IDLE, job.getStatus());
        assertEquals(5, job.getPriority());
        assertEquals(0, job.getMaxRetries());
        assertTrue(job.getEnabled());
        assertNull(job.getNextRunAt());
        verify(eventPublisher).publish(argThat(event -> event.getType() == JobEventType.JOB_ADDED));
    }

    @Test
    void addJobRejectsInvalidDefinitions() {
        assertThrows(InvalidJobSpecException.class, () -> service.addJob(oneShot(" ")));
        assertThrows(InvalidJobSpecException.class,
                () -> service.addJob(oneShot("true").toBuilder().maxRetries(-1).build()));
        assertThrows(InvalidScheduleException.class,
                () -> service.addJob(oneShot("true").toBuilder().schedule(JobSchedule.cron("61 * * * *")).build()));

        service.addJob(oneShot("true").toBuilder().id("fixed").build());
        assertThrows(InvalidJobSpecException.class, () -> service.addJob(oneShot("true").toBuilder().id("fixed").build()));
        assertEquals(1, service.listJobs(JobFilter.all()).size());
    }

    @Test
    void intervalJobRunsAndAdvancesFromItsPreviousSlot() throws Exception {
        JobSpec job = service.addJob(oneShot("echo hi").toBuilder()
                .schedule(JobSchedule.every(Duration.ofMillis(1000)))
                .build());
        assertEquals(JobStatus.SCHEDULED, job.getStatus());
        Instant firstSlot = job.getNextRunAt();

        waitUntil(() -> service.getJob(job.getId()).getLastExecution() != null);
        JobSpec afterRun = service.getJob(job.getId());

        assertEquals(ExecutionStatus.COMPLETED, afterRun.getLastExecution().getStatus());
        assertEquals(0, afterRun.getLastExecution().getExitCode());
        assertEquals(JobStatus.SCHEDULED, afterRun.getStatus());
        assertEquals(firstSlot.plusMillis(1000), afterRun.getNextRunAt());

        JobExecution execution = service.getJobHistory(job.getId(), 1).get(0);
        assertEquals("hi\n", execution.getStdout());
        assertEquals(ExecutionTrigger.SCHEDULE, execution.getTrigger());
    }

    @Test
    void failingJobIsRetriedExactlyMaxRetriesTimes() throws Exception {
        JobSpec job = service.addJob(oneShot("exit 1").toBuilder().maxRetries(2).build());

        service.triggerJob(job.getId());
        waitUntil(() -> statusOf(job.getId()) == JobStatus.FAILED);

        List<JobExecution> history = service.getJobHistory(job.getId(), null);
        assertEquals(3, history.size());
        assertTrue(history.stream().allMatch(execution -> execution.getStatus() == ExecutionStatus.FAILED));
        assertEquals(List.of(2, 1, 0), history.stream().map(JobExecution::getAttempt).toList());
        assertEquals(ExecutionTrigger.RETRY, history.get(0).getTrigger());
        assertEquals(ExecutionTrigger.TRIGGER, history.get(2).getTrigger());
        assertEquals(3, service.getJob(job.getId()).getFailureCount());

        JobStatistics statistics = service.getJobStatistics(job.getId());
        assertEquals(3, statistics.getTotalExecutions());
        assertEquals(0.0, statistics.getSuccessRate());
    }

    @Test
    void stopJobRecordsAStoppedExecutionAndIsNeverRetried() throws Exception {
        JobSpec job = service.addJob(oneShot("sleep 30").toBuilder().maxRetries(3).build());
        service.startJob(job.getId());
        assertEquals(JobStatus.RUNNING, statusOf(job.getId()));
        assertNotNull(service.getJob(job.getId()).getPid());

        JobSpec stopped = service.stopJob(job.getId(), null);

        assertEquals(JobStatus.STOPPED, stopped.getStatus());
        assertEquals(ExecutionStatus.STOPPED, stopped.getLastExecution().getStatus());
        assertNull(stopped.getPid());
        assertEquals(1, service.getJobHistory(job.getId(), null).size());
        assertThrows(JobStateException.class, () -> service.stopJob(job.getId(), "SIGTERM"));
    }

    @Test
    void onlyOneExecutionPerJobAtATime() {
        JobSpec job = service.addJob(oneShot("sleep 30"));
        service.startJob(job.getId());

        JobStateException triggered = assertThrows(JobStateException.class, () -> service.triggerJob(job.getId()));
        assertEquals(ErrorCodes.JOB_ALREADY_RUNNING, triggered.getErrorCode());
        assertThrows(JobStateException.class, () -> service.startJob(job.getId()));

        service.stopJob(job.getId(), "KILL");
    }

    @Test
    void timeoutKillsTheChildAndCountsAsAFailure() throws Exception {
        JobSpec job = service.addJob(oneShot("sleep 30").toBuilder().timeout(300L).build());
        service.startJob(job.getId());

        waitUntil(() -> statusOf(job.getId()) == JobStatus.FAILED);

        JobExecution execution = service.getJobHistory(job.getId(), 1).get(0);
        assertEquals(ExecutionStatus.TIMEOUT, execution.getStatus());
        assertEquals("Timed out after 300 ms", execution.getError());
        verify(eventPublisher, atLeastOnce()).publish(argThat(event -> event.getType() == JobEventType.JOB_TIMED_OUT));
    }

    @Test
    void jobLeavingABackgroundProcessStillFinishes() throws Exception {
        JobSpec job = service.addJob(oneShot("sleep 20 & echo started").toBuilder().timeout(500L).build());
        service.triggerJob(job.getId());
        long begin = System.nanoTime();

        waitUntil(() -> statusOf(job.getId()) != JobStatus.RUNNING);

        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - begin) < 5);
        JobExecution execution = service.getJobHistory(job.getId(), 1).get(0);
        assertEquals("started\n", execution.getStdout());
    }

    @Test
    void spawnFailureIsRecordedAsAFailedExecution() throws Exception {
        JobSpec job = service.addJob(oneShot("true").toBuilder()
                .workingDirectory(runtimeDir.resolve("missing").toString())
                .build());

        JobSpec afterStart = service.startJob(job.getId());

        assertEquals(JobStatus.FAILED, afterStart.getStatus());
        assertEquals(-1, afterStart.getLastExecution().getExitCode());
        assertTrue(service.getJobHistory(job.getId(), 1).get(0).getError().contains("Working directory does not exist"));
    }

    @Test
    void removeRefusesARunningJobUnlessForced() {
        JobSpec job = service.addJob(oneShot("sleep 30"));
        service.startJob(job.getId());

        assertThrows(JobStateException.class, () -> service.removeJob(job.getId(), false));
        assertTrue(service.removeJob(job.getId(), true));

        assertThrows(JobNotFoundException.class, () -> service.getJob(job.getId()));
        assertTrue(jobStore.get(job.getId()).isEmpty());
    }

    @Test
    void disabledJobIsNeitherScheduledNorStartable() {
        JobSpec job = service.addJob(oneShot("true").toBuilder()
                .enabled(false)
                .schedule(JobSchedule.every(Duration.ofMinutes(5)))
                .build());
        assertEquals(JobStatus.IDLE, job.getStatus());
        assertNull(job.getNextRunAt());

        JobStateException refused = assertThrows(JobStateException.class, () -> service.startJob(job.getId()));
        assertEquals(ErrorCodes.JOB_DISABLED, refused.getErrorCode());

        JobSpec enabled = service.enableJob(job.getId());
        assertEquals(JobStatus.SCHEDULED, enabled.getStatus());
        assertNotNull(enabled.getNextRunAt());

        JobSpec disabled = service.disableJob(job.getId());
        assertEquals(JobStatus.IDLE, disabled.getStatus());
        assertEquals(0, service.status().getScheduler().getScheduledJobs());
    }

    @Test
    void startRefusesAScheduledJob() {
        JobSpec job = service.addJob(oneShot("true").toBuilder()
                .schedule(JobSchedule.every(Duration.ofMinutes(5)))
                .build());

        JobStateException refused = assertThrows(JobStateException.class, () -> service.startJob(job.getId()));
        assertEquals(ErrorCodes.JOB_NOT_IDLE, refused.getErrorCode());
    }

    @Test
    void updateJobReschedules() {
        JobSpec job = service.addJob(oneShot("true"));

        JobSpec updated = service.updateJob(job.getId(), JobUpdate.builder()
                .schedule(JobSchedule.every(Duration.ofMinutes(1)))
                .description("every minute")
                .build());

        assertEquals(JobStatus.SCHEDULED, updated.getStatus());
        assertEquals("every minute", updated.getDescription());
        assertNotNull(updated.getNextRunAt());
        assertThrows(InvalidScheduleException.class, () -> service.updateJob(job.getId(),
                JobUpdate.builder().schedule(JobSchedule.cron("bad")).build()));
        assertEquals(updated.getSchedule(), service.getJob(job.getId()).getSchedule());
    }

    @Test
    void listJobsFiltersByStatusAndName() {
        service.addJob(oneShot("true").toBuilder().name("backup-db").build());
        service.addJob(oneShot("true").toBuilder().name("report")
                .schedule(JobSchedule.every(Duration.ofMinutes(5))).build());

        assertEquals(1, service.listJobs(JobFilter.builder().namePattern("BACKUP").build()).size());
        assertEquals(1, service.listJobs(JobFilter.builder().status(List.of(JobStatus.SCHEDULED)).build()).size());
        assertEquals(1, service.listJobs(JobFilter.builder().limit(1).build()).size());
    }

    @Test
    void jobsSurviveARestart() {
        JobSpec recurring = service.addJob(oneShot("true").toBuilder()
                .schedule(JobSchedule.every(Duration.ofMinutes(10)))
                .build());
        JobSpec disabled = service.addJob(oneShot("true").toBuilder().enabled(false).build());
        service.stop();

        JobDaemonService restarted = newService(new InMemoryJobStore(100));
        restarted.start();

        JobSpec recovered = restarted.getJob(recurring.getId());
        assertEquals(JobStatus.SCHEDULED, recovered.getStatus());
        assertEquals(recurring.getNextRunAt(), recovered.getNextRunAt());
        assertEquals(recurring.getSchedule(), recovered.getSchedule());
        assertFalse(restarted.getJob(disabled.getId()).getEnabled());
        assertEquals(1, restarted.status().getScheduler().getScheduledJobs());
    }

    @Test
    void unusableSnapshotStartsEmpty() throws Exception {
        service.stop();
        Files.writeString(runtimeDir.resolve("jobs.json"), "null");

        JobDaemonService restarted = newService(new InMemoryJobStore(100));
        restarted.start();

        assertTrue(restarted.isRunning());
        assertEquals(0, restarted.status().getTotalJobs());
    }

    @Test
    void nullSnapshotEntriesAreSkipped() throws Exception {
        service.stop();
        Files.writeString(runtimeDir.resolve("jobs.json"),
                "[null, {\"id\": \"job_kept\", \"command\": \"true\", \"status\": \"COMPLETED\"}]");

        JobDaemonService restarted = newService(new InMemoryJobStore(100));
        restarted.start();

        assertEquals(JobStatus.COMPLETED, restarted.getJob("job_kept").getStatus());
        assertEquals(1, restarted.status().getTotalJobs());
    }

    @Test
    void stopTerminatesRunningJobs() {
        JobSpec job = service.addJob(oneShot("sleep 30"));
        service.startJob(job.getId());

        service.stop();

        assertFalse(service.isRunning());
        assertFalse(service.status().isRunning());
        JobDaemonService restarted = newService(new InMemoryJobStore(100));
        restarted.start();
        assertEquals(JobStatus.STOPPED, restarted.getJob(job.getId()).getStatus());
    }

    @Test
    void statusCountsJobsByStatus() {
        service.addJob(oneShot("true"));
        service.addJob(oneShot("true").toBuilder().schedule(JobSchedule.every(Duration.ofMinutes(5))).build());

        DaemonStatus status = service.status();

        assertTrue(status.isRunning());
        assertEquals(2, status.getTotalJobs());
        assertEquals(1L, status.getJobsByStatus().get(JobStatus.IDLE));
        assertEquals(1L, status.getJobsByStatus().get(JobStatus.SCHEDULED));
        assertEquals(HeapJobScheduler.NAME, status.getScheduler().getStrategy());
        assertEquals("memory", status.getStoreType());
    }

    @Test
    void unknownJobIsReported() {
        JobNotFoundException missing = assertThrows(JobNotFoundException.class, () -> service.getJob("job_missing"));
        assertEquals("JOB_NOT_FOUND", missing.getErrorCode());
    }
}
