package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionSummary;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.utils.JsonMappers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonJobSnapshotFileTest {

    @TempDir
    Path dir;

    @Test
    void savedJobsAreLoadedBack() throws Exception {
        JsonJobSnapshotFile snapshot = new JsonJobSnapshotFile(dir.resolve("state/jobs.json"), JsonMappers.create());
        Instant next = Instant.parse("2024-03-10T10:00:00.123Z");
        JobSpec job = JobSpec.builder()
                .id("job_1")
                .command("echo hi")
                .schedule(JobSchedule.every(Duration.ofSeconds(30)))
                .status(JobStatus.SCHEDULED)
                .nextRunAt(next)
                .scheduleAnchor(next)
                .lastExecution(ExecutionSummary.builder().executionId("exec_1").status(ExecutionStatus.COMPLETED).exitCode(0).build())
                .build();

        snapshot.save(List.of(job));
        List<JobSpec> loaded = snapshot.load().orElseThrow();

        assertEquals(1, loaded.size());
        assertEquals(job, loaded.get(0));
        try (Stream<Path> files = Files.list(dir.resolve("state"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void missingFileLoadsNothing() {
        assertTrue(new JsonJobSnapshotFile(dir.resolve("none.json"), JsonMappers.create()).load().isEmpty());
    }

    @Test
    void corruptFileIsIgnored() throws Exception {
        Path file = dir.resolve("jobs.json");
        Files.writeString(file, "[{\"id\": ");

        assertTrue(new JsonJobSnapshotFile(file, JsonMappers.create()).load().isEmpty());
    }

    @Test
    void cronScheduleIsKept() {
        JsonJobSnapshotFile snapshot = new JsonJobSnapshotFile(dir.resolve("jobs.json"), JsonMappers.create());
        JobSpec job = JobSpec.builder().id("job_2").command("date").schedule(JobSchedule.cron("0 3 * * MON-FRI")).build();

        snapshot.save(List.of(job));

        JobSchedule loaded = snapshot.load().orElseThrow().get(0).getSchedule();
        assertEquals("0 3 * * MON-FRI", loaded.getCron());
        assertNull(loaded.getInterval());
    }

    @Test
    void nullDocumentIsIgnored() throws Exception {
        Path file = dir.resolve("jobs.json");
        Files.writeString(file, "null");

        assertTrue(new JsonJobSnapshotFile(file, JsonMappers.create()).load().isEmpty());
    }

    @Test
    void nullEntriesAreSkipped() throws Exception {
        Path file = dir.resolve("jobs.json");
        Files.writeString(file, "[null, {\"id\": \"job_1\", \"command\": \"true\"}]");

        List<JobSpec> loaded = new JsonJobSnapshotFile(file, JsonMappers.create()).load().orElseThrow();

        assertEquals(1, loaded.size());
        assertEquals("job_1", loaded.get(0).getId());
    }
}
