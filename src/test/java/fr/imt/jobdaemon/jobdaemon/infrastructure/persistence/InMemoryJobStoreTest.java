package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private final InMemoryJobStore store = new InMemoryJobStore(3);

    private static JobSpec job(String id) {
        return JobSpec.builder().id(id).name(id).command("true").createdAt(Instant.now()).build();
    }

    private static JobExecution execution(String jobId, int n) {
        return JobExecution.builder()
                .executionId("exec_" + n)
                .jobId(jobId)
                .status(ExecutionStatus.COMPLETED)
                .startedAt(Instant.ofEpochSecond(n))
                .build();
    }

    @Test
    void storesCopies() {
        JobSpec job = job("a");
        store.save(job);
        job.setName("changed");

        assertEquals("a", store.get("a").orElseThrow().getName());
    }

    @Test
    void partialUpdateMergesEnvironment() {
        store.save(job("a").toBuilder().environment(Map.of("A", "1")).build());

        JobSpec updated = store.update("a", JobUpdate.builder()
                .description("nightly")
                .environment(Map.of("B", "2"))
                .build());

        assertEquals("nightly", updated.getDescription());
        assertEquals(Map.of("A", "1", "B", "2"), updated.getEnvironment());
        assertEquals("true", updated.getCommand());
        assertThrows(JobNotFoundException.class, () -> store.update("missing", new JobUpdate()));
    }

    @Test
    void historyIsNewestFirstAndBounded() {
        store.save(job("a"));
        for (int i = 1; i <= 5; i++) {
            store.saveExecution(execution("a", i));
        }

        List<JobExecution> history = store.getExecutions("a", 10);
        assertEquals(List.of("exec_5", "exec_4", "exec_3"),
                history.stream().map(JobExecution::getExecutionId).toList());
        assertEquals(1, store.getExecutions("a", 1).size());
        assertTrue(store.getExecutions("other", 10).isEmpty());
    }

    @Test
    void cleanupDropsHistoryOfRemovedJobs() {
        store.saveExecution(execution("orphan", 1));
        store.save(job("kept"));
        store.saveExecution(execution("kept", 2));

        store.cleanup();

        assertTrue(store.getExecutions("orphan", 10).isEmpty());
        assertEquals(1, store.getExecutions("kept", 10).size());
    }

    @Test
    void listAppliesFilterAndLimit() {
        store.save(job("alpha"));
        store.save(job("beta").toBuilder().enabled(false).build());

        assertEquals(List.of("alpha"), store.list(JobFilter.builder().enabled(true).build())
                .stream().map(JobSpec::getId).toList());
        assertEquals(1, store.list(JobFilter.builder().limit(1).build()).size());
        assertTrue(store.delete("alpha"));
        assertFalse(store.delete("alpha"));
    }
}
