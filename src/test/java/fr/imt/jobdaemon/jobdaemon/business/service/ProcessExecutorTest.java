package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.ProcessResult;
import fr.imt.jobdaemon.jobdaemon.exception.JobExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessExecutorTest {

    private final ProcessExecutor executor = new ProcessExecutor("/bin/sh", 64);

    @TempDir
    Path workDir;

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static JobSpec job(String command) {
        return JobSpec.builder().id("job_test").command(command).build();
    }

    @Test
    void capturesOutputAndExitCode() throws Exception {
        ProcessResult result = executor.start(job("echo out; echo err >&2; exit 3"))
                .completion().get(10, TimeUnit.SECONDS);

        assertEquals(3, result.exitCode());
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
        assertFalse(result.isSuccess());
    }

    @Test
    void runsInTheWorkingDirectoryWithTheJobEnvironment() throws Exception {
        JobSpec job = job("pwd; echo $GREETING").toBuilder()
                .workingDirectory(workDir.toString())
                .environment(Map.of("GREETING", "hello"))
                .build();

        ProcessResult result = executor.start(job).completion().get(10, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(workDir.toRealPath() + "\nhello\n", result.stdout());
    }

    @Test
    void backgroundProcessHoldingTheOutputDoesNotDelayCompletion() throws Exception {
        ProcessExecutor settling = new ProcessExecutor("/bin/sh", 64, Duration.ofMillis(300));
        try {
            long begin = System.nanoTime();
            ProcessResult result = settling.start(job("sleep 5 & echo started"))
                    .completion().get(3, TimeUnit.SECONDS);

            assertEquals(0, result.exitCode());
            assertEquals("started\n", result.stdout());
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin) < 3000);
        } finally {
            settling.shutdown();
        }
    }

    @Test
    void truncatesOutputPastTheLimit() throws Exception {
        ProcessResult result = executor.start(job("head -c 1000 /dev/zero | tr '\\0' 'x'"))
                .completion().get(10, TimeUnit.SECONDS);

        assertTrue(result.stdout().startsWith("x".repeat(64)));
        assertTrue(result.stdout().contains("[truncated 936 bytes]"));
    }

    @Test
    void missingWorkingDirectoryFailsToStart() {
        JobSpec job = job("true").toBuilder().workingDirectory(workDir.resolve("missing").toString()).build();
        assertThrows(JobExecutionException.class, () -> executor.start(job));
    }

    @Test
    void terminateEndsTheChild() throws Exception {
        RunningProcess running = executor.start(job("sleep 30"));
        assertTrue(running.isAlive());

        executor.signal(running.process(), "SIGTERM");

        ProcessResult result = running.completion().get(10, TimeUnit.SECONDS);
        assertNotEquals(0, result.exitCode());
    }

    @Test
    void normalizesSignalNames() {
        assertEquals("TERM", ProcessExecutor.normalizeSignal(null));
        assertEquals("TERM", ProcessExecutor.normalizeSignal("sigterm"));
        assertEquals("KILL", ProcessExecutor.normalizeSignal("9"));
        assertEquals("HUP", ProcessExecutor.normalizeSignal("SIGHUP"));
        assertThrows(IllegalArgumentException.class, () -> ProcessExecutor.normalizeSignal("SIGSEGV"));
    }
}
