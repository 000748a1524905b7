package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.ProcessResult;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.JobExecutionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Spawns job commands as {@code <shell> -c <command>} and delivers signals to them.
 * <p>
 * Output is drained on a dedicated pool so that a chatty child never blocks on a full pipe.
 */
@Slf4j
@Service
public class ProcessExecutor {

    private static final Map<String, String> SIGNAL_NUMBERS = Map.of(
            "1", "HUP",
            "2", "INT",
            "3", "QUIT",
            "9", "KILL",
            "10", "USR1",
            "12", "USR2",
            "15", "TERM");

    private static final List<String> SUPPORTED_SIGNALS =
            List.of("TERM", "KILL", "INT", "HUP", "QUIT", "USR1", "USR2");

    private static final Duration DEFAULT_OUTPUT_SETTLE = Duration.ofSeconds(1);

    private final String shell;
    private final int maxOutputBytes;
    private final Duration outputSettle;
    private final ExecutorService outputPumps;

    @Autowired
    public ProcessExecutor(DaemonProperties properties) {
        this(properties.getExecution().getShell(), (int) properties.getExecution().getMaxOutput().toBytes(),
                properties.getExecution().getGracePeriod());
    }

    public ProcessExecutor(String shell, int maxOutputBytes) {
        this(shell, maxOutputBytes, DEFAULT_OUTPUT_SETTLE);
    }

    /**
     * @param outputSettle how long to keep reading output after the child exited. Background processes the
     *                     child left behind can hold its pipes open indefinitely.
     */
    public ProcessExecutor(String shell, int maxOutputBytes, Duration outputSettle) {
        this.shell = shell;
        this.maxOutputBytes = maxOutputBytes;
        this.outputSettle = outputSettle;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("job-output-");
        threadFactory.setDaemon(true);
        this.outputPumps = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * @throws JobExecutionException if the working directory is missing or the shell cannot be started
     */
    public RunningProcess start(JobSpec job) {
        ProcessBuilder builder = new ProcessBuilder(shell, "-c", job.getCommand());
        builder.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));

        String workingDirectory = job.getWorkingDirectory();
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            File directory = new File(workingDirectory);
            if (!directory.isDirectory()) {
                throw new JobExecutionException("Working directory does not exist: " + workingDirectory);
            }
            builder.directory(directory);
        }
        if (job.getEnvironment() != null) {
            builder.environment().putAll(job.getEnvironment());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new JobExecutionException("Failed to start job " + job.getId() + ": " + e.getMessage(), e);
        }
        log.debug("Spawned job {} as pid {}: {}", job.getId(), process.pid(), job.getCommand());

        BoundedOutput stdout = new BoundedOutput(maxOutputBytes);
        BoundedOutput stderr = new BoundedOutput(maxOutputBytes);
        CompletableFuture<Void> drained = CompletableFuture.allOf(
                drain(process.getInputStream(), stdout, job.getId()),
                drain(process.getErrorStream(), stderr, job.getId()));
        CompletableFuture<ProcessResult> completion = process.onExit()
                .thenCompose(exited -> settle(drained, job.getId(), exited.pid()))
                .thenApply(ignored -> new ProcessResult(process.exitValue(), stdout.toString(), stderr.toString()));
        return new RunningProcess(process, completion);
    }

    /**
     * Delivers a signal to the child. TERM and KILL also reach the child's descendants,
     * otherwise a compound shell command would leave its children holding the output pipes.
     */
    public void signal(Process process, String signal) {
        String name = normalizeSignal(signal);
        switch (name) {
            case "KILL" -> kill(process);
            case "TERM" -> {
                process.descendants().forEach(ProcessHandle::destroy);
                process.destroy();
            }
            default -> sendSignal(name, process.pid());
        }
    }

    public void kill(Process process) {
        List<ProcessHandle> descendants = process.descendants().toList();
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
    }

    /**
     * Accepts {@code SIGTERM}, {@code TERM}, {@code term} or {@code 15}, and returns the bare name.
     *
     * @throws IllegalArgumentException for signals the daemon does not deliver
     */
    public static String normalizeSignal(String signal) {
        if (signal == null || signal.isBlank()) {
            return "TERM";
        }
        String name = signal.trim().toUpperCase(Locale.ROOT);
        if (name.startsWith("SIG")) {
            name = name.substring(3);
        }
        name = SIGNAL_NUMBERS.getOrDefault(name, name);
        if (!SUPPORTED_SIGNALS.contains(name)) {
            throw new IllegalArgumentException("Unsupported signal: " + signal);
        }
        return name;
    }

    private void sendSignal(String name, long pid) {
        try {
            Process kill = new ProcessBuilder("kill", "-s", name, String.valueOf(pid))
                    .redirectErrorStream(true)
                    .start();
            if (!kill.waitFor(2, TimeUnit.SECONDS) || kill.exitValue() != 0) {
                throw new JobExecutionException("Failed to send SIG" + name + " to pid " + pid);
            }
        } catch (IOException e) {
            throw new JobExecutionException("Failed to send SIG" + name + " to pid " + pid, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException("Interrupted while sending SIG" + name + " to pid " + pid, e);
        }
    }

    private CompletableFuture<Void> settle(CompletableFuture<Void> drained, String jobId, long pid) {
        CompletableFuture<Void> settled = new CompletableFuture<>();
        drained.whenComplete((ignored, error) -> settled.complete(null));
        CompletableFuture.delayedExecutor(outputSettle.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (settled.complete(null)) {
                log.warn("Job {} exited (pid {}) but a background process still holds its output, "
                        + "keeping what was read so far", jobId, pid);
            }
        });
        return settled;
    }

    private CompletableFuture<Void> drain(InputStream stream, BoundedOutput output, String jobId) {
        return CompletableFuture.runAsync(() -> {
            byte[] chunk = new byte[8192];
            try (InputStream in = stream) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    output.write(chunk, 0, read);
                }
            } catch (IOException e) {
                log.warn("Output of job {} cut short: {}", jobId, e.getMessage());
            }
        }, outputPumps);
    }

    @PreDestroy
    public void shutdown() {
        outputPumps.shutdownNow();
    }
}
