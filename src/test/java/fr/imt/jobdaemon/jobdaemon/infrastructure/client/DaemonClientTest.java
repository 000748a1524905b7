package fr.imt.jobdaemon.jobdaemon.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import fr.imt.jobdaemon.jobdaemon.business.command.ControlCommandFactory;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatus;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import fr.imt.jobdaemon.jobdaemon.business.utils.JsonMappers;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonNotRunningException;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonRequestException;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.exception.RequestTimeoutException;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.ControlProtocolServer;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.IpcExceptionHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DaemonClientTest {

    @TempDir
    Path dir;

    @Mock
    private JobDaemonService jobDaemonService;

    private ControlProtocolServer server;
    private ControlCommandFactory commandFactory;
    private DaemonClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    private Path startServer() {
        Path socket = dir.resolve("d.sock");
        commandFactory = new ControlCommandFactory(jobDaemonService);
        server = new ControlProtocolServer(commandFactory, new IpcExceptionHandler(), JsonMappers.create());
        server.start(socket);
        return socket;
    }

    @Test
    void missingSocketMeansTheDaemonIsNotRunning() {
        client = new DaemonClient(dir.resolve("absent.sock"), Duration.ofSeconds(1));

        DaemonNotRunningException error = assertThrows(DaemonNotRunningException.class, () -> client.getJob("job_1"));
        assertEquals(ErrorCodes.SOCKET_NOT_FOUND, error.getErrorCode());
        assertTrue(error.getMessage().contains("jobdaemon start"));
        assertFalse(client.isDaemonRunning());
    }

    @Test
    void staleSocketFileMeansTheDaemonIsNotRunning() throws Exception {
        Path stale = Files.createFile(dir.resolve("stale.sock"));
        client = new DaemonClient(stale, Duration.ofSeconds(1));

        DaemonNotRunningException error = assertThrows(DaemonNotRunningException.class, client::connect);
        assertEquals(ErrorCodes.DAEMON_NOT_RUNNING, error.getErrorCode());
    }

    @Test
    void typedCommandsRoundTrip() {
        Instant next = Instant.parse("2024-03-10T10:00:00Z");
        when(jobDaemonService.addJob(any())).thenAnswer(invocation -> {
            JobSpec request = invocation.getArgument(0);
            return request.toBuilder().id("job_1").status(JobStatus.SCHEDULED).nextRunAt(next).build();
        });
        client = new DaemonClient(startServer(), Duration.ofSeconds(5));

        JobSpec created = client.addJob(JobSpec.builder().command("echo hi").build());

        assertTrue(client.isDaemonRunning());
        assertEquals("job_1", created.getId());
        assertEquals(JobStatus.SCHEDULED, created.getStatus());
        assertEquals(next, created.getNextRunAt());
        assertEquals("echo hi", created.getCommand());
    }

    @Test
    void schedulesSurviveTheWire() {
        when(jobDaemonService.addJob(any())).thenAnswer(invocation -> {
            JobSpec request = invocation.getArgument(0);
            return request.toBuilder().id("job_" + request.getName()).status(JobStatus.SCHEDULED).build();
        });
        client = new DaemonClient(startServer(), Duration.ofSeconds(5));

        JobSpec interval = client.addJob(JobSpec.builder()
                .name("tick").command("echo tick").schedule(JobSchedule.every(Duration.ofSeconds(1))).build());
        JobSpec cron = client.addJob(JobSpec.builder()
                .name("nightly").command("echo nightly").schedule(JobSchedule.cron("*/5 * * * *")).build());

        assertEquals(1000L, interval.getSchedule().getInterval());
        assertNull(interval.getSchedule().getCron());
        assertTrue(interval.isRecurring());
        assertEquals("*/5 * * * *", cron.getSchedule().getCron());
        assertTrue(cron.getSchedule().hasCron());

        ArgumentCaptor<JobSpec> received = ArgumentCaptor.forClass(JobSpec.class);
        verify(jobDaemonService, times(2)).addJob(received.capture());
        assertEquals(1000L, received.getAllValues().get(0).getSchedule().getInterval());
        assertEquals("*/5 * * * *", received.getAllValues().get(1).getSchedule().getCron());
    }

    @Test
    void daemonErrorsAreRaisedWithTheirCode() {
        when(jobDaemonService.removeJob("job_x", false)).thenThrow(new JobNotFoundException("job_x"));
        client = new DaemonClient(startServer(), Duration.ofSeconds(5));

        DaemonRequestException error = assertThrows(DaemonRequestException.class, () -> client.removeJob("job_x", false));

        assertEquals("JOB_NOT_FOUND", error.getErrorCode());
        assertEquals("Job not found: job_x", error.getMessage());
    }

    @Test
    void timeoutDropsThePendingRequestAndKeepsTheConnection() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Path socket = startServer();
        commandFactory.register("hang", args -> () -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        });
        commandFactory.register("ping", args -> () -> "pong");
        client = new DaemonClient(socket, Duration.ofMillis(300));

        RequestTimeoutException timeout = assertThrows(RequestTimeoutException.class, () -> client.send("hang", Map.of()));
        assertEquals("REQUEST_TIMEOUT", timeout.getErrorCode());

        release.countDown();
        assertEquals("pong", client.send("ping", Map.of()).asText());
    }

    @Test
    void concurrentRequestsAreCorrelatedById() throws Exception {
        Path socket = startServer();
        commandFactory.register("echo", args -> () -> args.requireString("value"));
        client = new DaemonClient(socket, Duration.ofSeconds(5));

        CompletableFuture<JsonNode> first = client.sendAsync("echo", Map.of("value", "one"));
        CompletableFuture<JsonNode> second = client.sendAsync("echo", Map.of("value", "two"));

        assertEquals("two", second.get(5, TimeUnit.SECONDS).asText());
        assertEquals("one", first.get(5, TimeUnit.SECONDS).asText());
    }

    @Test
    void serverShutdownFailsPendingRequests() {
        Path socket = startServer();
        commandFactory.register("ping", args -> () -> "pong");
        client = new DaemonClient(socket, Duration.ofSeconds(5));
        assertEquals("pong", client.send("ping", Map.of()).asText());

        server.stop();

        assertThrows(DaemonNotRunningException.class, () -> client.send("ping", Map.of()));
    }
}
