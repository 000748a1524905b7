package fr.imt.jobdaemon.jobdaemon.infrastructure.service;

import fr.imt.jobdaemon.jobdaemon.business.command.ControlCommandFactory;
import fr.imt.jobdaemon.jobdaemon.business.command.DeferredAction;
import fr.imt.jobdaemon.jobdaemon.business.event.RecentJobEvents;
import fr.imt.jobdaemon.jobdaemon.business.model.DaemonStatus;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import fr.imt.jobdaemon.jobdaemon.infrastructure.runtime.DaemonRuntimeFiles;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.ControlProtocolServer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Brings the daemon up and down: pid file, job core, control socket.
 * Also serves the daemon-level control commands ({@code status}, {@code restart}, {@code stop-daemon}).
 */
@Slf4j
@Component
public class DaemonLifecycle {

    private final JobDaemonService jobDaemonService;
    private final ControlProtocolServer controlServer;
    private final DaemonRuntimeFiles runtimeFiles;
    private final RecentJobEvents recentEvents;
    private final DaemonTerminator terminator;

    private boolean running;

    public DaemonLifecycle(JobDaemonService jobDaemonService,
                           ControlProtocolServer controlServer,
                           ControlCommandFactory commandFactory,
                           DaemonRuntimeFiles runtimeFiles,
                           RecentJobEvents recentEvents,
                           DaemonTerminator terminator) {
        this.jobDaemonService = jobDaemonService;
        this.controlServer = controlServer;
        this.runtimeFiles = runtimeFiles;
        this.recentEvents = recentEvents;
        this.terminator = terminator;

        commandFactory.register(ControlCommandFactory.STATUS, args -> this::status);
        commandFactory.register(ControlCommandFactory.RESTART, args -> () ->
                new DeferredAction(Map.of("message", "Daemon restarting"), "daemon-restart", this::restartOrExit));
        commandFactory.register(ControlCommandFactory.STOP_DAEMON, args -> () ->
                new DeferredAction(Map.of("message", "Daemon stopping"), "daemon-shutdown", this::shutdown));
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        runtimeFiles.ensureNotRunning();
        runtimeFiles.writePidFile();
        try {
            jobDaemonService.start();
            controlServer.start(runtimeFiles.getSocketPath());
        } catch (RuntimeException e) {
            log.error("Daemon startup failed: {}", e.getMessage());
            jobDaemonService.stop();
            runtimeFiles.releasePidFile();
            throw e;
        }
        running = true;
        log.info("Job daemon started with pid {}, control socket {}",
                ProcessHandle.current().pid(), runtimeFiles.getSocketPath());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        jobDaemonService.stop();
        controlServer.stop();
        runtimeFiles.releasePidFile();
        log.info("Job daemon stopped");
    }

    public synchronized void restart() {
        log.info("Restarting job daemon");
        stop();
        start();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public DaemonStatus status() {
        return jobDaemonService.status().toBuilder()
                .running(isRunning())
                .pid(ProcessHandle.current().pid())
                .socketPath(runtimeFiles.getSocketPath().toString())
                .recentEvents(recentEvents.snapshot())
                .build();
    }

    private void restartOrExit() {
        try {
            restart();
        } catch (RuntimeException e) {
            log.error("Restart failed, exiting", e);
            terminator.terminate();
        }
    }

    private void shutdown() {
        stop();
        terminator.terminate();
    }
}
