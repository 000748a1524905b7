package fr.imt.jobdaemon.jobdaemon.infrastructure.runtime;

import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonAlreadyRunningException;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonStartupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Pid file and control socket file of the daemon: detection of a live instance, removal of stale files.
 */
@Slf4j
@Component
public class DaemonRuntimeFiles {

    private final Path pidFile;
    private final Path socketPath;

    @Autowired
    public DaemonRuntimeFiles(DaemonProperties properties) {
        this(properties.getPidFile(), properties.getSocketPath());
    }

    public DaemonRuntimeFiles(Path pidFile, Path socketPath) {
        this.pidFile = pidFile;
        this.socketPath = socketPath;
    }

    /**
     * Fails when another daemon is alive, otherwise removes whatever a dead one left behind.
     */
    public void ensureNotRunning() {
        Optional<Long> pid = readPid();
        if (pid.isPresent() && isOtherLiveProcess(pid.get())) {
            throw new DaemonAlreadyRunningException("Daemon already running with pid " + pid.get() + " (" + pidFile + ")");
        }
        if (Files.exists(socketPath)) {
            if (socketAcceptsConnections(socketPath)) {
                throw new DaemonAlreadyRunningException("Another daemon is listening on " + socketPath);
            }
            log.info("Removing stale socket {}", socketPath);
            delete(socketPath);
        }
        if (pid.isPresent()) {
            log.info("Removing stale pid file {} (pid {})", pidFile, pid.get());
            delete(pidFile);
        }
    }

    /**
     * Claims the pid file. Creation is exclusive, so of two daemons starting together only one wins.
     *
     * @throws DaemonAlreadyRunningException if a live process claimed it first
     */
    public void writePidFile() {
        String pid = String.valueOf(ProcessHandle.current().pid());
        try {
            Files.createDirectories(pidFile.toAbsolutePath().getParent());
            try {
                Files.writeString(pidFile, pid, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                Optional<Long> holder = readPid();
                if (holder.isPresent() && isOtherLiveProcess(holder.get())) {
                    throw new DaemonAlreadyRunningException(
                            "Daemon already running with pid " + holder.get() + " (" + pidFile + ")");
                }
                Files.writeString(pidFile, pid, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new DaemonStartupException("Cannot write pid file " + pidFile, e);
        }
    }

    /**
     * Deletes the pid file if it still names this process. The socket file belongs to whoever bound it.
     */
    public void releasePidFile() {
        Optional<Long> pid = readPid();
        if (pid.isPresent() && pid.get() != ProcessHandle.current().pid()) {
            log.warn("Pid file {} now names pid {}, leaving it", pidFile, pid.get());
            return;
        }
        delete(pidFile);
    }

    public Optional<Long> readPid() {
        if (!Files.exists(pidFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim()));
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable pid file {}: {}", pidFile, e.getMessage());
            return Optional.empty();
        }
    }

    public Path getPidFile() {
        return pidFile;
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public static boolean socketAcceptsConnections(Path socketPath) {
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            return channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean isOtherLiveProcess(long pid) {
        return pid != ProcessHandle.current().pid()
                && ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + path, e);
        }
    }
}
