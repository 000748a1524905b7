package fr.imt.jobdaemon.jobdaemon.presentation.ipc;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments;
import fr.imt.jobdaemon.jobdaemon.business.command.ControlCommand;
import fr.imt.jobdaemon.jobdaemon.business.command.ControlCommandFactory;
import fr.imt.jobdaemon.jobdaemon.business.command.DeferredAction;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonAlreadyRunningException;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonStartupException;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.BindException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Control protocol endpoint on a Unix domain socket.
 * <p>
 * Each connection gets a reader thread; requests are dispatched to a worker pool so a connection can
 * have several requests in flight and responses come back in completion order, matched by id.
 */
@Slf4j
@Component
public class ControlProtocolServer {

    private final ControlCommandFactory commandFactory;
    private final IpcExceptionHandler exceptionHandler;
    private final ObjectMapper objectMapper;
    private final Set<IpcConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocketChannel serverChannel;
    private Thread acceptor;
    private ExecutorService connectionReaders;
    private ExecutorService requestWorkers;
    private Path socketPath;

    public ControlProtocolServer(ControlCommandFactory commandFactory,
                                 IpcExceptionHandler exceptionHandler,
                                 ObjectMapper objectMapper) {
        this.commandFactory = commandFactory;
        this.exceptionHandler = exceptionHandler;
        this.objectMapper = objectMapper;
    }

    public synchronized void start(Path socketPath) {
        if (isRunning()) {
            throw new IllegalStateException("Control server already listening on " + this.socketPath);
        }
        try {
            ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            try {
                channel.bind(UnixDomainSocketAddress.of(socketPath));
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            serverChannel = channel;
        } catch (BindException e) {
            throw new DaemonAlreadyRunningException("Control socket " + socketPath + " is already in use", e);
        } catch (IOException e) {
            throw new DaemonStartupException("Cannot bind control socket " + socketPath + ": " + e.getMessage(), e);
        }
        restrictPermissions(socketPath);

        this.socketPath = socketPath;
        connectionReaders = Executors.newCachedThreadPool(threadFactory("ipc-connection-"));
        requestWorkers = Executors.newCachedThreadPool(threadFactory("ipc-worker-"));

        acceptor = new Thread(this::acceptLoop, "ipc-acceptor");
        acceptor.start();
        log.info("Control socket listening on {}", socketPath);
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close();
        } catch (IOException e) {
            log.warn("Error closing control socket: {}", e.getMessage());
        }
        connections.forEach(IpcConnection::close);
        connections.clear();

        requestWorkers.shutdown();
        connectionReaders.shutdownNow();
        try {
            if (!requestWorkers.awaitTermination(2, TimeUnit.SECONDS)) {
                requestWorkers.shutdownNow();
            }
            acceptor.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Could not remove control socket {}: {}", socketPath, e.getMessage());
        }
        serverChannel = null;
        acceptor = null;
        log.info("Control socket on {} closed", socketPath);
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isOpen();
    }

    public int connectionCount() {
        return connections.size();
    }

    private void acceptLoop() {
        ServerSocketChannel channel = serverChannel;
        while (channel.isOpen()) {
            try {
                SocketChannel client = channel.accept();
                IpcConnection connection = new IpcConnection(client, this, objectMapper);
                connections.add(connection);
                connectionReaders.execute(connection);
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                log.error("Failed to accept control connection", e);
            }
        }
        log.debug("Control socket acceptor stopped");
    }

    /**
     * Queues a request from a connection; the response is written back on the same connection.
     */
    void submit(IpcConnection connection, IpcRequest request) {
        requestWorkers.execute(() -> {
            IpcResponse response;
            Runnable afterReply = null;
            try {
                Object result = execute(request);
                if (result instanceof DeferredAction) {
                    DeferredAction deferred = (DeferredAction) result;
                    response = IpcResponse.ok(request.getId(), deferred.reply());
                    afterReply = () -> startDeferred(deferred);
                } else {
                    response = IpcResponse.ok(request.getId(), result);
                }
            } catch (Exception e) {
                response = exceptionHandler.handle(request.getId(), e);
            }
            connection.send(response);
            if (afterReply != null) {
                afterReply.run();
            }
        });
    }

    void closed(IpcConnection connection) {
        connections.remove(connection);
    }

    private Object execute(IpcRequest request) {
        log.debug("Request {} -> {}", request.getId(), request.getCommand());
        ControlCommand command = commandFactory.create(
                request.getCommand(), new CommandArguments(request.getArgs(), objectMapper));
        return command.execute();
    }

    private static void startDeferred(DeferredAction deferred) {
        Thread thread = new Thread(deferred.action(), deferred.threadName());
        thread.setDaemon(false);
        thread.start();
    }

    private static void restrictPermissions(Path socketPath) {
        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.warn("Could not restrict permissions on {}: {}", socketPath, e.getMessage());
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
        threadFactory.setDaemon(true);
        return threadFactory;
    }
}
