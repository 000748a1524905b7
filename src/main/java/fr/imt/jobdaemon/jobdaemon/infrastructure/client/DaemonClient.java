package fr.imt.jobdaemon.jobdaemon.infrastructure.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.command.CommandArguments;
import fr.imt.jobdaemon.jobdaemon.business.command.ControlCommandFactory;
import fr.imt.jobdaemon.jobdaemon.business.model.DaemonStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobStatistics;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.business.utils.JsonMappers;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonNotRunningException;
import fr.imt.jobdaemon.jobdaemon.exception.DaemonRequestException;
import fr.imt.jobdaemon.jobdaemon.exception.RequestTimeoutException;
import fr.imt.jobdaemon.jobdaemon.infrastructure.runtime.DaemonRuntimeFiles;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.FrameChannel;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client side of the control protocol, for processes talking to a running daemon.
 * <p>
 * Requests are correlated by id, so several may be in flight on the one connection. A request that
 * gets no answer within the timeout fails with {@link RequestTimeoutException}; a late answer is
 * dropped and the connection stays usable.
 */
@Slf4j
public class DaemonClient implements AutoCloseable {

    private final Path socketPath;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final Map<String, CompletableFuture<IpcResponse>> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();

    private FrameChannel frames;
    private Thread reader;

    public DaemonClient(Path socketPath, Duration requestTimeout) {
        this(socketPath, requestTimeout, JsonMappers.create());
    }

    public DaemonClient(Path socketPath, Duration requestTimeout, ObjectMapper objectMapper) {
        this.socketPath = socketPath;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    public static DaemonClient fromProperties(DaemonProperties properties) {
        return new DaemonClient(properties.getSocketPath(), properties.getClient().getRequestTimeout());
    }

    /**
     * True when something accepts connections on the socket. Never throws.
     */
    public boolean isDaemonRunning() {
        return Files.exists(socketPath) && DaemonRuntimeFiles.socketAcceptsConnections(socketPath);
    }

    public synchronized void connect() {
        if (frames != null && frames.isOpen()) {
            return;
        }
        if (!Files.exists(socketPath)) {
            throw new DaemonNotRunningException(ErrorCodes.SOCKET_NOT_FOUND,
                    "Daemon socket not found at " + socketPath);
        }
        SocketChannel channel;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        } catch (IOException e) {
            throw new DaemonNotRunningException(ErrorCodes.DAEMON_NOT_RUNNING,
                    "Cannot open a socket: " + e.getMessage(), e);
        }
        try {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            closeQuietly(channel);
            if (e instanceof AccessDeniedException || String.valueOf(e.getMessage()).contains("Permission denied")) {
                throw new DaemonNotRunningException(ErrorCodes.SOCKET_PERMISSION_DENIED,
                        "Permission denied on daemon socket " + socketPath, e);
            }
            throw new DaemonNotRunningException(ErrorCodes.DAEMON_NOT_RUNNING,
                    "Daemon is not running (stale socket " + socketPath + ")", e);
        }

        FrameChannel connected = new FrameChannel(channel, Constants.MAX_FRAME_BYTES);
        frames = connected;
        reader = new Thread(() -> readLoop(connected), "jobdaemon-client-reader");
        reader.setDaemon(true);
        reader.start();
    }

    // ===== Raw protocol =====

    public CompletableFuture<JsonNode> sendAsync(String command, Map<String, ?> args) {
        connect();
        String id = "req_" + requestIds.incrementAndGet();
        CompletableFuture<IpcResponse> response = new CompletableFuture<>();
        pending.put(id, response);

        IpcRequest request = new IpcRequest(id, command, objectMapper.valueToTree(args != null ? args : Map.of()));
        try {
            currentFrames().writeFrame(objectMapper.writeValueAsBytes(request));
        } catch (IOException e) {
            pending.remove(id);
            return CompletableFuture.failedFuture(new DaemonNotRunningException(
                    ErrorCodes.DAEMON_NOT_RUNNING, "Lost connection to daemon: " + e.getMessage(), e));
        }

        long timeoutMillis = requestTimeout.toMillis();
        return response.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS).handle((reply, error) -> {
            pending.remove(id);
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                if (cause instanceof TimeoutException) {
                    throw new RequestTimeoutException("Request '" + command + "' timed out after " + timeoutMillis + " ms");
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new CompletionException(cause);
            }
            if (!reply.isSuccess()) {
                throw new DaemonRequestException(reply.getCode(), reply.getError());
            }
            return objectMapper.valueToTree(reply.getData());
        });
    }

    public JsonNode send(String command, Map<String, ?> args) {
        try {
            return sendAsync(command, args).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    // ===== Typed commands =====

    public DaemonStatus status() {
        return convert(send(ControlCommandFactory.STATUS, Map.of()), DaemonStatus.class);
    }

    public JobSpec addJob(JobSpec spec) {
        return convert(send(ControlCommandFactory.ADD_JOB, Map.of(CommandArguments.JOB_SPEC, spec)), JobSpec.class);
    }

    public JobSpec startJob(String jobId) {
        return jobCommand(ControlCommandFactory.START_JOB, jobId);
    }

    public JobSpec triggerJob(String jobId) {
        return jobCommand(ControlCommandFactory.TRIGGER_JOB, jobId);
    }

    public JobSpec stopJob(String jobId, String signal) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(CommandArguments.JOB_ID, jobId);
        if (signal != null) {
            args.put(CommandArguments.SIGNAL, signal);
        }
        return convert(send(ControlCommandFactory.STOP_JOB, args), JobSpec.class);
    }

    public List<JobSpec> listJobs(JobFilter filter) {
        Map<String, Object> args = filter != null ? Map.of(CommandArguments.FILTER, filter) : Map.of();
        return objectMapper.convertValue(send(ControlCommandFactory.LIST_JOBS, args), new TypeReference<List<JobSpec>>() {
        });
    }

    public JobSpec getJob(String jobId) {
        return jobCommand(ControlCommandFactory.GET_JOB, jobId);
    }

    public boolean removeJob(String jobId, boolean force) {
        JsonNode removed = send(ControlCommandFactory.REMOVE_JOB,
                Map.of(CommandArguments.JOB_ID, jobId, CommandArguments.FORCE, force));
        return removed.asBoolean();
    }

    public JobSpec updateJob(String jobId, JobUpdate update) {
        return convert(send(ControlCommandFactory.UPDATE_JOB,
                Map.of(CommandArguments.JOB_ID, jobId, CommandArguments.UPDATE, update)), JobSpec.class);
    }

    public JobSpec enableJob(String jobId) {
        return jobCommand(ControlCommandFactory.ENABLE_JOB, jobId);
    }

    public JobSpec disableJob(String jobId) {
        return jobCommand(ControlCommandFactory.DISABLE_JOB, jobId);
    }

    public List<JobExecution> getJobHistory(String jobId, Integer limit) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(CommandArguments.JOB_ID, jobId);
        if (limit != null) {
            args.put(CommandArguments.LIMIT, limit);
        }
        return objectMapper.convertValue(send(ControlCommandFactory.JOB_HISTORY, args), new TypeReference<List<JobExecution>>() {
        });
    }

    public JobStatistics getJobStatistics(String jobId) {
        return convert(send(ControlCommandFactory.JOB_STATS, Map.of(CommandArguments.JOB_ID, jobId)),
                JobStatistics.class);
    }

    public String restart() {
        return send(ControlCommandFactory.RESTART, Map.of()).path("message").asText();
    }

    public String stopDaemon() {
        return send(ControlCommandFactory.STOP_DAEMON, Map.of()).path("message").asText();
    }

    @Override
    public synchronized void close() {
        if (frames != null) {
            try {
                frames.close();
            } catch (IOException e) {
                log.debug("Error closing daemon connection: {}", e.getMessage());
            }
            frames = null;
        }
        failPending("Client closed");
    }

    // ===== Internals =====

    private void readLoop(FrameChannel connection) {
        try {
            byte[] frame;
            while ((frame = connection.readFrame()) != null) {
                IpcResponse response;
                try {
                    response = objectMapper.readValue(frame, IpcResponse.class);
                } catch (IOException e) {
                    log.warn("Ignoring malformed response from daemon: {}", e.getMessage());
                    continue;
                }
                CompletableFuture<IpcResponse> waiting = response.getId() != null ? pending.remove(response.getId()) : null;
                if (waiting == null) {
                    log.debug("Ignoring response {} with no pending request", response.getId());
                } else {
                    waiting.complete(response);
                }
            }
        } catch (IOException e) {
            log.debug("Daemon connection closed: {}", e.getMessage());
        }
        disconnected(connection);
        failPending("Connection to daemon closed");
    }

    /**
     * Forgets a dead connection so that the next request connects again.
     */
    private synchronized void disconnected(FrameChannel connection) {
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("Error closing daemon connection: {}", e.getMessage());
        }
        if (frames == connection) {
            frames = null;
        }
    }

    private void failPending(String message) {
        pending.forEach((id, future) -> future.completeExceptionally(
                new DaemonNotRunningException(ErrorCodes.DAEMON_NOT_RUNNING, message)));
        pending.clear();
    }

    private synchronized FrameChannel currentFrames() throws IOException {
        if (frames == null) {
            throw new IOException("Not connected");
        }
        return frames;
    }

    private JobSpec jobCommand(String command, String jobId) {
        return convert(send(command, Map.of(CommandArguments.JOB_ID, jobId)), JobSpec.class);
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        return objectMapper.convertValue(node, type);
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
