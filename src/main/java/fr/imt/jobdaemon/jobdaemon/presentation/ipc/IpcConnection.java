package fr.imt.jobdaemon.jobdaemon.presentation.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.SocketChannel;

/**
 * One client connection. Reads request frames until the peer hangs up; a frame that is not a valid
 * request, or one larger than {@link Constants#MAX_FRAME_BYTES}, closes the connection.
 */
@Slf4j
class IpcConnection implements Runnable {

    private final FrameChannel frames;
    private final ControlProtocolServer server;
    private final ObjectMapper objectMapper;

    IpcConnection(SocketChannel channel, ControlProtocolServer server, ObjectMapper objectMapper) {
        this.frames = new FrameChannel(channel, Constants.MAX_FRAME_BYTES);
        this.server = server;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try {
            byte[] frame;
            while ((frame = frames.readFrame()) != null) {
                if (isBlank(frame)) {
                    continue;
                }
                IpcRequest request;
                try {
                    request = objectMapper.readValue(frame, IpcRequest.class);
                } catch (IOException e) {
                    log.warn("Malformed control request, closing connection: {}", e.getMessage());
                    break;
                }
                if (request == null) {
                    log.warn("Control request is not a JSON object, closing connection");
                    break;
                }
                server.submit(this, request);
            }
        } catch (FrameChannel.FrameTooLargeException e) {
            log.warn("{}, closing connection", e.getMessage());
        } catch (AsynchronousCloseException e) {
            log.debug("Control connection closed");
        } catch (IOException e) {
            log.debug("Control connection read failed: {}", e.getMessage());
        } finally {
            close();
        }
    }

    void send(IpcResponse response) {
        if (!frames.isOpen()) {
            log.debug("Dropping response {} for a closed connection", response.getId());
            return;
        }
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            log.error("Could not encode response {}", response.getId(), e);
            payload = encodeFallback(response.getId());
        }
        try {
            frames.writeFrame(payload);
        } catch (IOException e) {
            log.debug("Could not deliver response {}: {}", response.getId(), e.getMessage());
        }
    }

    void close() {
        try {
            frames.close();
        } catch (IOException e) {
            log.debug("Error closing control connection: {}", e.getMessage());
        }
        server.closed(this);
    }

    private byte[] encodeFallback(String requestId) {
        IpcResponse error = IpcResponse.error(requestId, ErrorCodes.INTERNAL_ERROR,
                "The daemon could not encode its reply, see the daemon log");
        try {
            return objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode an error response", e);
        }
    }

    private static boolean isBlank(byte[] frame) {
        for (byte b : frame) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }
}
