package fr.imt.jobdaemon.jobdaemon.presentation.ipc;

import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.exception.JobDaemonException;
import fr.imt.jobdaemon.jobdaemon.exception.JobExecutionException;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto.IpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns exceptions raised by control commands into error responses. Stack traces stay in the daemon log.
 */
@Slf4j
@Component
public class IpcExceptionHandler {


    public IpcResponse handle(String requestId, Throwable ex) {

        // ===== Domain exceptions =====

        if (ex instanceof JobNotFoundException) {
            log.debug("Request {}: {}", requestId, ex.getMessage());
            return IpcResponse.error(requestId, ((JobDaemonException) ex).getErrorCode(), ex.getMessage());
        }
        if (ex instanceof JobExecutionException) {
            log.error("Request {} failed to execute a job: {}", requestId, ex.getMessage(), ex);
            return IpcResponse.error(requestId, ((JobDaemonException) ex).getErrorCode(), ex.getMessage());
        }
        if (ex instanceof JobDaemonException) {
            log.warn("Request {} rejected: {}", requestId, ex.getMessage());
            return IpcResponse.error(requestId, ((JobDaemonException) ex).getErrorCode(), ex.getMessage());
        }

        // ===== Malformed requests =====

        if (ex instanceof IllegalArgumentException) {
            log.warn("Invalid request {}: {}", requestId, ex.getMessage());
            return IpcResponse.error(requestId, ErrorCodes.INVALID_REQUEST, ex.getMessage());
        }

        log.error("Unhandled exception while serving request {}", requestId, ex);
        return IpcResponse.error(requestId, ErrorCodes.INTERNAL_ERROR, "An internal error occurred, see the daemon log");
    }
}
