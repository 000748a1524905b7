package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown by the client when the daemon does not answer within the request timeout.
 */
public class RequestTimeoutException extends JobDaemonException {


    public RequestTimeoutException(String message) {
        super(ErrorCodes.REQUEST_TIMEOUT, message);
    }

    public RequestTimeoutException(String message, Throwable cause) {
        super(ErrorCodes.REQUEST_TIMEOUT, message, cause);
    }
}
