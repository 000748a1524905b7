package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Raised by the client when the daemon answered a request with {@code success=false}.
 * The error code is the one the daemon reported, even when this build does not know it.
 */
public class DaemonRequestException extends JobDaemonException {

    public DaemonRequestException(String errorCode, String message) {
        super(errorCode, message);
    }
}
