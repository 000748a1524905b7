package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown at startup when another daemon owns the socket or the pid file.
 */
public class DaemonAlreadyRunningException extends JobDaemonException {


    public DaemonAlreadyRunningException(String message) {
        super(ErrorCodes.DAEMON_ALREADY_RUNNING, message);
    }

    public DaemonAlreadyRunningException(String message, Throwable cause) {
        super(ErrorCodes.DAEMON_ALREADY_RUNNING, message, cause);
    }
}
