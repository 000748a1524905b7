package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when the daemon cannot bind its socket or write its runtime files.
 */
public class DaemonStartupException extends JobDaemonException {


    public DaemonStartupException(String message) {
        super(ErrorCodes.DAEMON_STARTUP_FAILED, message);
    }

    public DaemonStartupException(String message, Throwable cause) {
        super(ErrorCodes.DAEMON_STARTUP_FAILED, message, cause);
    }
}
