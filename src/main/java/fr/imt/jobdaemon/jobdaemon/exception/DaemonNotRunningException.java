package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Client-side failure to reach the daemon. The message always carries a hint on how to start it.
 */
public class DaemonNotRunningException extends JobDaemonException {

    private static final String START_HINT = "Start the daemon with: jobdaemon start";

    public DaemonNotRunningException(String errorCode, String message) {
        super(errorCode, message + ". " + START_HINT);
    }

    public DaemonNotRunningException(String errorCode, String message, Throwable cause) {
        super(errorCode, message + ". " + START_HINT, cause);
    }
}
