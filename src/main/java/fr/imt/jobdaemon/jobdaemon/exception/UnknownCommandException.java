package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when a control request names a command the daemon does not know.
 */
public class UnknownCommandException extends JobDaemonException {


    public UnknownCommandException(String message) {
        super(ErrorCodes.UNKNOWN_COMMAND, message);
    }

    public UnknownCommandException(String message, Throwable cause) {
        super(ErrorCodes.UNKNOWN_COMMAND, message, cause);
    }
}
