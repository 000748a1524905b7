package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when a job definition is missing its command or carries out-of-range values.
 */
public class InvalidJobSpecException extends JobDaemonException {


    public InvalidJobSpecException(String message) {
        super(ErrorCodes.INVALID_JOB_SPEC, message);
    }

    public InvalidJobSpecException(String message, Throwable cause) {
        super(ErrorCodes.INVALID_JOB_SPEC, message, cause);
    }
}
