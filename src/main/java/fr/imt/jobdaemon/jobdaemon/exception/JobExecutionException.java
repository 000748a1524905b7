package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when the child process of a job cannot be spawned.
 */
public class JobExecutionException extends JobDaemonException {


    public JobExecutionException(String message) {
        super(ErrorCodes.JOB_EXECUTION_FAILED, message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(ErrorCodes.JOB_EXECUTION_FAILED, message, cause);
    }
}
