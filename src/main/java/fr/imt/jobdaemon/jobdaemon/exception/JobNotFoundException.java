package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Exception thrown when a requested job is not found.
 */
public class JobNotFoundException extends JobDaemonException {


    public JobNotFoundException(String jobId) {
        super(ErrorCodes.JOB_NOT_FOUND, "Job not found: " + jobId);
    }

    public JobNotFoundException(String jobId, Throwable cause) {
        super(ErrorCodes.JOB_NOT_FOUND, "Job not found: " + jobId, cause);
    }
}
