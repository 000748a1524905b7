package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when an operation does not fit the current state of a job,
 * e.g. starting a job that is already running.
 */
public class JobStateException extends JobDaemonException {

    public JobStateException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static JobStateException alreadyRunning(String jobId) {
        return new JobStateException(ErrorCodes.JOB_ALREADY_RUNNING, "Job is already running: " + jobId);
    }

    public static JobStateException notRunning(String jobId) {
        return new JobStateException(ErrorCodes.JOB_NOT_RUNNING, "Job is not running: " + jobId);
    }

    public static JobStateException notIdle(String jobId, Object status) {
        return new JobStateException(ErrorCodes.JOB_NOT_IDLE, "Job " + jobId + " is " + status + ", use trigger to run it now");
    }

    public static JobStateException disabled(String jobId) {
        return new JobStateException(ErrorCodes.JOB_DISABLED, "Job is disabled: " + jobId);
    }
}
