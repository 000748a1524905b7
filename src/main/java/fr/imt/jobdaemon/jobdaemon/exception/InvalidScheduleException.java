package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Thrown when a cron expression or an interval cannot be used to schedule a job.
 */
public class InvalidScheduleException extends JobDaemonException {


    public InvalidScheduleException(String message) {
        super(ErrorCodes.INVALID_SCHEDULE, message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(ErrorCodes.INVALID_SCHEDULE, message, cause);
    }
}
