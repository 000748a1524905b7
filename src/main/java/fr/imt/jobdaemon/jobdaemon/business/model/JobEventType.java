package fr.imt.jobdaemon.jobdaemon.business.model;

public enum JobEventType {
    DAEMON_STARTED,
    DAEMON_STOPPED,
    JOB_ADDED,
    JOB_UPDATED,
    JOB_REMOVED,
    JOB_STARTED,
    JOB_COMPLETED,
    JOB_FAILED,
    JOB_RETRYING,
    JOB_STOPPED,
    JOB_TIMED_OUT
}
