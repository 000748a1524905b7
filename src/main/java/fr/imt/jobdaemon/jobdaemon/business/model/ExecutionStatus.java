package fr.imt.jobdaemon.jobdaemon.business.model;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED,
    TIMEOUT
}
