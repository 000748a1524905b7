package fr.imt.jobdaemon.jobdaemon.business.model;

/**
 * What caused an execution to start.
 */
public enum ExecutionTrigger {
    SCHEDULE,
    START,
    TRIGGER,
    RETRY
}
