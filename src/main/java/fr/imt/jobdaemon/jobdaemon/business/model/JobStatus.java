package fr.imt.jobdaemon.jobdaemon.business.model;

import lombok.Getter;

@Getter
public enum JobStatus {
    IDLE(false),
    SCHEDULED(false),
    RUNNING(false),
    RETRYING(false),
    COMPLETED(true),
    FAILED(true),
    STOPPED(true);

    /**
     * Terminal statuses only apply to one-shot jobs; recurring jobs go back to SCHEDULED.
     */
    private final boolean terminal;

    JobStatus(boolean terminal) {
        this.terminal = terminal;
    }
}
