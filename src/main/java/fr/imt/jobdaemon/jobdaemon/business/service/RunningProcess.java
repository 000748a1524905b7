package fr.imt.jobdaemon.jobdaemon.business.service;

import fr.imt.jobdaemon.jobdaemon.business.model.ProcessResult;

import java.util.concurrent.CompletableFuture;

/**
 * A spawned child and the future that completes once it exited and both output streams are drained.
 */
public record RunningProcess(Process process, CompletableFuture<ProcessResult> completion) {

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }
}
