package fr.imt.jobdaemon.jobdaemon.infrastructure.service;

/**
 * Ends the daemon process once {@code stop-daemon} has stopped everything.
 */
@FunctionalInterface
public interface DaemonTerminator {

    void terminate();
}
