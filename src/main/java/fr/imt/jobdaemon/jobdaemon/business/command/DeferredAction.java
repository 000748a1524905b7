package fr.imt.jobdaemon.jobdaemon.business.command;

/**
 * Result of a command that must answer before acting, such as {@code restart}: the server first writes
 * {@code reply}, then runs {@code action} on a new non-daemon thread named {@code threadName}.
 */
public record DeferredAction(Object reply, String threadName, Runnable action) {
}
