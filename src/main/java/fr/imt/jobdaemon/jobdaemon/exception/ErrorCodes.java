package fr.imt.jobdaemon.jobdaemon.exception;

import java.util.Set;

/**
 * Every error code the daemon puts on the wire, over the control socket as well as the HTTP API.
 * Clients match on these strings, so existing values never change.
 */
public final class ErrorCodes {

    // jobs
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    public static final String INVALID_JOB_SPEC = "INVALID_JOB_SPEC";
    public static final String INVALID_SCHEDULE = "INVALID_SCHEDULE";
    public static final String JOB_ALREADY_RUNNING = "JOB_ALREADY_RUNNING";
    public static final String JOB_NOT_RUNNING = "JOB_NOT_RUNNING";
    public static final String JOB_NOT_IDLE = "JOB_NOT_IDLE";
    public static final String JOB_DISABLED = "JOB_DISABLED";
    public static final String JOB_EXECUTION_FAILED = "JOB_EXECUTION_FAILED";

    // daemon lifecycle
    public static final String DAEMON_ALREADY_RUNNING = "DAEMON_ALREADY_RUNNING";
    public static final String DAEMON_STARTUP_FAILED = "DAEMON_STARTUP_FAILED";
    public static final String DAEMON_NOT_RUNNING = "DAEMON_NOT_RUNNING";
    public static final String SOCKET_NOT_FOUND = "SOCKET_NOT_FOUND";
    public static final String SOCKET_PERMISSION_DENIED = "SOCKET_PERMISSION_DENIED";

    // requests
    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String REQUEST_TIMEOUT = "REQUEST_TIMEOUT";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String WEBHOOKS_DISABLED = "WEBHOOKS_DISABLED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final Set<String> KNOWN = Set.of(
            JOB_NOT_FOUND, INVALID_JOB_SPEC, INVALID_SCHEDULE, JOB_ALREADY_RUNNING, JOB_NOT_RUNNING, JOB_NOT_IDLE,
            JOB_DISABLED, JOB_EXECUTION_FAILED, DAEMON_ALREADY_RUNNING, DAEMON_STARTUP_FAILED, DAEMON_NOT_RUNNING,
            SOCKET_NOT_FOUND, SOCKET_PERMISSION_DENIED, UNKNOWN_COMMAND, INVALID_REQUEST, REQUEST_TIMEOUT,
            UNAUTHORIZED, WEBHOOKS_DISABLED, INTERNAL_ERROR);

    private ErrorCodes() {
    }

    /**
     * A daemon of another version may answer with a code this build does not list.
     */
    public static boolean isKnown(String code) {
        return code != null && KNOWN.contains(code);
    }
}
