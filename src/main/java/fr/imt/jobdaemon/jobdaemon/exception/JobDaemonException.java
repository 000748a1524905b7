package fr.imt.jobdaemon.jobdaemon.exception;

/**
 * Root of the daemon's failures. The error code, one of {@link ErrorCodes}, is what callers act on;
 * the message is for humans. A missing code is reported as {@link ErrorCodes#INTERNAL_ERROR}.
 */
public class JobDaemonException extends RuntimeException {

    private final String errorCode;

    public JobDaemonException(String errorCode, String message) {
        super(message);
        this.errorCode = normalize(errorCode);
    }

    public JobDaemonException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = normalize(errorCode);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean hasCode(String code) {
        return errorCode.equals(code);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }

    private static String normalize(String errorCode) {
        return errorCode == null || errorCode.isBlank() ? ErrorCodes.INTERNAL_ERROR : errorCode;
    }
}
