package fr.imt.jobdaemon.jobdaemon.business.model;

/**
 * Exit code and captured (possibly truncated) output of a finished child process.
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
