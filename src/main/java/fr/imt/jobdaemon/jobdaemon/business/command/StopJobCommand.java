package fr.imt.jobdaemon.jobdaemon.business.command;

import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class StopJobCommand implements ControlCommand {

    private final JobDaemonService jobDaemonService;

    private final String jobId;

    /**
     * Signal name or number, SIGTERM when null.
     */
    private final String signal;

    @Override
    public Object execute() {
        return jobDaemonService.stopJob(jobId, signal);
    }

}
