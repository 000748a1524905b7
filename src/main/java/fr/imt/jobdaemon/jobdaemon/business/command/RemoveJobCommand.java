package fr.imt.jobdaemon.jobdaemon.business.command;

import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class RemoveJobCommand implements ControlCommand {

    private final JobDaemonService jobDaemonService;

    private final String jobId;

    private final boolean force;

    @Override
    public Object execute() {
        return jobDaemonService.removeJob(jobId, force);
    }

}
