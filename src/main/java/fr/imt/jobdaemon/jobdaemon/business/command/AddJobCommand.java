package fr.imt.jobdaemon.jobdaemon.business.command;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class AddJobCommand implements ControlCommand {

    private final JobDaemonService jobDaemonService;

    private final JobSpec jobSpec;

    @Override
    public Object execute() {
        return jobDaemonService.addJob(jobSpec);
    }

}
