package fr.imt.jobdaemon.jobdaemon.business.command;

import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.service.JobDaemonService;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class ListJobsCommand implements ControlCommand {

    private final JobDaemonService jobDaemonService;

    private final JobFilter filter;

    @Override
    public Object execute() {
        return jobDaemonService.listJobs(filter);
    }

}
