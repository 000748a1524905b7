package fr.imt.jobdaemon.jobdaemon.business.event;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;

@FunctionalInterface
public interface JobEventListener {

    void onEvent(JobEvent event);
}
