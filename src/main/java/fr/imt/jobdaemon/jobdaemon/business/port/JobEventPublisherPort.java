package fr.imt.jobdaemon.jobdaemon.business.port;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;

public interface JobEventPublisherPort {

    /**
     * Hands the event over for asynchronous delivery. Never blocks the caller.
     */
    void publish(JobEvent event);
}
