package fr.imt.jobdaemon.jobdaemon.business.scheduler;

import java.util.List;

@FunctionalInterface
public interface DueJobHandler {

    /**
     * Called on the scheduler executor with the ids of the jobs that became due, in firing order.
     * The entries have already been removed from the scheduler.
     */
    void onDue(List<String> jobIds);
}
