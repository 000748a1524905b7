package fr.imt.jobdaemon.jobdaemon.business.port;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Whole-table snapshot of the job definitions, rewritten after every mutation and read back at startup.
 */
public interface JobSnapshotPort {

    /**
     * @return the saved jobs, or empty when there is no usable snapshot
     */
    Optional<List<JobSpec>> load();

    void save(Collection<JobSpec> jobs);
}
