package fr.imt.jobdaemon.jobdaemon.business.port;

import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for job definitions and their execution history.
 * The history of a job is bounded; the oldest executions are dropped first.
 */
public interface JobStorePort {

    /**
     * Inserts or replaces a job.
     */
    JobSpec save(JobSpec job);

    Optional<JobSpec> get(String jobId);

    List<JobSpec> list(JobFilter filter);

    /**
     * Applies a partial update and returns the resulting job.
     *
     * @throws fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException if the job does not exist
     */
    JobSpec update(String jobId, JobUpdate update);

    /**
     * Deletes a job and its history. Returns false when there was nothing to delete.
     */
    boolean delete(String jobId);

    void saveExecution(JobExecution execution);

    /**
     * Most recent executions first.
     */
    List<JobExecution> getExecutions(String jobId, int limit);

    /**
     * Drops history that no longer belongs to any job.
     */
    void cleanup();

    String type();
}
