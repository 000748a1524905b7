package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.port.JobStorePort;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default store. Jobs are kept as copies so that callers never share state with the store,
 * and each job keeps a ring of its most recent executions.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "jobdaemon.store", name = "type", havingValue = Constants.STORE_MEMORY, matchIfMissing = true)
public class InMemoryJobStore implements JobStorePort {

    private final Map<String, JobSpec> jobs = new ConcurrentHashMap<>();
    private final Map<String, Deque<JobExecution>> executions = new ConcurrentHashMap<>();
    private final int maxHistory;

    @Autowired
    public InMemoryJobStore(DaemonProperties properties) {
        this(properties.getExecution().getMaxHistory());
    }

    public InMemoryJobStore(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    @Override
    public JobSpec save(JobSpec job) {
        jobs.put(job.getId(), copy(job));
        return job;
    }

    @Override
    public Optional<JobSpec> get(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(this::copy);
    }

    @Override
    public List<JobSpec> list(JobFilter filter) {
        JobFilter effective = filter != null ? filter : JobFilter.all();
        return jobs.values().stream()
                .sorted(Comparator.comparing(JobSpec::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .filter(effective::matches)
                .limit(effective.effectiveLimit())
                .map(this::copy)
                .toList();
    }

    @Override
    public JobSpec update(String jobId, JobUpdate update) {
        JobSpec updated = jobs.computeIfPresent(jobId, (id, current) -> {
            JobSpec next = copy(current);
            update.applyTo(next);
            return next;
        });
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return copy(updated);
    }

    @Override
    public boolean delete(String jobId) {
        executions.remove(jobId);
        return jobs.remove(jobId) != null;
    }

    @Override
    public void saveExecution(JobExecution execution) {
        Deque<JobExecution> ring = executions.computeIfAbsent(execution.getJobId(), id -> new ArrayDeque<>());
        synchronized (ring) {
            ring.removeIf(existing -> existing.getExecutionId().equals(execution.getExecutionId()));
            ring.addFirst(execution.toBuilder().build());
            while (ring.size() > maxHistory) {
                ring.removeLast();
            }
        }
    }

    @Override
    public List<JobExecution> getExecutions(String jobId, int limit) {
        Deque<JobExecution> ring = executions.get(jobId);
        if (ring == null) {
            return List.of();
        }
        synchronized (ring) {
            List<JobExecution> result = new ArrayList<>();
            for (JobExecution execution : ring) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(execution.toBuilder().build());
            }
            return result;
        }
    }

    @Override
    public void cleanup() {
        int before = executions.size();
        executions.keySet().removeIf(jobId -> !jobs.containsKey(jobId));
        int removed = before - executions.size();
        if (removed > 0) {
            log.debug("Dropped execution history of {} removed job(s)", removed);
        }
    }

    @Override
    public String type() {
        return Constants.STORE_MEMORY;
    }

    private JobSpec copy(JobSpec job) {
        return job.toBuilder().build();
    }
}
