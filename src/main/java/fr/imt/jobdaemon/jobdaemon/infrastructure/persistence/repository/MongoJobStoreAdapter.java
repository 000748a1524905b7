package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.repository;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobFilter;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.business.model.JobUpdate;
import fr.imt.jobdaemon.jobdaemon.business.port.JobStorePort;
import fr.imt.jobdaemon.jobdaemon.business.utils.Constants;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import fr.imt.jobdaemon.jobdaemon.exception.JobNotFoundException;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobDocument;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobExecutionDocument;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.mapper.JobDocumentMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB-backed store: {@code jobs} and {@code job_executions} collections.
 * Every call goes through the store retry template.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobdaemon.store", name = "type", havingValue = Constants.STORE_MONGO)
public class MongoJobStoreAdapter implements JobStorePort {

    private final JobDocumentRepository jobRepository;
    private final JobExecutionDocumentRepository executionRepository;
    private final MongoTemplate mongoTemplate;
    private final JobDocumentMapper mapper;
    private final RetryTemplate jobStoreRetryTemplate;
    private final DaemonProperties properties;

    @Override
    public JobSpec save(JobSpec job) {
        withRetry("save job " + job.getId(), () -> jobRepository.save(mapper.toDocument(job)));
        return job;
    }

    @Override
    public Optional<JobSpec> get(String jobId) {
        return withRetry("get job " + jobId, () -> jobRepository.findById(jobId)).map(mapper::toDomain);
    }

    @Override
    public List<JobSpec> list(JobFilter filter) {
        JobFilter effective = filter != null ? filter : JobFilter.all();
        Query query = new Query();
        if (effective.getStatus() != null && !effective.getStatus().isEmpty()) {
            query.addCriteria(Criteria.where("status").in(effective.getStatus()));
        }
        if (effective.getTags() != null && !effective.getTags().isEmpty()) {
            query.addCriteria(Criteria.where("tags").in(effective.getTags()));
        }
        if (effective.getEnabled() != null) {
            query.addCriteria(effective.getEnabled()
                    ? Criteria.where("enabled").ne(false)
                    : Criteria.where("enabled").is(false));
        }
        if (effective.getNamePattern() != null && !effective.getNamePattern().isBlank()) {
            query.addCriteria(Criteria.where("name").regex(effective.getNamePattern(), "i"));
        }
        query.with(Sort.by(Sort.Direction.ASC, "createdAt")).limit(effective.effectiveLimit());

        return withRetry("list jobs", () -> mongoTemplate.find(query, JobDocument.class)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public JobSpec update(String jobId, JobUpdate update) {
        Update mongoUpdate = toMongoUpdate(update);
        if (!mongoUpdate.getUpdateObject().isEmpty()) {
            Query query = Query.query(Criteria.where("_id").is(jobId));
            UpdateResult result = withRetry("update job " + jobId,
                    () -> mongoTemplate.updateFirst(query, mongoUpdate, JobDocument.class));
            if (result.getMatchedCount() == 0) {
                throw new JobNotFoundException(jobId);
            }
        }
        return get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public boolean delete(String jobId) {
        return withRetry("delete job " + jobId, () -> {
            boolean existed = jobRepository.existsById(jobId);
            jobRepository.deleteById(jobId);
            executionRepository.deleteByJobId(jobId);
            return existed;
        });
    }

    @Override
    public void saveExecution(JobExecution execution) {
        String jobId = execution.getJobId();
        withRetry("save execution " + execution.getExecutionId(),
                () -> executionRepository.save(mapper.toDocument(execution)));

        int maxHistory = properties.getExecution().getMaxHistory();
        long count = withRetry("count executions of " + jobId, () -> executionRepository.countByJobId(jobId));
        if (count > maxHistory) {
            Query stale = Query.query(Criteria.where("jobId").is(jobId))
                    .with(Sort.by(Sort.Direction.DESC, "startedAt"))
                    .skip(maxHistory);
            stale.fields().include("_id");
            List<String> staleIds = withRetry("find stale executions of " + jobId,
                    () -> mongoTemplate.find(stale, JobExecutionDocument.class)).stream()
                    .map(JobExecutionDocument::getExecutionId)
                    .toList();
            DeleteResult deleted = withRetry("trim executions of " + jobId, () -> mongoTemplate.remove(
                    Query.query(Criteria.where("_id").in(staleIds)), JobExecutionDocument.class));
            log.debug("Trimmed {} execution(s) of job {}", deleted.getDeletedCount(), jobId);
        }
    }

    @Override
    public List<JobExecution> getExecutions(String jobId, int limit) {
        return withRetry("get executions of " + jobId,
                () -> executionRepository.findByJobIdOrderByStartedAtDesc(jobId, PageRequest.of(0, Math.max(1, limit))))
                .stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public void cleanup() {
        List<String> jobIds = withRetry("list job ids", () -> jobRepository.findAll()).stream()
                .map(JobDocument::getId)
                .toList();
        DeleteResult orphans = withRetry("remove orphan executions", () -> mongoTemplate.remove(
                Query.query(Criteria.where("jobId").nin(jobIds)), JobExecutionDocument.class));
        if (orphans.getDeletedCount() > 0) {
            log.info("Removed {} execution(s) of deleted jobs", orphans.getDeletedCount());
        }
    }

    @Override
    public String type() {
        return Constants.STORE_MONGO;
    }

    private Update toMongoUpdate(JobUpdate update) {
        Update mongoUpdate = new Update();
        setIfPresent(mongoUpdate, "name", update.getName());
        setIfPresent(mongoUpdate, "description", update.getDescription());
        setIfPresent(mongoUpdate, "command", update.getCommand());
        setIfPresent(mongoUpdate, "schedule", update.getSchedule());
        setIfPresent(mongoUpdate, "priority", update.getPriority());
        setIfPresent(mongoUpdate, "enabled", update.getEnabled());
        setIfPresent(mongoUpdate, "maxRetries", update.getMaxRetries());
        setIfPresent(mongoUpdate, "timeout", update.getTimeout());
        setIfPresent(mongoUpdate, "workingDirectory", update.getWorkingDirectory());
        setIfPresent(mongoUpdate, "tags", update.getTags());
        if (update.getEnvironment() != null) {
            update.getEnvironment().forEach((key, value) -> mongoUpdate.set("environment." + key, value));
        }
        return mongoUpdate;
    }

    private static void setIfPresent(Update update, String field, Object value) {
        if (value != null) {
            update.set(field, value);
        }
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        return jobStoreRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying {} (attempt {})", operation, context.getRetryCount() + 1);
            }
            return call.get();
        });
    }
}
