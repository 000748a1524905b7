package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.repository;

import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobExecutionDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobExecutionDocumentRepository extends MongoRepository<JobExecutionDocument, String> {

    List<JobExecutionDocument> findByJobIdOrderByStartedAtDesc(String jobId, Pageable pageable);

    long countByJobId(String jobId);

    void deleteByJobId(String jobId);
}
