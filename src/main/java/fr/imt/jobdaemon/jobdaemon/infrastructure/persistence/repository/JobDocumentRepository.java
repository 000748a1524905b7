package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.repository;

import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JobDocumentRepository extends MongoRepository<JobDocument, String> {
}
