package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.mapper;

import fr.imt.jobdaemon.jobdaemon.business.model.JobExecution;
import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobDocument;
import fr.imt.jobdaemon.jobdaemon.infrastructure.persistence.JobExecutionDocument;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface JobDocumentMapper {

    JobDocument toDocument(JobSpec job);

    JobSpec toDomain(JobDocument document);

    JobExecutionDocument toDocument(JobExecution execution);

    JobExecution toDomain(JobExecutionDocument document);
}
