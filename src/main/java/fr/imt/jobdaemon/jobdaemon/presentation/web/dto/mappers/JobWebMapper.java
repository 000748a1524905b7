package fr.imt.jobdaemon.jobdaemon.presentation.web.dto.mappers;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSpec;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.JobRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.JobResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobWebMapper {

    JobResponse toResponse(JobSpec job);

    List<JobResponse> toResponses(List<JobSpec> jobs);

    JobSpec toSpec(JobRequest request);
}
