package fr.imt.jobdaemon.jobdaemon.presentation.web.dto;

import fr.imt.jobdaemon.jobdaemon.business.model.JobSchedule;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class JobRequest {
    private String id;
    private String name;
    private String description;
    @NotBlank
    private String command;
    private JobSchedule schedule;
    @Min(0)
    @Max(10)
    private Integer priority;
    private Boolean enabled;
    @PositiveOrZero
    private Integer maxRetries;
    @PositiveOrZero
    private Long timeout;
    private String workingDirectory;
    private Map<String, String> environment;
    private List<String> tags;
}
