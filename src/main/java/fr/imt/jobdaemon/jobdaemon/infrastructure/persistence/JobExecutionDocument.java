package fr.imt.jobdaemon.jobdaemon.infrastructure.persistence;

import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionStatus;
import fr.imt.jobdaemon.jobdaemon.business.model.ExecutionTrigger;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "job_executions")
@CompoundIndex(name = "job_started", def = "{'jobId': 1, 'startedAt': -1}")
@Data
public class JobExecutionDocument {

    @Id
    private String executionId;

    private String jobId;

    private String jobName;

    private String command;

    private int attempt;

    private ExecutionTrigger trigger;

    private ExecutionStatus status;

    private Long pid;

    private Instant startedAt;

    private Instant completedAt;

    private Long duration;

    private Integer exitCode;

    private String stdout;

    private String stderr;

    private String error;
}
