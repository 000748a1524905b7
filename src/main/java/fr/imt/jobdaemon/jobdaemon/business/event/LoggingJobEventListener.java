package fr.imt.jobdaemon.jobdaemon.business.event;

import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingJobEventListener implements JobEventListener {

    @Override
    public void onEvent(JobEvent event) {
        switch (event.getType()) {
            case JOB_FAILED, JOB_TIMED_OUT -> log.warn("[{}] job={} name={} status={} exitCode={} {}",
                    event.getType(), event.getJobId(), event.getJobName(), event.getStatus(),
                    event.getExitCode(), event.getMessage() != null ? event.getMessage() : "");
            case DAEMON_STARTED, DAEMON_STOPPED -> log.info("[{}] {}", event.getType(),
                    event.getMessage() != null ? event.getMessage() : "");
            default -> log.info("[{}] job={} name={} status={}",
                    event.getType(), event.getJobId(), event.getJobName(), event.getStatus());
        }
    }
}
