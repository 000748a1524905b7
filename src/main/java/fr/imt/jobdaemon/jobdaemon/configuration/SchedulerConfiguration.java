package fr.imt.jobdaemon.jobdaemon.configuration;

import fr.imt.jobdaemon.jobdaemon.business.scheduler.HeapJobScheduler;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.JobScheduler;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.LinearScanJobScheduler;
import fr.imt.jobdaemon.jobdaemon.business.scheduler.NextRunCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class SchedulerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public JobScheduler jobScheduler(DaemonProperties properties, Clock clock) {
        DaemonProperties.Scheduler scheduler = properties.getScheduler();
        if (scheduler.isLegacy()) {
            log.info("Using legacy scan scheduler, checking every {}", scheduler.getCheckInterval());
            return new LinearScanJobScheduler(clock, scheduler.getCheckInterval());
        }
        log.info("Using heap scheduler, max sleep {}", scheduler.getMaxSleep());
        return new HeapJobScheduler(clock, scheduler.getMaxSleep());
    }

    @Bean
    public NextRunCalculator nextRunCalculator(Clock clock) {
        return new NextRunCalculator(clock);
    }
}
