package fr.imt.jobdaemon.jobdaemon.infrastructure.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringDaemonTerminator implements DaemonTerminator {

    private final ConfigurableApplicationContext context;

    @Override
    public void terminate() {
        log.info("Shutting down the application");
        System.exit(SpringApplication.exit(context, () -> 0));
    }
}
