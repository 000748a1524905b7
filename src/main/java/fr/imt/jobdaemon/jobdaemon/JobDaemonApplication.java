package fr.imt.jobdaemon.jobdaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobDaemonApplication.class, args);
    }

}
