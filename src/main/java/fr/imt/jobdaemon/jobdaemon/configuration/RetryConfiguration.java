package fr.imt.jobdaemon.jobdaemon.configuration;

import fr.imt.jobdaemon.jobdaemon.business.service.RetryBackoff;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfiguration {

    /**
     * Retries transient store failures (lost Mongo connection, write conflicts).
     */
    @Bean
    public RetryTemplate jobStoreRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(3)
                .exponentialBackoff(200, 2, 2000)
                .retryOn(TransientDataAccessException.class)
                .retryOn(DataAccessResourceFailureException.class)
                .build();
    }

    /**
     * Delay between failed attempts of a job.
     */
    @Bean
    public RetryBackoff jobRetryBackoff(DaemonProperties properties) {
        DaemonProperties.Retry retry = properties.getRetry();
        return new RetryBackoff(retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff());
    }
}
