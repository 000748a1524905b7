package fr.imt.jobdaemon.jobdaemon.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.utils.JsonMappers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The daemon and its clients must agree on the wire format, so both use the same mapper setup.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonMappers.create();
    }
}
