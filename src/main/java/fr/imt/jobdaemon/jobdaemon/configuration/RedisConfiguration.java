package fr.imt.jobdaemon.jobdaemon.configuration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.listener.ChannelTopic;

/**
 * Only active when job events are relayed to Redis.
 */
@Configuration
@ConditionalOnProperty(prefix = "jobdaemon.events.redis", name = "enabled", havingValue = "true")
public class RedisConfiguration {

    @Bean
    public ChannelTopic jobEventsTopic(DaemonProperties properties) {
        return new ChannelTopic(properties.getEvents().getRedis().getTopic());
    }
}
