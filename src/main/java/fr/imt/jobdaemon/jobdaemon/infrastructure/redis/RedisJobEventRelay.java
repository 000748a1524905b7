package fr.imt.jobdaemon.jobdaemon.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.imt.jobdaemon.jobdaemon.business.event.JobEventListener;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.stereotype.Component;

/**
 * Publishes every job event as JSON on a Redis channel. Redis being down never affects the daemon.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobdaemon.events.redis", name = "enabled", havingValue = "true")
public class RedisJobEventRelay implements JobEventListener {

    private final StringRedisTemplate redisTemplate;
    private final ChannelTopic jobEventsTopic;
    private final ObjectMapper objectMapper;

    @Override
    public void onEvent(JobEvent event) {
        try {
            String message = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(jobEventsTopic.getTopic(), message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize job event {} for job {}", event.getType(), event.getJobId(), e);
        } catch (Exception e) {
            log.error("Failed to relay job event {} for job {}", event.getType(), event.getJobId(), e);
        }
    }
}
