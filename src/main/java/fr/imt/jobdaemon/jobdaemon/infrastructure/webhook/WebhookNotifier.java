package fr.imt.jobdaemon.jobdaemon.infrastructure.webhook;

import fr.imt.jobdaemon.jobdaemon.business.event.JobEventListener;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEvent;
import fr.imt.jobdaemon.jobdaemon.business.model.JobEventType;
import fr.imt.jobdaemon.jobdaemon.configuration.DaemonProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Posts every job event as JSON to the registered webhook endpoints.
 * A failing endpoint is logged and never affects the daemon or the other endpoints.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "jobdaemon.events.webhooks", name = "enabled", havingValue = "true")
public class WebhookNotifier implements JobEventListener {

    public static final String EVENT_HEADER = "X-JobDaemon-Event";

    static final String SOURCE = "jobdaemon";

    private final RestTemplate restTemplate;
    private final CopyOnWriteArrayList<String> endpoints = new CopyOnWriteArrayList<>();

    @Autowired
    public WebhookNotifier(DaemonProperties properties, RestTemplateBuilder restTemplateBuilder) {
        this(properties, restTemplateBuilder
                .setConnectTimeout(properties.getEvents().getWebhooks().getTimeout())
                .setReadTimeout(properties.getEvents().getWebhooks().getTimeout())
                .build());
    }

    WebhookNotifier(DaemonProperties properties, RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
        properties.getEvents().getWebhooks().getEndpoints().forEach(this::register);
    }

    /**
     * Adds an endpoint. Registering the same URL twice has no effect.
     *
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     */
    public void register(String endpoint) {
        String url = endpoint == null ? "" : endpoint.trim();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid webhook URL: " + endpoint, e);
        }
        if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
            throw new IllegalArgumentException("Webhook URL must be an absolute http or https URL: " + endpoint);
        }
        if (endpoints.addIfAbsent(url)) {
            log.info("Registered webhook endpoint {}", url);
        }
    }

    public List<String> endpoints() {
        return List.copyOf(endpoints);
    }

    @Override
    public void onEvent(JobEvent event) {
        if (endpoints.isEmpty()) {
            return;
        }
        String eventName = eventName(event.getType());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventName);
        payload.put("data", event);
        payload.put("timestamp", event.getTimestamp() != null ? event.getTimestamp() : Instant.now());
        payload.put("source", SOURCE);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_HEADER, eventName);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        for (String endpoint : endpoints) {
            try {
                restTemplate.postForEntity(endpoint, request, Void.class);
            } catch (RestClientException e) {
                log.warn("Webhook {} failed for {} on job {}: {}", endpoint, eventName, event.getJobId(), e.getMessage());
            }
        }
    }

    /**
     * {@code JOB_STARTED} becomes {@code job.started}, {@code JOB_TIMED_OUT} becomes {@code job.timed_out}.
     */
    static String eventName(JobEventType type) {
        return type.name().toLowerCase(Locale.ROOT).replaceFirst("_", ".");
    }
}
