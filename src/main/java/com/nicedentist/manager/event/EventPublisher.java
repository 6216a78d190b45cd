package com.nicedentist.manager.event;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts outbound integration events as JSON to a relay endpoint.
 * The event type travels in the {@code X-Event-Type} header, the same header
 * {@code /api/events} reads on the way in.
 */
@Service
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    public static final String EVENT_TYPE_HEADER = "X-Event-Type";

    private final RestTemplate restTemplate;
    private final boolean enabled;
    private final String endpoint;

    public EventPublisher(RestTemplateBuilder builder,
                          @Value("${nicedentist.events.enabled:false}") boolean enabled,
                          @Value("${nicedentist.events.endpoint:}") String endpoint) {
        this.restTemplate = builder.build();
        this.enabled = enabled && StringUtils.isNotBlank(endpoint);
        this.endpoint = endpoint;
        if (enabled && StringUtils.isBlank(endpoint)) {
            log.warn("Event publishing enabled without nicedentist.events.endpoint; events will only be logged");
        }
    }

    public boolean publish(IntegrationEvent event) {
        if (!enabled) {
            log.info("Event publishing disabled, not sending {} {}", event.getEventType(), event.getEventId());
            return true;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_TYPE_HEADER, event.getEventType());

        try {
            restTemplate.postForEntity(endpoint, new HttpEntity<>(event, headers), Void.class);
            log.info("Published {} {}", event.getEventType(), event.getEventId());
            return true;
        } catch (RestClientException e) {
            log.error("Failed to publish {} {} to {}", event.getEventType(), event.getEventId(), endpoint, e);
            return false;
        }
    }
}
