package com.nicedentist.manager.controller;

import com.nicedentist.manager.event.EventDispatcher;
import com.nicedentist.manager.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Inbound side of the integration events. A relay posts the raw event JSON with its type
 * in {@code X-Event-Type}; 202 means it was applied, 422 that it was dropped.
 */
@RestController
public class IntegrationEventController {

    private static final Logger log = LoggerFactory.getLogger(IntegrationEventController.class);

    private final EventDispatcher dispatcher;

    public IntegrationEventController(EventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(value = "/api/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> receive(@RequestHeader(EventPublisher.EVENT_TYPE_HEADER) String eventType,
                                                       @RequestBody String body) {
        boolean handled = dispatcher.dispatch(eventType, body);
        if (!handled) {
            log.warn("Event {} was not applied", eventType);
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("eventType", eventType, "handled", false));
        }
        return ResponseEntity.accepted().body(Map.of("eventType", eventType, "handled", true));
    }
}
