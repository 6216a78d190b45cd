package com.nicedentist.manager.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nicedentist.manager.service.UserLinkService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Routes inbound integration events by type. Whatever transport delivers them
 * (HTTP relay, broker listener) hands over the type and the raw JSON body.
 */
@Component
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final ObjectMapper mapper;
    private final UserLinkService userLinkService;

    public EventDispatcher(ObjectMapper mapper, UserLinkService userLinkService) {
        this.mapper = mapper;
        this.userLinkService = userLinkService;
    }

    /**
     * @return true when a handler accepted the event; unknown types, unreadable
     *         payloads and handler failures give false
     */
    public boolean dispatch(String eventType, String json) {
        if (StringUtils.isBlank(eventType)) {
            log.warn("Dropping event without a type");
            return false;
        }
        switch (eventType.trim().toLowerCase(Locale.ROOT)) {
            case "usercreated":
                return handleUserCreated(json);
            default:
                log.warn("Unknown event type: {}", eventType);
                return false;
        }
    }

    private boolean handleUserCreated(String json) {
        UserCreatedEvent event;
        try {
            event = mapper.readValue(json, UserCreatedEvent.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable {} payload", UserCreatedEvent.TYPE, e);
            return false;
        }
        log.info("Received {} {}", UserCreatedEvent.TYPE, event.getEventId());
        return userLinkService.handleUserCreated(event);
    }
}
