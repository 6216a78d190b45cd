package com.nicedentist.manager.event;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope shared by every message exchanged with the auth service.
 * The payload lives in the subclass as {@code data}.
 */
@Getter
@Setter
public abstract class IntegrationEvent {

    private String eventId = UUID.randomUUID().toString();
    private Instant timestamp = Instant.now();

    public abstract String getEventType();
}
