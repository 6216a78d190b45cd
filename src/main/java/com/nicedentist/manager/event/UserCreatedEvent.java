package com.nicedentist.manager.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Sent by the auth service once it has created a login for a customer or dentist.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserCreatedEvent extends IntegrationEvent {

    public static final String TYPE = "UserCreated";

    private Data data;

    public UserCreatedEvent(Data data) {
        this.data = data;
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        private Long userId;
        private String email;
        private String role;
        /** "customer" or "dentist", any case. */
        private String entityType;
        private Long entityId;
    }
}
