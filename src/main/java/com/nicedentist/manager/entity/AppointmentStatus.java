package com.nicedentist.manager.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an appointment.
 * <p>
 * COMPLETED and CANCELLED are terminal. A customer's cancellation request can be
 * approved (CANCELLED) or rejected (back to SCHEDULED).
 */
public enum AppointmentStatus {

    SCHEDULED("Scheduled"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled"),
    CANCELLATION_REQUESTED("Cancellation Requested");

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> ALLOWED = new EnumMap<>(AppointmentStatus.class);

    static {
        ALLOWED.put(SCHEDULED, EnumSet.of(COMPLETED, CANCELLED, CANCELLATION_REQUESTED));
        ALLOWED.put(CANCELLATION_REQUESTED, EnumSet.of(CANCELLED, SCHEDULED));
        ALLOWED.put(COMPLETED, EnumSet.noneOf(AppointmentStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(AppointmentStatus.class));
    }

    private final String description;

    AppointmentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public Set<AppointmentStatus> allowedTransitions() {
        return Collections.unmodifiableSet(ALLOWED.get(this));
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        return target != null && ALLOWED.get(this).contains(target);
    }

    public boolean isTerminal() {
        return ALLOWED.get(this).isEmpty();
    }

    /** Parses either the enum name or its description, ignoring case, spaces and underscores. */
    public static AppointmentStatus parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Status is required.");
        }
        String normalized = value.replace("_", "").replace(" ", "").trim();
        for (AppointmentStatus s : values()) {
            if (s.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown appointment status: " + value);
    }
}
