package com.nicedentist.manager.service;

import java.time.LocalDateTime;

/**
 * Outbound messages to customers. Every call is best-effort: the boolean is advisory
 * and callers must not undo anything when it is false.
 */
public interface NotificationSender {

    boolean sendWelcome(String email, String name, String username, String password, String role);

    boolean sendAppointmentConfirmation(String email,
                                        String customerName,
                                        String dentistName,
                                        LocalDateTime appointmentDateTime,
                                        String procedureType);

    boolean sendAppointmentCancellation(String email,
                                        String customerName,
                                        LocalDateTime appointmentDateTime,
                                        String procedureType);
}
