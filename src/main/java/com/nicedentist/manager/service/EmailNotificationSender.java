package com.nicedentist.manager.service;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders customer emails and hands them to the log. SMTP delivery is not wired in;
 * the rendered subject and body are what a mail relay would send.
 */
@Service
public class EmailNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationSender.class);

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.ENGLISH);

    private final boolean enabled;
    private final String from;
    private final String clinicName;

    public EmailNotificationSender(@Value("${nicedentist.email.enabled:true}") boolean enabled,
                                   @Value("${nicedentist.email.from:no-reply@nicedentist.com}") String from,
                                   @Value("${nicedentist.email.clinic-name:NiceDentist}") String clinicName) {
        this.enabled = enabled;
        this.from = from;
        this.clinicName = clinicName;
    }

    @Override
    public boolean sendWelcome(String email, String name, String username, String password, String role) {
        String subject = "Welcome to " + clinicName + " - Your Account Details";
        String body = "Dear " + name + ",\n\n"
                + "Your " + StringUtils.lowerCase(role) + " account at " + clinicName + " has been created.\n\n"
                + "Username: " + username + "\n"
                + "Temporary password: " + password + "\n\n"
                + "Please change your password after your first login.\n\n"
                + "Best regards,\nThe " + clinicName + " Team";
        return send("welcome", email, subject, body);
    }

    @Override
    public boolean sendAppointmentConfirmation(String email,
                                               String customerName,
                                               String dentistName,
                                               LocalDateTime appointmentDateTime,
                                               String procedureType) {
        String subject = "Appointment Confirmation - " + clinicName;
        String body = "Dear " + customerName + ",\n\n"
                + "Your appointment has been confirmed.\n\n"
                + "Date: " + appointmentDateTime.format(DATE) + "\n"
                + "Time: " + appointmentDateTime.format(TIME) + "\n"
                + "Dentist: " + dentistName + "\n"
                + "Procedure: " + procedureType + "\n\n"
                + "Please arrive 15 minutes early. If you need to cancel, request it at least 24 hours in advance.\n\n"
                + "Best regards,\nThe " + clinicName + " Team";
        return send("appointment confirmation", email, subject, body);
    }

    @Override
    public boolean sendAppointmentCancellation(String email,
                                               String customerName,
                                               LocalDateTime appointmentDateTime,
                                               String procedureType) {
        String subject = "Appointment Cancelled - " + clinicName;
        String body = "Dear " + customerName + ",\n\n"
                + "Your " + procedureType + " appointment on " + appointmentDateTime.format(DATE)
                + " at " + appointmentDateTime.format(TIME) + " has been cancelled.\n\n"
                + "Contact us if you would like to book a new time.\n\n"
                + "Best regards,\nThe " + clinicName + " Team";
        return send("appointment cancellation", email, subject, body);
    }

    private boolean send(String kind, String to, String subject, String body) {
        if (!enabled) {
            log.info("Email disabled, skipping {} email for {}", kind, to);
            return true;
        }
        if (StringUtils.isBlank(to)) {
            log.warn("No recipient address for {} email", kind);
            return false;
        }
        // never log the body: welcome emails carry the temporary password
        log.info("Sending {} email from {} to {}: \"{}\" ({} chars)", kind, from, to, subject, body.length());
        return true;
    }
}
