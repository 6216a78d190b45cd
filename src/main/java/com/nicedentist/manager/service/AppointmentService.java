package com.nicedentist.manager.service;

import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.repository.AppointmentStore;
import com.nicedentist.manager.repository.CustomerRepository;
import com.nicedentist.manager.repository.DentistRepository;
import com.nicedentist.manager.repository.SlotConflictException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The only entry point that mutates appointments. Every mutation reads the current
 * record from the store, changes it and writes it back; concurrent writers to the
 * same appointment are last-write-wins.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    static final String NOT_FOUND = "Appointment not found.";
    static final String CUSTOMER_CONFLICT = "Customer already has an appointment at this time.";
    static final String DENTIST_CONFLICT = "Dentist already has an appointment at this time.";
    static final String SLOT_TAKEN = "This time slot is no longer available.";

    private final AppointmentStore store;
    private final SlotService slotService;
    private final CustomerRepository customerRepository;
    private final DentistRepository dentistRepository;
    private final NotificationSender notificationSender;
    private final boolean strictStatusTransitions;

    public AppointmentService(AppointmentStore store,
                              SlotService slotService,
                              CustomerRepository customerRepository,
                              DentistRepository dentistRepository,
                              NotificationSender notificationSender,
                              @Value("${nicedentist.schedule.strict-status-transitions:false}") boolean strictStatusTransitions) {
        this.store = store;
        this.slotService = slotService;
        this.customerRepository = customerRepository;
        this.dentistRepository = dentistRepository;
        this.notificationSender = notificationSender;
        this.strictStatusTransitions = strictStatusTransitions;
    }

    // =========================================================
    // READS
    // =========================================================
    public PagedResult<Appointment> getAllAppointments(AppointmentFilter filter) {
        return store.getAll(filter);
    }

    public Optional<Appointment> getAppointment(Long id) {
        return store.getById(id);
    }

    public List<Appointment> getAppointmentsByCustomer(Long customerId) {
        return store.getByCustomerId(customerId);
    }

    public List<Appointment> getAppointmentsByDentist(Long dentistId) {
        return store.getByDentistId(dentistId);
    }

    // =========================================================
    // CREATE
    // =========================================================
    public ServiceResult<Appointment> createAppointment(Long customerId,
                                                        Long dentistId,
                                                        LocalDateTime appointmentDateTime,
                                                        String procedureType,
                                                        String notes) {
        if (!isPositive(customerId) || !isPositive(dentistId)) {
            return ServiceResult.invalid("Invalid customer or dentist ID.");
        }
        if (StringUtils.isBlank(procedureType)) {
            return ServiceResult.invalid("Procedure type is required.");
        }

        SlotService.ValidationResult validation = slotService.validateDateTime(appointmentDateTime);
        if (!validation.valid()) {
            return ServiceResult.invalid(validation.message());
        }

        Customer customer = customerRepository.findById(customerId).filter(Customer::isActive).orElse(null);
        if (customer == null) {
            return ServiceResult.invalid("Customer not found.");
        }
        Dentist dentist = dentistRepository.findById(dentistId).filter(Dentist::isActive).orElse(null);
        if (dentist == null) {
            return ServiceResult.invalid("Dentist not found.");
        }

        if (slotService.hasCustomerConflict(customerId, appointmentDateTime, null)) {
            return ServiceResult.conflict(CUSTOMER_CONFLICT);
        }
        if (slotService.hasDentistConflict(dentistId, appointmentDateTime, null)) {
            return ServiceResult.conflict(DENTIST_CONFLICT);
        }

        Appointment created;
        try {
            created = store.create(Appointment.builder()
                    .customerId(customerId)
                    .dentistId(dentistId)
                    .appointmentDateTime(appointmentDateTime)
                    .procedureType(procedureType.trim())
                    .notes(StringUtils.defaultString(notes))
                    .status(AppointmentStatus.SCHEDULED)
                    .build());
        } catch (SlotConflictException e) {
            // lost a race with a concurrent booking
            log.warn("Slot taken while booking: {}", e.getMessage());
            return ServiceResult.conflict(conflictMessage(e));
        } catch (ConcurrencyFailureException e) {
            // the database aborted the insert in favour of a concurrent booking
            log.warn("Booking for customer {} with dentist {} at {} lost a concurrent write: {}",
                    customerId, dentistId, appointmentDateTime, e.getMessage());
            return ServiceResult.conflict(conflictMessageAfterRace(customerId, dentistId, appointmentDateTime));
        }

        log.info("Created appointment {}: customer={} dentist={} at {} ({})",
                created.getId(), customerId, dentistId, appointmentDateTime, created.getProcedureType());

        try {
            boolean sent = notificationSender.sendAppointmentConfirmation(
                    customer.getEmail(),
                    customer.getName(),
                    dentist.getName(),
                    appointmentDateTime,
                    created.getProcedureType());
            if (!sent) {
                log.warn("Confirmation email for appointment {} was not sent", created.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Confirmation email for appointment {} failed", created.getId(), e);
        }

        return ServiceResult.success("Appointment created successfully.", created);
    }

    // =========================================================
    // UPDATE
    // =========================================================
    public ServiceResult<Appointment> updateAppointment(Long id,
                                                        Long customerId,
                                                        Long dentistId,
                                                        LocalDateTime appointmentDateTime,
                                                        String procedureType,
                                                        String notes) {
        Appointment existing = store.getById(id).orElse(null);
        if (existing == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (!isPositive(customerId) || !isPositive(dentistId)) {
            return ServiceResult.invalid("Invalid customer or dentist ID.");
        }
        if (StringUtils.isBlank(procedureType)) {
            return ServiceResult.invalid("Procedure type is required.");
        }

        // only a new date/time goes through the calendar rules again
        boolean timeChanged = !Objects.equals(existing.getAppointmentDateTime(), appointmentDateTime);
        if (timeChanged) {
            SlotService.ValidationResult validation = slotService.validateDateTime(appointmentDateTime);
            if (!validation.valid()) {
                return ServiceResult.invalid(validation.message());
            }
        }
        // a party that is new to this slot must be free at that time
        if ((timeChanged || !Objects.equals(existing.getCustomerId(), customerId))
                && slotService.hasCustomerConflict(customerId, appointmentDateTime, id)) {
            return ServiceResult.conflict(CUSTOMER_CONFLICT);
        }
        if ((timeChanged || !Objects.equals(existing.getDentistId(), dentistId))
                && slotService.hasDentistConflict(dentistId, appointmentDateTime, id)) {
            return ServiceResult.conflict(DENTIST_CONFLICT);
        }

        existing.setCustomerId(customerId);
        existing.setDentistId(dentistId);
        existing.setAppointmentDateTime(appointmentDateTime);
        existing.setProcedureType(procedureType.trim());
        existing.setNotes(StringUtils.defaultString(notes));

        Appointment updated = store.update(existing);
        log.info("Updated appointment {}", id);
        return ServiceResult.success("Appointment updated successfully.", updated);
    }

    /**
     * Overwrites the status. Transitions outside {@link AppointmentStatus#allowedTransitions()}
     * are logged, and rejected only when strict transitions are switched on.
     */
    public ServiceResult<Appointment> updateStatus(Long id, AppointmentStatus status, String reason) {
        if (status == null) {
            return ServiceResult.invalid("Status is required.");
        }
        Appointment appointment = store.getById(id).orElse(null);
        if (appointment == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }

        AppointmentStatus current = appointment.getStatus();
        if (current != status && !current.canTransitionTo(status)) {
            if (strictStatusTransitions) {
                return ServiceResult.invalidState("Cannot change status from "
                        + current.getDescription() + " to " + status.getDescription() + ".");
            }
            log.warn("Appointment {} status overwritten outside the transition table: {} -> {}", id, current, status);
        }

        appointment.setStatus(status);
        Appointment updated = store.update(appointment);
        log.info("Appointment {} status {} -> {} (reason: {})", id, current, status, StringUtils.defaultIfBlank(reason, "-"));
        return ServiceResult.success("Appointment status updated successfully.", updated);
    }

    // =========================================================
    // STATUS LIFECYCLE
    // =========================================================
    public ServiceResult<Appointment> requestCancellation(Long id, Long requestingCustomerId) {
        Appointment appointment = store.getById(id).orElse(null);
        if (appointment == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (!Objects.equals(appointment.getCustomerId(), requestingCustomerId)) {
            log.warn("Customer {} tried to cancel appointment {} owned by customer {}",
                    requestingCustomerId, id, appointment.getCustomerId());
            return ServiceResult.forbidden("You can only cancel your own appointments.");
        }
        if (!appointment.getStatus().canTransitionTo(AppointmentStatus.CANCELLATION_REQUESTED)) {
            return ServiceResult.invalidState("Only scheduled appointments can be cancelled.");
        }

        appointment.setStatus(AppointmentStatus.CANCELLATION_REQUESTED);
        Appointment updated = store.update(appointment);
        log.info("Cancellation requested for appointment {} by customer {}", id, requestingCustomerId);
        return ServiceResult.success("Cancellation request submitted successfully.", updated);
    }

    public ServiceResult<Appointment> cancelAppointment(Long id) {
        Appointment appointment = store.getById(id).orElse(null);
        if (appointment == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (appointment.getStatus() == AppointmentStatus.COMPLETED) {
            return ServiceResult.invalidState("Cannot cancel completed appointments.");
        }
        if (appointment.getStatus() == AppointmentStatus.CANCELLED) {
            return ServiceResult.success("Appointment is already cancelled.", appointment);
        }

        appointment.setStatus(AppointmentStatus.CANCELLED);
        Appointment updated = store.update(appointment);
        log.info("Cancelled appointment {}", id);

        notifyCancellation(updated);
        return ServiceResult.success("Appointment cancelled successfully.", updated);
    }

    public ServiceResult<Appointment> completeAppointment(Long id) {
        Appointment appointment = store.getById(id).orElse(null);
        if (appointment == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (!appointment.getStatus().canTransitionTo(AppointmentStatus.COMPLETED)) {
            return ServiceResult.invalidState("Only scheduled appointments can be completed.");
        }

        appointment.setStatus(AppointmentStatus.COMPLETED);
        Appointment updated = store.update(appointment);
        log.info("Completed appointment {}", id);
        return ServiceResult.success("Appointment marked as completed.", updated);
    }

    public boolean deleteAppointment(Long id) {
        boolean deleted = store.delete(id);
        if (deleted) {
            log.info("Deleted appointment {}", id);
        }
        return deleted;
    }

    // =========================================================
    // AVAILABILITY
    // =========================================================
    public List<LocalDateTime> getAvailableSlots(Long dentistId, LocalDate startDate, LocalDate endDate) {
        return slotService.getAvailableSlots(dentistId, startDate, endDate);
    }

    /** Free slots per active dentist, keyed by dentist id in name order. */
    public Map<Long, List<LocalDateTime>> getAllAvailableSlots(LocalDate startDate, LocalDate endDate) {
        Map<Long, List<LocalDateTime>> result = new LinkedHashMap<>();
        for (Dentist dentist : dentistRepository.findByActiveTrueOrderByName()) {
            result.put(dentist.getId(), slotService.getAvailableSlots(dentist.getId(), startDate, endDate));
        }
        return result;
    }

    public boolean isSlotAvailable(Long dentistId, LocalDateTime dateTime) {
        return slotService.isSlotAvailable(dentistId, dateTime);
    }

    private void notifyCancellation(Appointment appointment) {
        try {
            Optional<Customer> customer = customerRepository.findById(appointment.getCustomerId());
            if (customer.isEmpty()) {
                log.warn("No customer {} to notify about cancelled appointment {}",
                        appointment.getCustomerId(), appointment.getId());
                return;
            }
            boolean sent = notificationSender.sendAppointmentCancellation(
                    customer.get().getEmail(),
                    customer.get().getName(),
                    appointment.getAppointmentDateTime(),
                    appointment.getProcedureType());
            if (!sent) {
                log.warn("Cancellation email for appointment {} was not sent", appointment.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Cancellation email for appointment {} failed", appointment.getId(), e);
        }
    }

    private static String conflictMessage(SlotConflictException e) {
        return e.getParty() == SlotConflictException.Party.CUSTOMER ? CUSTOMER_CONFLICT : DENTIST_CONFLICT;
    }

    private String conflictMessageAfterRace(Long customerId, Long dentistId, LocalDateTime dateTime) {
        if (slotService.hasCustomerConflict(customerId, dateTime, null)) {
            return CUSTOMER_CONFLICT;
        }
        if (slotService.hasDentistConflict(dentistId, dateTime, null)) {
            return DENTIST_CONFLICT;
        }
        return SLOT_TAKEN;
    }

    private static boolean isPositive(Long id) {
        return id != null && id > 0;
    }
}
