package com.nicedentist.manager.service;

import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.repository.AppointmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business calendar rules and double-booking checks.
 * Slots are fixed-length, so a conflict means the exact same start time.
 * Nothing here writes; the store is the only data source.
 */
@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);
    private static final DateTimeFormatter HOURS = DateTimeFormatter.ofPattern("HH:mm");

    static final String PAST_MESSAGE = "Cannot schedule appointments in the past.";
    static final String WEEKEND_MESSAGE = "Appointments cannot be scheduled on weekends.";

    private final AppointmentStore store;
    private final Clock clock;
    private final LocalTime businessStart;
    private final LocalTime businessEnd;
    private final int slotMinutes;

    @Autowired
    public SlotService(AppointmentStore store,
                       Clock clock,
                       @Value("${nicedentist.schedule.open:08:00}") String businessStart,
                       @Value("${nicedentist.schedule.close:18:00}") String businessEnd,
                       @Value("${nicedentist.schedule.slot-minutes:30}") int slotMinutes) {
        this(store, clock, LocalTime.parse(businessStart), LocalTime.parse(businessEnd), slotMinutes);
    }

    public SlotService(AppointmentStore store, Clock clock, LocalTime businessStart, LocalTime businessEnd, int slotMinutes) {
        if (!businessStart.isBefore(businessEnd)) {
            throw new IllegalArgumentException("Business hours must open before they close: " + businessStart + "-" + businessEnd);
        }
        if (slotMinutes <= 0) {
            throw new IllegalArgumentException("Slot length must be positive: " + slotMinutes);
        }
        this.store = store;
        this.clock = clock;
        this.businessStart = businessStart;
        this.businessEnd = businessEnd;
        this.slotMinutes = slotMinutes;
    }

    public LocalTime getBusinessStart() {
        return businessStart;
    }

    public LocalTime getBusinessEnd() {
        return businessEnd;
    }

    public int getSlotMinutes() {
        return slotMinutes;
    }

    /**
     * Checks, in order: strictly in the future, inside business hours, on a weekday.
     * Only the first failure is reported.
     */
    public ValidationResult validateDateTime(LocalDateTime dateTime) {
        if (dateTime == null) {
            return ValidationResult.invalid("Appointment date and time is required.");
        }
        if (!dateTime.isAfter(LocalDateTime.now(clock))) {
            return ValidationResult.invalid(PAST_MESSAGE);
        }
        if (!isWithinBusinessHours(dateTime.toLocalTime())) {
            return ValidationResult.invalid(businessHoursMessage());
        }
        if (isWeekend(dateTime.toLocalDate())) {
            return ValidationResult.invalid(WEEKEND_MESSAGE);
        }
        return ValidationResult.VALID;
    }

    public boolean hasCustomerConflict(Long customerId, LocalDateTime dateTime, Long excludeId) {
        return store.hasCustomerConflict(customerId, dateTime, excludeId);
    }

    public boolean hasDentistConflict(Long dentistId, LocalDateTime dateTime, Long excludeId) {
        return store.hasDentistConflict(dentistId, dateTime, excludeId);
    }

    /**
     * Free slots for a dentist from {@code startDate} at opening to {@code endDate} at closing,
     * weekdays only. Recomputed on every call.
     */
    public List<LocalDateTime> getAvailableSlots(Long dentistId, LocalDate startDate, LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            return List.of();
        }

        // one read for the whole window instead of a conflict query per slot
        Set<LocalDateTime> taken = store
                .getByDentistIdAndDateRange(dentistId, startDate.atTime(businessStart), endDate.atTime(businessEnd))
                .stream()
                .filter(Appointment::occupiesSlot)
                .map(Appointment::getAppointmentDateTime)
                .collect(Collectors.toSet());

        List<LocalDateTime> slots = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            if (isWeekend(date)) continue;
            LocalDateTime close = date.atTime(businessEnd);
            for (LocalDateTime slot = date.atTime(businessStart); slot.isBefore(close); slot = slot.plusMinutes(slotMinutes)) {
                if (!taken.contains(slot)) {
                    slots.add(slot);
                }
            }
        }
        log.debug("Dentist {} has {} free slots between {} and {}", dentistId, slots.size(), startDate, endDate);
        return slots;
    }

    public boolean isSlotAvailable(Long dentistId, LocalDateTime dateTime) {
        return validateDateTime(dateTime).valid() && !store.hasDentistConflict(dentistId, dateTime, null);
    }

    public boolean isWithinBusinessHours(LocalTime time) {
        return !time.isBefore(businessStart) && time.isBefore(businessEnd);
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    String businessHoursMessage() {
        return "Appointments can only be scheduled between " + businessStart.format(HOURS)
                + " and " + businessEnd.format(HOURS) + ".";
    }

    public record ValidationResult(boolean valid, String message) {

        static final ValidationResult VALID = new ValidationResult(true, "");

        static ValidationResult invalid(String message) {
            return new ValidationResult(false, message);
        }
    }
}
