package com.nicedentist.manager.repository;

import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.entity.Appointment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keyed persistence for appointments. The store owns the canonical set of
 * appointments; callers read, modify and write back through it.
 * <p>
 * Conflict checks use exact timestamp equality and ignore cancelled appointments.
 * Both implementations must agree on that.
 */
public interface AppointmentStore {

    /**
     * Assigns the id and both timestamps, then stores the appointment.
     *
     * @throws SlotConflictException if a non-cancelled appointment already holds the
     *                               same slot for the customer or the dentist
     */
    Appointment create(Appointment appointment);

    Optional<Appointment> getById(Long id);

    List<Appointment> getByCustomerId(Long customerId);

    List<Appointment> getByDentistId(Long dentistId);

    /** Appointments whose date/time lies within [start, end], ordered by date/time. */
    List<Appointment> getByDateRange(LocalDateTime start, LocalDateTime end);

    List<Appointment> getByDentistIdAndDateRange(Long dentistId, LocalDateTime start, LocalDateTime end);

    boolean hasCustomerConflict(Long customerId, LocalDateTime dateTime, Long excludeId);

    boolean hasDentistConflict(Long dentistId, LocalDateTime dateTime, Long excludeId);

    /**
     * Overwrites the stored appointment and refreshes {@code updatedAt}.
     *
     * @throws IllegalArgumentException if no appointment has the given id
     */
    Appointment update(Appointment appointment);

    boolean delete(Long id);

    PagedResult<Appointment> getAll(AppointmentFilter filter);
}
