package com.nicedentist.manager.repository;

import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Ephemeral store for tests and local runs. Hands out copies, so nothing a caller
 * does to a returned appointment is visible until it is passed back to {@link #update}.
 */
@Repository
@ConditionalOnProperty(name = "nicedentist.store", havingValue = "memory")
public class InMemoryAppointmentStore implements AppointmentStore {

    private static final Comparator<Appointment> BY_DATE_TIME =
            Comparator.comparing(Appointment::getAppointmentDateTime).thenComparing(Appointment::getId);

    private final Map<Long, Appointment> appointments = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Clock clock;

    public InMemoryAppointmentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Appointment create(Appointment appointment) {
        if (hasCustomerConflict(appointment.getCustomerId(), appointment.getAppointmentDateTime(), null)) {
            throw new SlotConflictException(SlotConflictException.Party.CUSTOMER,
                    appointment.getCustomerId(), appointment.getAppointmentDateTime());
        }
        if (hasDentistConflict(appointment.getDentistId(), appointment.getAppointmentDateTime(), null)) {
            throw new SlotConflictException(SlotConflictException.Party.DENTIST,
                    appointment.getDentistId(), appointment.getAppointmentDateTime());
        }

        Instant now = clock.instant();
        Appointment stored = appointment.copy();
        stored.setId(nextId.getAndIncrement());
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        if (stored.getStatus() == null) stored.setStatus(AppointmentStatus.SCHEDULED);
        if (stored.getNotes() == null) stored.setNotes("");
        appointments.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public Optional<Appointment> getById(Long id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(appointments.get(id)).map(Appointment::copy);
    }

    @Override
    public List<Appointment> getByCustomerId(Long customerId) {
        return select(a -> Objects.equals(a.getCustomerId(), customerId));
    }

    @Override
    public List<Appointment> getByDentistId(Long dentistId) {
        return select(a -> Objects.equals(a.getDentistId(), dentistId));
    }

    @Override
    public List<Appointment> getByDateRange(LocalDateTime start, LocalDateTime end) {
        return select(a -> within(a.getAppointmentDateTime(), start, end));
    }

    @Override
    public List<Appointment> getByDentistIdAndDateRange(Long dentistId, LocalDateTime start, LocalDateTime end) {
        return select(a -> Objects.equals(a.getDentistId(), dentistId) && within(a.getAppointmentDateTime(), start, end));
    }

    @Override
    public boolean hasCustomerConflict(Long customerId, LocalDateTime dateTime, Long excludeId) {
        return appointments.values().stream().anyMatch(a ->
                Objects.equals(a.getCustomerId(), customerId) && holds(a, dateTime, excludeId));
    }

    @Override
    public boolean hasDentistConflict(Long dentistId, LocalDateTime dateTime, Long excludeId) {
        return appointments.values().stream().anyMatch(a ->
                Objects.equals(a.getDentistId(), dentistId) && holds(a, dateTime, excludeId));
    }

    @Override
    public synchronized Appointment update(Appointment appointment) {
        Long id = appointment.getId();
        if (id == null || !appointments.containsKey(id)) {
            throw new IllegalArgumentException("Appointment with ID " + id + " not found");
        }
        Appointment stored = appointment.copy();
        stored.setCreatedAt(appointments.get(id).getCreatedAt());
        stored.setUpdatedAt(clock.instant());
        appointments.put(id, stored);
        return stored.copy();
    }

    @Override
    public synchronized boolean delete(Long id) {
        return id != null && appointments.remove(id) != null;
    }

    @Override
    public PagedResult<Appointment> getAll(AppointmentFilter filter) {
        List<Appointment> matching = select(a ->
                (filter.customerId() == null || Objects.equals(a.getCustomerId(), filter.customerId()))
                        && (filter.dentistId() == null || Objects.equals(a.getDentistId(), filter.dentistId()))
                        && (filter.startDate() == null || !a.getAppointmentDateTime().isBefore(filter.startDate()))
                        && (filter.endDate() == null || !a.getAppointmentDateTime().isAfter(filter.endDate()))
                        && (filter.status() == null || a.getStatus() == filter.status()));

        List<Appointment> page = matching.stream()
                .skip((long) (filter.page() - 1) * filter.pageSize())
                .limit(filter.pageSize())
                .toList();
        return new PagedResult<>(page, filter.page(), filter.pageSize(), matching.size());
    }

    private List<Appointment> select(Predicate<Appointment> predicate) {
        return appointments.values().stream()
                .filter(predicate)
                .sorted(BY_DATE_TIME)
                .map(Appointment::copy)
                .toList();
    }

    private static boolean holds(Appointment a, LocalDateTime dateTime, Long excludeId) {
        return a.occupiesSlot()
                && a.getAppointmentDateTime().equals(dateTime)
                && (excludeId == null || !excludeId.equals(a.getId()));
    }

    private static boolean within(LocalDateTime value, LocalDateTime start, LocalDateTime end) {
        return !value.isBefore(start) && !value.isAfter(end);
    }
}
