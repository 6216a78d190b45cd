package com.nicedentist.manager.repository;

import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Relational store, the source of truth in production.
 * The insert runs in a SERIALIZABLE transaction together with its conflict checks,
 * so two requests racing for the same slot cannot both succeed.
 */
@Repository
@ConditionalOnProperty(name = "nicedentist.store", havingValue = "jpa", matchIfMissing = true)
public class JpaAppointmentStore implements AppointmentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAppointmentStore.class);

    private final AppointmentRepository repository;
    private final Clock clock;

    public JpaAppointmentStore(AppointmentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public Appointment create(Appointment appointment) {
        if (hasCustomerConflict(appointment.getCustomerId(), appointment.getAppointmentDateTime(), null)) {
            throw new SlotConflictException(SlotConflictException.Party.CUSTOMER,
                    appointment.getCustomerId(), appointment.getAppointmentDateTime());
        }
        if (hasDentistConflict(appointment.getDentistId(), appointment.getAppointmentDateTime(), null)) {
            throw new SlotConflictException(SlotConflictException.Party.DENTIST,
                    appointment.getDentistId(), appointment.getAppointmentDateTime());
        }

        Instant now = clock.instant();
        Appointment toSave = appointment.copy();
        toSave.setId(null);
        toSave.setCreatedAt(now);
        toSave.setUpdatedAt(now);
        if (toSave.getStatus() == null) toSave.setStatus(AppointmentStatus.SCHEDULED);
        if (toSave.getNotes() == null) toSave.setNotes("");

        Appointment saved = repository.save(toSave);
        log.debug("Inserted appointment {}", saved.getId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Appointment> getById(Long id) {
        if (id == null) return Optional.empty();
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Appointment> getByCustomerId(Long customerId) {
        return repository.findByCustomerIdOrderByAppointmentDateTimeAsc(customerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Appointment> getByDentistId(Long dentistId) {
        return repository.findByDentistIdOrderByAppointmentDateTimeAsc(dentistId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Appointment> getByDateRange(LocalDateTime start, LocalDateTime end) {
        return repository.findByAppointmentDateTimeBetweenOrderByAppointmentDateTimeAsc(start, end);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Appointment> getByDentistIdAndDateRange(Long dentistId, LocalDateTime start, LocalDateTime end) {
        return repository.findByDentistIdAndAppointmentDateTimeBetweenOrderByAppointmentDateTimeAsc(dentistId, start, end);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasCustomerConflict(Long customerId, LocalDateTime dateTime, Long excludeId) {
        return excludeId == null
                ? repository.existsByCustomerIdAndAppointmentDateTimeAndStatusNot(
                        customerId, dateTime, AppointmentStatus.CANCELLED)
                : repository.existsByCustomerIdAndAppointmentDateTimeAndStatusNotAndIdNot(
                        customerId, dateTime, AppointmentStatus.CANCELLED, excludeId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasDentistConflict(Long dentistId, LocalDateTime dateTime, Long excludeId) {
        return excludeId == null
                ? repository.existsByDentistIdAndAppointmentDateTimeAndStatusNot(
                        dentistId, dateTime, AppointmentStatus.CANCELLED)
                : repository.existsByDentistIdAndAppointmentDateTimeAndStatusNotAndIdNot(
                        dentistId, dateTime, AppointmentStatus.CANCELLED, excludeId);
    }

    @Override
    @Transactional
    public Appointment update(Appointment appointment) {
        if (appointment.getId() == null || !repository.existsById(appointment.getId())) {
            throw new IllegalArgumentException("Appointment with ID " + appointment.getId() + " not found");
        }
        appointment.setUpdatedAt(clock.instant());
        return repository.save(appointment);
    }

    @Override
    @Transactional
    public boolean delete(Long id) {
        if (id == null || !repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public PagedResult<Appointment> getAll(AppointmentFilter filter) {
        PageRequest pageRequest = PageRequest.of(
                filter.page() - 1,
                filter.pageSize(),
                Sort.by("appointmentDateTime").ascending().and(Sort.by("id")));
        Page<Appointment> page = repository.findAll(toSpecification(filter), pageRequest);
        return PagedResult.of(page);
    }

    private static Specification<Appointment> toSpecification(AppointmentFilter filter) {
        Specification<Appointment> spec = Specification.where(null);
        if (filter.customerId() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("customerId"), filter.customerId()));
        }
        if (filter.dentistId() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("dentistId"), filter.dentistId()));
        }
        if (filter.startDate() != null) {
            spec = spec.and((root, q, cb) ->
                    cb.greaterThanOrEqualTo(root.<LocalDateTime>get("appointmentDateTime"), filter.startDate()));
        }
        if (filter.endDate() != null) {
            spec = spec.and((root, q, cb) ->
                    cb.lessThanOrEqualTo(root.<LocalDateTime>get("appointmentDateTime"), filter.endDate()));
        }
        if (filter.status() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), filter.status()));
        }
        return spec;
    }
}
