package com.nicedentist.manager.repository;

import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.LocalDateTime;
import java.util.List;

public interface AppointmentRepository extends JpaRepository<Appointment, Long>, JpaSpecificationExecutor<Appointment> {

    List<Appointment> findByCustomerIdOrderByAppointmentDateTimeAsc(Long customerId);

    List<Appointment> findByDentistIdOrderByAppointmentDateTimeAsc(Long dentistId);

    List<Appointment> findByAppointmentDateTimeBetweenOrderByAppointmentDateTimeAsc(LocalDateTime start, LocalDateTime end);

    List<Appointment> findByDentistIdAndAppointmentDateTimeBetweenOrderByAppointmentDateTimeAsc(
            Long dentistId,
            LocalDateTime start,
            LocalDateTime end
    );

    boolean existsByCustomerIdAndAppointmentDateTimeAndStatusNot(
            Long customerId,
            LocalDateTime dateTime,
            AppointmentStatus status
    );

    boolean existsByCustomerIdAndAppointmentDateTimeAndStatusNotAndIdNot(
            Long customerId,
            LocalDateTime dateTime,
            AppointmentStatus status,
            Long id
    );

    boolean existsByDentistIdAndAppointmentDateTimeAndStatusNot(
            Long dentistId,
            LocalDateTime dateTime,
            AppointmentStatus status
    );

    boolean existsByDentistIdAndAppointmentDateTimeAndStatusNotAndIdNot(
            Long dentistId,
            LocalDateTime dateTime,
            AppointmentStatus status,
            Long id
    );
}
