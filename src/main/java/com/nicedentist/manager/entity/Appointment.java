package com.nicedentist.manager.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "ix_appointment_customer_slot", columnList = "customer_id, appointment_date_time"),
    @Index(name = "ix_appointment_dentist_slot", columnList = "dentist_id, appointment_date_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class Appointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "dentist_id", nullable = false)
    private Long dentistId;

    @Column(name = "appointment_date_time", nullable = false)
    private LocalDateTime appointmentDateTime;

    @Column(name = "procedure_type", nullable = false, length = 100)
    private String procedureType;

    @Column(length = 1000)
    @Builder.Default
    private String notes = "";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.SCHEDULED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** A cancelled appointment no longer occupies its slot. */
    public boolean occupiesSlot() {
        return status != AppointmentStatus.CANCELLED;
    }

    public Appointment copy() {
        return toBuilder().build();
    }
}
