package com.nicedentist.manager.dto;

import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentResponse {
    private Long id;
    private Long customerId;
    private String customerName;
    private Long dentistId;
    private String dentistName;
    private LocalDateTime appointmentDateTime;
    private String procedureType;
    private String notes;
    private AppointmentStatus status;
    private String statusDescription;
    private Instant createdAt;
    private Instant updatedAt;

    public static AppointmentResponse from(Appointment appointment, String customerName, String dentistName) {
        return AppointmentResponse.builder()
                .id(appointment.getId())
                .customerId(appointment.getCustomerId())
                .customerName(customerName)
                .dentistId(appointment.getDentistId())
                .dentistName(dentistName)
                .appointmentDateTime(appointment.getAppointmentDateTime())
                .procedureType(appointment.getProcedureType())
                .notes(appointment.getNotes())
                .status(appointment.getStatus())
                .statusDescription(appointment.getStatus().getDescription())
                .createdAt(appointment.getCreatedAt())
                .updatedAt(appointment.getUpdatedAt())
                .build();
    }
}
