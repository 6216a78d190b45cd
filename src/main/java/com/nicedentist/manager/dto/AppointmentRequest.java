package com.nicedentist.manager.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/** Body of create and update calls. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentRequest {
    private Long customerId;
    private Long dentistId;
    private LocalDateTime appointmentDateTime;
    private String procedureType;
    private String notes;
}
