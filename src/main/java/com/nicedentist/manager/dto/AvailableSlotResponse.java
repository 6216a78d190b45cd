package com.nicedentist.manager.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AvailableSlotResponse {
    private Long dentistId;
    private String dentistName;
    private LocalDateTime dateTime;
    private int durationMinutes;
    private boolean available;
}
