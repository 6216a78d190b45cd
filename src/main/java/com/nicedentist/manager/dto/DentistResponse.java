package com.nicedentist.manager.dto;

import com.nicedentist.manager.entity.Dentist;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DentistResponse {
    private Long id;
    private String name;
    private String email;
    private String phone;
    private String licenseNumber;
    private String specialization;
    private Long userId;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static DentistResponse from(Dentist d) {
        return new DentistResponse(d.getId(), d.getName(), d.getEmail(), d.getPhone(), d.getLicenseNumber(),
                d.getSpecialization(), d.getUserId(), d.isActive(), d.getCreatedAt(), d.getUpdatedAt());
    }
}
