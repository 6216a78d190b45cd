package com.nicedentist.manager.dto;

import com.nicedentist.manager.entity.Dentist;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DentistRequest {
    private String name;
    private String email;
    private String phone;
    private String licenseNumber;
    private String specialization;
    /** Absent means active. */
    private Boolean active;

    public Dentist toDentist() {
        return Dentist.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .licenseNumber(licenseNumber)
                .specialization(specialization)
                .active(active == null || active)
                .build();
    }
}
