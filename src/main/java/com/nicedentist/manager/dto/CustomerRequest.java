package com.nicedentist.manager.dto;

import com.nicedentist.manager.entity.Customer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerRequest {
    private String name;
    private String email;
    private String phone;
    private LocalDate dateOfBirth;
    private String address;
    /** Absent means active. */
    private Boolean active;

    public Customer toCustomer() {
        return Customer.builder()
                .name(name)
                .email(email)
                .phone(phone)
                .dateOfBirth(dateOfBirth)
                .address(address)
                .active(active == null || active)
                .build();
    }
}
