package com.nicedentist.manager.event;

import com.nicedentist.manager.entity.Dentist;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Asks the auth service to provision a login for a new dentist.
 * It answers with a {@link UserCreatedEvent}.
 */
@Getter
@Setter
@NoArgsConstructor
public class DentistCreatedEvent extends IntegrationEvent {

    public static final String TYPE = "DentistCreated";

    private Data data;

    public DentistCreatedEvent(Data data) {
        this.data = data;
    }

    public static DentistCreatedEvent of(Dentist dentist) {
        return new DentistCreatedEvent(new Data(
                dentist.getId(),
                dentist.getName(),
                dentist.getEmail(),
                dentist.getLicenseNumber(),
                dentist.getSpecialization()));
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Data {
        private Long dentistId;
        private String name;
        private String email;
        private String licenseNumber;
        private String specialization;
    }
}
