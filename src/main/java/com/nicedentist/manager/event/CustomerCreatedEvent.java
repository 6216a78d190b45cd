package com.nicedentist.manager.event;

import com.nicedentist.manager.entity.Customer;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class CustomerCreatedEvent extends IntegrationEvent {

    public static final String TYPE = "CustomerCreated";

    private Data data;

    public CustomerCreatedEvent(Data data) {
        this.data = data;
    }

    public static CustomerCreatedEvent of(Customer customer) {
        return new CustomerCreatedEvent(new Data(customer.getId(), customer.getName(), customer.getEmail(), customer.getPhone()));
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
        private Long customerId;
        private String name;
        private String email;
        private String phone;
    }
}
