package com.nicedentist.manager.service;

import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.event.UserCreatedEvent;
import com.nicedentist.manager.repository.CustomerRepository;
import com.nicedentist.manager.repository.DentistRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Stores the auth service's user id on the customer or dentist it was created for.
 */
@Service
public class UserLinkService {

    private static final Logger log = LoggerFactory.getLogger(UserLinkService.class);

    private final CustomerRepository customerRepository;
    private final DentistRepository dentistRepository;
    private final Clock clock;

    public UserLinkService(CustomerRepository customerRepository, DentistRepository dentistRepository, Clock clock) {
        this.customerRepository = customerRepository;
        this.dentistRepository = dentistRepository;
        this.clock = clock;
    }

    /**
     * Looks the entity up by id first, then by email. Returns false when the event
     * cannot be applied; never throws.
     */
    public boolean handleUserCreated(UserCreatedEvent event) {
        UserCreatedEvent.Data data = event == null ? null : event.getData();
        if (data == null || data.getUserId() == null) {
            log.warn("UserCreated event without user data");
            return false;
        }
        String entityType = StringUtils.defaultString(data.getEntityType()).trim().toLowerCase(Locale.ROOT);
        try {
            switch (entityType) {
                case "customer":
                    return linkCustomer(data);
                case "dentist":
                    return linkDentist(data);
                default:
                    log.warn("Unknown entity type '{}' for user {}", data.getEntityType(), data.getEmail());
                    return false;
            }
        } catch (RuntimeException e) {
            log.error("Failed to link user {} to {} {}", data.getUserId(), entityType, data.getEntityId(), e);
            return false;
        }
    }

    private boolean linkCustomer(UserCreatedEvent.Data data) {
        Optional<Customer> found = Optional.ofNullable(data.getEntityId()).flatMap(customerRepository::findById);
        if (found.isEmpty()) {
            log.warn("Customer {} not found, falling back to email {}", data.getEntityId(), data.getEmail());
            found = Optional.ofNullable(data.getEmail()).flatMap(customerRepository::findByEmailIgnoreCase);
        }
        if (found.isEmpty()) {
            log.error("No customer for user {} ({})", data.getUserId(), data.getEmail());
            return false;
        }
        Customer customer = found.get();
        customer.setUserId(data.getUserId());
        customer.setUpdatedAt(Instant.now(clock));
        customerRepository.save(customer);
        log.info("Linked customer {} to user {}", customer.getId(), data.getUserId());
        return true;
    }

    private boolean linkDentist(UserCreatedEvent.Data data) {
        Optional<Dentist> found = Optional.ofNullable(data.getEntityId()).flatMap(dentistRepository::findById);
        if (found.isEmpty()) {
            log.warn("Dentist {} not found, falling back to email {}", data.getEntityId(), data.getEmail());
            found = Optional.ofNullable(data.getEmail()).flatMap(dentistRepository::findByEmailIgnoreCase);
        }
        if (found.isEmpty()) {
            log.error("No dentist for user {} ({})", data.getUserId(), data.getEmail());
            return false;
        }
        Dentist dentist = found.get();
        dentist.setUserId(data.getUserId());
        dentist.setUpdatedAt(Instant.now(clock));
        dentistRepository.save(dentist);
        log.info("Linked dentist {} to user {}", dentist.getId(), data.getUserId());
        return true;
    }
}
