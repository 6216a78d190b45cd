package com.nicedentist.manager.config;

import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.repository.CustomerRepository;
import com.nicedentist.manager.repository.DentistRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Idempotent demo data: a few dentists and one customer, inserted only when the
 * tables are empty. Seeded records go straight to the repositories, so no auth
 * users or events are created for them.
 */
@Component
@ConditionalOnProperty(name = "nicedentist.seed.enabled", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final DentistRepository dentistRepository;
    private final CustomerRepository customerRepository;

    public DataInitializer(DentistRepository dentistRepository, CustomerRepository customerRepository) {
        this.dentistRepository = dentistRepository;
        this.customerRepository = customerRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        if (dentistRepository.count() == 0) {
            log.info("Seeding dentists...");
            dentistRepository.saveAll(List.of(
                    Dentist.builder().name("Dr. Sarah Johnson").email("sarah.johnson@nicedentist.com").phone("555-0101")
                            .licenseNumber("DDS-10001").specialization("General Dentistry").active(true).build(),
                    Dentist.builder().name("Dr. Michael Chen").email("michael.chen@nicedentist.com").phone("555-0102")
                            .licenseNumber("DDS-10002").specialization("Orthodontics").active(true).build(),
                    Dentist.builder().name("Dr. Emily Davis").email("emily.davis@nicedentist.com").phone("555-0103")
                            .licenseNumber("DDS-10003").specialization("Pediatric Dentistry").active(true).build()
            ));
        }
        if (customerRepository.count() == 0) {
            log.info("Seeding customers...");
            customerRepository.save(Customer.builder().name("John Doe").email("john.doe@example.com").phone("555-0199")
                    .dateOfBirth(LocalDate.of(1985, 4, 12)).address("123 Main St").active(true).build());
        }
        log.info("DataInitializer: dentists={}, customers={}", dentistRepository.count(), customerRepository.count());
    }
}
