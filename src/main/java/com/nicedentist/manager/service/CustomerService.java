package com.nicedentist.manager.service;

import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.event.CustomerCreatedEvent;
import com.nicedentist.manager.event.EventPublisher;
import com.nicedentist.manager.repository.CustomerRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Customer records plus their login in the auth service. A customer is only stored
 * once the auth service has accepted the user; the login is removed again when
 * storing fails.
 */
@Service
public class CustomerService {

    private static final Logger log = LoggerFactory.getLogger(CustomerService.class);

    static final String ROLE = "Customer";
    static final String NOT_FOUND = "Customer not found.";
    static final String DUPLICATE_EMAIL = "A customer with this email already exists.";

    private static final String PASSWORD_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789!@#$%";
    private static final int PASSWORD_LENGTH = 12;

    private final CustomerRepository customerRepository;
    private final AuthApiService authApiService;
    private final NotificationSender notificationSender;
    private final EventPublisher eventPublisher;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CustomerService(CustomerRepository customerRepository,
                           AuthApiService authApiService,
                           NotificationSender notificationSender,
                           EventPublisher eventPublisher,
                           Clock clock) {
        this.customerRepository = customerRepository;
        this.authApiService = authApiService;
        this.notificationSender = notificationSender;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public ServiceResult<Customer> createCustomer(Customer customer) {
        if (StringUtils.isAnyBlank(customer.getName(), customer.getEmail(), customer.getPhone())) {
            return ServiceResult.invalid("Name, email and phone are required.");
        }
        String email = customer.getEmail().trim();

        if (authApiService.userExistsByEmail(email)) {
            return ServiceResult.conflict("A user with this email already exists in the system.");
        }
        if (customerRepository.findByEmailIgnoreCase(email).isPresent()) {
            return ServiceResult.conflict(DUPLICATE_EMAIL);
        }

        String username = generateUsername(email);
        String password = generatePassword();
        if (!authApiService.createUser(username, email, password, ROLE)) {
            return ServiceResult.invalid("Failed to create user account.");
        }

        Instant now = Instant.now(clock);
        customer.setId(null);
        customer.setName(customer.getName().trim());
        customer.setEmail(email);
        customer.setActive(true);
        customer.setCreatedAt(now);
        customer.setUpdatedAt(now);

        Customer saved;
        try {
            saved = customerRepository.save(customer);
        } catch (DataAccessException e) {
            log.error("Storing customer {} failed, removing the auth user again", email, e);
            if (!authApiService.deleteUserByEmail(email)) {
                log.error("Auth user {} is left without a customer record", email);
            }
            if (e instanceof DataIntegrityViolationException) {
                return ServiceResult.conflict(DUPLICATE_EMAIL);
            }
            throw e;
        }
        log.info("Created customer {} ({})", saved.getId(), email);

        try {
            if (!notificationSender.sendWelcome(email, saved.getName(), username, password, ROLE)) {
                log.warn("Welcome email for customer {} was not sent", saved.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Welcome email for customer {} failed", saved.getId(), e);
        }
        if (!eventPublisher.publish(CustomerCreatedEvent.of(saved))) {
            log.warn("CustomerCreated event for customer {} was not published", saved.getId());
        }

        return ServiceResult.success("Customer created successfully.", saved);
    }

    public Optional<Customer> getCustomer(Long id) {
        return customerRepository.findById(id);
    }

    /** Name order; {@code search} matches name or email, ignoring case. */
    public PagedResult<Customer> listCustomers(int page, int pageSize, String search) {
        PageRequest pageRequest = PageRequest.of(
                PagedResult.normalizePage(page) - 1,
                PagedResult.normalizePageSize(pageSize),
                Sort.by("name").ascending().and(Sort.by("id")));
        Page<Customer> result = StringUtils.isBlank(search)
                ? customerRepository.findAll(pageRequest)
                : customerRepository.findByNameContainingIgnoreCaseOrEmailContainingIgnoreCase(search.trim(), search.trim(), pageRequest);
        return PagedResult.of(result);
    }

    public ServiceResult<Customer> updateCustomer(Long id, Customer changes) {
        if (id == null || id <= 0) {
            return ServiceResult.invalid("Invalid customer ID.");
        }
        Customer existing = customerRepository.findById(id).orElse(null);
        if (existing == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (StringUtils.isAnyBlank(changes.getName(), changes.getEmail(), changes.getPhone())) {
            return ServiceResult.invalid("Name, email and phone are required.");
        }

        String email = changes.getEmail().trim();
        if (!email.equalsIgnoreCase(existing.getEmail())) {
            Optional<Customer> clash = customerRepository.findByEmailIgnoreCase(email);
            if (clash.isPresent() && !clash.get().getId().equals(id)) {
                return ServiceResult.conflict(DUPLICATE_EMAIL);
            }
        }

        existing.setName(changes.getName().trim());
        existing.setEmail(email);
        existing.setPhone(changes.getPhone());
        existing.setDateOfBirth(changes.getDateOfBirth());
        existing.setAddress(changes.getAddress());
        existing.setActive(changes.isActive());
        existing.setUpdatedAt(Instant.now(clock));

        Customer saved = customerRepository.save(existing);
        log.info("Updated customer {}", id);
        return ServiceResult.success("Customer updated successfully.", saved);
    }

    public ServiceResult<Void> deleteCustomer(Long id) {
        Customer customer = customerRepository.findById(id).orElse(null);
        if (customer == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        customerRepository.delete(customer);
        log.info("Deleted customer {}", id);

        if (!authApiService.deleteUserByEmail(customer.getEmail())) {
            log.warn("Auth user {} was not removed with customer {}", customer.getEmail(), id);
        }
        return ServiceResult.success("Customer deleted successfully.");
    }

    String generateUsername(String email) {
        return StringUtils.substringBefore(email, "@") + "_" + (Instant.now(clock).toEpochMilli() % 10000);
    }

    String generatePassword() {
        StringBuilder password = new StringBuilder(PASSWORD_LENGTH);
        for (int i = 0; i < PASSWORD_LENGTH; i++) {
            password.append(PASSWORD_CHARS.charAt(random.nextInt(PASSWORD_CHARS.length())));
        }
        return password.toString();
    }
}
