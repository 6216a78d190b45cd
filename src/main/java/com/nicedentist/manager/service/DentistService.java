package com.nicedentist.manager.service;

import com.nicedentist.manager.dto.PagedResult;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.event.DentistCreatedEvent;
import com.nicedentist.manager.event.EventPublisher;
import com.nicedentist.manager.repository.DentistRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Dentist records. The auth login is provisioned asynchronously: creation publishes
 * {@link DentistCreatedEvent} and the user id arrives later through {@link UserLinkService}.
 */
@Service
public class DentistService {

    private static final Logger log = LoggerFactory.getLogger(DentistService.class);

    static final String NOT_FOUND = "Dentist not found.";

    private final DentistRepository dentistRepository;
    private final EventPublisher eventPublisher;
    private final Clock clock;

    public DentistService(DentistRepository dentistRepository, EventPublisher eventPublisher, Clock clock) {
        this.dentistRepository = dentistRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public ServiceResult<Dentist> createDentist(Dentist dentist) {
        if (StringUtils.isAnyBlank(dentist.getName(), dentist.getEmail(), dentist.getLicenseNumber())) {
            return ServiceResult.invalid("Name, email and license number are required.");
        }
        String email = dentist.getEmail().trim();
        String licenseNumber = dentist.getLicenseNumber().trim();

        if (dentistRepository.findByEmailIgnoreCase(email).isPresent()) {
            return ServiceResult.conflict(duplicateEmail(email));
        }
        if (dentistRepository.findByLicenseNumberIgnoreCase(licenseNumber).isPresent()) {
            return ServiceResult.conflict(duplicateLicense(licenseNumber));
        }

        Instant now = Instant.now(clock);
        dentist.setId(null);
        dentist.setName(dentist.getName().trim());
        dentist.setEmail(email);
        dentist.setLicenseNumber(licenseNumber);
        dentist.setActive(true);
        dentist.setCreatedAt(now);
        dentist.setUpdatedAt(now);

        Dentist saved = dentistRepository.save(dentist);
        log.info("Created dentist {} ({})", saved.getId(), email);

        if (!eventPublisher.publish(DentistCreatedEvent.of(saved))) {
            log.warn("DentistCreated event for dentist {} was not published", saved.getId());
        }
        return ServiceResult.success("Dentist created successfully.", saved);
    }

    public Optional<Dentist> getDentist(Long id) {
        return dentistRepository.findById(id);
    }

    public Optional<Dentist> getDentistByEmail(String email) {
        if (StringUtils.isBlank(email)) {
            return Optional.empty();
        }
        return dentistRepository.findByEmailIgnoreCase(email.trim());
    }

    public PagedResult<Dentist> listDentists(int page, int pageSize) {
        PageRequest pageRequest = PageRequest.of(
                PagedResult.normalizePage(page) - 1,
                PagedResult.normalizePageSize(pageSize),
                Sort.by("name").ascending().and(Sort.by("id")));
        return PagedResult.of(dentistRepository.findAll(pageRequest));
    }

    public List<Dentist> listActiveDentists() {
        return dentistRepository.findByActiveTrueOrderByName();
    }

    public ServiceResult<Dentist> updateDentist(Long id, Dentist changes) {
        Dentist existing = dentistRepository.findById(id).orElse(null);
        if (existing == null) {
            return ServiceResult.notFound(NOT_FOUND);
        }
        if (StringUtils.isAnyBlank(changes.getName(), changes.getEmail(), changes.getLicenseNumber())) {
            return ServiceResult.invalid("Name, email and license number are required.");
        }

        String email = changes.getEmail().trim();
        String licenseNumber = changes.getLicenseNumber().trim();
        if (!email.equalsIgnoreCase(existing.getEmail())) {
            Optional<Dentist> clash = dentistRepository.findByEmailIgnoreCase(email);
            if (clash.isPresent() && !clash.get().getId().equals(id)) {
                return ServiceResult.conflict(duplicateEmail(email));
            }
        }
        if (!licenseNumber.equalsIgnoreCase(existing.getLicenseNumber())) {
            Optional<Dentist> clash = dentistRepository.findByLicenseNumberIgnoreCase(licenseNumber);
            if (clash.isPresent() && !clash.get().getId().equals(id)) {
                return ServiceResult.conflict(duplicateLicense(licenseNumber));
            }
        }

        existing.setName(changes.getName().trim());
        existing.setEmail(email);
        existing.setPhone(changes.getPhone());
        existing.setLicenseNumber(licenseNumber);
        existing.setSpecialization(changes.getSpecialization());
        existing.setActive(changes.isActive());
        existing.setUpdatedAt(Instant.now(clock));

        Dentist saved = dentistRepository.save(existing);
        log.info("Updated dentist {} (active={})", id, saved.isActive());
        return ServiceResult.success("Dentist updated successfully.", saved);
    }

    public boolean deleteDentist(Long id) {
        if (!dentistRepository.existsById(id)) {
            return false;
        }
        dentistRepository.deleteById(id);
        log.info("Deleted dentist {}", id);
        return true;
    }

    private static String duplicateEmail(String email) {
        return "A dentist with email '" + email + "' already exists.";
    }

    private static String duplicateLicense(String licenseNumber) {
        return "A dentist with license number '" + licenseNumber + "' already exists.";
    }
}
