package com.nicedentist.manager.repository;

import com.nicedentist.manager.entity.Dentist;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DentistRepository extends JpaRepository<Dentist, Long> {

    List<Dentist> findByActiveTrueOrderByName();

    Optional<Dentist> findByEmailIgnoreCase(String email);

    Optional<Dentist> findByLicenseNumberIgnoreCase(String licenseNumber);
}
