package com.nicedentist.manager.controller;

import com.nicedentist.manager.dto.DentistRequest;
import com.nicedentist.manager.dto.DentistResponse;
import com.nicedentist.manager.dto.PagedResponse;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.service.DentistService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequestMapping("/api/dentists")
public class DentistController {

    private static final String NOT_FOUND = "Dentist not found.";

    private final DentistService dentistService;

    public DentistController(DentistService dentistService) {
        this.dentistService = dentistService;
    }

    @GetMapping
    public PagedResponse<DentistResponse> list(@RequestParam(defaultValue = "1") int page,
                                               @RequestParam(defaultValue = "10") int pageSize) {
        return PagedResponse.from(dentistService.listDentists(page, pageSize), DentistResponse::from);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id) {
        return dentistService.getDentist(id)
                .<ResponseEntity<Object>>map(d -> ResponseEntity.ok(DentistResponse.from(d)))
                .orElseGet(() -> Responses.notFound(NOT_FOUND));
    }

    @GetMapping("/by-email/{email}")
    public ResponseEntity<Object> getByEmail(@PathVariable String email) {
        return dentistService.getDentistByEmail(email)
                .<ResponseEntity<Object>>map(d -> ResponseEntity.ok(DentistResponse.from(d)))
                .orElseGet(() -> Responses.notFound(NOT_FOUND));
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody DentistRequest request) {
        ServiceResult<Dentist> result = dentistService.createDentist(request.toDentist());
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.created(URI.create("/api/dentists/" + result.value().getId()))
                .body(DentistResponse.from(result.value()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody DentistRequest request) {
        ServiceResult<Dentist> result = dentistService.updateDentist(id, request.toDentist());
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.ok(DentistResponse.from(result.value()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> delete(@PathVariable Long id) {
        if (!dentistService.deleteDentist(id)) {
            return Responses.notFound(NOT_FOUND);
        }
        return ResponseEntity.noContent().build();
    }
}
