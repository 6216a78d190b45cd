package com.nicedentist.manager.controller;

import com.nicedentist.manager.dto.AppointmentFilter;
import com.nicedentist.manager.dto.AppointmentRequest;
import com.nicedentist.manager.dto.AppointmentResponse;
import com.nicedentist.manager.dto.AvailableSlotResponse;
import com.nicedentist.manager.dto.CancellationRequest;
import com.nicedentist.manager.dto.PagedResponse;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.dto.StatusUpdateRequest;
import com.nicedentist.manager.entity.Appointment;
import com.nicedentist.manager.entity.AppointmentStatus;
import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.entity.Dentist;
import com.nicedentist.manager.service.AppointmentService;
import com.nicedentist.manager.service.CustomerService;
import com.nicedentist.manager.service.DentistService;
import com.nicedentist.manager.service.SlotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);

    private static final String NOT_FOUND = "Appointment not found.";

    private final AppointmentService appointmentService;
    private final CustomerService customerService;
    private final DentistService dentistService;
    private final SlotService slotService;

    public AppointmentController(AppointmentService appointmentService,
                                 CustomerService customerService,
                                 DentistService dentistService,
                                 SlotService slotService) {
        this.appointmentService = appointmentService;
        this.customerService = customerService;
        this.dentistService = dentistService;
        this.slotService = slotService;
    }

    @GetMapping
    public PagedResponse<AppointmentResponse> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int pageSize,
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) Long dentistId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(required = false) String status) {
        AppointmentFilter filter = AppointmentFilter.builder()
                .page(page)
                .pageSize(pageSize)
                .customerId(customerId)
                .dentistId(dentistId)
                .startDate(startDate)
                .endDate(endDate)
                .status(status == null ? null : AppointmentStatus.parse(status))
                .build();
        NameLookup names = new NameLookup();
        return PagedResponse.from(appointmentService.getAllAppointments(filter), names::toResponse);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id) {
        return appointmentService.getAppointment(id)
                .<ResponseEntity<Object>>map(a -> ResponseEntity.ok(new NameLookup().toResponse(a)))
                .orElseGet(() -> Responses.notFound(NOT_FOUND));
    }

    @GetMapping("/customer/{customerId}")
    public List<AppointmentResponse> byCustomer(@PathVariable Long customerId) {
        return new NameLookup().toResponses(appointmentService.getAppointmentsByCustomer(customerId));
    }

    @GetMapping("/dentist/{dentistId}")
    public List<AppointmentResponse> byDentist(@PathVariable Long dentistId) {
        return new NameLookup().toResponses(appointmentService.getAppointmentsByDentist(dentistId));
    }

    @GetMapping("/dentist/{dentistId}/available-slots")
    public ResponseEntity<Object> availableSlots(
            @PathVariable Long dentistId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            return Responses.badRequest("Start date must be before end date.");
        }
        Dentist dentist = dentistService.getDentist(dentistId).orElse(null);
        if (dentist == null) {
            return Responses.notFound("Dentist not found.");
        }
        List<LocalDateTime> slots = appointmentService.getAvailableSlots(dentistId, startDate, endDate);
        return ResponseEntity.ok(toSlotResponses(dentist, slots));
    }

    @GetMapping("/available-slots")
    public ResponseEntity<Object> allAvailableSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        if (startDate.isAfter(endDate)) {
            return Responses.badRequest("Start date must be before end date.");
        }
        Map<Long, Dentist> dentists = new HashMap<>();
        for (Dentist d : dentistService.listActiveDentists()) {
            dentists.put(d.getId(), d);
        }
        List<AvailableSlotResponse> result = new ArrayList<>();
        appointmentService.getAllAvailableSlots(startDate, endDate).forEach((dentistId, slots) -> {
            Dentist dentist = dentists.get(dentistId);
            if (dentist != null) {
                result.addAll(toSlotResponses(dentist, slots));
            }
        });
        return ResponseEntity.ok(result);
    }

    @GetMapping("/dentist/{dentistId}/slot-available")
    public Map<String, Object> slotAvailable(
            @PathVariable Long dentistId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTime) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dentistId", dentistId);
        body.put("dateTime", dateTime);
        body.put("available", appointmentService.isSlotAvailable(dentistId, dateTime));
        return body;
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody AppointmentRequest request) {
        ServiceResult<Appointment> result = appointmentService.createAppointment(
                request.getCustomerId(),
                request.getDentistId(),
                request.getAppointmentDateTime(),
                request.getProcedureType(),
                request.getNotes());
        if (!result.success()) {
            log.info("Booking rejected ({}): {}", result.outcome(), result.message());
            return Responses.failure(result);
        }
        Appointment created = result.value();
        return ResponseEntity.created(URI.create("/api/appointments/" + created.getId()))
                .body(new NameLookup().toResponse(created));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody AppointmentRequest request) {
        return toResponse(appointmentService.updateAppointment(
                id,
                request.getCustomerId(),
                request.getDentistId(),
                request.getAppointmentDateTime(),
                request.getProcedureType(),
                request.getNotes()));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<Object> updateStatus(@PathVariable Long id, @RequestBody StatusUpdateRequest request) {
        AppointmentStatus status = AppointmentStatus.parse(request.getStatus());
        return toResponse(appointmentService.updateStatus(id, status, request.getReason()));
    }

    @PostMapping("/{id}/request-cancellation")
    public ResponseEntity<Object> requestCancellation(@PathVariable Long id, @RequestBody CancellationRequest request) {
        if (request.getCustomerId() == null) {
            return Responses.badRequest("Customer ID is required.");
        }
        return toResponse(appointmentService.requestCancellation(id, request.getCustomerId()));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Object> cancel(@PathVariable Long id) {
        return toResponse(appointmentService.cancelAppointment(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<Object> complete(@PathVariable Long id) {
        return toResponse(appointmentService.completeAppointment(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> delete(@PathVariable Long id) {
        if (!appointmentService.deleteAppointment(id)) {
            return Responses.notFound(NOT_FOUND);
        }
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<Object> toResponse(ServiceResult<Appointment> result) {
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.ok(new NameLookup().toResponse(result.value()));
    }

    private List<AvailableSlotResponse> toSlotResponses(Dentist dentist, List<LocalDateTime> slots) {
        List<AvailableSlotResponse> out = new ArrayList<>(slots.size());
        for (LocalDateTime slot : slots) {
            out.add(new AvailableSlotResponse(dentist.getId(), dentist.getName(), slot, slotService.getSlotMinutes(), true));
        }
        return out;
    }

    /** Resolves customer and dentist names once per request. */
    private class NameLookup {

        private final Map<Long, String> customers = new HashMap<>();
        private final Map<Long, String> dentists = new HashMap<>();

        AppointmentResponse toResponse(Appointment a) {
            String customerName = customers.computeIfAbsent(a.getCustomerId(),
                    id -> customerService.getCustomer(id).map(Customer::getName).orElse(""));
            String dentistName = dentists.computeIfAbsent(a.getDentistId(),
                    id -> dentistService.getDentist(id).map(Dentist::getName).orElse(""));
            return AppointmentResponse.from(a, customerName, dentistName);
        }

        List<AppointmentResponse> toResponses(List<Appointment> appointments) {
            return appointments.stream().map(this::toResponse).toList();
        }
    }
}
