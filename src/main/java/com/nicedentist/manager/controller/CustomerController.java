package com.nicedentist.manager.controller;

import com.nicedentist.manager.dto.CustomerRequest;
import com.nicedentist.manager.dto.CustomerResponse;
import com.nicedentist.manager.dto.PagedResponse;
import com.nicedentist.manager.dto.ServiceResult;
import com.nicedentist.manager.entity.Customer;
import com.nicedentist.manager.service.CustomerService;
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
@RequestMapping("/api/customers")
public class CustomerController {

    private final CustomerService customerService;

    public CustomerController(CustomerService customerService) {
        this.customerService = customerService;
    }

    @GetMapping
    public PagedResponse<CustomerResponse> list(@RequestParam(defaultValue = "1") int page,
                                                @RequestParam(defaultValue = "10") int pageSize,
                                                @RequestParam(required = false) String search) {
        return PagedResponse.from(customerService.listCustomers(page, pageSize, search), CustomerResponse::from);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id) {
        return customerService.getCustomer(id)
                .<ResponseEntity<Object>>map(c -> ResponseEntity.ok(CustomerResponse.from(c)))
                .orElseGet(() -> Responses.notFound("Customer not found."));
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody CustomerRequest request) {
        ServiceResult<Customer> result = customerService.createCustomer(request.toCustomer());
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.created(URI.create("/api/customers/" + result.value().getId()))
                .body(CustomerResponse.from(result.value()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody CustomerRequest request) {
        ServiceResult<Customer> result = customerService.updateCustomer(id, request.toCustomer());
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.ok(CustomerResponse.from(result.value()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> delete(@PathVariable Long id) {
        ServiceResult<Void> result = customerService.deleteCustomer(id);
        if (!result.success()) {
            return Responses.failure(result);
        }
        return ResponseEntity.noContent().build();
    }
}
