package com.nicedentist.manager.dto;

import com.nicedentist.manager.entity.AppointmentStatus;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Criteria for listing appointments. Null fields do not filter; dates are inclusive.
 */
@Builder
public record AppointmentFilter(
        int page,
        int pageSize,
        Long customerId,
        Long dentistId,
        LocalDateTime startDate,
        LocalDateTime endDate,
        AppointmentStatus status
) {

    public AppointmentFilter {
        page = PagedResult.normalizePage(page);
        pageSize = PagedResult.normalizePageSize(pageSize);
    }

    public static AppointmentFilter firstPage(int pageSize) {
        return AppointmentFilter.builder().page(1).pageSize(pageSize).build();
    }
}
