package com.nicedentist.manager.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {
    /** Enum name or display text, e.g. "CANCELLATION_REQUESTED" or "Cancellation Requested". */
    private String status;
    private String reason;
}
