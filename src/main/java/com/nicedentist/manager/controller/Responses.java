package com.nicedentist.manager.controller;

import com.nicedentist.manager.dto.ServiceResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/** Maps service outcomes onto HTTP. */
final class Responses {

    private Responses() {
    }

    static HttpStatus statusOf(ServiceResult.Outcome outcome) {
        switch (outcome) {
            case SUCCESS:
                return HttpStatus.OK;
            case INVALID:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
            case INVALID_STATE:
                return HttpStatus.CONFLICT;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            default:
                throw new IllegalStateException("Unmapped outcome " + outcome);
        }
    }

    static ResponseEntity<Object> failure(ServiceResult<?> result) {
        return ResponseEntity.status(statusOf(result.outcome())).body(message(result.message()));
    }

    static ResponseEntity<Object> badRequest(String message) {
        return ResponseEntity.badRequest().body(message(message));
    }

    static ResponseEntity<Object> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(message(message));
    }

    static Map<String, String> message(String message) {
        return Map.of("message", StringUtils.defaultString(message));
    }
}
